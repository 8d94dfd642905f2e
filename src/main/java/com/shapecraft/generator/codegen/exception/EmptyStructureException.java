package com.shapecraft.generator.codegen.exception;

public class EmptyStructureException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    public EmptyStructureException(String message) {
        super(message);
    }
}
