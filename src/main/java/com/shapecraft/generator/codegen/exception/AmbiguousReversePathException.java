package com.shapecraft.generator.codegen.exception;

public class AmbiguousReversePathException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    public AmbiguousReversePathException(String message) {
        super(message);
    }
}
