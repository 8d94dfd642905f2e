package com.shapecraft.generator.codegen.exception;

/**
 * A type name or member could not be resolved against the schema.
 */
public class UnresolvedTypeException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    public UnresolvedTypeException(String message) {
        super(message);
    }
}
