package com.shapecraft.generator.codegen.exception;

/**
 * A shape literal sits in a position from which no nested structure can be
 * derived.
 */
public class UnsupportedExpressionShapeException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    public UnsupportedExpressionShapeException(String message) {
        super(message);
    }
}
