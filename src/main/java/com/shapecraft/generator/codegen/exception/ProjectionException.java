package com.shapecraft.generator.codegen.exception;

/**
 * Base class of the failures raised while analysing a projection. Most of them
 * are caught close to where they are thrown and turned into diagnostics.
 */
public class ProjectionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ProjectionException(String message) {
        super(message);
    }

    public ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
