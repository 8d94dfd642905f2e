package com.shapecraft.generator.codegen.exception;

public class TemplateRenderingException extends ProjectionException {
    private static final long serialVersionUID = 1L;

    public TemplateRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
