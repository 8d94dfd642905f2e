package com.shapecraft.generator.parser.exception;

/**
 * Syntax error in a shape or schema file.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String fileName, int line, int column, String message) {
        super(fileName + ":" + line + ":" + column + ": " + message);
    }
}
