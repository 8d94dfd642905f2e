package com.shapecraft.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the shape tokenizer.
 */
@Data
@AllArgsConstructor
public class ShapeToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        PACKAGE,
        IMPORT,
        PROJECTION,
        FROM,
        NEW,
        TRUE,
        FALSE,
        NULL,
        IDENTIFIER,
        INT_LITERAL,
        LONG_LITERAL,
        DOUBLE_LITERAL,
        STRING_LITERAL,
        CHAR_LITERAL,
        DOT,
        SAFE_DOT,
        COALESCE,
        QUESTION,
        COLON,
        COMMA,
        SEMICOLON,
        LPAREN,
        RPAREN,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        ARROW,
        EQUAL,
        NOT_EQUAL,
        LESS,
        LESS_OR_EQUAL,
        GREATER,
        GREATER_OR_EQUAL,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        AND,
        OR,
        NOT,
        EOF,
        UNKNOWN
    }

    public boolean isLiteral() {
        return type == TokenType.INT_LITERAL || type == TokenType.LONG_LITERAL
                || type == TokenType.DOUBLE_LITERAL || type == TokenType.STRING_LITERAL
                || type == TokenType.CHAR_LITERAL || type == TokenType.TRUE
                || type == TokenType.FALSE || type == TokenType.NULL;
    }
}
