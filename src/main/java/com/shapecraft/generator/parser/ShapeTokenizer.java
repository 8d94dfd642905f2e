package com.shapecraft.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.parser.ShapeToken.TokenType;
import com.shapecraft.generator.parser.exception.ParseException;

/**
 * Tokenizer for shape files.
 */
public class ShapeTokenizer {
    private static final Logger log = LoggerFactory.getLogger(ShapeTokenizer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("package", TokenType.PACKAGE),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("projection", TokenType.PROJECTION),
        Map.entry("from", TokenType.FROM),
        Map.entry("new", TokenType.NEW),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("null", TokenType.NULL)
    );

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public ShapeTokenizer(String source, String fileName) {
        this.source = source.replace("\r\n", "\n");
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file. The last token is always {@code EOF}.
     */
    public List<ShapeToken> tokenize() {
        List<ShapeToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new ShapeToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} into {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                newLine();
            } else if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advanceChar();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                int startLine = line;
                int startCol = column;
                advanceChar();
                advanceChar();
                while (pos < source.length() && !(source.charAt(pos) == '*' && peekChar(1) == '/')) {
                    if (source.charAt(pos) == '\n') {
                        newLine();
                    } else {
                        advanceChar();
                    }
                }
                if (pos >= source.length()) {
                    throw new ParseException(fileName, startLine, startCol, "Unterminated block comment");
                }
                advanceChar();
                advanceChar();
            } else {
                break;
            }
        }
    }

    private ShapeToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '"' || c == '\'') {
            return readQuoted(c, startLine, startCol);
        }
        if (Character.isDigit(c)) {
            return readNumber(startLine, startCol);
        }
        if (Character.isJavaIdentifierStart(c)) {
            return readIdentifierOrKeyword(startLine, startCol);
        }

        TokenType type;
        String text;
        switch (c) {
            case '?' -> {
                if (peekChar(1) == '.') {
                    type = TokenType.SAFE_DOT;
                    text = "?.";
                } else if (peekChar(1) == '?') {
                    type = TokenType.COALESCE;
                    text = "??";
                } else {
                    type = TokenType.QUESTION;
                    text = "?";
                }
            }
            case '=' -> {
                if (peekChar(1) == '>') {
                    type = TokenType.ARROW;
                    text = "=>";
                } else if (peekChar(1) == '=') {
                    type = TokenType.EQUAL;
                    text = "==";
                } else {
                    type = TokenType.UNKNOWN;
                    text = "=";
                }
            }
            case '!' -> {
                if (peekChar(1) == '=') {
                    type = TokenType.NOT_EQUAL;
                    text = "!=";
                } else {
                    type = TokenType.NOT;
                    text = "!";
                }
            }
            case '<' -> {
                if (peekChar(1) == '=') {
                    type = TokenType.LESS_OR_EQUAL;
                    text = "<=";
                } else {
                    type = TokenType.LESS;
                    text = "<";
                }
            }
            case '>' -> {
                if (peekChar(1) == '=') {
                    type = TokenType.GREATER_OR_EQUAL;
                    text = ">=";
                } else {
                    type = TokenType.GREATER;
                    text = ">";
                }
            }
            case '&' -> {
                type = peekChar(1) == '&' ? TokenType.AND : TokenType.UNKNOWN;
                text = peekChar(1) == '&' ? "&&" : "&";
            }
            case '|' -> {
                type = peekChar(1) == '|' ? TokenType.OR : TokenType.UNKNOWN;
                text = peekChar(1) == '|' ? "||" : "|";
            }
            case '.' -> {
                type = TokenType.DOT;
                text = ".";
            }
            case ':' -> {
                type = TokenType.COLON;
                text = ":";
            }
            case ',' -> {
                type = TokenType.COMMA;
                text = ",";
            }
            case ';' -> {
                type = TokenType.SEMICOLON;
                text = ";";
            }
            case '(' -> {
                type = TokenType.LPAREN;
                text = "(";
            }
            case ')' -> {
                type = TokenType.RPAREN;
                text = ")";
            }
            case '{' -> {
                type = TokenType.LBRACE;
                text = "{";
            }
            case '}' -> {
                type = TokenType.RBRACE;
                text = "}";
            }
            case '[' -> {
                type = TokenType.LBRACKET;
                text = "[";
            }
            case ']' -> {
                type = TokenType.RBRACKET;
                text = "]";
            }
            case '+' -> {
                type = TokenType.PLUS;
                text = "+";
            }
            case '-' -> {
                type = TokenType.MINUS;
                text = "-";
            }
            case '*' -> {
                type = TokenType.STAR;
                text = "*";
            }
            case '/' -> {
                type = TokenType.SLASH;
                text = "/";
            }
            case '%' -> {
                type = TokenType.PERCENT;
                text = "%";
            }
            default -> {
                type = TokenType.UNKNOWN;
                text = String.valueOf(c);
            }
        }

        for (int i = 0; i < text.length(); i++) {
            advanceChar();
        }
        return new ShapeToken(type, text, startLine, startCol);
    }

    /**
     * Reads a string or char literal, keeping quotes and escapes as written.
     */
    private ShapeToken readQuoted(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.append(quote);
        advanceChar();

        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ParseException(fileName, startLine, startCol, "Unterminated literal");
            }
            char c = source.charAt(pos);
            sb.append(c);
            advanceChar();
            if (c == '\\' && pos < source.length()) {
                sb.append(source.charAt(pos));
                advanceChar();
            } else if (c == quote) {
                break;
            }
        }

        TokenType type = quote == '"' ? TokenType.STRING_LITERAL : TokenType.CHAR_LITERAL;
        return new ShapeToken(type, sb.toString(), startLine, startCol);
    }

    private ShapeToken readNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        TokenType type = TokenType.INT_LITERAL;

        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            sb.append(source.charAt(pos));
            advanceChar();
        }
        if (pos < source.length() && source.charAt(pos) == '.' && Character.isDigit(peekChar(1))) {
            type = TokenType.DOUBLE_LITERAL;
            sb.append('.');
            advanceChar();
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                sb.append(source.charAt(pos));
                advanceChar();
            }
        }
        if (pos < source.length()) {
            char suffix = source.charAt(pos);
            if ((suffix == 'L' || suffix == 'l') && type == TokenType.INT_LITERAL) {
                type = TokenType.LONG_LITERAL;
                sb.append('L');
                advanceChar();
            } else if (suffix == 'd' || suffix == 'D') {
                type = TokenType.DOUBLE_LITERAL;
                sb.append('d');
                advanceChar();
            }
        }

        return new ShapeToken(type, sb.toString(), startLine, startCol);
    }

    private ShapeToken readIdentifierOrKeyword(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            advanceChar();
        }

        String value = sb.toString();
        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new ShapeToken(keywordType, value, startLine, startCol);
        }
        return new ShapeToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advanceChar() {
        pos++;
        column++;
    }

    private void newLine() {
        pos++;
        line++;
        column = 1;
    }
}
