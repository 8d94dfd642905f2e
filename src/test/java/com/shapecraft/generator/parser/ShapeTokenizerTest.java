package com.shapecraft.generator.parser;

import com.shapecraft.generator.parser.ShapeToken.TokenType;
import com.shapecraft.generator.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ShapeTokenizer.
 */
class ShapeTokenizerTest {

    @Test
    void testNullSafeAndCoalesceOperators() {
        List<TokenType> types = types("o.customer?.name ?? \"n/a\"");

        assertThat(types).containsExactly(
                TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.SAFE_DOT,
                TokenType.IDENTIFIER, TokenType.COALESCE, TokenType.STRING_LITERAL, TokenType.EOF);
    }

    @Test
    void testKeywordsAndArrow() {
        List<TokenType> types = types("projection Row from Order o => { }");

        assertThat(types).containsExactly(
                TokenType.PROJECTION, TokenType.IDENTIFIER, TokenType.FROM, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.ARROW, TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF);
    }

    @Test
    void testNumericLiterals() {
        List<ShapeToken> tokens = new ShapeTokenizer("42 10L 1.5 2d", "test.shape").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.INT_LITERAL);
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.LONG_LITERAL);
        assertThat(tokens.get(1).getValue()).isEqualTo("10L");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.DOUBLE_LITERAL);
        assertThat(tokens.get(2).getValue()).isEqualTo("1.5");
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.DOUBLE_LITERAL);
    }

    @Test
    void testStringLiteralKeepsQuotesAndEscapes() {
        List<ShapeToken> tokens = new ShapeTokenizer("\"a\\\"b\" 'x'", "test.shape").tokenize();

        assertThat(tokens.get(0).getValue()).isEqualTo("\"a\\\"b\"");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.CHAR_LITERAL);
        assertThat(tokens.get(1).getValue()).isEqualTo("'x'");
    }

    @Test
    void testCommentsAreSkippedAndPositionsTracked() {
        String source = """
            // header comment
            /* block
               comment */ a
              b
            """;

        List<ShapeToken> tokens = new ShapeTokenizer(source, "test.shape").tokenize();

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0).getValue()).isEqualTo("a");
        assertThat(tokens.get(0).getLine()).isEqualTo(3);
        assertThat(tokens.get(0).getColumn()).isEqualTo(15);
        assertThat(tokens.get(1).getLine()).isEqualTo(4);
        assertThat(tokens.get(1).getColumn()).isEqualTo(3);
    }

    @Test
    void testRelationalAndLogicalOperators() {
        List<TokenType> types = types("a <= b && c != d || !e");

        assertThat(types).containsExactly(
                TokenType.IDENTIFIER, TokenType.LESS_OR_EQUAL, TokenType.IDENTIFIER, TokenType.AND,
                TokenType.IDENTIFIER, TokenType.NOT_EQUAL, TokenType.IDENTIFIER, TokenType.OR,
                TokenType.NOT, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void testUnterminatedBlockCommentReportsStart() {
        ShapeTokenizer tokenizer = new ShapeTokenizer("a\n  /* never closed", "broken.shape");

        assertThatThrownBy(tokenizer::tokenize)
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("broken.shape:2:3:")
                .hasMessageContaining("Unterminated block comment");
    }

    @Test
    void testUnterminatedStringLiteral() {
        ShapeTokenizer tokenizer = new ShapeTokenizer("name: \"open\n", "broken.shape");

        assertThatThrownBy(tokenizer::tokenize)
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated literal");
    }

    private List<TokenType> types(String source) {
        return new ShapeTokenizer(source, "test.shape").tokenize().stream()
                .map(ShapeToken::getType)
                .collect(Collectors.toList());
    }
}
