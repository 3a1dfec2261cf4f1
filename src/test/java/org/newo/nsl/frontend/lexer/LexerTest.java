package org.newo.nsl.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that template text is converted into the expected token stream,
 * including delimiters, keywords, literals and illegal input.
 */
public class LexerTest {

    /**
     * Verifies the full token stream of a template that uses set, output, if/else and for tags.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testTemplateTokenization() {
        // Arrange
        String source = String.join("\n",
                "{% set my_var = 10 %}",
                "{{ my_var + 5 }}",
                "{% if my_var > 5 %}",
                "    \"Hello, World!\"",
                "{% else %}",
                "    'Goodbye'",
                "{% endif %}",
                "{% for item in items %}",
                "    {{ item.name }}",
                "{% endfor %}");

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::literal).containsExactly(
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.SET, "set"), tuple(TokenType.IDENT, "my_var"),
                tuple(TokenType.ASSIGN, "="), tuple(TokenType.INT, "10"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.LBRACE, "{{"), tuple(TokenType.IDENT, "my_var"), tuple(TokenType.PLUS, "+"),
                tuple(TokenType.INT, "5"), tuple(TokenType.RBRACE, "}}"),
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.IF, "if"), tuple(TokenType.IDENT, "my_var"),
                tuple(TokenType.GT, ">"), tuple(TokenType.INT, "5"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.STRING, "Hello, World!"),
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.ELSE, "else"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.STRING, "Goodbye"),
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.ENDIF, "endif"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.FOR, "for"), tuple(TokenType.IDENT, "item"),
                tuple(TokenType.IN, "in"), tuple(TokenType.IDENT, "items"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.LBRACE, "{{"), tuple(TokenType.IDENT, "item"), tuple(TokenType.DOT, "."),
                tuple(TokenType.IDENT, "name"), tuple(TokenType.RBRACE, "}}"),
                tuple(TokenType.LPERCENT, "{%"), tuple(TokenType.ENDFOR, "endfor"), tuple(TokenType.RPERCENT, "%}"),
                tuple(TokenType.EOF, ""));
    }

    /**
     * Verifies that all two-character operators are recognized and that a single {@code =}
     * is still an assignment.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testComparisonOperators() {
        // Arrange
        Lexer lexer = new Lexer("== != <= >= < > = ! | * /");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.EQ, TokenType.NOT_EQ, TokenType.LTE, TokenType.GTE, TokenType.LT, TokenType.GT,
                TokenType.ASSIGN, TokenType.BANG, TokenType.PIPE, TokenType.ASTERISK, TokenType.SLASH,
                TokenType.EOF);
    }

    /**
     * Verifies that lone braces, a lone percent sign and non-ASCII characters become
     * illegal tokens instead of failing the lexer.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testIllegalCharactersBecomeIllegalTokens() {
        // Arrange
        Lexer lexer = new Lexer("{ } % # Привет");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.ILLEGAL,
                TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.ILLEGAL,
                TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.EOF);
        assertThat(tokens.get(4).literal()).isEqualTo("П");
    }

    /**
     * Verifies that an unterminated string yields a single illegal token carrying the rest of the input.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testUnterminatedString() {
        // Arrange
        Lexer lexer = new Lexer("{{ \"open }}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::literal).containsExactly(
                tuple(TokenType.LBRACE, "{{"),
                tuple(TokenType.ILLEGAL, "\"open }}"),
                tuple(TokenType.EOF, ""));
    }

    /**
     * Verifies that {@code {# ... #}} comments produce no tokens, even across lines.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkipped() {
        // Arrange
        Lexer lexer = new Lexer("{# note\n more #}{{ x }}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LBRACE, TokenType.IDENT, TokenType.RBRACE, TokenType.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(2);
    }

    /**
     * Verifies that tokens record the line and column of their first character.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testTokenPositions() {
        // Arrange
        Lexer lexer = new Lexer("{{ a }}\n  {% set b = 'x' %}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(1)).extracting(Token::literal, Token::line, Token::column).containsExactly("a", 1, 4);
        assertThat(tokens.get(3)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.LPERCENT, 2, 3);
        assertThat(tokens.get(7)).extracting(Token::type, Token::literal, Token::column).containsExactly(TokenType.STRING, "x", 14);
    }

    /**
     * Verifies that keywords are case-sensitive and that identifiers may contain digits and underscores.
     * This is a unit test for the keyword lookup.
     */
    @Test
    @Tag("unit")
    void testKeywordLookup() {
        // Arrange
        Lexer lexer = new Lexer("if IF null _tmp1 elif endblock");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IF, TokenType.IDENT, TokenType.NULL, TokenType.IDENT, TokenType.ELIF,
                TokenType.ENDBLOCK, TokenType.EOF);
    }

    /**
     * Verifies that an exhausted lexer keeps returning EOF tokens.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testEofIsRepeated() {
        // Arrange
        Lexer lexer = new Lexer("x");
        lexer.nextToken();

        // Act
        Token first = lexer.nextToken();
        Token second = lexer.nextToken();

        // Assert
        assertThat(first.type()).isEqualTo(TokenType.EOF);
        assertThat(second.type()).isEqualTo(TokenType.EOF);
    }
}
