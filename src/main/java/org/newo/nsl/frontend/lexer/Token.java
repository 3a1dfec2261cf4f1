package org.newo.nsl.frontend.lexer;

/**
 * Represents a single token extracted from the template source by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param literal The text of the token. For strings this is the content without the quotes.
 * @param line The 1-based line number where the token begins.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String literal,
        int line,
        int column
) {
}
