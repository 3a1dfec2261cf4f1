package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

/**
 * A string literal.
 *
 * @param token The {@code STRING} token.
 * @param value The content between the quotes.
 */
public record StringLiteral(
        Token token,
        String value
) implements Expression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
