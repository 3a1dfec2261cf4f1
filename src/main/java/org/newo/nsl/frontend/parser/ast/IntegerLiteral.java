package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

/**
 * An integer literal.
 *
 * @param token The {@code INT} token.
 * @param value The parsed value.
 */
public record IntegerLiteral(
        Token token,
        long value
) implements Expression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
