package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

/**
 * The literal {@code true} or {@code false}.
 *
 * @param token The keyword token.
 * @param value The boolean value.
 */
public record BooleanLiteral(
        Token token,
        boolean value
) implements Expression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
