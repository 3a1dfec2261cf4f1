package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * A binary arithmetic or comparison expression.
 *
 * @param token The operator token.
 * @param operator The operator text, e.g. {@code +} or {@code ==}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record InfixExpression(
        Token token,
        String operator,
        Expression left,
        Expression right
) implements Expression {

    public InfixExpression {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
