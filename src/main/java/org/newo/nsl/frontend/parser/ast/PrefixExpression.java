package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * A unary expression such as {@code !flag} or {@code -count}.
 *
 * @param token The operator token.
 * @param operator The operator text, {@code !} or {@code -}.
 * @param operand The operand.
 */
public record PrefixExpression(
        Token token,
        String operator,
        Expression operand
) implements Expression {

    public PrefixExpression {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
