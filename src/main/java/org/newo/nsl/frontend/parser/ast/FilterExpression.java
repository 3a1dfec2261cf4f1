package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * Filter application {@code input | filter}. Filter names live outside the variable scopes.
 *
 * @param token The {@code |} token.
 * @param input The filtered expression.
 * @param filter The filter name.
 */
public record FilterExpression(
        Token token,
        Expression input,
        Identifier filter
) implements Expression {

    public FilterExpression {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(filter, "filter");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
