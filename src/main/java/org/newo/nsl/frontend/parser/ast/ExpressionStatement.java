package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * A bare expression outside of any tag, e.g. {@code 5 + 5}.
 *
 * @param token The first token of the expression.
 * @param expression The expression.
 */
public record ExpressionStatement(
        Token token,
        Expression expression
) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
