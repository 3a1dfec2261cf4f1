package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for an output tag {@code {{ expression }}}.
 *
 * @param token The {@code {{} token.
 * @param expression The rendered expression.
 */
public record OutputStatement(
        Token token,
        Expression expression
) implements Statement {

    public OutputStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
