package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for {@code {% set name = value %}}.
 *
 * @param token The {@code set} keyword token.
 * @param name The assigned variable.
 * @param value The assigned expression.
 */
public record SetStatement(
        Token token,
        Identifier name,
        Expression value
) implements Statement {

    public SetStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
