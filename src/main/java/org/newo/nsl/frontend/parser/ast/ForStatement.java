package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for {@code {% for iterator in sequence %} ... {% endfor %}}.
 *
 * @param token The {@code for} keyword token.
 * @param iterator The loop variable, visible only inside the body.
 * @param sequence The iterated expression.
 * @param body The loop body.
 */
public record ForStatement(
        Token token,
        Identifier iterator,
        Expression sequence,
        BlockStatement body
) implements Statement {

    public ForStatement {
        Objects.requireNonNull(iterator, "iterator");
        Objects.requireNonNull(sequence, "sequence");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
