package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * One {@code elif} branch of an {@link IfStatement}.
 *
 * @param token The {@code elif} keyword token.
 * @param condition The branch condition.
 * @param consequence The branch body.
 */
public record ElseIfClause(
        Token token,
        Expression condition,
        BlockStatement consequence
) implements AstNode {

    public ElseIfClause {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(consequence, "consequence");
    }
}
