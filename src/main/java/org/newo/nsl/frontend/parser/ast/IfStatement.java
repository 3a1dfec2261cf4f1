package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for an {@code if / elif / else / endif} conditional.
 *
 * @param token The {@code if} keyword token.
 * @param condition The condition of the first branch.
 * @param consequence The body of the first branch.
 * @param elseIfs The {@code elif} branches in source order; empty if there are none.
 * @param alternative The body of the {@code else} branch, or {@code null} if there is none.
 */
public record IfStatement(
        Token token,
        Expression condition,
        BlockStatement consequence,
        List<ElseIfClause> elseIfs,
        BlockStatement alternative
) implements Statement {

    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(consequence, "consequence");
        elseIfs = List.copyOf(elseIfs);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
