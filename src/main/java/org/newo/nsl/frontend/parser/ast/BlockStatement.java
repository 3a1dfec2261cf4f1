package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.List;

/**
 * A sequence of statements forming the body of a conditional branch or a loop.
 *
 * @param token The token that opened the block (the {@code %}} of the opening tag).
 * @param statements The statements of the block; may be empty.
 */
public record BlockStatement(
        Token token,
        List<Statement> statements
) implements Statement {

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
