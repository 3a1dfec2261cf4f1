package org.newo.nsl.frontend.parser.ast;

/**
 * A node that appears in statement position: a template tag, an output tag,
 * a block of statements or a bare expression.
 */
public sealed interface Statement extends AstNode
        permits SetStatement, IfStatement, ForStatement, OutputStatement, BlockStatement, ExpressionStatement {

    /**
     * Dispatches to the matching {@code visit} overload.
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @return The visitor's result.
     */
    <T> T accept(StatementVisitor<T> visitor);
}
