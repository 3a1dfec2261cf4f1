package org.newo.nsl.frontend.parser.ast;

/**
 * A visitor over all {@link Statement} variants. Adding a statement type adds a method here,
 * which forces every traversal to handle it.
 *
 * @param <T> The return type of the visit methods.
 */
public interface StatementVisitor<T> {
    T visit(SetStatement node);
    T visit(IfStatement node);
    T visit(ForStatement node);
    T visit(OutputStatement node);
    T visit(BlockStatement node);
    T visit(ExpressionStatement node);
}
