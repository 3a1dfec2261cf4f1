package org.newo.nsl.frontend.parser.ast;

/**
 * A visitor over all {@link Expression} variants.
 *
 * @param <T> The return type of the visit methods.
 */
public interface ExpressionVisitor<T> {
    T visit(Identifier node);
    T visit(IntegerLiteral node);
    T visit(StringLiteral node);
    T visit(BooleanLiteral node);
    T visit(PrefixExpression node);
    T visit(InfixExpression node);
    T visit(AttributeAccess node);
    T visit(FilterExpression node);
}
