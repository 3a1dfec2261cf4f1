package org.newo.nsl.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends AstNode
        permits Identifier, IntegerLiteral, StringLiteral, BooleanLiteral,
                PrefixExpression, InfixExpression, AttributeAccess, FilterExpression {

    /**
     * Dispatches to the matching {@code visit} overload.
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @return The visitor's result.
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
