package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

/**
 * A variable, attribute or filter name.
 *
 * @param token The identifier token.
 * @param name The name.
 */
public record Identifier(
        Token token,
        String name
) implements Expression {

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
