package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

import java.util.Objects;

/**
 * Attribute access {@code object.attribute}. The attribute is a plain name, never a variable.
 *
 * @param token The {@code .} token.
 * @param object The accessed expression.
 * @param attribute The attribute name.
 */
public record AttributeAccess(
        Token token,
        Expression object,
        Identifier attribute
) implements Expression {

    public AttributeAccess {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
