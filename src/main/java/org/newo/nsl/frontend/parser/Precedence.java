package org.newo.nsl.frontend.parser;

import org.newo.nsl.frontend.lexer.TokenType;

import java.util.Map;

/**
 * Binding strength of the expression operators, weakest first.
 */
public enum Precedence {
    LOWEST,
    /** {@code ==} and {@code !=} */
    EQUALS,
    /** {@code <}, {@code >}, {@code <=} and {@code >=} */
    COMPARISON,
    /** {@code +} and {@code -} */
    SUM,
    /** {@code *} and {@code /} */
    PRODUCT,
    /** {@code |} */
    FILTER,
    /** {@code .} */
    ATTRIBUTE,
    /** unary {@code !} and {@code -} */
    PREFIX;

    private static final Map<TokenType, Precedence> INFIX = Map.ofEntries(
            Map.entry(TokenType.EQ, EQUALS),
            Map.entry(TokenType.NOT_EQ, EQUALS),
            Map.entry(TokenType.LT, COMPARISON),
            Map.entry(TokenType.GT, COMPARISON),
            Map.entry(TokenType.LTE, COMPARISON),
            Map.entry(TokenType.GTE, COMPARISON),
            Map.entry(TokenType.PLUS, SUM),
            Map.entry(TokenType.MINUS, SUM),
            Map.entry(TokenType.ASTERISK, PRODUCT),
            Map.entry(TokenType.SLASH, PRODUCT),
            Map.entry(TokenType.PIPE, FILTER),
            Map.entry(TokenType.DOT, ATTRIBUTE)
    );

    /**
     * @param type A token type.
     * @return The infix precedence of the type, or {@link #LOWEST} if it is not an infix operator.
     */
    public static Precedence of(TokenType type) {
        return INFIX.getOrDefault(type, LOWEST);
    }

    /**
     * @param type A token type.
     * @return {@code true} if the type can appear between two operands.
     */
    public static boolean isInfix(TokenType type) {
        return INFIX.containsKey(type);
    }
}
