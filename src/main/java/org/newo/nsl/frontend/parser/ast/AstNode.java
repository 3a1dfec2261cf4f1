package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.lexer.Token;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node keeps the token it originates from so that later phases can report positions.
 */
public sealed interface AstNode permits Statement, Expression, ElseIfClause {

    /**
     * @return The token this node was created from.
     */
    Token token();

    /**
     * @return The 1-based line of the originating token, or 1 if the position is unknown.
     */
    default int line() {
        Token token = token();
        return token != null && token.line() > 0 ? token.line() : 1;
    }
}
