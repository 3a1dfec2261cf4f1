package org.newo.nsl.frontend.parser.ast;

import org.newo.nsl.frontend.printer.DebugPrinter;

import java.util.List;

/**
 * The root node of every AST the parser produces.
 *
 * @param statements The top-level statements in source order.
 */
public record Program(List<Statement> statements) {

    public Program {
        statements = List.copyOf(statements);
    }

    /**
     * @return The parenthesized debug form of the program, see {@link DebugPrinter}.
     */
    @Override
    public String toString() {
        return DebugPrinter.INSTANCE.print(this);
    }
}
