package org.newo.nsl.api;

import org.newo.nsl.frontend.parser.ast.Program;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of parsing one template.
 *
 * @param program The best-effort AST; statements that failed to parse are missing.
 * @param errors The syntax errors in the order they were found.
 */
public record ParseResult(Program program, List<String> errors) {

    public ParseResult {
        Objects.requireNonNull(program, "program");
        errors = List.copyOf(errors);
    }

    /**
     * @return {@code true} if the template parsed without errors.
     */
    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
