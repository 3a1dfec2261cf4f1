package org.newo.nsl.lint;

import org.newo.nsl.diagnostics.DiagnosticsEngine;

/**
 * A text-level check on a template that runs before the template is parsed.
 */
@FunctionalInterface
public interface ILintCheck {
    /**
     * Checks a single template.
     * @param file The template.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    void check(SourceFile file, DiagnosticsEngine diagnostics);
}
