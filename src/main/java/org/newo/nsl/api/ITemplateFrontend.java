package org.newo.nsl.api;

import org.newo.nsl.diagnostics.Diagnostic;
import org.newo.nsl.metadata.DeclaredParameters;

import java.util.List;
import java.util.Optional;

/**
 * Defines the public interface of the NSL template front end.
 */
public interface ITemplateFrontend {

    /**
     * Parses template text.
     * @param content The template text.
     * @return The AST and the syntax errors.
     */
    ParseResult parse(String content);

    /**
     * Renders template text in canonical form.
     * @param content The template text.
     * @return The canonical text, or empty if the template has syntax errors.
     */
    Optional<String> format(String content);

    /**
     * Lints template text.
     * @param fileName The name used in diagnostics.
     * @param content The template text.
     * @param parameters The declared parameters of the template.
     * @return The diagnostics in report order.
     */
    List<Diagnostic> lint(String fileName, String content, DeclaredParameters parameters);
}
