package org.newo.nsl.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;


import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DiagnosticsEngine} and the {@link DiagnosticFormatter}.
 */
public class DiagnosticsTest {

    /**
     * Verifies that only errors count as errors and that diagnostics keep their report order.
     * This is a unit test for the diagnostics engine.
     */
    @Test
    @Tag("unit")
    void testEngineCollectsInOrder() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("w", "f.nsl", 2, "line");
        boolean errorsAfterWarning = engine.hasErrors();
        engine.reportError("e", "f.nsl", 1);
        engine.reportWarning("x", "g.nsl", 3, null);

        // Assert
        assertThat(errorsAfterWarning).isFalse();
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::message).containsExactly("w", "e", "x");
        assertThat(engine.summary()).isEqualTo("[WARNING] f.nsl:2: w\n[ERROR] f.nsl:1: e\n[WARNING] g.nsl:3: x");
        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    /**
     * Verifies plain and colored rendering, with and without a snippet.
     * This is a unit test for the diagnostic formatter.
     */
    @Test
    @Tag("unit")
    void testFormatter() {
        // Arrange
        Diagnostic withSnippet = new Diagnostic(Diagnostic.Type.WARNING, "Line contains an NSL comment",
                "flows/a.nsl", 4, "{# hi #}");
        Diagnostic withoutSnippet = new Diagnostic(Diagnostic.Type.ERROR, "unclosed block(s): if", "flows/a.nsl", 1);

        // Act
        String plain = new DiagnosticFormatter(false).format(withSnippet);
        String colored = new DiagnosticFormatter(true).format(withSnippet);
        String single = new DiagnosticFormatter(true).format(withoutSnippet);

        // Assert
        assertThat(plain).isEqualTo("flows/a.nsl:4: Line contains an NSL comment\n  {# hi #}");
        assertThat(colored).isEqualTo("flows/a.nsl:4: Line contains an NSL comment\n\u001B[32m  {# hi #}\u001B[0m");
        assertThat(single).isEqualTo("flows/a.nsl:1: unclosed block(s): if");
    }
}
