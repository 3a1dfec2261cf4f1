package org.newo.nsl;

import org.newo.nsl.api.ParseResult;
import org.newo.nsl.diagnostics.Diagnostic;
import org.newo.nsl.metadata.DeclaredParameters;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@link NslFrontend} facade, running the whole pipeline.
 */
public class NslFrontendTest {

    private final NslFrontend frontend = new NslFrontend();

    /**
     * Verifies that parsing returns the AST together with the syntax errors.
     * This is a unit test for the facade.
     */
    @Test
    @Tag("unit")
    void testParse() {
        // Act
        ParseResult ok = frontend.parse("{{ a + b * c }}");
        ParseResult broken = frontend.parse("{% set foo = %} {{ bar }}");

        // Assert
        assertThat(ok.isSuccessful()).isTrue();
        assertThat(ok.program().toString()).isEqualTo("{{(a + (b * c))}}");
        assertThat(broken.errors()).containsExactly("no prefix parse function for %} found");
        assertThat(broken.program().statements()).hasSize(1);
    }

    /**
     * Verifies that formatting returns canonical text and refuses templates with syntax errors.
     * This is a unit test for the facade.
     */
    @Test
    @Tag("unit")
    void testFormat() {
        // Act
        Optional<String> formatted = frontend.format("{%set x=1%}{%if x%}{{x}}{%endif%}");
        Optional<String> rejected = frontend.format("{{ }}");

        // Assert
        assertThat(formatted).contains("{% set x = 1 %}\n{% if x %}\n    {{ x }}\n{% endif %}\n");
        assertThat(rejected).isEmpty();
    }

    /**
     * Verifies that linting through the facade reports undefined variables.
     * This is a unit test for the facade.
     */
    @Test
    @Tag("unit")
    void testLint() {
        // Act
        List<Diagnostic> diagnostics = frontend.lint("skill.nsl",
                "{% for u in users %}{{ u.name | title }}{{ missing }}{% endfor %}",
                DeclaredParameters.of(List.of("users")));

        // Assert
        assertThat(diagnostics).extracting(Diagnostic::message).containsExactly(
                "undefined variable: 'missing' is used but not defined in parameters or in the skill");
    }

    /**
     * Verifies that a very long operator chain is rejected by the parser instead of reaching
     * the recursive printer and analyzer.
     * This is a unit test for the nesting limit through the facade.
     */
    @Test
    @Tag("unit")
    void testLongOperatorChainIsRejected() {
        // Arrange
        String source = "{{ a" + " + a".repeat(19_999) + " }}";

        // Act
        ParseResult result = frontend.parse(source);
        Optional<String> formatted = frontend.format(source);
        List<Diagnostic> diagnostics = frontend.lint("chain.nsl", source, DeclaredParameters.of(List.of("a")));

        // Assert
        assertThat(result.errors()).containsExactly("expression nesting exceeds 256 levels");
        assertThat(formatted).isEmpty();
        assertThat(diagnostics).isEmpty();
    }
}
