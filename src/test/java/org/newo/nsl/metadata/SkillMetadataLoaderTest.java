package org.newo.nsl.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SkillMetadataLoader}.
 * These tests use a temporary directory for the template and metadata files.
 */
public class SkillMetadataLoaderTest {

    @TempDir
    Path dir;

    private SkillMetadataLoader loader;
    private Path template;

    @BeforeEach
    void setUp() throws IOException {
        loader = new SkillMetadataLoader(".nsl", List.of(".meta.yaml", ".meta.yml"));
        template = dir.resolve("greet.nsl");
        Files.writeString(template, "{{ user_name }}");
    }

    /**
     * Verifies that parameter names are read in order and unnamed entries are skipped.
     * This is a unit test for metadata parsing.
     */
    @Test
    @Tag("unit")
    void testReadsParameterNames() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("greet.meta.yaml"), String.join("\n",
                "title: Greeting",
                "parameters:",
                "  - name: user_name",
                "    default_value: friend",
                "  - name: ''",
                "  - default_value: orphan",
                "  - name: greeting",
                ""));

        // Act
        DeclaredParameters parameters = loader.load(template);

        // Assert
        assertThat(parameters.isPresent()).isTrue();
        assertThat(parameters.names()).containsExactly("user_name", "greeting");
    }

    /**
     * Verifies that the .meta.yaml file wins over .meta.yml and that .meta.yml is used as fallback.
     * This is a unit test for metadata file lookup.
     */
    @Test
    @Tag("unit")
    void testSuffixPrecedence() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("greet.meta.yml"), "parameters:\n  - name: from_yml\n");

        // Act
        DeclaredParameters fallback = loader.load(template);
        Files.writeString(dir.resolve("greet.meta.yaml"), "parameters:\n  - name: from_yaml\n");
        DeclaredParameters preferred = loader.load(template);

        // Assert
        assertThat(fallback.names()).containsExactly("from_yml");
        assertThat(preferred.names()).containsExactly("from_yaml");
    }

    /**
     * Verifies that a template without metadata has absent parameters, while empty
     * metadata yields present but empty parameters.
     * This is a unit test for the absent/empty distinction.
     */
    @Test
    @Tag("unit")
    void testAbsentAndEmptyMetadata() throws IOException {
        // Act
        DeclaredParameters missing = loader.load(template);
        Files.writeString(dir.resolve("greet.meta.yaml"), "parameters: []\n");
        DeclaredParameters empty = loader.load(template);

        // Assert
        assertThat(missing).isEqualTo(DeclaredParameters.absent());
        assertThat(missing.isPresent()).isFalse();
        assertThat(empty.isPresent()).isTrue();
        assertThat(empty.names()).isEmpty();
    }

    /**
     * Verifies that metadata holding only comments or an empty document declares no parameters.
     * This is a unit test for the absent/empty distinction.
     */
    @ParameterizedTest
    @ValueSource(strings = {"# no parameters yet\n", "---\n", "---\n# nothing here\n", "  \n"})
    @Tag("unit")
    void testContentlessMetadataIsEmpty(String yaml) throws IOException {
        // Arrange
        Files.writeString(dir.resolve("greet.meta.yaml"), yaml);

        // Act
        DeclaredParameters parameters = loader.load(template);

        // Assert
        assertThat(parameters.isPresent()).isTrue();
        assertThat(parameters.names()).isEmpty();
    }

    /**
     * Verifies that malformed YAML is reported as an IOException naming the metadata file.
     * This is a unit test for metadata error handling.
     */
    @Test
    @Tag("unit")
    void testMalformedMetadata() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("greet.meta.yaml"), "parameters: [unclosed\n");

        // Act & Assert
        assertThatThrownBy(() -> loader.load(template))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("failed to unmarshal greet.meta.yaml");
    }

    /**
     * Verifies that asking absent parameters for their names is a programming error.
     * This is a unit test for {@link DeclaredParameters}.
     */
    @Test
    @Tag("unit")
    void testAbsentParametersHaveNoNames() {
        assertThatThrownBy(() -> DeclaredParameters.absent().names()).isInstanceOf(IllegalStateException.class);
    }
}
