package org.newo.nsl.format;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link WhitespaceFormatter}.
 */
public class WhitespaceFormatterTest {

    private final WhitespaceFormatter formatter = new WhitespaceFormatter();

    /**
     * Verifies that trailing spaces and tabs are removed from every line.
     * This is a unit test for the formatter.
     */
    @Test
    @Tag("unit")
    void testTrailingWhitespace() {
        assertThat(formatter.format("{{ a }}  \n{{ b }}\t\n")).isEqualTo("{{ a }}\n{{ b }}\n");
    }

    /**
     * Verifies that runs of blank lines collapse to a single blank line.
     * This is a unit test for the formatter.
     */
    @Test
    @Tag("unit")
    void testBlankLinesCollapse() {
        assertThat(formatter.format("a\n\n\n\nb\n\nc")).isEqualTo("a\n\nb\n\nc\n");
    }

    /**
     * Verifies that leading and trailing blank space of the file is removed and one newline is added.
     * This is a unit test for the formatter.
     */
    @Test
    @Tag("unit")
    void testSingleFinalNewline() {
        assertThat(formatter.format("\n\n  {{ a }}\n\n\n")).isEqualTo("{{ a }}\n");
        assertThat(formatter.format("")).isEqualTo("\n");
    }

    /**
     * Verifies that a file is only rewritten when formatting changes it.
     * This is a unit test for in-place formatting.
     */
    @Test
    @Tag("unit")
    void testFormatFileReportsModification(@TempDir Path dir) throws IOException {
        // Arrange
        Path messy = dir.resolve("messy.nsl");
        Path clean = dir.resolve("clean.nsl");
        Files.writeString(messy, "{{ a }}   \n\n\n\n{{ b }}");
        Files.writeString(clean, "{{ a }}\n");

        // Act
        boolean messyChanged = formatter.formatFile(messy);
        boolean cleanChanged = formatter.formatFile(clean);

        // Assert
        assertThat(messyChanged).isTrue();
        assertThat(Files.readString(messy)).isEqualTo("{{ a }}\n\n{{ b }}\n");
        assertThat(cleanChanged).isFalse();
        assertThat(Files.readString(clean)).isEqualTo("{{ a }}\n");
    }
}
