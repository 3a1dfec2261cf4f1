package org.newo.nsl.lint;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SourceFile} line splitting.
 */
public class SourceFileTest {

    /**
     * Verifies handling of CRLF terminators, a final terminator and empty lines.
     * This is a unit test for line splitting.
     */
    @Test
    @Tag("unit")
    void testLineSplitting() {
        assertThat(SourceFile.of("f", "a\r\nb\n\nc\n").lines()).containsExactly("a", "b", "", "c");
        assertThat(SourceFile.of("f", "a").lines()).containsExactly("a");
        assertThat(SourceFile.of("f", "").lines()).isEmpty();
    }
}
