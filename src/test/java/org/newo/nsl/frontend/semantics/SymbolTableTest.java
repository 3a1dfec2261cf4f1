package org.newo.nsl.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SymbolTable}.
 */
public class SymbolTableTest {

    /**
     * Verifies that names defined in an inner scope disappear when it is left,
     * and that the root scope can never be left.
     * This is a unit test for scope management.
     */
    @Test
    @Tag("unit")
    void testScopeStack() {
        // Arrange
        SymbolTable table = new SymbolTable(List.of("param"));

        // Act
        table.enterScope();
        table.define("inner");
        boolean innerVisible = table.isDefined("inner") && table.isDefined("param");
        table.leaveScope();
        table.leaveScope();

        // Assert
        assertThat(innerVisible).isTrue();
        assertThat(table.isDefined("inner")).isFalse();
        assertThat(table.isDefined("param")).isTrue();
    }
}
