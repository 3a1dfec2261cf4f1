package org.newo.nsl.frontend.printer;

import org.newo.nsl.frontend.lexer.Lexer;
import org.newo.nsl.frontend.parser.Parser;
import org.newo.nsl.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DebugPrinter}.
 */
public class DebugPrinterTest {

    /**
     * Verifies the compact forms of statements and the parenthesized form of expressions.
     * This is a unit test for the debug printer.
     */
    @Test
    @Tag("unit")
    void testCompactForms() {
        // Arrange
        Program program = new Parser(new Lexer(
                "{% set x = 5 + 5 %}{{ -a }}{% if c %}{{ d }}{% elif e %}f{% else %}g{% endif %}{% for i in l %}{{ i | h }}{% endfor %}"))
                .parseProgram();

        // Act
        String printed = DebugPrinter.INSTANCE.print(program);

        // Assert
        assertThat(printed).isEqualTo("set x = (5 + 5){{(-a)}}if c {{d}}elif e felse gfor i in l {{i | h}}");
        assertThat(program.toString()).isEqualTo(printed);
    }
}
