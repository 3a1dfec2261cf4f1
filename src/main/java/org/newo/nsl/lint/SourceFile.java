package org.newo.nsl.lint;

import java.util.ArrayList;
import java.util.List;

/**
 * The text of one template, together with its lines.
 *
 * @param fileName The name used in diagnostics.
 * @param content The full text.
 * @param lines The lines of the text without their terminators; line {@code n} is at index {@code n - 1}.
 */
public record SourceFile(
        String fileName,
        String content,
        List<String> lines
) {

    public SourceFile {
        lines = List.copyOf(lines);
    }

    /**
     * Splits the content into lines. Both {@code \n} and {@code \r\n} end a line, and a final
     * line terminator does not start another line.
     * @param fileName The name used in diagnostics.
     * @param content The full text.
     * @return The source file.
     */
    public static SourceFile of(String fileName, String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < content.length()) {
            int end = content.indexOf('\n', start);
            if (end < 0) {
                end = content.length();
            }
            String line = content.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = end + 1;
        }
        return new SourceFile(fileName, content, lines);
    }
}
