package org.newo.nsl.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Normalizes the whitespace of a template without parsing it: trailing spaces and tabs are
 * removed, runs of blank lines are collapsed to one, and the file ends with exactly one newline.
 */
public class WhitespaceFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(WhitespaceFormatter.class);

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("(?m)[\\t ]+$");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");

    /**
     * Formats template text.
     * @param content The template text.
     * @return The normalized text.
     */
    public String format(String content) {
        String result = TRAILING_WHITESPACE.matcher(content).replaceAll("");
        result = BLANK_LINE_RUNS.matcher(result).replaceAll("\n\n");
        return result.strip() + "\n";
    }

    /**
     * Formats a file in place. The file is only written if its content changes.
     * @param file The template file.
     * @return {@code true} if the file was rewritten.
     * @throws IOException if the file cannot be read or written.
     */
    public boolean formatFile(Path file) throws IOException {
        String original = Files.readString(file, StandardCharsets.UTF_8);
        String formatted = format(original);
        if (formatted.equals(original)) {
            return false;
        }
        Files.writeString(file, formatted, StandardCharsets.UTF_8);
        LOG.info("Formatted {}", file);
        return true;
    }
}
