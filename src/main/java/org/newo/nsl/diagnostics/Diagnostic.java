package org.newo.nsl.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * produced while linting or analyzing a template file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue; 1 for file-scoped issues.
 * @param sourceLine The raw source line the issue refers to, or {@code null} if there is none.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        String sourceLine
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the template invalid. */
        ERROR,
        /** An advisory problem that does not block later checks. */
        WARNING
    }

    /**
     * Creates a diagnostic without a source snippet.
     * @param type The type of the diagnostic.
     * @param message The diagnostic message.
     * @param fileName The file name.
     * @param lineNumber The line number.
     */
    public Diagnostic(Type type, String message, String fileName, int lineNumber) {
        this(type, message, fileName, lineNumber, null);
    }

    /**
     * @return {@code true} if this diagnostic is an error.
     */
    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
