package org.newo.nsl.diagnostics;

/**
 * Renders diagnostics for terminal output as {@code path:line: message}, followed by
 * the offending source line when the diagnostic carries one.
 */
public final class DiagnosticFormatter {

    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RESET = "\u001B[0m";

    private final boolean colored;

    /**
     * @param colored Whether the snippet line is highlighted with ANSI colors.
     */
    public DiagnosticFormatter(boolean colored) {
        this.colored = colored;
    }

    /**
     * Formats a single diagnostic.
     * @param diagnostic The diagnostic to render.
     * @return One line, or two lines if a snippet is present.
     */
    public String format(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder()
                .append(diagnostic.fileName())
                .append(':')
                .append(diagnostic.lineNumber())
                .append(": ")
                .append(diagnostic.message());
        String snippet = diagnostic.sourceLine();
        if (snippet != null) {
            sb.append('\n');
            if (colored) {
                sb.append(ANSI_GREEN).append("  ").append(snippet).append(ANSI_RESET);
            } else {
                sb.append("  ").append(snippet);
            }
        }
        return sb.toString();
    }
}
