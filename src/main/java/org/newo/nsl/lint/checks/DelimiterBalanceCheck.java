package org.newo.nsl.lint.checks;

import org.newo.nsl.diagnostics.DiagnosticsEngine;
import org.newo.nsl.lint.ILintCheck;
import org.newo.nsl.lint.SourceFile;

import java.util.List;

/**
 * Compares the number of opening and closing delimiters of each kind across the whole file.
 * Each unbalanced pair is reported once, at line 1.
 */
public class DelimiterBalanceCheck implements ILintCheck {

    private static final List<String[]> PAIRS = List.of(
            new String[]{"{{", "}}"},
            new String[]{"{%", "%}"},
            new String[]{"{#", "#}"}
    );

    @Override
    public void check(SourceFile file, DiagnosticsEngine diagnostics) {
        String content = file.content();
        for (String[] pair : PAIRS) {
            if (count(content, pair[0]) != count(content, pair[1])) {
                diagnostics.reportError(
                        "unbalanced delimiters across file: " + pair[0] + " and " + pair[1],
                        file.fileName(), 1);
            }
        }
    }

    /**
     * Counts non-overlapping occurrences, scanning left to right.
     */
    static int count(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
