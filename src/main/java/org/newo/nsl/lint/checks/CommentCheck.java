package org.newo.nsl.lint.checks;

import org.newo.nsl.diagnostics.DiagnosticsEngine;
import org.newo.nsl.lint.ILintCheck;
import org.newo.nsl.lint.SourceFile;

import java.util.List;

/**
 * Warns about lines containing {@code {#} or {@code #}}, since comments are stripped
 * from deployed skills.
 */
public class CommentCheck implements ILintCheck {

    @Override
    public void check(SourceFile file, DiagnosticsEngine diagnostics) {
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.contains("{#") || line.contains("#}")) {
                diagnostics.reportWarning("Line contains an NSL comment", file.fileName(), i + 1, line);
            }
        }
    }
}
