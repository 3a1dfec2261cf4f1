package org.newo.nsl.lint.checks;

import org.newo.nsl.diagnostics.DiagnosticsEngine;
import org.newo.nsl.lint.ILintCheck;
import org.newo.nsl.lint.SourceFile;

import java.util.List;

/**
 * Warns about lines that contain Cyrillic letters. Each line is reported at most once.
 */
public class CyrillicCharacterCheck implements ILintCheck {

    @Override
    public void check(SourceFile file, DiagnosticsEngine diagnostics) {
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean cyrillic = line.codePoints()
                    .anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.CYRILLIC);
            if (cyrillic) {
                diagnostics.reportWarning("Line contains Cyrillic characters", file.fileName(), i + 1, line);
            }
        }
    }
}
