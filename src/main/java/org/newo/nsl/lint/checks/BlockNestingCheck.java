package org.newo.nsl.lint.checks;

import org.newo.nsl.diagnostics.DiagnosticsEngine;
import org.newo.nsl.lint.ILintCheck;
import org.newo.nsl.lint.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Verifies that {@code if}, {@code for} and {@code block} tags are closed by their matching
 * end tags, in the right order. Reports at most one error, at line 1, for the first problem found.
 */
public class BlockNestingCheck implements ILintCheck {

    private static final Pattern BLOCK_TAG = Pattern.compile("\\{%-?\\s*(\\w+)");
    private static final Set<String> STARTERS = Set.of("if", "for", "block");
    private static final Map<String, String> ENDERS = Map.of(
            "endif", "if",
            "endfor", "for",
            "endblock", "block"
    );

    @Override
    public void check(SourceFile file, DiagnosticsEngine diagnostics) {
        Deque<String> open = new ArrayDeque<>();
        Matcher matcher = BLOCK_TAG.matcher(file.content());
        while (matcher.find()) {
            String tag = matcher.group(1);
            if (STARTERS.contains(tag)) {
                open.push(tag);
                continue;
            }
            String opener = ENDERS.get(tag);
            if (opener == null) {
                continue;
            }
            if (open.isEmpty()) {
                diagnostics.reportError("unexpected closing tag: " + tag, file.fileName(), 1);
                return;
            }
            if (!open.peek().equals(opener)) {
                diagnostics.reportError(
                        "mismatched closing tag: expected end for " + open.peek() + ", but got " + tag,
                        file.fileName(), 1);
                return;
            }
            open.pop();
        }

        if (!open.isEmpty()) {
            // Report outermost first.
            List<String> unclosed = new ArrayList<>(open);
            Collections.reverse(unclosed);
            diagnostics.reportError("unclosed block(s): " + String.join(", ", unclosed), file.fileName(), 1);
        }
    }
}
