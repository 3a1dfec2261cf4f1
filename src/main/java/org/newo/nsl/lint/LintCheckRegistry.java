package org.newo.nsl.lint;

import org.newo.nsl.lint.checks.BlockNestingCheck;
import org.newo.nsl.lint.checks.CommentCheck;
import org.newo.nsl.lint.checks.CyrillicCharacterCheck;
import org.newo.nsl.lint.checks.DelimiterBalanceCheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A registry for lint checks. Checks run in registration order.
 */
public class LintCheckRegistry {
    private final Map<String, ILintCheck> checks = new LinkedHashMap<>();

    /**
     * Registers a new check, replacing any check with the same name.
     * @param name The name of the check (e.g., "cyrillic").
     * @param check The check.
     */
    public void register(String name, ILintCheck check) {
        checks.put(name, check);
    }

    /**
     * @return All registered checks in the order they run.
     */
    public List<ILintCheck> getChecks() {
        return Collections.unmodifiableList(new ArrayList<>(checks.values()));
    }

    /**
     * Initializes the registry with all built-in checks.
     * @return A new instance of {@link LintCheckRegistry} with all checks registered.
     */
    public static LintCheckRegistry initialize() {
        LintCheckRegistry registry = new LintCheckRegistry();
        registry.register("cyrillic", new CyrillicCharacterCheck());
        registry.register("comment", new CommentCheck());
        registry.register("delimiters", new DelimiterBalanceCheck());
        registry.register("blocks", new BlockNestingCheck());
        return registry;
    }
}
