package org.newo.nsl.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Settings of the lint orchestrator, read from the {@code nsl.lint} section of a Typesafe
 * {@link Config}. Defaults live in {@code reference.conf}.
 *
 * @param fileExtension The extension of template files, e.g. {@code .nsl}.
 * @param metadataSuffixes The suffixes of sidecar metadata files, in lookup order.
 * @param parallelism The number of worker threads used for directory linting.
 * @param maxNestingDepth The parser's limit for nested statements and expressions.
 */
public record LintOptions(
        String fileExtension,
        List<String> metadataSuffixes,
        int parallelism,
        int maxNestingDepth
) {

    /** The configuration path of the lint section. */
    public static final String CONFIG_PATH = "nsl.lint";

    public LintOptions {
        metadataSuffixes = List.copyOf(metadataSuffixes);
    }

    /**
     * Reads and validates the lint options.
     * @param config A resolved configuration containing the {@code nsl.lint} section.
     * @return The options.
     * @throws ConfigException if a key is missing or has an invalid value.
     */
    public static LintOptions fromConfig(Config config) {
        Config lint = config.getConfig(CONFIG_PATH);
        String extension = lint.getString("file-extension");
        List<String> suffixes = lint.getStringList("metadata-suffixes");
        int parallelism = lint.getInt("parallelism");
        int depth = lint.getInt("max-nesting-depth");

        if (extension.isBlank()) {
            throw new ConfigException.BadValue(lint.origin(), CONFIG_PATH + ".file-extension", "must not be blank");
        }
        if (suffixes.isEmpty() || suffixes.stream().anyMatch(String::isBlank)) {
            throw new ConfigException.BadValue(lint.origin(), CONFIG_PATH + ".metadata-suffixes",
                    "must be a non-empty list of non-blank suffixes");
        }
        if (parallelism < 1) {
            throw new ConfigException.BadValue(lint.origin(), CONFIG_PATH + ".parallelism",
                    "must be at least 1, got " + parallelism);
        }
        if (depth < 1) {
            throw new ConfigException.BadValue(lint.origin(), CONFIG_PATH + ".max-nesting-depth",
                    "must be at least 1, got " + depth);
        }
        return new LintOptions(extension, suffixes, parallelism, depth);
    }

    /**
     * Loads the options from the application configuration
     * (system properties, {@code application.conf}, then {@code reference.conf}).
     * @return The options.
     */
    public static LintOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * @return The options defined in {@code reference.conf} alone.
     */
    public static LintOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
