package org.newo.nsl.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the parameters of a skill from the YAML metadata file next to its template.
 * <p>
 * For {@code greet.nsl} the loader tries each configured suffix in order, by default
 * {@code greet.meta.yaml} and then {@code greet.meta.yml}. The file is expected to contain
 * <pre>
 * parameters:
 *   - name: user_name
 *   - name: greeting
 * </pre>
 * Entries without a name are ignored; any other keys are tolerated.
 */
public class SkillMetadataLoader implements IParameterSource {

    private static final Logger LOG = LoggerFactory.getLogger(SkillMetadataLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final String templateExtension;
    private final List<String> suffixes;

    /**
     * @param templateExtension The extension stripped from the template name, e.g. {@code .nsl}.
     * @param suffixes The metadata suffixes to try, in order.
     */
    public SkillMetadataLoader(String templateExtension, List<String> suffixes) {
        this.templateExtension = Objects.requireNonNull(templateExtension, "templateExtension");
        this.suffixes = List.copyOf(suffixes);
    }

    @Override
    public DeclaredParameters load(Path templateFile) throws IOException {
        Path metadataFile = findMetadataFile(templateFile);
        if (metadataFile == null) {
            LOG.debug("No skill metadata for {}", templateFile);
            return DeclaredParameters.absent();
        }

        String yaml = Files.readString(metadataFile, StandardCharsets.UTF_8);
        SkillMetadata metadata;
        try {
            JsonNode tree = yamlMapper.readTree(yaml);
            // Blank, comment-only and bare "---" documents declare no parameters.
            if (tree == null || tree.isMissingNode() || tree.isNull()
                    || (tree.isTextual() && tree.asText().isBlank())) {
                LOG.debug("Empty skill metadata in {}", metadataFile);
                return DeclaredParameters.of(List.of());
            }
            metadata = yamlMapper.treeToValue(tree, SkillMetadata.class);
        } catch (JacksonException e) {
            throw new IOException("failed to unmarshal " + metadataFile.getFileName() + ": " + e.getOriginalMessage(), e);
        }

        List<String> names = new ArrayList<>();
        if (metadata != null && metadata.parameters != null) {
            for (Parameter parameter : metadata.parameters) {
                if (parameter != null && parameter.name != null && !parameter.name.isBlank()) {
                    names.add(parameter.name);
                }
            }
        }
        LOG.debug("Loaded {} parameter(s) from {}", names.size(), metadataFile);
        return DeclaredParameters.of(names);
    }

    /**
     * @param templateFile A template path.
     * @return The first existing metadata file for the template, or {@code null}.
     */
    Path findMetadataFile(Path templateFile) {
        String fileName = templateFile.getFileName().toString();
        String base = fileName.endsWith(templateExtension)
                ? fileName.substring(0, fileName.length() - templateExtension.length())
                : fileName;
        for (String suffix : suffixes) {
            Path candidate = templateFile.resolveSibling(base + suffix);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SkillMetadata {
        public List<Parameter> parameters;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Parameter {
        public String name;
    }
}
