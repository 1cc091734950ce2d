package io.reportxform.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import io.reportxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * The rule set enforced by {@link SandboxValidator}.
 *
 * <p>Rules are loaded from YAML documents with three lists: {@code prohibitedPatterns}
 * (case-insensitive regular expressions), {@code allowedFunctions} and {@code allowedNamespaces}.
 * Every document is validated against the bundled {@code sandbox-rules.schema.json} before use;
 * the default rules ship as the classpath resource {@code sandbox-rules.yaml}.
 *
 * @param prohibitedPatterns compiled prohibited patterns, in declaration order
 * @param allowedFunctions   allowed function names, upper-cased
 * @param allowedNamespaces  allowed namespace prefixes, in declaration order
 */
public record SandboxRules(List<Pattern> prohibitedPatterns, Set<String> allowedFunctions, List<String> allowedNamespaces) {

    static final String DEFAULT_RESOURCE = "/sandbox-rules.yaml";
    static final String SCHEMA_RESOURCE = "/sandbox-rules.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static volatile SandboxRules defaults;

    public SandboxRules {
        prohibitedPatterns = List.copyOf(Objects.requireNonNull(prohibitedPatterns, "prohibitedPatterns"));
        allowedFunctions = allowedFunctions.stream()
                .map(name -> name.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        allowedNamespaces = List.copyOf(Objects.requireNonNull(allowedNamespaces, "allowedNamespaces"));
    }

    /** Case-insensitive membership test against {@link #allowedFunctions()}. */
    public boolean isAllowedFunction(String name) {
        return allowedFunctions.contains(name.toUpperCase(Locale.ROOT));
    }

    /** True if {@code namespace} starts with one of the allowed prefixes, ignoring case. */
    public boolean isAllowedNamespace(String namespace) {
        String lower = namespace.toLowerCase(Locale.ROOT);
        for (String prefix : allowedNamespaces) {
            if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * The bundled rule set. Loaded once and cached.
     *
     * @throws ConfigLoadException if the bundled resource is missing or invalid
     */
    public static SandboxRules defaults() {
        SandboxRules rules = defaults;
        if (rules == null) {
            synchronized (SandboxRules.class) {
                rules = defaults;
                if (rules == null) {
                    try (InputStream in = SandboxRules.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                        if (in == null) {
                            throw new ConfigLoadException("Missing classpath resource " + DEFAULT_RESOURCE);
                        }
                        rules = parse(YAML_MAPPER.readTree(in), DEFAULT_RESOURCE);
                    } catch (IOException e) {
                        throw new ConfigLoadException("Failed to read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
                    }
                    defaults = rules;
                }
            }
        }
        return rules;
    }

    /**
     * Loads a rule set from a YAML file.
     *
     * @throws ConfigLoadException if the file cannot be read, violates the schema or holds an
     *                             invalid pattern
     */
    public static SandboxRules load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), path.toString());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read sandbox rules " + path + ": " + e.getMessage(), e);
        }
    }

    static SandboxRules parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ConfigLoadException("Sandbox rules " + source + " are empty");
        }
        Set<com.networknt.schema.ValidationMessage> errors = schema().validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(com.networknt.schema.ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigLoadException("Sandbox rules " + source + " do not match schema: " + detail);
        }

        List<Pattern> patterns = new ArrayList<>();
        for (String regex : strings(root.get("prohibitedPatterns"))) {
            try {
                patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new ConfigLoadException(
                        "Invalid prohibited pattern '" + regex + "' in " + source + ": " + e.getDescription(), e);
            }
        }
        return new SandboxRules(
                patterns,
                new LinkedHashSet<>(strings(root.get("allowedFunctions"))),
                strings(root.get("allowedNamespaces")));
    }

    private static JsonSchema schema() {
        try (InputStream in = SandboxRules.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new ConfigLoadException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read " + SCHEMA_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }
}
