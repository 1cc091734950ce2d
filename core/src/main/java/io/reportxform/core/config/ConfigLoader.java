package io.reportxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.reportxform.core.error.ConfigLoadException;
import io.reportxform.core.translate.SandboxPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ReportXformConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * compiler:
 *   max-nesting-depth: 32
 *   sandbox-policy: report        # report | reject
 *   sandbox-rules: ./rules.yaml   # optional, replaces the bundled rules
 * report:
 *   data-set-name: ReportData     # empty string disables the data set
 *   body-height: 6
 *   header-height: 0.5
 *   footer-height: 0.5
 *   page:
 *     width: 8.5
 *     height: 11
 *     margins: { left: 1, right: 1, top: 1, bottom: 1 }
 * </pre>
 *
 * Missing keys keep the {@link ReportXformConfig.Builder} defaults; unknown keys are rejected.
 *
 * <p>Environment variables ({@code REPORTXFORM_MAX_NESTING_DEPTH}, {@code
 * REPORTXFORM_SANDBOX_POLICY}, {@code REPORTXFORM_SANDBOX_RULES}, {@code
 * REPORTXFORM_DATA_SET_NAME}, {@code REPORTXFORM_PAGE_WIDTH}, {@code REPORTXFORM_PAGE_HEIGHT},
 * {@code REPORTXFORM_BODY_HEIGHT}) take precedence over YAML. A variable counts as set only if it
 * is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_PREFIX = "REPORTXFORM_";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("compiler", "report");
    private static final Set<String> KNOWN_COMPILER_KEYS =
            Set.of("max-nesting-depth", "sandbox-policy", "sandbox-rules");
    private static final Set<String> KNOWN_REPORT_KEYS =
            Set.of("data-set-name", "body-height", "header-height", "footer-height", "page");
    private static final Set<String> KNOWN_PAGE_KEYS = Set.of("width", "height", "margins");
    private static final Set<String> KNOWN_MARGIN_KEYS = Set.of("left", "right", "top", "bottom");

    private ConfigLoader() {
        // utility class
    }

    /** The defaults with the process environment applied. */
    public static ReportXformConfig defaults() {
        return defaults(System::getenv);
    }

    /** The defaults with the given environment applied. */
    public static ReportXformConfig defaults(Function<String, String> envLookup) {
        ReportXformConfig.Builder builder = ReportXformConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return build(builder, "defaults");
    }

    /**
     * Loads a configuration file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static ReportXformConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a configuration file, applying overrides from {@code envLookup}. A {@code null} return
     * from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static ReportXformConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }

        ReportXformConfig.Builder builder = ReportXformConfig.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            mapYaml(root, builder, configPath.toString());
        }
        applyEnvOverrides(builder, envLookup);
        ReportXformConfig config = build(builder, configPath.toString());
        LOG.info("Loaded configuration from {}", configPath);
        return config;
    }

    private static void mapYaml(JsonNode root, ReportXformConfig.Builder builder, String source) {
        requireObject(root, "configuration root", source);
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "configuration root", source);

        JsonNode compiler = root.path("compiler");
        if (!compiler.isMissingNode()) {
            requireObject(compiler, "compiler", source);
            rejectUnknownKeys(compiler, KNOWN_COMPILER_KEYS, "compiler", source);
            if (compiler.has("max-nesting-depth")) {
                builder.maxNestingDepth(requireInt(compiler, "max-nesting-depth", source));
            }
            if (compiler.has("sandbox-policy")) {
                builder.sandboxPolicy(parsePolicy(compiler.get("sandbox-policy").asText(), source));
            }
            if (compiler.has("sandbox-rules")) {
                builder.sandboxRulesPath(Path.of(compiler.get("sandbox-rules").asText()));
            }
        }

        JsonNode report = root.path("report");
        if (!report.isMissingNode()) {
            requireObject(report, "report", source);
            rejectUnknownKeys(report, KNOWN_REPORT_KEYS, "report", source);
            if (report.has("data-set-name")) {
                builder.dataSetName(report.get("data-set-name").asText());
            }
            if (report.has("body-height")) builder.bodyHeight(requireNumber(report, "body-height", source));
            if (report.has("header-height")) builder.headerHeight(requireNumber(report, "header-height", source));
            if (report.has("footer-height")) builder.footerHeight(requireNumber(report, "footer-height", source));

            JsonNode page = report.path("page");
            if (!page.isMissingNode()) {
                requireObject(page, "report.page", source);
                rejectUnknownKeys(page, KNOWN_PAGE_KEYS, "report.page", source);
                if (page.has("width")) builder.pageWidth(requireNumber(page, "width", source));
                if (page.has("height")) builder.pageHeight(requireNumber(page, "height", source));

                JsonNode margins = page.path("margins");
                if (!margins.isMissingNode()) {
                    requireObject(margins, "report.page.margins", source);
                    rejectUnknownKeys(margins, KNOWN_MARGIN_KEYS, "report.page.margins", source);
                    if (margins.has("left")) builder.leftMargin(requireNumber(margins, "left", source));
                    if (margins.has("right")) builder.rightMargin(requireNumber(margins, "right", source));
                    if (margins.has("top")) builder.topMargin(requireNumber(margins, "top", source));
                    if (margins.has("bottom")) builder.bottomMargin(requireNumber(margins, "bottom", source));
                }
            }
        }
    }

    private static void applyEnvOverrides(ReportXformConfig.Builder builder, Function<String, String> envLookup) {
        envInt(envLookup, "MAX_NESTING_DEPTH", builder::maxNestingDepth);
        envString(envLookup, "SANDBOX_POLICY", value -> builder.sandboxPolicy(parsePolicy(value, "environment")));
        envString(envLookup, "SANDBOX_RULES", value -> builder.sandboxRulesPath(Path.of(value)));
        envString(envLookup, "DATA_SET_NAME", builder::dataSetName);
        envDouble(envLookup, "PAGE_WIDTH", builder::pageWidth);
        envDouble(envLookup, "PAGE_HEIGHT", builder::pageHeight);
        envDouble(envLookup, "BODY_HEIGHT", builder::bodyHeight);
    }

    private static ReportXformConfig build(ReportXformConfig.Builder builder, String source) {
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static SandboxPolicy parsePolicy(String value, String source) {
        try {
            return SandboxPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Unknown sandbox-policy '" + value + "' in " + source + " (expected report or reject)", e);
        }
    }

    // --- Env var helpers ---

    private static String envValue(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(ENV_PREFIX + name);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envValue(envLookup, name);
        if (value != null) {
            setter.accept(value);
        }
    }

    private static void envInt(Function<String, String> envLookup, String name, IntConsumer setter) {
        String value = envValue(envLookup, name);
        if (value != null) {
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_PREFIX + name + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envDouble(Function<String, String> envLookup, String name, DoubleConsumer setter) {
        String value = envValue(envLookup, name);
        if (value != null) {
            try {
                setter.accept(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_PREFIX + name + " must be a number, got '" + value + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static void requireObject(JsonNode node, String block, String source) {
        if (!node.isObject()) {
            throw new ConfigLoadException("'" + block + "' must be a mapping in " + source);
        }
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String block, String source) {
        List<String> unknown = new ArrayList<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigLoadException(
                    "Unknown key(s) " + unknown + " in '" + block + "' of " + source + ". Allowed: "
                            + known.stream().sorted().toList());
        }
    }

    private static int requireInt(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("'" + field + "' must be an integer in " + source);
        }
        return value.asInt();
    }

    private static double requireNumber(JsonNode node, String field, String source) {
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new ConfigLoadException("'" + field + "' must be a number in " + source);
        }
        return value.asDouble();
    }
}
