package io.reportxform.core.translate;

import io.reportxform.core.error.SandboxViolationException;
import io.reportxform.core.model.SandboxResult;
import io.reportxform.core.model.ValidationMessage;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks generated expressions against {@link SandboxRules}.
 *
 * <ul>
 *   <li>{@code SANDBOX001} (error): a prohibited pattern matches the expression text;
 *   <li>{@code SANDBOX002} (warning): a call to a function outside the allowed set;
 *   <li>{@code SANDBOX003} (error): a dotted namespace access outside the allowed prefixes.
 * </ul>
 *
 * Function and namespace scans ignore string-literal contents. Report collections ({@code Fields},
 * {@code Parameters}, {@code Globals}, {@code User}, {@code Code}, {@code ReportItems}) and
 * {@code .Value}/{@code .IsMissing} property access are not namespace accesses.
 *
 * <p>Violations never stop generation on their own; {@link #validateOrThrow(String)} escalates.
 * Thread-safe.
 */
public final class SandboxValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SandboxValidator.class);

    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:[^\"]|\"\")*\"");
    private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+)\\s*\\(");
    private static final Pattern NAMESPACE_ACCESS =
            Pattern.compile("(?<![\\w.])[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)+");

    private static final Set<String> REPORT_COLLECTIONS =
            Set.of("FIELDS", "PARAMETERS", "GLOBALS", "USER", "CODE", "REPORTITEMS");
    private static final Set<String> FIELD_PROPERTIES = Set.of("VALUE", "ISMISSING");
    private static final Set<String> OPERATOR_KEYWORDS = Set.of("AND", "OR", "NOT", "MOD", "XOR", "ANDALSO", "ORELSE");

    private final SandboxRules rules;

    public SandboxValidator() {
        this(SandboxRules.defaults());
    }

    public SandboxValidator(SandboxRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public SandboxResult validate(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        List<ValidationMessage> messages = new ArrayList<>();
        List<String> violations = new ArrayList<>();

        for (Pattern pattern : rules.prohibitedPatterns()) {
            if (pattern.matcher(expression).find()) {
                violations.add("Prohibited pattern detected: " + pattern.pattern());
                messages.add(ValidationMessage.error(
                        "SANDBOX001", "Expression contains prohibited pattern: " + pattern.pattern(), expression));
            }
        }

        String code = STRING_LITERAL.matcher(expression).replaceAll("\"\"");

        for (String function : functionCalls(code)) {
            if (!rules.isAllowedFunction(function)
                    && !isReportCollection(function)
                    && !OPERATOR_KEYWORDS.contains(function.toUpperCase(Locale.ROOT))) {
                messages.add(ValidationMessage.warning(
                        "SANDBOX002",
                        "Unknown function call: " + function + ". Ensure it is a valid report function.",
                        function));
            }
        }

        for (String namespace : namespaceAccesses(code)) {
            if (!rules.isAllowedNamespace(namespace)) {
                violations.add("Access to namespace not allowed: " + namespace);
                messages.add(ValidationMessage.error(
                        "SANDBOX003", "Access to namespace '" + namespace + "' is not allowed", namespace));
            }
        }

        boolean valid = violations.isEmpty();
        if (!valid) {
            LOG.warn("Sandbox violations in expression '{}': {}", expression, String.join("; ", violations));
        }
        return new SandboxResult(valid, messages, violations);
    }

    /**
     * Validates and throws on the first failing result.
     *
     * @throws SandboxViolationException if any rule is violated
     */
    public SandboxResult validateOrThrow(String expression) {
        SandboxResult result = validate(expression);
        if (!result.valid()) {
            throw new SandboxViolationException(expression, result.violations());
        }
        return result;
    }

    public SandboxRules rules() {
        return rules;
    }

    private static Set<String> functionCalls(String code) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = FUNCTION_CALL.matcher(code);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static Set<String> namespaceAccesses(String code) {
        Set<String> accesses = new LinkedHashSet<>();
        Matcher matcher = NAMESPACE_ACCESS.matcher(code);
        while (matcher.find()) {
            String access = matcher.group();
            if (!isReportCollectionAccess(access) && !isFieldPropertyAccess(access)) {
                accesses.add(access);
            }
        }
        return accesses;
    }

    private static boolean isReportCollection(String name) {
        return REPORT_COLLECTIONS.contains(name.toUpperCase(Locale.ROOT));
    }

    private static boolean isReportCollectionAccess(String access) {
        return isReportCollection(access.substring(0, access.indexOf('.')));
    }

    private static boolean isFieldPropertyAccess(String access) {
        String[] parts = access.split("\\.");
        return parts.length == 2 && FIELD_PROPERTIES.contains(parts[1].toUpperCase(Locale.ROOT));
    }
}
