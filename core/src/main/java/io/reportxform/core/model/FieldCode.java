package io.reportxform.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A field code as handed over by the extraction stage.
 *
 * @param id       stable locator of the field code within the source document
 * @param category the field-code category
 * @param rawText  the raw field-code instruction text
 * @param switches formatting switches keyed by switch character (for example {@code "@"} for a
 *                 date picture); never null. A switch without an argument maps to {@code ""}
 */
public record FieldCode(String id, FieldCategory category, String rawText, Map<String, String> switches) {

    public FieldCode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
        switches = switches == null ? Map.of() : Map.copyOf(withoutNullValues(switches));
    }

    public FieldCode(String id, FieldCategory category, String rawText) {
        this(id, category, rawText, Map.of());
    }

    private static Map<String, String> withoutNullValues(Map<String, String> switches) {
        if (!switches.containsValue(null)) {
            return switches;
        }
        Map<String, String> copy = new LinkedHashMap<>();
        switches.forEach((key, value) -> copy.put(key, value == null ? "" : value));
        return copy;
    }

    /** Creates a field code whose category is detected from the leading keyword. */
    public static FieldCode of(String id, String rawText) {
        return new FieldCode(id, FieldCategory.detect(rawText), rawText);
    }
}
