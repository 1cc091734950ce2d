package io.reportxform.core.model;

import java.util.Locale;

/** Category of a field code as reported by the extraction stage. */
public enum FieldCategory {
    /** {@code MERGEFIELD}: data binding. */
    MERGE_FIELD("MERGEFIELD"),
    /** {@code IF}: conditional text. */
    IF("IF"),
    /** {@code DATE}: current date. */
    DATE("DATE"),
    /** {@code TIME}: current time. */
    TIME("TIME"),
    /** {@code PAGE}: current page number. */
    PAGE("PAGE"),
    /** {@code NUMPAGES}: total page count. */
    NUM_PAGES("NUMPAGES"),
    /** {@code =}: calculation formula. */
    FORMULA("="),
    /** {@code SEQ}: sequence number. */
    SEQUENCE("SEQ"),
    /** {@code TOC}: table of contents. */
    TABLE_OF_CONTENTS("TOC"),
    /** {@code HYPERLINK}. */
    HYPERLINK("HYPERLINK"),
    /** Anything the extraction stage could not classify. */
    UNSUPPORTED(null);

    private final String keyword;

    FieldCategory(String keyword) {
        this.keyword = keyword;
    }

    /** The leading field-code keyword, or {@code null} for {@link #UNSUPPORTED}. */
    public String keyword() {
        return keyword;
    }

    /**
     * Classifies raw field-code text by its leading keyword. Unknown keywords map to {@link
     * #UNSUPPORTED}.
     */
    public static FieldCategory detect(String rawText) {
        if (rawText == null) {
            return UNSUPPORTED;
        }
        String trimmed = rawText.strip();
        if (trimmed.startsWith("{")) {
            trimmed = trimmed.substring(1).strip();
        }
        if (trimmed.startsWith("=")) {
            return FORMULA;
        }
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        String word = trimmed.substring(0, end).toUpperCase(Locale.ROOT);
        for (FieldCategory category : values()) {
            if (word.equals(category.keyword)) {
                return category;
            }
        }
        return UNSUPPORTED;
    }
}
