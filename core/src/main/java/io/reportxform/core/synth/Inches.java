package io.reportxform.core.synth;

import java.util.Locale;
import java.util.regex.Pattern;

/** Fixed-point inch lengths as RDL writes them, e.g. {@code 6.50in}. */
public final class Inches {

    private static final Pattern FIXED_POINT = Pattern.compile("\\d+(\\.\\d+)?in");

    private Inches() {
        // utility class
    }

    /** Page and section geometry: two decimals. */
    public static String section(double inches) {
        return String.format(Locale.ROOT, "%.2fin", inches);
    }

    /** Report-item bounds: five decimals. */
    public static String item(double inches) {
        return String.format(Locale.ROOT, "%.5fin", inches);
    }

    /** True for non-negative fixed-point values with the {@code in} unit. */
    public static boolean isFixedPoint(String value) {
        return value != null && FIXED_POINT.matcher(value.strip()).matches();
    }

    /**
     * Parses a value written by {@link #section} or {@link #item}.
     *
     * @throws IllegalArgumentException if the value is not a fixed-point inch length
     */
    public static double parse(String value) {
        if (!isFixedPoint(value)) {
            throw new IllegalArgumentException("Not a fixed-point inch length: " + value);
        }
        String digits = value.strip();
        return Double.parseDouble(digits.substring(0, digits.length() - 2));
    }
}
