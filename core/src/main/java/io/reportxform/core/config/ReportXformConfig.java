package io.reportxform.core.config;

import io.reportxform.core.translate.SandboxPolicy;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Compiler and report-layout settings. Lengths are in inches.
 *
 * <p>Every field has a default; use {@link #builder()} to override individual values or
 * {@link ConfigLoader} to read them from YAML.
 *
 * @param maxNestingDepth  bound on expression and conditional nesting
 * @param sandboxPolicy    what to do with expressions that violate the sandbox rules
 * @param sandboxRulesPath YAML rule file replacing the bundled rules, or {@code null}
 * @param dataSetName      name of the generated data set; blank means no data set
 * @param pageWidth        page width
 * @param pageHeight       page height
 * @param leftMargin       left page margin
 * @param rightMargin      right page margin
 * @param topMargin        top page margin
 * @param bottomMargin     bottom page margin
 * @param bodyHeight       initial body height
 * @param headerHeight     height of generated page headers
 * @param footerHeight     height of generated page footers
 */
public record ReportXformConfig(
        int maxNestingDepth,
        SandboxPolicy sandboxPolicy,
        Path sandboxRulesPath,
        String dataSetName,
        double pageWidth,
        double pageHeight,
        double leftMargin,
        double rightMargin,
        double topMargin,
        double bottomMargin,
        double bodyHeight,
        double headerHeight,
        double footerHeight) {

    public ReportXformConfig {
        Objects.requireNonNull(sandboxPolicy, "sandboxPolicy must not be null");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        requirePositive("pageWidth", pageWidth);
        requirePositive("pageHeight", pageHeight);
        requirePositive("bodyHeight", bodyHeight);
        requirePositive("headerHeight", headerHeight);
        requirePositive("footerHeight", footerHeight);
        requireNonNegative("leftMargin", leftMargin);
        requireNonNegative("rightMargin", rightMargin);
        requireNonNegative("topMargin", topMargin);
        requireNonNegative("bottomMargin", bottomMargin);
        if (pageWidth - leftMargin - rightMargin <= 0) {
            throw new IllegalArgumentException("Margins leave no printable width on a " + pageWidth + "in page");
        }
    }

    /** Page width minus the left and right margins. */
    public double printableWidth() {
        return pageWidth - leftMargin - rightMargin;
    }

    /** True when a data set should be generated. */
    public boolean hasDataSet() {
        return dataSetName != null && !dataSetName.isBlank();
    }

    /** The all-defaults configuration. */
    public static ReportXformConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }

    /** Builder for {@link ReportXformConfig}, pre-filled with defaults (US Letter, 1in margins). */
    public static final class Builder {
        private int maxNestingDepth = 32;
        private SandboxPolicy sandboxPolicy = SandboxPolicy.REPORT;
        private Path sandboxRulesPath;
        private String dataSetName = "ReportData";
        private double pageWidth = 8.5;
        private double pageHeight = 11;
        private double leftMargin = 1;
        private double rightMargin = 1;
        private double topMargin = 1;
        private double bottomMargin = 1;
        private double bodyHeight = 6;
        private double headerHeight = 0.5;
        private double footerHeight = 0.5;

        Builder() {}

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder sandboxPolicy(SandboxPolicy sandboxPolicy) {
            this.sandboxPolicy = sandboxPolicy;
            return this;
        }

        public Builder sandboxRulesPath(Path sandboxRulesPath) {
            this.sandboxRulesPath = sandboxRulesPath;
            return this;
        }

        public Builder dataSetName(String dataSetName) {
            this.dataSetName = dataSetName;
            return this;
        }

        public Builder pageWidth(double pageWidth) {
            this.pageWidth = pageWidth;
            return this;
        }

        public Builder pageHeight(double pageHeight) {
            this.pageHeight = pageHeight;
            return this;
        }

        public Builder leftMargin(double leftMargin) {
            this.leftMargin = leftMargin;
            return this;
        }

        public Builder rightMargin(double rightMargin) {
            this.rightMargin = rightMargin;
            return this;
        }

        public Builder topMargin(double topMargin) {
            this.topMargin = topMargin;
            return this;
        }

        public Builder bottomMargin(double bottomMargin) {
            this.bottomMargin = bottomMargin;
            return this;
        }

        /** Sets all four margins. */
        public Builder margins(double margin) {
            this.leftMargin = margin;
            this.rightMargin = margin;
            this.topMargin = margin;
            this.bottomMargin = margin;
            return this;
        }

        public Builder bodyHeight(double bodyHeight) {
            this.bodyHeight = bodyHeight;
            return this;
        }

        public Builder headerHeight(double headerHeight) {
            this.headerHeight = headerHeight;
            return this;
        }

        public Builder footerHeight(double footerHeight) {
            this.footerHeight = footerHeight;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public ReportXformConfig build() {
            return new ReportXformConfig(
                    maxNestingDepth,
                    sandboxPolicy,
                    sandboxRulesPath,
                    dataSetName,
                    pageWidth,
                    pageHeight,
                    leftMargin,
                    rightMargin,
                    topMargin,
                    bottomMargin,
                    bodyHeight,
                    headerHeight,
                    footerHeight);
        }
    }
}
