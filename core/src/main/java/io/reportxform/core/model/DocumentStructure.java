package io.reportxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Document structure as perceived by the upstream layout stage. Only the parts the synthesizer
 * consumes are modelled: positioned paragraphs, tables and images, and role-tagged logical
 * elements.
 *
 * @param pages           pages in document order
 * @param logicalElements elements tagged with a logical role (header, footer, ...)
 */
public record DocumentStructure(List<Page> pages, List<LogicalElement> logicalElements) {

    public DocumentStructure {
        pages = List.copyOf(pages);
        logicalElements = List.copyOf(logicalElements);
    }

    /** One page of content. */
    public record Page(int number, List<Paragraph> paragraphs, List<Table> tables, List<Image> images) {
        public Page {
            paragraphs = List.copyOf(paragraphs);
            tables = tables == null ? List.of() : List.copyOf(tables);
            images = images == null ? List.of() : List.copyOf(images);
        }

        public Page(int number, List<Paragraph> paragraphs) {
            this(number, paragraphs, List.of(), List.of());
        }
    }

    /** A positioned paragraph made of text runs. */
    public record Paragraph(String id, List<TextRun> runs, Bounds bounds) {
        public Paragraph {
            Objects.requireNonNull(id, "id must not be null");
            runs = List.copyOf(runs);
            Objects.requireNonNull(bounds, "bounds must not be null");
        }
    }

    /** A run carries either plain text or a field code, never both. */
    public record TextRun(String text, FieldCode fieldCode) {
        public TextRun {
            if ((text == null) == (fieldCode == null)) {
                throw new IllegalArgumentException("A text run carries exactly one of text or fieldCode");
            }
        }

        public static TextRun text(String text) {
            return new TextRun(text, null);
        }

        public static TextRun field(FieldCode fieldCode) {
            return new TextRun(null, fieldCode);
        }

        public boolean isField() {
            return fieldCode != null;
        }
    }

    /**
     * A positioned grid. Rows may be ragged; the widest row sets the column count and shorter rows
     * are padded with empty cells.
     */
    public record Table(String id, List<TableRow> rows, Bounds bounds) {
        public Table {
            Objects.requireNonNull(id, "id must not be null");
            rows = List.copyOf(rows);
            Objects.requireNonNull(bounds, "bounds must not be null");
        }

        public int columnCount() {
            int columns = 0;
            for (TableRow row : rows) {
                columns = Math.max(columns, row.cells().size());
            }
            return columns;
        }
    }

    /** A table row; a height of zero means the default row height. */
    public record TableRow(double height, List<TableCell> cells) {
        public TableRow {
            if (height < 0) {
                throw new IllegalArgumentException("Row height must not be negative");
            }
            cells = List.copyOf(cells);
        }
    }

    /**
     * A table cell. Width is in inches, zero when unknown. The background colour is optional.
     */
    public record TableCell(List<TextRun> runs, double width, String backgroundColor) {
        public TableCell {
            runs = List.copyOf(runs);
            if (width < 0) {
                throw new IllegalArgumentException("Cell width must not be negative");
            }
        }

        public static TableCell of(String text) {
            return new TableCell(List.of(TextRun.text(text)), 0, null);
        }
    }

    /**
     * An embedded picture. Header images are placed in the page header instead of the body.
     */
    public record Image(String id, byte[] data, String mimeType, Bounds bounds, boolean header) {
        public Image {
            Objects.requireNonNull(id, "id must not be null");
            data = Objects.requireNonNull(data, "data must not be null").clone();
            Objects.requireNonNull(mimeType, "mimeType must not be null");
            Objects.requireNonNull(bounds, "bounds must not be null");
        }

        @Override
        public byte[] data() {
            return data.clone();
        }
    }

    /** Rectangle in inches, relative to the body origin. */
    public record Bounds(double left, double top, double width, double height) {
        public Bounds {
            if (width < 0 || height < 0) {
                throw new IllegalArgumentException("Bounds must not have negative size");
            }
        }
    }

    /** Logical role of an element. */
    public enum LogicalRole {
        UNKNOWN,
        HEADER,
        FOOTER,
        TITLE,
        BODY
    }

    /** An element tagged with a logical role. */
    public record LogicalElement(LogicalRole role, String content) {
        public LogicalElement {
            Objects.requireNonNull(role, "role must not be null");
        }
    }
}
