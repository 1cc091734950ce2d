package io.reportxform.core.synth;

import static io.reportxform.core.synth.RdlNamespaces.append;
import static io.reportxform.core.synth.RdlNamespaces.rdl;

import io.reportxform.core.model.DocumentStructure;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds static {@code Tablix} report items: one column member per column and one row member per
 * row, with each cell holding an unpositioned textbox named {@code Tablix<n>_Cell_<row>_<column>}.
 * Tablix numbers come from a per-instance counter, so use one factory per document.
 *
 * <p>Not thread-safe.
 */
public final class TablixFactory {

    private static final Logger LOG = LoggerFactory.getLogger(TablixFactory.class);

    static final double DEFAULT_ROW_HEIGHT = 0.25;
    static final double DEFAULT_COLUMN_WIDTH = 1.0;

    private final TextboxFactory textboxes;
    private int counter;

    public TablixFactory(TextboxFactory textboxes) {
        this.textboxes = textboxes;
    }

    /**
     * Creates a tablix for {@code table}.
     *
     * @param cellValues  text-run values per row and cell, parallel to {@code table.rows()}; rows
     *                    may be shorter than the column count
     * @param dataSetName data set the tablix is bound to, or {@code null} for an unbound tablix
     * @return the tablix, or {@code null} if the table has no cells
     */
    public Element createTablix(
            Document doc, DocumentStructure.Table table, List<List<List<String>>> cellValues, String dataSetName) {
        int columns = table.columnCount();
        if (columns == 0) {
            LOG.warn("Table '{}' has no cells; skipped", table.id());
            return null;
        }
        int id = ++counter;
        String name = "Tablix" + id;
        double[] widths = columnWidths(table, columns);

        Element tablixColumns = rdl(doc, "TablixColumns");
        for (double width : widths) {
            tablixColumns.appendChild(append(rdl(doc, "TablixColumn"), rdl(doc, "Width", Inches.item(width))));
        }

        Element tablixRows = rdl(doc, "TablixRows");
        double rowsHeight = 0;
        List<DocumentStructure.TableRow> rows = table.rows();
        for (int r = 0; r < rows.size(); r++) {
            DocumentStructure.TableRow row = rows.get(r);
            double height = row.height() > 0 ? row.height() : DEFAULT_ROW_HEIGHT;
            rowsHeight += height;
            Element cells = rdl(doc, "TablixCells");
            for (int c = 0; c < columns; c++) {
                String cellName = name + "_Cell_" + r + "_" + c;
                Element textbox;
                if (c < row.cells().size()) {
                    DocumentStructure.TableCell cell = row.cells().get(c);
                    textbox = textboxes.createCellTextbox(doc, cellName, cellValues.get(r).get(c), cell.backgroundColor());
                } else {
                    textbox = textboxes.createCellTextbox(doc, cellName, List.of(), null);
                }
                cells.appendChild(append(rdl(doc, "TablixCell"), append(rdl(doc, "CellContents"), textbox)));
            }
            tablixRows.appendChild(append(
                    rdl(doc, "TablixRow"), rdl(doc, "Height", Inches.item(height)), cells));
        }

        Element tablix = rdl(doc, "Tablix");
        tablix.setAttributeNS(null, "Name", name);
        append(
                tablix,
                append(rdl(doc, "TablixBody"), tablixColumns, tablixRows),
                hierarchy(doc, "TablixColumnHierarchy", columns),
                hierarchy(doc, "TablixRowHierarchy", rows.size()));
        if (dataSetName != null && !dataSetName.isBlank()) {
            tablix.appendChild(rdl(doc, "DataSetName", dataSetName));
        }
        DocumentStructure.Bounds bounds = table.bounds();
        double width = bounds.width() > 0 ? bounds.width() : sum(widths);
        double height = bounds.height() > 0 ? bounds.height() : rowsHeight;
        LOG.debug("Created {} for table '{}' ({}x{})", name, table.id(), rows.size(), columns);
        return append(
                tablix,
                rdl(doc, "Top", Inches.item(bounds.top())),
                rdl(doc, "Left", Inches.item(bounds.left())),
                rdl(doc, "Height", Inches.item(height)),
                rdl(doc, "Width", Inches.item(width)),
                rdl(doc, "Style"));
    }

    /** Number of tablixes created so far. */
    public int created() {
        return counter;
    }

    /**
     * Widths come from the first row's cells. Unknown widths share the table width left over by
     * the known ones, or fall back to {@value #DEFAULT_COLUMN_WIDTH} inch.
     */
    static double[] columnWidths(DocumentStructure.Table table, int columns) {
        double[] widths = new double[columns];
        List<DocumentStructure.TableCell> first = table.rows().get(0).cells();
        double known = 0;
        List<Integer> unknown = new ArrayList<>();
        for (int c = 0; c < columns; c++) {
            double width = c < first.size() ? first.get(c).width() : 0;
            if (width > 0) {
                widths[c] = width;
                known += width;
            } else {
                unknown.add(c);
            }
        }
        if (!unknown.isEmpty()) {
            double remaining = table.bounds().width() - known;
            double share = remaining > 0 ? remaining / unknown.size() : DEFAULT_COLUMN_WIDTH;
            for (int c : unknown) {
                widths[c] = share;
            }
        }
        return widths;
    }

    private static Element hierarchy(Document doc, String name, int members) {
        Element list = rdl(doc, "TablixMembers");
        for (int i = 0; i < members; i++) {
            list.appendChild(rdl(doc, "TablixMember"));
        }
        return append(rdl(doc, name), list);
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
