package io.reportxform.core.synth;

import static io.reportxform.core.synth.RdlNamespaces.append;
import static io.reportxform.core.synth.RdlNamespaces.rd;
import static io.reportxform.core.synth.RdlNamespaces.rdl;

import java.util.List;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds {@code Textbox} report items. Generated names ({@code Textbox1}, {@code Textbox2}, ...)
 * come from a per-instance counter, so use one factory per document.
 *
 * <p>Not thread-safe.
 */
public final class TextboxFactory {

    private int counter;

    /**
     * Creates a textbox with one text run per value. Values starting with {@code =} are
     * expressions; all values are sanitized.
     */
    public Element createTextbox(
            Document doc, List<String> runValues, double left, double top, double width, double height) {
        return createNamedTextbox(doc, nextName(), runValues, left, top, width, height, null);
    }

    /**
     * Creates a textbox with a fixed name and an optional paragraph alignment ({@code Left},
     * {@code Center}, {@code Right}).
     */
    public Element createNamedTextbox(
            Document doc,
            String name,
            List<String> runValues,
            double left,
            double top,
            double width,
            double height,
            String textAlign) {
        return append(
                textbox(doc, name, runValues, textAlign),
                rdl(doc, "Top", Inches.item(top)),
                rdl(doc, "Left", Inches.item(left)),
                rdl(doc, "Height", Inches.item(height)),
                rdl(doc, "Width", Inches.item(width)),
                rdl(doc, "Style"));
    }

    /**
     * Creates an unpositioned textbox for a tablix cell; the cell's column and row give its size.
     *
     * @param backgroundColor optional cell background, {@code null} for none
     */
    public Element createCellTextbox(Document doc, String name, List<String> runValues, String backgroundColor) {
        Element style = rdl(doc, "Style");
        if (backgroundColor != null && !backgroundColor.isBlank()) {
            style.appendChild(rdl(doc, "BackgroundColor", backgroundColor.strip()));
        }
        return append(textbox(doc, name, runValues, null), style);
    }

    private static Element textbox(Document doc, String name, List<String> runValues, String textAlign) {
        Element textRuns = rdl(doc, "TextRuns");
        if (runValues.isEmpty()) {
            textRuns.appendChild(textRun(doc, ""));
        }
        for (String value : runValues) {
            textRuns.appendChild(textRun(doc, value));
        }
        Element paragraphStyle = rdl(doc, "Style");
        if (textAlign != null) {
            paragraphStyle.appendChild(rdl(doc, "TextAlign", textAlign));
        }

        Element textbox = rdl(doc, "Textbox");
        textbox.setAttributeNS(null, "Name", RdlNamespaces.sanitize(name));
        return append(
                textbox,
                rdl(doc, "CanGrow", "true"),
                rdl(doc, "KeepTogether", "true"),
                append(rdl(doc, "Paragraphs"), append(rdl(doc, "Paragraph"), textRuns, paragraphStyle)),
                rd(doc, "DefaultName", name));
    }

    /** Number of generated names handed out so far. */
    public int created() {
        return counter;
    }

    private String nextName() {
        return "Textbox" + ++counter;
    }

    private static Element textRun(Document doc, String value) {
        return append(rdl(doc, "TextRun"), rdl(doc, "Value", value), rdl(doc, "Style"));
    }
}
