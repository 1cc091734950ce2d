package io.reportxform.core.synth;

import static io.reportxform.core.synth.RdlNamespaces.append;
import static io.reportxform.core.synth.RdlNamespaces.rd;
import static io.reportxform.core.synth.RdlNamespaces.rdl;

import io.reportxform.core.config.ReportXformConfig;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Creates RDL documents and applies structural mutations to them.
 *
 * <p>Mutations locate their anchor element with a namespace-qualified XPath. When the anchor is
 * missing the mutation does nothing, logs a warning and returns {@code false}.
 *
 * <p>Instances are stateless apart from the configuration and may be shared. A single document
 * must not be mutated from several threads at once.
 */
public final class RdlDocumentBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RdlDocumentBuilder.class);

    /** Name of the field synthesized when a data set has no real fields. */
    public static final String PLACEHOLDER_FIELD = "PlaceholderField";

    static final String DATA_SOURCE_NAME = "DataSource";
    static final String LOCAL_REPORT = "/* Local Report */";

    private static final String BODY_ITEMS = "/rdl:Report/rdl:ReportSections/rdl:ReportSection/rdl:Body/rdl:ReportItems";
    private static final String BODY_HEIGHT = "/rdl:Report/rdl:ReportSections/rdl:ReportSection/rdl:Body/rdl:Height";
    private static final String PAGE = "/rdl:Report/rdl:ReportSections/rdl:ReportSection/rdl:Page";
    private static final String DATA_SET_FIELDS = "/rdl:Report/rdl:DataSets/rdl:DataSet";
    private static final String REPORT_SECTIONS = "/rdl:Report/rdl:ReportSections";
    private static final String EMBEDDED_IMAGES = "/rdl:Report/rdl:EmbeddedImages";

    private final ReportXformConfig config;

    public RdlDocumentBuilder(ReportXformConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates a report skeleton: one report section with an empty body and the configured page.
     * Data sources and a data set holding {@value #PLACEHOLDER_FIELD} are added only when
     * {@code dataSetName} is non-blank.
     */
    public Document createEmptyDocument(String dataSetName) {
        Document doc = newDocument();
        Element report = rdl(doc, "Report");
        report.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", RdlNamespaces.RDL);
        report.setAttributeNS(
                XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + RdlNamespaces.RD_PREFIX, RdlNamespaces.REPORT_DESIGNER);
        doc.appendChild(report);

        if (dataSetName != null && !dataSetName.isBlank()) {
            report.appendChild(createDataSources(doc, dataSetName));
            report.appendChild(createDataSets(doc, dataSetName));
        }
        report.appendChild(createReportSections(doc));
        return doc;
    }

    /**
     * Adds a field to the named data set. The first real field replaces
     * {@value #PLACEHOLDER_FIELD}; a field already present is left alone.
     *
     * @return {@code false} if the data set does not exist
     */
    public boolean addDataField(Document doc, String dataSetName, String fieldName, String dataType) {
        Element fields = locate(doc, DATA_SET_FIELDS, "Name", RdlNamespaces.sanitize(dataSetName), "rdl:Fields");
        if (fields == null) {
            LOG.warn("DataSet '{}' not found; field '{}' not added", dataSetName, fieldName);
            return false;
        }
        String name = RdlNamespaces.sanitize(fieldName);
        Element placeholder = null;
        for (Element field : childElements(fields, "Field")) {
            String existing = field.getAttribute("Name");
            if (existing.equals(name)) {
                LOG.debug("Field '{}' already present in DataSet '{}'", name, dataSetName);
                return true;
            }
            if (existing.equals(PLACEHOLDER_FIELD)) {
                placeholder = field;
            }
        }
        fields.appendChild(createField(doc, name, dataType));
        if (placeholder != null) {
            fields.removeChild(placeholder);
        }
        return true;
    }

    /**
     * Appends a report item to the body.
     *
     * @return {@code false} if the document has no body
     */
    public boolean addReportItem(Document doc, Element item) {
        Element items = locate(doc, BODY_ITEMS, null, null, null);
        if (items == null) {
            LOG.warn("Body ReportItems not found; report item not added");
            return false;
        }
        items.appendChild(item.getOwnerDocument() == doc ? item : doc.importNode(item, true));
        return true;
    }

    /**
     * Adds an image to the {@code EmbeddedImages} section, creating the section just before
     * {@code ReportSections} on first use. An image already embedded under {@code name} is kept.
     *
     * @return {@code false} if the document has no report sections
     */
    public boolean addEmbeddedImage(Document doc, String name, String mimeType, byte[] data) {
        Element images = locate(doc, EMBEDDED_IMAGES, null, null, null);
        if (images == null) {
            Element sections = locate(doc, REPORT_SECTIONS, null, null, null);
            if (sections == null) {
                LOG.warn("ReportSections not found; embedded image '{}' not added", name);
                return false;
            }
            images = rdl(doc, "EmbeddedImages");
            sections.getParentNode().insertBefore(images, sections);
        }
        String imageName = RdlNamespaces.sanitize(name);
        for (Element existing : childElements(images, "EmbeddedImage")) {
            if (existing.getAttribute("Name").equals(imageName)) {
                LOG.debug("Embedded image '{}' already present", imageName);
                return true;
            }
        }
        Element image = rdl(doc, "EmbeddedImage");
        image.setAttributeNS(null, "Name", imageName);
        images.appendChild(append(
                image,
                rdl(doc, "MIMEType", mimeType),
                rdl(doc, "ImageData", Base64.getEncoder().encodeToString(data))));
        return true;
    }

    /**
     * Inserts a page header as the first child of {@code Page}. Each call adds a new header block.
     *
     * @throws IllegalArgumentException if {@code heightInches} is not positive
     * @return {@code false} if the document has no page
     */
    public boolean setPageHeader(
            Document doc, List<Element> items, double heightInches, boolean printOnFirst, boolean printOnLast) {
        Element header = createBand(doc, "PageHeader", items, heightInches, printOnFirst, printOnLast);
        Element page = locate(doc, PAGE, null, null, null);
        if (page == null) {
            LOG.warn("Page not found; header not added");
            return false;
        }
        page.insertBefore(header, page.getFirstChild());
        return true;
    }

    /**
     * Inserts a page footer after any existing header and footer blocks. Each call adds a new
     * footer block.
     *
     * @throws IllegalArgumentException if {@code heightInches} is not positive
     * @return {@code false} if the document has no page
     */
    public boolean setPageFooter(
            Document doc, List<Element> items, double heightInches, boolean printOnFirst, boolean printOnLast) {
        Element footer = createBand(doc, "PageFooter", items, heightInches, printOnFirst, printOnLast);
        Element page = locate(doc, PAGE, null, null, null);
        if (page == null) {
            LOG.warn("Page not found; footer not added");
            return false;
        }
        Node anchor = page.getFirstChild();
        while (anchor != null && isBand(anchor)) {
            anchor = anchor.getNextSibling();
        }
        page.insertBefore(footer, anchor);
        return true;
    }

    /**
     * Sets the body height.
     *
     * @throws IllegalArgumentException if {@code heightInches} is not positive
     * @return {@code false} if the document has no body height
     */
    public boolean updateBodyHeight(Document doc, double heightInches) {
        requirePositive(heightInches, "Body height");
        Element height = locate(doc, BODY_HEIGHT, null, null, null);
        if (height == null) {
            LOG.warn("Body Height not found; body height not updated");
            return false;
        }
        height.setTextContent(Inches.section(heightInches));
        return true;
    }

    // --- Skeleton ---

    private Element createDataSources(Document doc, String dataSetName) {
        // Stable per data set so that repeated runs produce identical output.
        String id = UUID.nameUUIDFromBytes(dataSetName.getBytes(StandardCharsets.UTF_8)).toString();
        Element dataSource = rdl(doc, "DataSource");
        dataSource.setAttributeNS(null, "Name", DATA_SOURCE_NAME);
        append(
                dataSource,
                rd(doc, "DataSourceID", id),
                append(
                        rdl(doc, "ConnectionProperties"),
                        rdl(doc, "DataProvider", "System.Data.DataSet"),
                        rdl(doc, "ConnectString", LOCAL_REPORT)));
        return append(rdl(doc, "DataSources"), dataSource);
    }

    private Element createDataSets(Document doc, String dataSetName) {
        Element dataSet = rdl(doc, "DataSet");
        dataSet.setAttributeNS(null, "Name", RdlNamespaces.sanitize(dataSetName));
        append(
                dataSet,
                append(
                        rdl(doc, "Query"),
                        rdl(doc, "DataSourceName", DATA_SOURCE_NAME),
                        rdl(doc, "CommandText", LOCAL_REPORT)),
                append(rdl(doc, "Fields"), createField(doc, PLACEHOLDER_FIELD, "System.String")),
                append(rd(doc, "DataSetInfo"), rd(doc, "DataSetName", dataSetName)));
        return append(rdl(doc, "DataSets"), dataSet);
    }

    private Element createReportSections(Document doc) {
        Element body = append(
                rdl(doc, "Body"), rdl(doc, "ReportItems"), rdl(doc, "Height", Inches.section(config.bodyHeight())));
        Element page = append(
                rdl(doc, "Page"),
                rdl(doc, "PageHeight", Inches.section(config.pageHeight())),
                rdl(doc, "PageWidth", Inches.section(config.pageWidth())),
                rdl(doc, "LeftMargin", Inches.section(config.leftMargin())),
                rdl(doc, "RightMargin", Inches.section(config.rightMargin())),
                rdl(doc, "TopMargin", Inches.section(config.topMargin())),
                rdl(doc, "BottomMargin", Inches.section(config.bottomMargin())));
        Element section = append(
                rdl(doc, "ReportSection"), body, rdl(doc, "Width", Inches.section(config.printableWidth())), page);
        return append(rdl(doc, "ReportSections"), section);
    }

    private static Element createField(Document doc, String name, String dataType) {
        Element field = rdl(doc, "Field");
        field.setAttributeNS(null, "Name", name);
        return append(field, rdl(doc, "DataField", name), rd(doc, "TypeName", dataType));
    }

    private static Element createBand(
            Document doc, String name, List<Element> items, double heightInches, boolean printOnFirst, boolean printOnLast) {
        requirePositive(heightInches, name + " height");
        Element band = append(
                rdl(doc, name),
                rdl(doc, "Height", Inches.section(heightInches)),
                rdl(doc, "PrintOnFirstPage", Boolean.toString(printOnFirst)),
                rdl(doc, "PrintOnLastPage", Boolean.toString(printOnLast)));
        if (items != null && !items.isEmpty()) {
            Element reportItems = rdl(doc, "ReportItems");
            for (Element item : items) {
                reportItems.appendChild(item.getOwnerDocument() == doc ? item : doc.importNode(item, true));
            }
            band.appendChild(reportItems);
        }
        return band;
    }

    private static void requirePositive(double heightInches, String what) {
        if (!(heightInches > 0)) {
            throw new IllegalArgumentException(what + " must be positive, got " + heightInches);
        }
    }

    private static boolean isBand(Node node) {
        return node.getNodeType() == Node.ELEMENT_NODE
                && RdlNamespaces.RDL.equals(node.getNamespaceURI())
                && ("PageHeader".equals(node.getLocalName()) || "PageFooter".equals(node.getLocalName()));
    }

    // --- XPath anchors ---

    /**
     * Evaluates {@code path}, optionally filtered by {@code [@attribute = value]} and followed by
     * {@code tail}, and returns the first match.
     */
    static Element locate(Document doc, String path, String attribute, String value, String tail) {
        if (attribute != null && value == null) {
            return null;
        }
        XPath xpath = XPathFactory.newInstance().newXPath();
        xpath.setNamespaceContext(RdlNamespaces.XPATH_CONTEXT);
        StringBuilder expression = new StringBuilder(path);
        if (attribute != null) {
            // Bound as a variable so that quotes in the value cannot break the expression.
            xpath.setXPathVariableResolver(name -> value);
            expression.append("[@").append(attribute).append(" = $value]");
        }
        if (tail != null) {
            expression.append('/').append(tail);
        }
        try {
            NodeList nodes = (NodeList) xpath.evaluate(expression.toString(), doc, XPathConstants.NODESET);
            return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
        } catch (XPathExpressionException e) {
            throw new IllegalStateException("Invalid anchor expression: " + expression, e);
        }
    }

    static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE
                    && RdlNamespaces.RDL.equals(child.getNamespaceURI())
                    && localName.equals(child.getLocalName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    static Document newDocument() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No namespace-aware DOM implementation available", e);
        }
    }
}
