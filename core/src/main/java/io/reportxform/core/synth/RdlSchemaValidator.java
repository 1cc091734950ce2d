package io.reportxform.core.synth;

import io.reportxform.core.error.SchemaValidationException;
import io.reportxform.core.model.ValidationMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Structural checks that every generated report must pass before it is handed out.
 *
 * <table>
 *   <caption>Rule codes</caption>
 *   <tr><td>ROOT001</td><td>root is not {@code Report} in the RDL namespace</td></tr>
 *   <tr><td>REQ001</td><td>{@code ReportSections} missing</td></tr>
 *   <tr><td>REQ002</td><td>{@code ReportSection/Body} missing</td></tr>
 *   <tr><td>REQ003</td><td>{@code Body/Height} missing</td></tr>
 *   <tr><td>REQ004</td><td>section {@code Width} missing</td></tr>
 *   <tr><td>REQ005</td><td>section {@code Page} missing</td></tr>
 *   <tr><td>DS001</td><td>{@code DataSources} without a {@code DataSource}</td></tr>
 *   <tr><td>DS002</td><td>{@code DataSets} without a {@code DataSet}</td></tr>
 *   <tr><td>FIELDS001</td><td>{@code Fields} without a {@code Field}</td></tr>
 *   <tr><td>GEOM001</td><td>length not written as fixed-point inches</td></tr>
 *   <tr><td>GEOM002</td><td>section width exceeds the printable page width</td></tr>
 *   <tr><td>HDR001</td><td>header/footer without print flags</td></tr>
 *   <tr><td>HDR002</td><td>header/footer without a positive height</td></tr>
 * </table>
 *
 * Stateless and thread-safe.
 */
public final class RdlSchemaValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RdlSchemaValidator.class);

    private static final Set<String> LENGTH_ELEMENTS = Set.of(
            "Height",
            "Width",
            "Top",
            "Left",
            "PageHeight",
            "PageWidth",
            "LeftMargin",
            "RightMargin",
            "TopMargin",
            "BottomMargin");

    private static final double TOLERANCE = 0.005;

    /** Runs every check and returns all findings; an empty list means the document conforms. */
    public List<ValidationMessage> validate(Document doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        List<ValidationMessage> errors = new ArrayList<>();

        Element root = doc.getDocumentElement();
        if (root == null || !isRdl(root, "Report")) {
            errors.add(ValidationMessage.error("ROOT001", "Document must have a Report root element in the RDL namespace", "/"));
            return errors;
        }

        checkSections(root, errors);
        checkData(root, errors);
        checkLengths(root, errors);
        checkBands(root, errors);

        if (!errors.isEmpty()) {
            LOG.debug("RDL document has {} schema violation(s)", errors.size());
        }
        return errors;
    }

    /**
     * Validates and throws once with every finding.
     *
     * @throws SchemaValidationException if any check fails
     */
    public void validateOrThrow(Document doc) {
        List<ValidationMessage> errors = validate(doc);
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(errors);
        }
    }

    private static void checkSections(Element root, List<ValidationMessage> errors) {
        Element sections = child(root, "ReportSections");
        if (sections == null) {
            errors.add(ValidationMessage.error("REQ001", "Required element 'ReportSections' is missing", "/Report"));
            return;
        }
        List<Element> sectionList = RdlDocumentBuilder.childElements(sections, "ReportSection");
        if (sectionList.isEmpty()) {
            errors.add(ValidationMessage.error(
                    "REQ002", "Required element 'ReportSection/Body' is missing", "/Report/ReportSections"));
            return;
        }
        int index = 0;
        for (Element section : sectionList) {
            index++;
            String location = "/Report/ReportSections/ReportSection[" + index + "]";
            Element body = child(section, "Body");
            if (body == null) {
                errors.add(ValidationMessage.error("REQ002", "Required element 'Body' is missing", location));
            } else if (child(body, "Height") == null) {
                errors.add(ValidationMessage.error("REQ003", "Required element 'Body/Height' is missing", location + "/Body"));
            }
            Element width = child(section, "Width");
            if (width == null) {
                errors.add(ValidationMessage.error("REQ004", "Required element 'Width' is missing", location));
            }
            Element page = child(section, "Page");
            if (page == null) {
                errors.add(ValidationMessage.error("REQ005", "Required element 'Page' is missing", location));
            }
            if (width != null && page != null) {
                checkPrintableWidth(width, page, location, errors);
            }
        }
    }

    private static void checkPrintableWidth(Element width, Element page, String location, List<ValidationMessage> errors) {
        Double sectionWidth = length(width);
        Double pageWidth = length(child(page, "PageWidth"));
        Double left = length(child(page, "LeftMargin"));
        Double right = length(child(page, "RightMargin"));
        if (sectionWidth == null || pageWidth == null) {
            return;
        }
        double printable = pageWidth - (left == null ? 0 : left) - (right == null ? 0 : right);
        if (sectionWidth > printable + TOLERANCE) {
            errors.add(ValidationMessage.error(
                    "GEOM002",
                    "Section width " + width.getTextContent() + " exceeds the printable width of "
                            + Inches.section(printable),
                    location + "/Width"));
        }
    }

    private static void checkData(Element root, List<ValidationMessage> errors) {
        Element sources = child(root, "DataSources");
        if (sources != null && RdlDocumentBuilder.childElements(sources, "DataSource").isEmpty()) {
            errors.add(ValidationMessage.error("DS001", "DataSources must contain at least one DataSource", "/Report/DataSources"));
        }
        Element sets = child(root, "DataSets");
        if (sets != null && RdlDocumentBuilder.childElements(sets, "DataSet").isEmpty()) {
            errors.add(ValidationMessage.error("DS002", "DataSets must contain at least one DataSet", "/Report/DataSets"));
        }
        NodeList fieldsLists = root.getElementsByTagNameNS(RdlNamespaces.RDL, "Fields");
        for (int i = 0; i < fieldsLists.getLength(); i++) {
            Element fields = (Element) fieldsLists.item(i);
            if (RdlDocumentBuilder.childElements(fields, "Field").isEmpty()) {
                errors.add(ValidationMessage.error("FIELDS001", "Fields must contain at least one Field", pathOf(fields)));
            }
        }
    }

    private static void checkLengths(Element root, List<ValidationMessage> errors) {
        NodeList all = root.getElementsByTagNameNS(RdlNamespaces.RDL, "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if (!LENGTH_ELEMENTS.contains(element.getLocalName()) || hasElementChildren(element)) {
                continue;
            }
            String value = element.getTextContent();
            if (!Inches.isFixedPoint(value)) {
                errors.add(ValidationMessage.error(
                        "GEOM001",
                        "Length '" + value + "' must be a fixed-point value in inches",
                        pathOf(element)));
            }
        }
    }

    private static void checkBands(Element root, List<ValidationMessage> errors) {
        for (String band : List.of("PageHeader", "PageFooter")) {
            NodeList bands = root.getElementsByTagNameNS(RdlNamespaces.RDL, band);
            for (int i = 0; i < bands.getLength(); i++) {
                Element element = (Element) bands.item(i);
                String location = pathOf(element);
                if (child(element, "PrintOnFirstPage") == null || child(element, "PrintOnLastPage") == null) {
                    errors.add(ValidationMessage.error(
                            "HDR001", band + " must declare PrintOnFirstPage and PrintOnLastPage", location));
                }
                Double height = length(child(element, "Height"));
                if (height == null || height <= 0) {
                    errors.add(ValidationMessage.error("HDR002", band + " must have a positive Height", location));
                }
            }
        }
    }

    // --- DOM helpers ---

    private static boolean isRdl(Element element, String localName) {
        return RdlNamespaces.RDL.equals(element.getNamespaceURI()) && localName.equals(element.getLocalName());
    }

    private static Element child(Element parent, String localName) {
        List<Element> children = RdlDocumentBuilder.childElements(parent, localName);
        return children.isEmpty() ? null : children.get(0);
    }

    private static boolean hasElementChildren(Element element) {
        for (org.w3c.dom.Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == org.w3c.dom.Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    private static Double length(Element element) {
        if (element == null || !Inches.isFixedPoint(element.getTextContent())) {
            return null;
        }
        return Inches.parse(element.getTextContent());
    }

    private static String pathOf(Element element) {
        StringBuilder path = new StringBuilder();
        org.w3c.dom.Node node = element;
        while (node != null && node.getNodeType() == org.w3c.dom.Node.ELEMENT_NODE) {
            path.insert(0, "/" + node.getLocalName());
            node = node.getParentNode();
        }
        return path.toString();
    }
}
