package io.reportxform.core.synth;

import java.util.Iterator;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * RDL 2016 namespaces, element factories and the XML text filter.
 */
public final class RdlNamespaces {

    /** Report definition namespace (RDL 2016). */
    public static final String RDL = "http://schemas.microsoft.com/sqlserver/reporting/2016/01/reportdefinition";

    /** Report designer namespace. */
    public static final String REPORT_DESIGNER = "http://schemas.microsoft.com/SQLServer/reporting/reportdesigner";

    /** Prefix used for {@link #REPORT_DESIGNER} in documents and XPath expressions. */
    public static final String RD_PREFIX = "rd";

    /** Prefix bound to {@link #RDL} in XPath expressions. */
    public static final String RDL_PREFIX = "rdl";

    /** Resolves {@code rdl:} and {@code rd:} in XPath expressions. */
    public static final NamespaceContext XPATH_CONTEXT = new NamespaceContext() {
        @Override
        public String getNamespaceURI(String prefix) {
            if (RDL_PREFIX.equals(prefix)) {
                return RDL;
            }
            if (RD_PREFIX.equals(prefix)) {
                return REPORT_DESIGNER;
            }
            return XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceURI) {
            if (RDL.equals(namespaceURI)) {
                return RDL_PREFIX;
            }
            if (REPORT_DESIGNER.equals(namespaceURI)) {
                return RD_PREFIX;
            }
            return null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceURI) {
            String prefix = getPrefix(namespaceURI);
            return prefix == null ? List.<String>of().iterator() : List.of(prefix).iterator();
        }
    };

    private RdlNamespaces() {
        // utility class
    }

    /** Creates an empty element in the RDL namespace. */
    public static Element rdl(Document doc, String name) {
        return doc.createElementNS(RDL, name);
    }

    /** Creates an RDL element holding sanitized text. */
    public static Element rdl(Document doc, String name, String text) {
        Element element = rdl(doc, name);
        element.setTextContent(sanitize(text));
        return element;
    }

    /** Creates an empty element in the report-designer namespace. */
    public static Element rd(Document doc, String name) {
        return doc.createElementNS(REPORT_DESIGNER, RD_PREFIX + ":" + name);
    }

    /** Creates a report-designer element holding sanitized text. */
    public static Element rd(Document doc, String name, String text) {
        Element element = rd(doc, name);
        element.setTextContent(sanitize(text));
        return element;
    }

    /** Appends children in order and returns the parent. */
    public static Element append(Element parent, Element... children) {
        for (Element child : children) {
            parent.appendChild(child);
        }
        return parent;
    }

    /**
     * Drops every UTF-16 unit outside tab, LF, CR, U+0020 to U+D7FF and U+E000 to U+FFFD.
     * Surrogates fall outside those ranges, so supplementary characters such as emoji are
     * removed along with unpaired halves. {@code null} becomes the empty string.
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isXmlChar(c)) {
                if (out != null) {
                    out.append(c);
                }
            } else if (out == null) {
                out = new StringBuilder(text.length()).append(text, 0, i);
            }
        }
        return out == null ? text : out.toString();
    }

    static boolean isXmlChar(char c) {
        return c == 0x9
                || c == 0xA
                || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD);
    }
}
