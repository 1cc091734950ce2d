package io.reportxform.core.synth;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;

/**
 * Serializes RDL documents as indented UTF-8 XML with a standard declaration.
 *
 * <p>Stateless and thread-safe; a fresh {@link Transformer} is created per call.
 */
public final class RdlDocumentWriter {

    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    /** Returns the serialized document as UTF-8 bytes. */
    public byte[] toBytes(Document doc) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(doc, out);
        return out.toByteArray();
    }

    /** Returns the serialized document as a string, declaration included. */
    public String toXml(Document doc) {
        return new String(toBytes(doc), StandardCharsets.UTF_8);
    }

    /**
     * Writes the document to {@code out}. The stream is not closed.
     *
     * @throws IllegalStateException if the platform transformer fails
     */
    public void write(Document doc, OutputStream out) {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(out, "out must not be null");
        doc.setXmlStandalone(true);
        try {
            newTransformer().transform(new DOMSource(doc), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize RDL document: " + e.getMessage(), e);
        }
    }

    private static Transformer newTransformer() throws TransformerConfigurationException {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Transformer transformer = factory.newTransformer();
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(INDENT_AMOUNT, "2");
        return transformer;
    }
}
