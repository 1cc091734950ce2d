package io.reportxform.core.synth;

import static io.reportxform.core.synth.RdlNamespaces.append;
import static io.reportxform.core.synth.RdlNamespaces.rdl;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds {@code Image} report items that point at an entry of the report's
 * {@code EmbeddedImages} section.
 */
public final class ImageFactory {

    static final String SIZING = "FitProportional";

    private ImageFactory() {}

    /**
     * Name under which an image is embedded: {@code Image_} followed by the image id with every
     * character outside {@code [A-Za-z0-9_]} replaced by {@code _}.
     */
    public static String embeddedName(String imageId) {
        StringBuilder name = new StringBuilder("Image_");
        for (int i = 0; i < imageId.length(); i++) {
            char c = imageId.charAt(i);
            boolean plain = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            name.append(plain ? c : '_');
        }
        return name.toString();
    }

    /** Creates an image item showing the embedded image {@code embeddedName}. */
    public static Element createImage(
            Document doc,
            String name,
            String embeddedName,
            String mimeType,
            double left,
            double top,
            double width,
            double height) {
        Element image = rdl(doc, "Image");
        image.setAttributeNS(null, "Name", RdlNamespaces.sanitize(name));
        return append(
                image,
                rdl(doc, "Source", "Embedded"),
                rdl(doc, "Value", embeddedName),
                rdl(doc, "MIMEType", mimeType),
                rdl(doc, "Sizing", SIZING),
                rdl(doc, "Top", Inches.item(top)),
                rdl(doc, "Left", Inches.item(left)),
                rdl(doc, "Height", Inches.item(height)),
                rdl(doc, "Width", Inches.item(width)),
                rdl(doc, "Style"));
    }
}
