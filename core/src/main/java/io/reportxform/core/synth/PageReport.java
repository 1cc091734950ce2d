package io.reportxform.core.synth;

import java.util.Objects;
import org.w3c.dom.Document;

/**
 * A report synthesized from a single page of the source document.
 *
 * @param name       report name, {@code Report_<pageNumber>}
 * @param document   the unvalidated report document
 * @param pageNumber 1-based position of the page in the source document
 */
public record PageReport(String name, Document document, int pageNumber) {

    public PageReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(document, "document must not be null");
    }
}
