package io.reportxform.core.synth;

import static io.reportxform.core.synth.RdlTestSupport.childNames;
import static io.reportxform.core.synth.RdlTestSupport.elements;
import static io.reportxform.core.synth.RdlTestSupport.first;
import static io.reportxform.core.synth.RdlTestSupport.remove;
import static io.reportxform.core.synth.RdlTestSupport.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.reportxform.core.config.ReportXformConfig;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

@DisplayName("RdlDocumentBuilder")
class RdlDocumentBuilderTest {

    private final RdlDocumentBuilder builder = new RdlDocumentBuilder(ReportXformConfig.defaults());

    private ListAppender<ILoggingEvent> logAppender;
    private Logger builderLogger;

    @BeforeEach
    void attachAppender() {
        builderLogger = (Logger) LoggerFactory.getLogger(RdlDocumentBuilder.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        builderLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        builderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Nested
    @DisplayName("createEmptyDocument")
    class CreateEmptyDocument {

        @Test
        void rootCarriesBothNamespaces() {
            Element root = builder.createEmptyDocument(null).getDocumentElement();

            assertThat(root.getNamespaceURI()).isEqualTo(RdlNamespaces.RDL);
            assertThat(root.getLocalName()).isEqualTo("Report");
            assertThat(root.lookupNamespaceURI(RdlNamespaces.RD_PREFIX)).isEqualTo(RdlNamespaces.REPORT_DESIGNER);
        }

        @Test
        void noDataSetNameMeansNoDataSources() {
            Document doc = builder.createEmptyDocument(null);

            assertThat(elements(doc, "DataSources")).isEmpty();
            assertThat(elements(doc, "DataSets")).isEmpty();
            assertThat(elements(builder.createEmptyDocument("  "), "DataSources")).isEmpty();
        }

        @Test
        void namedDataSetHasExactlyOnePlaceholderField() {
            Document doc = builder.createEmptyDocument("Orders");

            assertThat(elements(doc, "DataSources")).hasSize(1);
            assertThat(elements(doc, "DataSet")).singleElement().satisfies(ds ->
                    assertThat(ds.getAttribute("Name")).isEqualTo("Orders"));
            assertThat(elements(doc, "Field")).singleElement().satisfies(field ->
                    assertThat(field.getAttribute("Name")).isEqualTo(RdlDocumentBuilder.PLACEHOLDER_FIELD));
        }

        @Test
        void dataSourceIdIsStablePerDataSet() {
            String first = builder.createEmptyDocument("Orders")
                    .getElementsByTagNameNS(RdlNamespaces.REPORT_DESIGNER, "DataSourceID")
                    .item(0)
                    .getTextContent();
            String second = builder.createEmptyDocument("Orders")
                    .getElementsByTagNameNS(RdlNamespaces.REPORT_DESIGNER, "DataSourceID")
                    .item(0)
                    .getTextContent();

            assertThat(first).isEqualTo(second).hasSize(36);
        }

        @Test
        void sectionWidthIsThePrintableWidth() {
            ReportXformConfig config = ReportXformConfig.builder()
                    .pageWidth(8.27)
                    .leftMargin(0.75)
                    .rightMargin(0.5)
                    .build();
            Document doc = new RdlDocumentBuilder(config).createEmptyDocument(null);

            Element section = first(doc, "ReportSection");
            assertThat(childNames(section)).containsExactly("Body", "Width", "Page");
            assertThat(RdlDocumentBuilder.childElements(section, "Width").get(0).getTextContent())
                    .isEqualTo("7.02in");
            assertThat(text(doc, "PageWidth")).isEqualTo("8.27in");
            assertThat(text(doc, "LeftMargin")).isEqualTo("0.75in");
            assertThat(text(doc, "PageHeight")).isEqualTo("11.00in");
        }
    }

    @Nested
    @DisplayName("addDataField")
    class AddDataField {

        @Test
        void firstRealFieldReplacesPlaceholder() {
            Document doc = builder.createEmptyDocument("Orders");

            assertThat(builder.addDataField(doc, "Orders", "Amount", "System.Decimal")).isTrue();
            assertThat(builder.addDataField(doc, "Orders", "Customer", "System.String")).isTrue();

            assertThat(elements(doc, "Field"))
                    .extracting(field -> field.getAttribute("Name"))
                    .containsExactly("Amount", "Customer");
            assertThat(elements(doc, "DataField"))
                    .extracting(Element::getTextContent)
                    .containsExactly("Amount", "Customer");
        }

        @Test
        void duplicateFieldIsIgnored() {
            Document doc = builder.createEmptyDocument("Orders");
            builder.addDataField(doc, "Orders", "Amount", "System.Decimal");

            assertThat(builder.addDataField(doc, "Orders", "Amount", "System.Decimal")).isTrue();

            assertThat(elements(doc, "Field")).hasSize(1);
        }

        @Test
        void quotesInDataSetNameDoNotBreakTheLookup() {
            Document doc = builder.createEmptyDocument("Sales \"2024\" O'Brien");

            assertThat(builder.addDataField(doc, "Sales \"2024\" O'Brien", "Region", "System.String")).isTrue();
            assertThat(elements(doc, "Field")).extracting(f -> f.getAttribute("Name")).containsExactly("Region");
        }

        @Test
        void controlCharacterInDataSetNameStillMatches() {
            Document doc = builder.createEmptyDocument("Orders\u0001");

            assertThat(builder.addDataField(doc, "Orders\u0001", "Amount", "System.Decimal")).isTrue();
            assertThat(elements(doc, "DataSet")).singleElement().satisfies(ds ->
                    assertThat(ds.getAttribute("Name")).isEqualTo("Orders"));
            assertThat(elements(doc, "Field")).extracting(f -> f.getAttribute("Name")).containsExactly("Amount");
        }

        @Test
        void unknownDataSetIsADiagnosedNoOp() {
            Document doc = builder.createEmptyDocument("Orders");

            assertThat(builder.addDataField(doc, "Missing", "Amount", "System.Decimal")).isFalse();

            assertThat(elements(doc, "Field")).hasSize(1);
            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("DataSet 'Missing' not found");
                    });
        }
    }

    @Nested
    @DisplayName("addEmbeddedImage")
    class AddEmbeddedImage {

        @Test
        void sectionIsCreatedOnceBeforeReportSections() {
            Document doc = builder.createEmptyDocument(null);

            assertThat(builder.addEmbeddedImage(doc, "Image_logo", "image/png", new byte[] {1, 2, 3})).isTrue();
            assertThat(builder.addEmbeddedImage(doc, "Image_logo", "image/png", new byte[] {9})).isTrue();
            assertThat(builder.addEmbeddedImage(doc, "Image_seal", "image/gif", new byte[0])).isTrue();

            assertThat(childNames(doc.getDocumentElement())).containsExactly("EmbeddedImages", "ReportSections");
            assertThat(elements(doc, "EmbeddedImage"))
                    .extracting(image -> image.getAttribute("Name"))
                    .containsExactly("Image_logo", "Image_seal");
            assertThat(text(doc, "ImageData")).isEqualTo("AQID");
        }

        @Test
        void missingReportSectionsIsADiagnosedNoOp() {
            Document doc = builder.createEmptyDocument(null);
            remove(first(doc, "ReportSections"));

            assertThat(builder.addEmbeddedImage(doc, "Image_logo", "image/png", new byte[] {1})).isFalse();

            assertThat(elements(doc, "EmbeddedImages")).isEmpty();
            assertThat(logAppender.list)
                    .anySatisfy(event -> assertThat(event.getFormattedMessage())
                            .contains("embedded image 'Image_logo' not added"));
        }
    }

    @Nested
    @DisplayName("headers and footers")
    class Bands {

        @Test
        void headerGoesFirstAndCarriesFlags() {
            Document doc = builder.createEmptyDocument(null);

            assertThat(builder.setPageHeader(doc, List.of(), 0.75, true, false)).isTrue();

            Element page = first(doc, "Page");
            assertThat(childNames(page).get(0)).isEqualTo("PageHeader");
            Element header = first(doc, "PageHeader");
            assertThat(childNames(header)).containsExactly("Height", "PrintOnFirstPage", "PrintOnLastPage");
            assertThat(RdlDocumentBuilder.childElements(header, "Height").get(0).getTextContent())
                    .isEqualTo("0.75in");
            assertThat(RdlDocumentBuilder.childElements(header, "PrintOnLastPage").get(0).getTextContent())
                    .isEqualTo("false");
        }

        @Test
        void insertionIsNotIdempotent() {
            Document doc = builder.createEmptyDocument(null);

            builder.setPageHeader(doc, List.of(), 0.5, true, true);
            builder.setPageHeader(doc, List.of(), 0.5, true, true);

            assertThat(elements(doc, "PageHeader")).hasSize(2);
        }

        @Test
        void footerFollowsExistingBands() {
            Document doc = builder.createEmptyDocument(null);

            builder.setPageFooter(doc, List.of(), 0.5, true, true);
            builder.setPageHeader(doc, List.of(), 0.5, true, true);
            builder.setPageFooter(doc, List.of(), 0.4, false, true);

            assertThat(childNames(first(doc, "Page")))
                    .startsWith("PageHeader", "PageFooter", "PageFooter", "PageHeight");
        }

        @Test
        void bandItemsAreWrappedInReportItems() {
            Document doc = builder.createEmptyDocument(null);
            Element textbox = new TextboxFactory().createTextbox(doc, List.of("Title"), 0, 0, 6.5, 0.5);

            builder.setPageHeader(doc, List.of(textbox), 0.5, true, true);

            Element header = first(doc, "PageHeader");
            assertThat(childNames(header)).endsWith("ReportItems");
            assertThat(textbox.getParentNode().getParentNode()).isSameAs(header);
        }

        @Test
        void nonPositiveHeightIsRejected() {
            Document doc = builder.createEmptyDocument(null);

            assertThatThrownBy(() -> builder.setPageHeader(doc, List.of(), 0, true, true))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> builder.setPageFooter(doc, List.of(), -1, true, true))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(elements(doc, "PageHeader")).isEmpty();
        }

        @Test
        void missingPageIsADiagnosedNoOp() {
            Document doc = builder.createEmptyDocument(null);
            remove(first(doc, "Page"));

            assertThat(builder.setPageHeader(doc, List.of(), 0.5, true, true)).isFalse();
            assertThat(builder.setPageFooter(doc, List.of(), 0.5, true, true)).isFalse();

            assertThat(logAppender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Page not found; header not added", "Page not found; footer not added");
        }
    }

    @Nested
    @DisplayName("body")
    class Body {

        @Test
        void reportItemsAreAppendedToTheBody() {
            Document doc = builder.createEmptyDocument(null);
            TextboxFactory textboxes = new TextboxFactory();

            builder.addReportItem(doc, textboxes.createTextbox(doc, List.of("a"), 0, 0, 1, 0.25));
            builder.addReportItem(doc, textboxes.createTextbox(doc, List.of("b"), 0, 0.25, 1, 0.25));

            assertThat(elements(doc, "Textbox"))
                    .extracting(t -> t.getAttribute("Name"))
                    .containsExactly("Textbox1", "Textbox2");
        }

        @Test
        void itemsFromAnotherDocumentAreImported() {
            Document doc = builder.createEmptyDocument(null);
            Document other = RdlDocumentBuilder.newDocument();
            Element foreign = new TextboxFactory().createTextbox(other, List.of("x"), 0, 0, 1, 0.25);

            assertThat(builder.addReportItem(doc, foreign)).isTrue();

            assertThat(first(doc, "Textbox").getOwnerDocument()).isSameAs(doc);
        }

        @Test
        void bodyHeightIsUpdated() {
            Document doc = builder.createEmptyDocument(null);

            assertThat(builder.updateBodyHeight(doc, 3.256)).isTrue();

            Element body = first(doc, "Body");
            assertThat(RdlDocumentBuilder.childElements(body, "Height").get(0).getTextContent()).isEqualTo("3.26in");
        }

        @Test
        void missingBodyIsADiagnosedNoOp() {
            Document doc = builder.createEmptyDocument(null);
            remove(first(doc, "Body"));

            assertThat(builder.updateBodyHeight(doc, 2)).isFalse();
            assertThat(builder.addReportItem(doc, doc.createElementNS(RdlNamespaces.RDL, "Line"))).isFalse();
        }
    }
}
