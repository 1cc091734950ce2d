package io.reportxform.core.synth;

import io.reportxform.core.config.ReportXformConfig;
import io.reportxform.core.engine.FieldCodeCompiler;
import io.reportxform.core.engine.FieldCodeResult;
import io.reportxform.core.model.CalculationFormula;
import io.reportxform.core.model.ConditionalBranch;
import io.reportxform.core.model.DocumentStructure;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.model.LogicExtractionResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Turns a perceived document structure plus its extracted logic into an RDL report.
 *
 * <p>Each paragraph becomes one textbox in the body, each table a static tablix and each image an
 * image item backed by an embedded image; header images go to the page header instead. Text runs
 * are copied verbatim (sanitized), except that a leading {@code =} is preceded by a space so the
 * text stays a literal; field-code runs are compiled to expressions. A field code that fails to
 * compile is kept as its raw text so that nothing from the source document is lost. Every field
 * referenced by a compiled expression, a conditional branch or a formula is registered in the
 * data set.
 *
 * <p>Instances may be shared; each call builds its own document and textbox factory.
 */
public final class SchemaSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaSynthesizer.class);

    static final String HEADER_TEXTBOX = "HeaderTextbox";
    static final String FOOTER_TEXTBOX = "FooterTextbox";
    static final String PAGE_NUMBER_EXPRESSION = "=\"Page \" & Globals!PageNumber & \" of \" & Globals!TotalPages";

    static final String HEADER_IMAGE = "HeaderImage";

    private static final double DEFAULT_ITEM_HEIGHT = 0.25;
    private static final double DEFAULT_IMAGE_WIDTH = 1.0;
    private static final double DEFAULT_IMAGE_HEIGHT = 1.0;
    private static final double DEFAULT_HEADER_IMAGE_WIDTH = 2.0;
    private static final double DEFAULT_HEADER_IMAGE_HEIGHT = 0.7;
    private static final double HEADER_IMAGE_PADDING = 0.1;
    private static final double HEADER_IMAGE_GAP = 0.5;
    private static final String FIELD_TYPE = "System.String";

    private final ReportXformConfig config;
    private final FieldCodeCompiler compiler;
    private final RdlDocumentBuilder builder;
    private final RdlSchemaValidator validator;
    private final RdlDocumentWriter writer;

    public SchemaSynthesizer() {
        this(ReportXformConfig.defaults());
    }

    public SchemaSynthesizer(ReportXformConfig config) {
        this(config, new FieldCodeCompiler(config));
    }

    public SchemaSynthesizer(ReportXformConfig config, FieldCodeCompiler compiler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.builder = new RdlDocumentBuilder(config);
        this.validator = new RdlSchemaValidator();
        this.writer = new RdlDocumentWriter();
    }

    /**
     * Builds the report document. The result is not validated; see {@link #produce}.
     */
    public Document synthesize(DocumentStructure structure, LogicExtractionResult logic) {
        Objects.requireNonNull(structure, "structure must not be null");
        LogicExtractionResult extracted = logic != null ? logic : LogicExtractionResult.empty();

        Document doc = builder.createEmptyDocument(config.dataSetName());
        Pass pass = new Pass();
        List<DocumentStructure.Image> headerImages = new ArrayList<>();

        for (DocumentStructure.Page page : structure.pages()) {
            for (DocumentStructure.Paragraph paragraph : page.paragraphs()) {
                List<String> values = runValues(paragraph.runs(), "Paragraph '" + paragraph.id() + "'", pass);
                DocumentStructure.Bounds bounds = paragraph.bounds();
                double width = bounds.width() > 0 ? bounds.width() : config.printableWidth();
                double height = bounds.height() > 0 ? bounds.height() : DEFAULT_ITEM_HEIGHT;
                Element textbox = pass.textboxes.createTextbox(doc, values, bounds.left(), bounds.top(), width, height);
                builder.addReportItem(doc, textbox);
                pass.extend(bounds.top() + height);
            }
            for (DocumentStructure.Table table : page.tables()) {
                addTable(doc, table, pass);
            }
            for (DocumentStructure.Image image : page.images()) {
                String embedded = ImageFactory.embeddedName(image.id());
                builder.addEmbeddedImage(doc, embedded, image.mimeType(), image.data());
                if (image.header()) {
                    headerImages.add(image);
                    continue;
                }
                DocumentStructure.Bounds bounds = image.bounds();
                double width = bounds.width() > 0 ? bounds.width() : DEFAULT_IMAGE_WIDTH;
                double height = bounds.height() > 0 ? bounds.height() : DEFAULT_IMAGE_HEIGHT;
                builder.addReportItem(doc, ImageFactory.createImage(
                        doc, embedded, embedded, image.mimeType(), bounds.left(), bounds.top(), width, height));
                pass.images++;
                pass.extend(bounds.top() + height);
            }
        }

        for (ConditionalBranch branch : extracted.conditions()) {
            collectFields(branch.condition(), pass.fields);
            collectFields(branch.trueValue(), pass.fields);
            collectFields(branch.falseValue(), pass.fields);
        }
        for (CalculationFormula formula : extracted.formulas()) {
            collectFields(formula.parsedExpression(), pass.fields);
        }
        if (config.hasDataSet()) {
            for (String field : pass.fields) {
                builder.addDataField(doc, config.dataSetName(), field, FIELD_TYPE);
            }
        } else if (!pass.fields.isEmpty()) {
            LOG.debug("No data set configured; {} field reference(s) not registered", pass.fields.size());
        }

        if (pass.bottom > 0) {
            builder.updateBodyHeight(doc, Math.max(pass.bottom, config.bodyHeight()));
        }
        addHeader(doc, structure, headerImages, pass.textboxes);
        addFooter(doc, structure, pass.textboxes);

        LOG.info(
                "Synthesized report: {} textbox(es), {} tablix(es), {} image(s), {} field(s), {} field code(s) kept as text",
                pass.textboxes.created(),
                pass.tablixes.created(),
                pass.images,
                pass.fields.size(),
                pass.fallbacks);
        return doc;
    }

    /**
     * Builds one report per page, named {@code Report_1}, {@code Report_2}, ... Each report keeps
     * the document's logical elements and the full extracted logic. A structure with at most one
     * page yields a single report built from the whole structure.
     */
    public List<PageReport> synthesizePages(DocumentStructure structure, LogicExtractionResult logic) {
        Objects.requireNonNull(structure, "structure must not be null");
        if (structure.pages().size() <= 1) {
            return List.of(new PageReport(reportName(1), synthesize(structure, logic), 1));
        }
        LOG.info("Generating {} separate reports", structure.pages().size());
        List<PageReport> reports = new ArrayList<>(structure.pages().size());
        int pageNumber = 0;
        for (DocumentStructure.Page page : structure.pages()) {
            pageNumber++;
            DocumentStructure single = new DocumentStructure(List.of(page), structure.logicalElements());
            reports.add(new PageReport(reportName(pageNumber), synthesize(single, logic), pageNumber));
            LOG.debug("Generated {} for page {}", reportName(pageNumber), pageNumber);
        }
        return List.copyOf(reports);
    }

    /**
     * Synthesizes, validates and serializes the report.
     *
     * @return the UTF-8 encoded XML document
     * @throws io.reportxform.core.error.SchemaValidationException if the document does not conform
     */
    public byte[] produce(DocumentStructure structure, LogicExtractionResult logic) {
        Document doc = synthesize(structure, logic);
        validator.validateOrThrow(doc);
        return writer.toBytes(doc);
    }

    /**
     * Per-page counterpart of {@link #produce}: every report is validated before any is
     * serialized.
     *
     * @return UTF-8 encoded documents keyed by report name, in page order
     * @throws io.reportxform.core.error.SchemaValidationException if a report does not conform
     */
    public Map<String, byte[]> producePages(DocumentStructure structure, LogicExtractionResult logic) {
        List<PageReport> reports = synthesizePages(structure, logic);
        reports.forEach(report -> validator.validateOrThrow(report.document()));
        Map<String, byte[]> out = new LinkedHashMap<>();
        for (PageReport report : reports) {
            out.put(report.name(), writer.toBytes(report.document()));
        }
        return out;
    }

    public RdlDocumentBuilder builder() {
        return builder;
    }

    private void addHeader(
            Document doc,
            DocumentStructure structure,
            List<DocumentStructure.Image> headerImages,
            TextboxFactory textboxes) {
        List<Element> items = new ArrayList<>(2);
        double height = config.headerHeight();
        double textLeft = 0;
        if (!headerImages.isEmpty()) {
            // Repeated page headers carry the same picture; one is enough.
            DocumentStructure.Image image = headerImages.get(0);
            DocumentStructure.Bounds bounds = image.bounds();
            double width = bounds.width() > 0 ? bounds.width() : DEFAULT_HEADER_IMAGE_WIDTH;
            double imageHeight = bounds.height() > 0 ? bounds.height() : DEFAULT_HEADER_IMAGE_HEIGHT;
            height = Math.max(height, imageHeight + HEADER_IMAGE_PADDING);
            textLeft = width + HEADER_IMAGE_GAP;
            items.add(ImageFactory.createImage(
                    doc,
                    HEADER_IMAGE,
                    ImageFactory.embeddedName(image.id()),
                    image.mimeType(),
                    0,
                    0,
                    width,
                    imageHeight));
            LOG.debug("Header image '{}' placed at {}x{} in", image.id(), width, imageHeight);
        }
        for (DocumentStructure.LogicalElement element : structure.logicalElements()) {
            if (element.role() != DocumentStructure.LogicalRole.HEADER
                    || element.content() == null
                    || element.content().isBlank()) {
                continue;
            }
            items.add(textboxes.createNamedTextbox(
                    doc,
                    HEADER_TEXTBOX,
                    List.of(literal(element.content().strip())),
                    textLeft,
                    0,
                    Math.max(config.printableWidth() - textLeft, DEFAULT_ITEM_HEIGHT),
                    height,
                    null));
            break;
        }
        if (!items.isEmpty()) {
            builder.setPageHeader(doc, items, height, true, true);
        }
    }

    private void addFooter(Document doc, DocumentStructure structure, TextboxFactory textboxes) {
        boolean hasFooter = structure.logicalElements().stream()
                .anyMatch(element -> element.role() == DocumentStructure.LogicalRole.FOOTER);
        if (!hasFooter) {
            return;
        }
        Element textbox = textboxes.createNamedTextbox(
                doc,
                FOOTER_TEXTBOX,
                List.of(PAGE_NUMBER_EXPRESSION),
                0,
                0,
                config.printableWidth(),
                config.footerHeight(),
                "Center");
        builder.setPageFooter(doc, List.of(textbox), config.footerHeight(), true, true);
    }

    private void addTable(Document doc, DocumentStructure.Table table, Pass pass) {
        List<List<List<String>>> values = new ArrayList<>(table.rows().size());
        for (DocumentStructure.TableRow row : table.rows()) {
            List<List<String>> rowValues = new ArrayList<>(row.cells().size());
            for (DocumentStructure.TableCell cell : row.cells()) {
                rowValues.add(runValues(cell.runs(), "Table '" + table.id() + "'", pass));
            }
            values.add(rowValues);
        }
        String dataSet = config.hasDataSet() ? config.dataSetName() : null;
        Element tablix = pass.tablixes.createTablix(doc, table, values, dataSet);
        if (tablix == null) {
            return;
        }
        builder.addReportItem(doc, tablix);
        String height = RdlDocumentBuilder.childElements(tablix, "Height").get(0).getTextContent();
        pass.extend(table.bounds().top() + Inches.parse(height));
    }

    /** Text runs become literals, field codes their compiled expression or their raw text. */
    private List<String> runValues(List<DocumentStructure.TextRun> runs, String owner, Pass pass) {
        List<String> values = new ArrayList<>(runs.size());
        for (DocumentStructure.TextRun run : runs) {
            if (!run.isField()) {
                values.add(literal(run.text()));
                continue;
            }
            FieldCodeResult result = compiler.compile(run.fieldCode());
            if (result.isSuccess()) {
                values.add(result.expression());
                collectFields(result.tree(), pass.fields);
            } else {
                pass.fallbacks++;
                LOG.warn(
                        "{}: field code '{}' kept as text ({})",
                        owner,
                        run.fieldCode().id(),
                        result.error().getMessage());
                values.add(rawText(run.fieldCode()));
            }
        }
        return values;
    }

    private static String reportName(int pageNumber) {
        return "Report_" + pageNumber;
    }

    private static String rawText(FieldCode fieldCode) {
        return literal(fieldCode.rawText().strip());
    }

    /** Keeps source text from being read back as an unchecked expression. */
    static String literal(String text) {
        return text != null && text.startsWith("=") ? " " + text : text;
    }

    /** Mutable state of one synthesis run. */
    private static final class Pass {
        final TextboxFactory textboxes = new TextboxFactory();
        final TablixFactory tablixes = new TablixFactory(textboxes);
        final Set<String> fields = new LinkedHashSet<>();
        double bottom;
        int fallbacks;
        int images;

        void extend(double itemBottom) {
            bottom = Math.max(bottom, itemBottom);
        }
    }

    /** Adds every field name referenced under {@code root}, in pre-order. */
    static void collectFields(ExpressionNode root, Set<String> names) {
        if (root == null) {
            return;
        }
        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ExpressionNode node = pending.pop();
            if (node instanceof ExpressionNode.FieldReference field
                    && field.name() != null
                    && !field.name().isBlank()) {
                names.add(field.name());
            }
            List<ExpressionNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }
}
