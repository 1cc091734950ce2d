package io.reportxform.core.logic;

import io.reportxform.core.error.FieldCodeException;
import io.reportxform.core.model.CalculationFormula;
import io.reportxform.core.model.ConditionalBranch;
import io.reportxform.core.model.DocumentStructure;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCategory;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.model.LogicExtractionResult;
import io.reportxform.core.parse.FieldCodeParser;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decomposes a document's field codes into conditional branches and calculation formulas.
 */
public final class LogicDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(LogicDecomposer.class);

    private final FieldCodeParser parser;
    private final ConditionalAnalyzer analyzer;

    public LogicDecomposer() {
        this(new FieldCodeParser());
    }

    public LogicDecomposer(FieldCodeParser parser) {
        this(parser, new ConditionalAnalyzer(parser, parser.maxDepth()));
    }

    public LogicDecomposer(FieldCodeParser parser, ConditionalAnalyzer analyzer) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Collects the field codes of every paragraph run, then of every table cell, page by page, and
     * extracts them.
     */
    public LogicExtractionResult extract(DocumentStructure structure) {
        Objects.requireNonNull(structure, "structure must not be null");
        List<FieldCode> fieldCodes = new ArrayList<>();
        for (DocumentStructure.Page page : structure.pages()) {
            for (DocumentStructure.Paragraph paragraph : page.paragraphs()) {
                addFieldCodes(paragraph.runs(), fieldCodes);
            }
            for (DocumentStructure.Table table : page.tables()) {
                for (DocumentStructure.TableRow row : table.rows()) {
                    for (DocumentStructure.TableCell cell : row.cells()) {
                        addFieldCodes(cell.runs(), fieldCodes);
                    }
                }
            }
        }
        return extract(fieldCodes);
    }

    private static void addFieldCodes(List<DocumentStructure.TextRun> runs, List<FieldCode> fieldCodes) {
        for (DocumentStructure.TextRun run : runs) {
            if (run.isField()) {
                fieldCodes.add(run.fieldCode());
            }
        }
    }

    /**
     * Extracts conditional branches ({@code cond_N}) and formulas ({@code formula_N}). Items that
     * fail to parse are skipped and reported in {@link LogicExtractionResult#warnings()}.
     */
    public LogicExtractionResult extract(List<FieldCode> fieldCodes) {
        Objects.requireNonNull(fieldCodes, "fieldCodes must not be null");
        List<String> warnings = new ArrayList<>();
        List<ConditionalBranch> conditions = analyzer.analyzeConditions(fieldCodes, warnings);
        List<CalculationFormula> formulas = extractFormulas(fieldCodes, warnings);

        LOG.info(
                "Extracted {} field codes, {} conditions, {} formulas ({} warnings)",
                fieldCodes.size(),
                conditions.size(),
                formulas.size(),
                warnings.size());
        return new LogicExtractionResult(fieldCodes, conditions, formulas, warnings);
    }

    /**
     * Flattens every extracted branch and drops duplicates, keeping encounter order.
     *
     * @throws io.reportxform.core.error.NestingDepthExceededException if a branch nests too deeply
     */
    public List<ConditionalBranch> identifyConditions(LogicExtractionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        LOG.debug("Identifying conditions from {} field codes", result.fieldCodes().size());
        return result.conditions().stream()
                .flatMap(analyzer::flattenNestedConditions)
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .collect(Collectors.toUnmodifiableList());
    }

    /** Parses a bare expression into a tree. */
    public ExpressionNode buildTree(String expression) {
        LOG.debug("Building tree for expression: {}", expression);
        return parser.parseExpression(expression);
    }

    public ConditionalAnalyzer analyzer() {
        return analyzer;
    }

    private List<CalculationFormula> extractFormulas(List<FieldCode> fieldCodes, List<String> warnings) {
        List<CalculationFormula> formulas = new ArrayList<>();
        int formulaId = 0;
        for (FieldCode fieldCode : fieldCodes) {
            if (fieldCode.category() != FieldCategory.FORMULA) {
                continue;
            }
            try {
                ExpressionNode tree = parser.parse(fieldCode);
                formulas.add(new CalculationFormula(
                        "formula_" + ++formulaId, fieldCode.rawText(), tree, fieldCode.id()));
            } catch (FieldCodeException e) {
                LOG.warn("Skipping formula field code '{}': {}", fieldCode.id(), e.getMessage());
                warnings.add("Unable to parse formula field code " + fieldCode.id() + ": " + e.getMessage());
            }
        }
        return formulas;
    }
}
