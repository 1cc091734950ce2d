package io.reportxform.core.logic;

import io.reportxform.core.error.FieldCodeException;
import io.reportxform.core.error.NestingDepthExceededException;
import io.reportxform.core.model.ConditionalBranch;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCategory;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.parse.FieldCodeParser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts conditional branches from {@code IF} field codes and analyzes their structure.
 *
 * <p>Thread-safe: holds only the parser and the nesting bound.
 */
public final class ConditionalAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionalAnalyzer.class);

    static final String NESTED_TRUE = "_nested_true";
    static final String NESTED_FALSE = "_nested_false";

    private final FieldCodeParser parser;
    private final int maxDepth;

    public ConditionalAnalyzer() {
        this(new FieldCodeParser(), FieldCodeParser.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param parser   parser for field-code text
     * @param maxDepth deepest nesting level {@link #flattenNestedConditions} may reach; the
     *                 top-level branch is level 0
     */
    public ConditionalAnalyzer(FieldCodeParser parser, int maxDepth) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /** Same as {@link #analyzeConditions(List, List)}, discarding the diagnostics. */
    public List<ConditionalBranch> analyzeConditions(List<FieldCode> fieldCodes) {
        return analyzeConditions(fieldCodes, new ArrayList<>());
    }

    /**
     * Extracts one branch per {@code IF} field code, in input order, with ids {@code cond_1},
     * {@code cond_2}, ... The counter only advances on extracted branches. Codes that fail to
     * parse, or that do not parse to a conditional, are skipped with a warning.
     *
     * @param fieldCodes field codes in document order; other categories are ignored
     * @param warnings   receives one entry per skipped code
     */
    public List<ConditionalBranch> analyzeConditions(List<FieldCode> fieldCodes, List<String> warnings) {
        Objects.requireNonNull(fieldCodes, "fieldCodes must not be null");
        Objects.requireNonNull(warnings, "warnings must not be null");
        List<ConditionalBranch> branches = new ArrayList<>();
        int branchId = 0;
        for (FieldCode fieldCode : fieldCodes) {
            if (fieldCode.category() != FieldCategory.IF) {
                continue;
            }
            ExpressionNode root;
            try {
                root = parser.parse(fieldCode);
            } catch (FieldCodeException e) {
                LOG.warn("Skipping IF field code '{}': {}", fieldCode.id(), e.getMessage());
                warnings.add("Unable to parse IF field code " + fieldCode.id() + ": " + e.getMessage());
                continue;
            }
            if (!(root instanceof ExpressionNode.Conditional conditional)) {
                LOG.warn("Unable to extract conditional from field code '{}': {}", fieldCode.id(), fieldCode.rawText());
                warnings.add("Unable to extract conditional from field code " + fieldCode.id());
                continue;
            }
            branches.add(ConditionalBranch.of("cond_" + ++branchId, conditional, fieldCode.id()));
        }
        return branches;
    }

    /**
     * Lazily walks a branch and every conditional nested in its values, pre-order: the branch
     * itself, then its true-value subtree, then its false-value subtree. Nested ids append
     * {@code _nested_true} or {@code _nested_false} to the parent id.
     *
     * <p>The returned stream can be consumed once. A nesting level beyond the configured bound
     * raises {@link NestingDepthExceededException} during consumption.
     */
    public Stream<ConditionalBranch> flattenNestedConditions(ConditionalBranch branch) {
        Objects.requireNonNull(branch, "branch must not be null");
        Iterator<ConditionalBranch> walker = new PreOrderWalker(branch, maxDepth);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * True when the branches form a group that a single {@code Switch} can express: at least two
     * branches, the first condition compares a field reference on its left side, and every other
     * condition tests that same field.
     */
    public boolean canConvertToSwitch(List<ConditionalBranch> branches) {
        Objects.requireNonNull(branches, "branches must not be null");
        if (branches.size() < 2) {
            return false;
        }
        String field = testedField(branches.get(0).condition());
        if (field == null) {
            return false;
        }
        for (ConditionalBranch branch : branches) {
            if (!field.equals(testedField(branch.condition()))) {
                return false;
            }
        }
        return true;
    }

    public int maxDepth() {
        return maxDepth;
    }

    private static String testedField(ExpressionNode condition) {
        if (condition instanceof ExpressionNode.BinaryOperation binary
                && binary.left() instanceof ExpressionNode.FieldReference field) {
            return field.name();
        }
        return null;
    }

    /** Explicit-stack pre-order traversal. */
    private static final class PreOrderWalker implements Iterator<ConditionalBranch> {

        private record Pending(ConditionalBranch branch, int depth) {}

        private final Deque<Pending> stack = new ArrayDeque<>();
        private final int maxDepth;

        PreOrderWalker(ConditionalBranch root, int maxDepth) {
            this.maxDepth = maxDepth;
            stack.push(new Pending(root, 0));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public ConditionalBranch next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Pending current = stack.pop();
            ConditionalBranch branch = current.branch();
            if (current.depth() > maxDepth) {
                throw new NestingDepthExceededException(maxDepth, branch.sourceLocation(), null);
            }
            // Push false first so the true side is visited first.
            pushNested(branch, branch.falseValue(), NESTED_FALSE, current.depth());
            pushNested(branch, branch.trueValue(), NESTED_TRUE, current.depth());
            return branch;
        }

        private void pushNested(ConditionalBranch parent, ExpressionNode value, String suffix, int parentDepth) {
            if (!(value instanceof ExpressionNode.Conditional nested)) {
                return;
            }
            stack.push(new Pending(
                    ConditionalBranch.of(parent.id() + suffix, nested, parent.sourceLocation()), parentDepth + 1));
        }
    }
}
