package io.reportxform.core.logic;

import static io.reportxform.core.model.ExpressionNode.binary;
import static io.reportxform.core.model.ExpressionNode.conditional;
import static io.reportxform.core.model.ExpressionNode.field;
import static io.reportxform.core.model.ExpressionNode.literal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reportxform.core.error.NestingDepthExceededException;
import io.reportxform.core.model.ConditionalBranch;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCategory;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.parse.FieldCodeParser;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionalAnalyzer")
class ConditionalAnalyzerTest {

    private final ConditionalAnalyzer analyzer = new ConditionalAnalyzer();

    private static FieldCode ifCode(String id, String raw) {
        return new FieldCode(id, FieldCategory.IF, raw);
    }

    @Nested
    @DisplayName("analyzeConditions")
    class AnalyzeConditions {

        @Test
        void branchesAreNumberedInInputOrder() {
            List<ConditionalBranch> branches = analyzer.analyzeConditions(List.of(
                    ifCode("f1", "IF A = 1 \"a\" \"b\""),
                    FieldCode.of("f2", "MERGEFIELD Name"),
                    ifCode("f3", "IF B = 2 \"c\""),
                    ifCode("f4", "IF C = 3 \"d\" \"e\"")));

            assertThat(branches).extracting(ConditionalBranch::id).containsExactly("cond_1", "cond_2", "cond_3");
            assertThat(branches).extracting(ConditionalBranch::sourceLocation).containsExactly("f1", "f3", "f4");
            assertThat(branches.get(1).falseValue()).isNull();
        }

        @Test
        void unparsableCodeIsSkippedWithoutConsumingAnId() {
            List<String> warnings = new ArrayList<>();

            List<ConditionalBranch> branches = analyzer.analyzeConditions(
                    List.of(ifCode("f1", "IF ("), ifCode("f2", "IF A = 1 \"x\" \"y\"")), warnings);

            assertThat(branches).singleElement().satisfies(branch -> {
                assertThat(branch.id()).isEqualTo("cond_1");
                assertThat(branch.sourceLocation()).isEqualTo("f2");
            });
            assertThat(warnings).singleElement(InstanceOfAssertFactories.STRING).contains("f1");
        }

        @Test
        void nonConditionalRootIsSkipped() {
            List<String> warnings = new ArrayList<>();

            List<ConditionalBranch> branches = analyzer.analyzeConditions(
                    List.of(ifCode("f1", "IF(A = 1, \"x\") & \"y\"")), warnings);

            assertThat(branches).isEmpty();
            assertThat(warnings).singleElement(InstanceOfAssertFactories.STRING).contains("Unable to extract conditional");
        }
    }

    @Nested
    @DisplayName("flattenNestedConditions")
    class Flatten {

        @Test
        void preOrderWithSideTaggedIds() {
            ConditionalBranch root = analyzer.analyzeConditions(List.of(ifCode(
                            "f1", "IF A = 1 {IF B = 2 {IF D = 4 \"p\" \"q\"} \"y\"} {IF C = 3 \"m\" \"n\"}")))
                    .get(0);

            List<String> ids = analyzer.flattenNestedConditions(root)
                    .map(ConditionalBranch::id)
                    .collect(Collectors.toList());

            assertThat(ids)
                    .containsExactly(
                            "cond_1",
                            "cond_1_nested_true",
                            "cond_1_nested_true_nested_true",
                            "cond_1_nested_false");
        }

        @Test
        void nestedBranchesKeepTheSourceLocation() {
            ConditionalBranch root = new ConditionalBranch(
                    "cond_1",
                    field("A"),
                    conditional(field("B"), literal("x"), literal("y")),
                    null,
                    "f9");

            assertThat(analyzer.flattenNestedConditions(root))
                    .extracting(ConditionalBranch::sourceLocation)
                    .containsOnly("f9");
        }

        @Test
        void leafBranchYieldsItself() {
            ConditionalBranch leaf = new ConditionalBranch("cond_1", field("A"), literal("x"), literal("y"), "f1");

            assertThat(analyzer.flattenNestedConditions(leaf)).containsExactly(leaf);
        }

        @Test
        void depthBeyondBoundFailsDuringConsumption() {
            ConditionalAnalyzer shallow = new ConditionalAnalyzer(new FieldCodeParser(), 2);
            ConditionalBranch deep = new ConditionalBranch("cond_1", field("A"), nestedTrue(5), null, "f1");

            assertThatThrownBy(() -> shallow.flattenNestedConditions(deep).count())
                    .isInstanceOfSatisfying(NestingDepthExceededException.class, e -> {
                        assertThat(e.maxDepth()).isEqualTo(2);
                        assertThat(e.fieldCodeId()).isEqualTo("f1");
                    });
        }

        @Test
        void flatteningIsLazy() {
            ConditionalAnalyzer shallow = new ConditionalAnalyzer(new FieldCodeParser(), 0);
            ConditionalBranch deep = new ConditionalBranch("cond_1", field("A"), nestedTrue(3), null, "f1");

            assertThat(shallow.flattenNestedConditions(deep).findFirst()).contains(deep);
        }

        @Test
        void veryDeepNestingNeverOverflowsTheStack() {
            ConditionalAnalyzer generous = new ConditionalAnalyzer(new FieldCodeParser(), 5_000);
            ConditionalBranch deep = new ConditionalBranch("c", field("A"), nestedTrue(2_000), null, "f1");

            assertThat(generous.flattenNestedConditions(deep).count()).isEqualTo(2_001);
        }

        private ExpressionNode nestedTrue(int levels) {
            ExpressionNode node = literal("leaf");
            for (int i = 0; i < levels; i++) {
                node = conditional(field("L" + i), node, null);
            }
            return node;
        }
    }

    @Nested
    @DisplayName("canConvertToSwitch")
    class CanConvertToSwitch {

        private ConditionalBranch comparing(String id, String fieldName, String value) {
            return new ConditionalBranch(
                    id, binary("=", field(fieldName), literal(value)), literal(value + "!"), null, id);
        }

        @Test
        void sameFieldConverts() {
            assertThat(analyzer.canConvertToSwitch(List.of(
                            comparing("c1", "Status", "A"), comparing("c2", "Status", "B"), comparing("c3", "Status", "C"))))
                    .isTrue();
        }

        @Test
        void differentFieldDoesNotConvert() {
            assertThat(analyzer.canConvertToSwitch(List.of(comparing("c1", "Status", "A"), comparing("c2", "Type", "B"))))
                    .isFalse();
        }

        @Test
        void singleBranchDoesNotConvert() {
            assertThat(analyzer.canConvertToSwitch(List.of(comparing("c1", "Status", "A")))).isFalse();
        }

        @Test
        void nonComparisonConditionDoesNotConvert() {
            ConditionalBranch bare = new ConditionalBranch("c1", field("Status"), literal("x"), null, "c1");

            assertThat(analyzer.canConvertToSwitch(List.of(bare, comparing("c2", "Status", "B")))).isFalse();
        }
    }
}
