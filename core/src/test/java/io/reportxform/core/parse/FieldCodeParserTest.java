package io.reportxform.core.parse;

import static io.reportxform.core.model.ExpressionNode.binary;
import static io.reportxform.core.model.ExpressionNode.call;
import static io.reportxform.core.model.ExpressionNode.conditional;
import static io.reportxform.core.model.ExpressionNode.field;
import static io.reportxform.core.model.ExpressionNode.global;
import static io.reportxform.core.model.ExpressionNode.literal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reportxform.core.error.ExpressionSyntaxException;
import io.reportxform.core.error.NestingDepthExceededException;
import io.reportxform.core.error.UnsupportedFieldCodeException;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCategory;
import io.reportxform.core.model.FieldCode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("FieldCodeParser")
class FieldCodeParserTest {

    private final FieldCodeParser parser = new FieldCodeParser();

    private ExpressionNode parse(FieldCategory category, String raw) {
        return parser.parse(new FieldCode("fc-1", category, raw));
    }

    @Nested
    @DisplayName("MERGEFIELD")
    class MergeField {

        @Test
        void bareNameBecomesFieldReference() {
            assertThat(parse(FieldCategory.MERGE_FIELD, "MERGEFIELD CustomerName")).isEqualTo(field("CustomerName"));
        }

        @Test
        void bracedInstructionIsAccepted() {
            assertThat(parse(FieldCategory.MERGE_FIELD, "{ MERGEFIELD Total }")).isEqualTo(field("Total"));
        }

        @Test
        void quotedNameIsAccepted() {
            assertThat(parse(FieldCategory.MERGE_FIELD, "MERGEFIELD \"Order Date\"")).isEqualTo(field("Order Date"));
        }

        @Test
        void numericPictureWrapsInFormat() {
            assertThat(parse(FieldCategory.MERGE_FIELD, "MERGEFIELD Amount \\# \"#,##0.00\""))
                    .isEqualTo(call("FORMAT", field("Amount"), literal("#,##0.00")));
        }

        @Test
        void caseSwitchWrapsInUpper() {
            assertThat(parse(FieldCategory.MERGE_FIELD, "MERGEFIELD Name \\* Upper"))
                    .isEqualTo(call("UPPER", field("Name")));
        }

        @Test
        void missingNameIsSyntaxError() {
            assertThatThrownBy(() -> parse(FieldCategory.MERGE_FIELD, "MERGEFIELD"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("field name");
        }

        @Test
        void wrongKeywordIsSyntaxError() {
            assertThatThrownBy(() -> parse(FieldCategory.MERGE_FIELD, "IF A \"x\""))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Expected MERGEFIELD instruction but found IF");
        }
    }

    @Nested
    @DisplayName("IF")
    class If {

        @Test
        void conditionTrueAndFalseValues() {
            ExpressionNode node = parse(FieldCategory.IF, "IF {MERGEFIELD Status} = \"Active\" \"Yes\" \"No\"");

            assertThat(node)
                    .isEqualTo(conditional(
                            binary("=", field("Status"), literal("Active")), literal("Yes"), literal("No")));
        }

        @Test
        void falseValueIsOptional() {
            ExpressionNode node = parse(FieldCategory.IF, "IF Amount > 1000 \"High\"");

            assertThat(node).isInstanceOf(ExpressionNode.Conditional.class);
            assertThat(((ExpressionNode.Conditional) node).whenFalse()).isNull();
        }

        @Test
        void functionFormIsAccepted() {
            assertThat(parse(FieldCategory.IF, "IF(Amount > 0, \"pos\", \"neg\")"))
                    .isEqualTo(conditional(
                            binary(">", field("Amount"), literal(0L)), literal("pos"), literal("neg")));
        }

        @Test
        void nestedIfInBraces() {
            ExpressionNode node = parse(FieldCategory.IF, "IF A = 1 {IF B = 2 \"x\" \"y\"} \"z\"");

            ExpressionNode.Conditional outer = (ExpressionNode.Conditional) node;
            assertThat(outer.whenTrue()).isInstanceOf(ExpressionNode.Conditional.class);
            assertThat(outer.whenFalse()).isEqualTo(literal("z"));
        }

        @Test
        void missingTrueValueIsSyntaxError() {
            assertThatThrownBy(() -> parse(FieldCategory.IF, "IF Amount > 1"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("true value");
        }

        @Test
        void unknownNestedKeywordIsUnsupported() {
            assertThatThrownBy(() -> parse(FieldCategory.IF, "IF A = 1 {QUOTE \"x\"} \"y\""))
                    .isInstanceOfSatisfying(
                            UnsupportedFieldCodeException.class, e -> assertThat(e.fieldCodeId()).isEqualTo("fc-1"));
        }
    }

    @Nested
    @DisplayName("DATE, TIME, PAGE, NUMPAGES")
    class Globals {

        @Test
        void dateDefaultsToIsoPicture() {
            assertThat(parse(FieldCategory.DATE, "DATE"))
                    .isEqualTo(call("FORMAT", global("ExecutionTime"), literal("yyyy-MM-dd")));
        }

        @Test
        void dateSwitchSetsPicture() {
            assertThat(parse(FieldCategory.DATE, "DATE \\@ \"MM/dd/yyyy\""))
                    .isEqualTo(call("FORMAT", global("ExecutionTime"), literal("MM/dd/yyyy")));
        }

        @Test
        void suppliedSwitchesOverrideTextSwitches() {
            FieldCode code = new FieldCode("d1", FieldCategory.DATE, "DATE \\@ \"yyyy\"", Map.of("@", "MMMM d"));

            assertThat(parser.parse(code)).isEqualTo(call("FORMAT", global("ExecutionTime"), literal("MMMM d")));
        }

        @Test
        void timeDefaultsToHoursAndMinutes() {
            assertThat(parse(FieldCategory.TIME, "TIME"))
                    .isEqualTo(call("FORMAT", global("ExecutionTime"), literal("HH:mm")));
        }

        @Test
        void pageAndNumPages() {
            assertThat(parse(FieldCategory.PAGE, "PAGE")).isEqualTo(global("PageNumber"));
            assertThat(parse(FieldCategory.NUM_PAGES, "NUMPAGES \\* Arabic")).isEqualTo(global("TotalPages"));
        }
    }

    @Nested
    @DisplayName("formulas")
    class Formulas {

        @Test
        void aggregateOverBareField() {
            assertThat(parse(FieldCategory.FORMULA, "= Sum(Amount)"))
                    .isEqualTo(ExpressionNode.aggregate("Sum", field("Amount")));
        }

        @Test
        void aggregateWithScope() {
            assertThat(parse(FieldCategory.FORMULA, "=Count(Fields!Id.Value, \"Orders\")"))
                    .isEqualTo(ExpressionNode.aggregate("Count", field("Id"), literal("Orders")));
        }

        @Test
        void aggregateScopeMustBeString() {
            assertThatThrownBy(() -> parse(FieldCategory.FORMULA, "=Sum(Amount, 2)"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("scope must be a string literal");
        }

        @Test
        void multiplicationBindsTighterThanAddition() {
            assertThat(parse(FieldCategory.FORMULA, "=1 + 2 * 3"))
                    .isEqualTo(binary("+", literal(1L), binary("*", literal(2L), literal(3L))));
        }

        @Test
        void concatenationBindsLooserThanAddition() {
            assertThat(parse(FieldCategory.FORMULA, "=A & B + C"))
                    .isEqualTo(binary("&", field("A"), binary("+", field("B"), field("C"))));
        }

        @Test
        void notAppliesToWholeComparison() {
            assertThat(parse(FieldCategory.FORMULA, "=Not A = B"))
                    .isEqualTo(ExpressionNode.not(binary("=", field("A"), field("B"))));
        }

        @Test
        void andBindsTighterThanOr() {
            assertThat(parse(FieldCategory.FORMULA, "=A Or B And C"))
                    .isEqualTo(binary("Or", field("A"), binary("And", field("B"), field("C"))));
        }

        @Test
        void adjacentMinusFoldsIntoLiteral() {
            assertThat(parse(FieldCategory.FORMULA, "=-5")).isEqualTo(literal(-5L));
            assertThat(parse(FieldCategory.FORMULA, "=- 5"))
                    .isEqualTo(new ExpressionNode.UnaryOperation("-", literal(5L)));
            assertThat(parse(FieldCategory.FORMULA, "=-Amount"))
                    .isEqualTo(new ExpressionNode.UnaryOperation("-", field("Amount")));
        }

        @Test
        void literalsOfEveryType() {
            assertThat(parser.parseExpression("\"say \"\"hi\"\"\"")).isEqualTo(literal("say \"hi\""));
            assertThat(parser.parseExpression("1.50")).isEqualTo(literal(new BigDecimal("1.50")));
            assertThat(parser.parseExpression("#1/15/2024#")).isEqualTo(literal(LocalDate.of(2024, 1, 15)));
            assertThat(parser.parseExpression("#2024-01-15#")).isEqualTo(literal(LocalDate.of(2024, 1, 15)));
            assertThat(parser.parseExpression("True")).isEqualTo(literal(true));
            assertThat(parser.parseExpression("Nothing")).isEqualTo(literal(null));
        }

        @Test
        void reportCollections() {
            assertThat(parser.parseExpression("Parameters!Year.Value"))
                    .isEqualTo(ExpressionNode.parameter("Year"));
            assertThat(parser.parseExpression("Globals!PageNumber")).isEqualTo(global("PageNumber"));
            assertThat(parser.parseExpression("Fields!Amount")).isEqualTo(field("Amount"));
        }

        @Test
        void unknownCollectionIsSyntaxError() {
            assertThatThrownBy(() -> parser.parseExpression("Items!Name"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Unknown collection");
        }

        @Test
        void iifWithWrongArityIsSyntaxError() {
            assertThatThrownBy(() -> parser.parseExpression("IIf(A)"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("2 or 3 arguments");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void syntaxErrorCarriesOffsetAndFieldCodeId() {
            assertThatThrownBy(() -> parser.parse(new FieldCode("fc-7", FieldCategory.FORMULA, "=(1")))
                    .isInstanceOfSatisfying(ExpressionSyntaxException.class, e -> {
                        assertThat(e.fieldCodeId()).isEqualTo("fc-7");
                        assertThat(e.expression()).isEqualTo("=(1");
                        assertThat(e.offset()).isEqualTo(3);
                        assertThat(e.getMessage()).contains("')'");
                    });
        }

        @Test
        void emptyExpression() {
            assertThatThrownBy(() -> parser.parseExpression("  "))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessage("Empty expression");
        }

        @Test
        void emptyFieldCode() {
            assertThatThrownBy(() -> parse(FieldCategory.PAGE, ""))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessage("Empty field code");
        }

        @Test
        void unterminatedString() {
            assertThatThrownBy(() -> parser.parseExpression("\"abc"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        void trailingTokensAreRejected() {
            assertThatThrownBy(() -> parser.parseExpression("A B"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageContaining("end of input");
        }

        @ParameterizedTest
        @EnumSource(
                value = FieldCategory.class,
                names = {"SEQUENCE", "TABLE_OF_CONTENTS", "HYPERLINK", "UNSUPPORTED"})
        void categoriesWithoutExpressionFormAreUnsupported(FieldCategory category) {
            FieldCode code = new FieldCode("fc-3", category, "SEQ Figure \\* ARABIC");

            assertThatThrownBy(() -> parser.parse(code))
                    .isInstanceOfSatisfying(UnsupportedFieldCodeException.class, e -> {
                        assertThat(e.category()).isEqualTo(category);
                        assertThat(e.fieldCodeId()).isEqualTo("fc-3");
                        assertThat(e.rawText()).isEqualTo("SEQ Figure \\* ARABIC");
                    });
        }
    }

    @Nested
    @DisplayName("nesting bound")
    class NestingBound {

        @Test
        void depthWithinBoundParses() {
            assertThat(new FieldCodeParser(3).parseExpression("((1))")).isEqualTo(literal(1L));
        }

        @Test
        void depthBeyondBoundFailsWithTypedError() {
            assertThatThrownBy(() -> new FieldCodeParser(3).parseExpression("((((1))))"))
                    .isInstanceOfSatisfying(
                            NestingDepthExceededException.class, e -> assertThat(e.maxDepth()).isEqualTo(3));
        }

        @Test
        void adversarialNestingNeverOverflowsTheStack() {
            String deep = "(".repeat(5_000) + "1" + ")".repeat(5_000);

            assertThatThrownBy(() -> parser.parseExpression(deep)).isInstanceOf(NestingDepthExceededException.class);
        }

        @Test
        void prefixChainsCountTowardsDepth() {
            String chain = "Not ".repeat(100) + "A";

            assertThatThrownBy(() -> parser.parseExpression(chain)).isInstanceOf(NestingDepthExceededException.class);
        }

        @Test
        void boundMustBePositive() {
            assertThatThrownBy(() -> new FieldCodeParser(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
