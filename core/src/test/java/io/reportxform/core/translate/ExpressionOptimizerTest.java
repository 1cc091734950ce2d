package io.reportxform.core.translate;

import static org.assertj.core.api.Assertions.assertThat;

import io.reportxform.core.model.ExpressionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionOptimizer")
class ExpressionOptimizerTest {

    private final ExpressionOptimizer optimizer = new ExpressionOptimizer();

    @Test
    void collapsesNestedParentheses() {
        assertThat(optimizer.optimize("(((X)))")).isEqualTo("(X)");
    }

    @Test
    void collapsesDoubleNegation() {
        assertThat(optimizer.optimize("Not Not Active")).isEqualTo("Active");
    }

    @Test
    void foldsConstantConditions() {
        assertThat(optimizer.optimize("=IIf(True, \"A\", \"B\")")).isEqualTo("=\"A\"");
        assertThat(optimizer.optimize("=IIf(False, \"A\", \"B\")")).isEqualTo("=\"B\"");
    }

    @Test
    void foldsNestedConstantConditionsOnLaterRounds() {
        assertThat(optimizer.optimize("=IIf(False, 1, IIf(True, 2, 3))")).isEqualTo("=2");
    }

    @Test
    void foldedBranchInsideAComparisonKeepsItsScope() {
        assertThat(optimizer.optimize("=(IIf(True, Not Fields!A.Value, False) = Fields!B.Value)"))
                .isEqualTo("=((Not Fields!A.Value) = Fields!B.Value)");
        assertThat(optimizer.optimize("=IIf(False, 0, Fields!A.Value + 1) * 2"))
                .isEqualTo("=(Fields!A.Value + 1) * 2");
    }

    @Test
    void selfContainedBranchIsNotWrapped() {
        assertThat(optimizer.optimize("=(IIf(True, Fields!A.Value, 0) + Len(\"a b\"))"))
                .isEqualTo("=(Fields!A.Value + Len(\"a b\"))");
    }

    @Test
    void foldedConditionalMatchesTheGeneratedBranch() {
        ExpressionGenerator generator = new ExpressionGenerator();
        ExpressionNode whenTrue = ExpressionNode.binary("*", ExpressionNode.field("Qty"), ExpressionNode.field("Price"));
        ExpressionNode tree = ExpressionNode.conditional(
                ExpressionNode.literal(true), whenTrue, ExpressionNode.literal("n/a"));

        String generated = generator.generate(tree);

        assertThat(generated).startsWith("=IIf(True, ");
        assertThat(optimizer.optimize(generated)).isEqualTo(generator.generate(whenTrue));
    }

    @Test
    void leavesStringContentsAlone() {
        assertThat(optimizer.optimize("=\"((x))\" & \"Not Not\"")).isEqualTo("=\"((x))\" & \"Not Not\"");
        assertThat(optimizer.optimize("=\"IIf(True, a, b)\"")).isEqualTo("=\"IIf(True, a, b)\"");
    }

    @Test
    void leavesNonConstantConditionsAlone() {
        String text = "=IIf((Fields!A.Value > 1), \"x\", \"y\")";

        assertThat(optimizer.optimize(text)).isEqualTo(text);
    }

    @Test
    void unbalancedConditionalIsLeftAlone() {
        assertThat(optimizer.optimize("=IIf(True, 1")).isEqualTo("=IIf(True, 1");
    }

    @Test
    void nullCheckPassIsIdentity() {
        assertThat(optimizer.simplifyNullChecks("=IsNothing(Fields!A.Value)")).isEqualTo("=IsNothing(Fields!A.Value)");
    }

    @Test
    void blankInputIsReturnedUnchanged() {
        assertThat(optimizer.optimize("")).isEmpty();
        assertThat(optimizer.optimize(null)).isNull();
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "(((X)))",
                "Not Not Not A",
                "=IIf(True, IIf(False, ((1)), Not Not 2), 3)",
                "=((Fields!A.Value & \" \") & Fields!B.Value)",
                "=\"Not Not ((x))\"",
                "=Len((Fields!Name.Value))"
            })
    void optimizeIsIdempotent(String expression) {
        String once = optimizer.optimize(expression);

        assertThat(optimizer.optimize(once)).isEqualTo(once);
    }
}
