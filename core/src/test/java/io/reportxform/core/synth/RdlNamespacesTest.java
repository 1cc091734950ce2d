package io.reportxform.core.synth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RdlNamespacesTest {

    @Nested
    @DisplayName("sanitize")
    class Sanitize {

        @Test
        void nullBecomesEmpty() {
            assertThat(RdlNamespaces.sanitize(null)).isEmpty();
        }

        @Test
        void cleanTextIsReturnedAsIs() {
            String text = "Total:\t42\r\n";
            assertThat(RdlNamespaces.sanitize(text)).isSameAs(text);
        }

        @Test
        void controlCharactersAreDropped() {
            assertThat(RdlNamespaces.sanitize("Page\u000Cbreak\u0000 here\u0007")).isEqualTo("Pagebreak here");
        }

        @Test
        void supplementaryCharactersAreDropped() {
            assertThat(RdlNamespaces.sanitize("a\uD83D\uDE00b")).isEqualTo("ab");
            assertThat(RdlNamespaces.sanitize("Sales \uD83D\uDCC8 up")).isEqualTo("Sales  up");
        }

        @Test
        void unpairedSurrogatesAndNonCharactersAreDropped() {
            assertThat(RdlNamespaces.sanitize("a\uD800b\uFFFEc\uFFFFd")).isEqualTo("abcd");
        }
    }

    @Nested
    @DisplayName("Inches")
    class InchesFormat {

        @Test
        void sectionAndItemPrecision() {
            assertThat(Inches.section(6.5)).isEqualTo("6.50in");
            assertThat(Inches.item(0.25)).isEqualTo("0.25000in");
        }

        @Test
        void parsesWhatItWrites() {
            assertThat(Inches.parse(Inches.section(8.27))).isEqualTo(8.27);
            assertThat(Inches.parse(" 1in ")).isEqualTo(1.0);
        }

        @ParameterizedTest
        @ValueSource(strings = {"6.5", "-1.00in", "6.5cm", "1e3in", ".5in", ""})
        void rejectsAnythingElse(String value) {
            assertThat(Inches.isFixedPoint(value)).isFalse();
            assertThatThrownBy(() -> Inches.parse(value)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
