package io.reportxform.core.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reportxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SandboxRules")
class SandboxRulesTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaultsLoad() {
        SandboxRules rules = SandboxRules.defaults();

        assertThat(rules.prohibitedPatterns()).isNotEmpty();
        assertThat(rules.isAllowedFunction("iif")).isTrue();
        assertThat(rules.isAllowedFunction("Sum")).isTrue();
        assertThat(rules.isAllowedFunction("Execute")).isFalse();
        assertThat(rules.isAllowedNamespace("system.math.Abs")).isTrue();
        assertThat(rules.isAllowedNamespace("System.IO.File")).isFalse();
        assertThat(SandboxRules.defaults()).isSameAs(rules);
    }

    @Test
    void customRulesReplaceDefaults() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, """
                prohibitedPatterns:
                  - 'Danger\\('
                allowedFunctions: [Sum, Danger]
                allowedNamespaces: []
                """);

        SandboxValidator validator = new SandboxValidator(SandboxRules.load(file));

        assertThat(validator.validate("=Danger(1)").valid()).isFalse();
        assertThat(validator.validate("=System.Math.Abs(1)").valid()).isFalse();
        assertThat(validator.validate("=Sum(1)").messages()).isEmpty();
    }

    @Test
    void schemaViolationIsRejected() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, """
                prohibitedPatterns: []
                allowedFunctions: [Sum]
                extra: true
                """);

        assertThatThrownBy(() -> SandboxRules.load(file))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("do not match schema");
    }

    @Test
    void invalidRegexIsRejected() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, """
                prohibitedPatterns: ['([']
                allowedFunctions: []
                allowedNamespaces: []
                """);

        assertThatThrownBy(() -> SandboxRules.load(file))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Invalid prohibited pattern");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> SandboxRules.load(tempDir.resolve("absent.yaml")))
                .isInstanceOf(ConfigLoadException.class);
    }
}
