package io.smellscan.config;

import io.smellscan.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static ConfigLayer load(String yaml) throws ConfigurationException {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yml");
    }

    @Test
    void load_readsRuleSettingsAndParameters() throws Exception {
        ConfigLayer layer = load("""
                style:
                  too-many-functions:
                    active: true
                    severity: error
                    autoCorrect: false
                    excludes: ['**/generated/**']
                    thresholdInFiles: 5
                """);

        RuleOverride override = layer.rules().get("too-many-functions");
        assertThat(override.active()).isTrue();
        assertThat(override.severity()).isEqualTo(Severity.ERROR);
        assertThat(override.autoCorrect()).isFalse();
        assertThat(override.excludes()).containsExactly("**/generated/**");
        assertThat(override.parameters()).containsEntry("thresholdInFiles", 5);
    }

    @Test
    void load_leavesUnsetValuesNull() throws Exception {
        ConfigLayer layer = load("""
                style:
                  no-empty-block:
                    active: false
                """);

        RuleOverride override = layer.rules().get("no-empty-block");
        assertThat(override.active()).isFalse();
        assertThat(override.severity()).isNull();
        assertThat(override.parameters()).isNull();
    }

    @Test
    void load_inactiveRuleSetDeactivatesItsRules() throws Exception {
        ConfigLayer layer = load("""
                formatting:
                  active: false
                  fun-keyword-spacing:
                    autoCorrect: true
                """);

        RuleOverride override = layer.rules().get("fun-keyword-spacing");
        assertThat(override.active()).isFalse();
        assertThat(override.autoCorrect()).isTrue();
    }

    @Test
    void load_readsBuildSectionAndGlobalExcludes() throws Exception {
        ConfigLayer layer = load("""
                build:
                  maxIssues: 10
                  failFast: true
                excludes:
                  - '**/test/**'
                """);

        assertThat(layer.maxIssues()).isEqualTo(10);
        assertThat(layer.failFast()).isTrue();
        assertThat(layer.excludes()).containsExactly("**/test/**");
    }

    @Test
    void load_emptyDocumentGivesEmptyLayer() throws Exception {
        ConfigLayer layer = load("");

        assertThat(layer.rules()).isEmpty();
        assertThat(layer.name()).isEqualTo("test.yml");
    }

    @Test
    void load_rejectsUnknownSeverity() {
        assertThatThrownBy(() -> load("""
                style:
                  no-empty-block:
                    severity: fatal
                """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("fatal");
    }

    @Test
    void load_rejectsInvalidYaml() {
        assertThatThrownBy(() -> load("style: [unclosed"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void load_readsFileAndNamesLayerAfterIt() throws IOException {
        Path file = tempDir.resolve("smellscan.yml");
        Files.writeString(file, "style:\n  no-empty-block:\n    active: false\n");

        ConfigLayer layer = YamlConfigLoader.load(file);

        assertThat(layer.name()).isEqualTo(file.toString());
        assertThat(layer.rules()).containsKey("no-empty-block");
    }

    @Test
    void loadResource_readsBundledDefaults() throws IOException {
        ConfigLayer layer = YamlConfigLoader.loadResource("/smellscan/default-config.yml");

        assertThat(layer.rules()).containsKeys("no-empty-block", "too-many-functions", "fun-keyword-spacing");
    }
}
