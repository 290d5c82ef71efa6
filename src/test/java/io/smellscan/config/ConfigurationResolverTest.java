package io.smellscan.config;

import io.smellscan.model.Severity;
import io.smellscan.rules.RuleDescriptor;
import io.smellscan.rules.RuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationResolverTest {

    private final ConfigurationResolver resolver = new ConfigurationResolver();
    private RuleRegistry registry;

    private static RuleDescriptor rule(String id, boolean enabled, boolean typeResolution) {
        return RuleDescriptor.builder(id)
                .ruleSetId("style")
                .severity(Severity.WARNING)
                .defaultEnabled(enabled)
                .requiresTypeResolution(typeResolution)
                .nodeKinds("BLOCK")
                .visitor((node, context) -> { })
                .build();
    }

    @BeforeEach
    void setUp() {
        registry = RuleRegistry.of(
                rule("empty-block", true, false),
                rule("magic-number", false, false),
                rule("lambda", true, true)
        );
        registry.seal();
    }

    @Test
    void resolve_withoutLayersUsesRegistryDefaults() {
        EffectiveConfig config = resolver.resolve(List.of(), registry, true);

        assertThat(config.activeRuleIds()).containsExactly("empty-block", "lambda");
        assertThat(config.setting("empty-block")).get()
                .extracting(RuleSetting::severity)
                .isEqualTo(Severity.WARNING);
        assertThat(config.maxIssues()).isEqualTo(EffectiveConfig.UNLIMITED_ISSUES);
    }

    @Test
    void resolve_moduleLayerDisablesRuleEnabledGlobally() {
        ConfigLayer global = ConfigLayer.builder("global").enable("magic-number").build();
        ConfigLayer module = ConfigLayer.builder("module").disable("magic-number").build();

        EffectiveConfig config = resolver.resolve(List.of(global, module), registry, true);

        assertThat(config.isActive("magic-number")).isFalse();
    }

    @Test
    void resolve_laterLayerOverridesOnlyWhatItSets() {
        ConfigLayer global = ConfigLayer.builder("global")
                .rule("empty-block", RuleOverride.builder()
                        .severity(Severity.ERROR)
                        .parameter("threshold", 3)
                        .build())
                .build();
        ConfigLayer module = ConfigLayer.builder("module")
                .rule("empty-block", RuleOverride.builder().autoCorrect(true).build())
                .build();

        RuleSetting setting = resolver.resolve(List.of(global, module), registry, true)
                .setting("empty-block").orElseThrow();

        assertThat(setting.severity()).isEqualTo(Severity.ERROR);
        assertThat(setting.autoCorrect()).isTrue();
        assertThat(setting.parameters()).containsEntry("threshold", 3);
    }

    @Test
    void resolve_replacesParametersWholesale() {
        ConfigLayer global = ConfigLayer.builder("global")
                .rule("empty-block", RuleOverride.builder().parameter("a", 1).parameter("b", 2).build())
                .build();
        ConfigLayer module = ConfigLayer.builder("module")
                .rule("empty-block", RuleOverride.builder().parameter("b", 5).build())
                .build();

        RuleSetting setting = resolver.resolve(List.of(global, module), registry, true)
                .setting("empty-block").orElseThrow();

        assertThat(setting.parameters()).isEqualTo(Map.of("b", 5));
    }

    @Test
    void resolve_unionsExcludesAcrossLayers() {
        ConfigLayer global = ConfigLayer.builder("global").exclude("**/generated/**").build();
        ConfigLayer module = ConfigLayer.builder("module").exclude("**/test/**").build();

        EffectiveConfig config = resolver.resolve(List.of(global, module), registry, true);

        assertThat(config.excludes()).containsExactly("**/generated/**", "**/test/**");
        assertThat(config.isExcluded("src/test/FooTest.kt")).isTrue();
        assertThat(config.isExcluded("src/main/Foo.kt")).isFalse();
    }

    @Test
    void resolve_collectsUnknownRuleIdsAsWarnings() {
        ConfigLayer layer = ConfigLayer.builder("module")
                .enable("no-such-rule")
                .disable("empty-block")
                .build();

        EffectiveConfig config = resolver.resolve(List.of(layer), registry, true);

        assertThat(config.warnings())
                .containsExactly("Unknown rule id 'no-such-rule' in configuration");
        assertThat(config.isActive("empty-block")).isFalse();
    }

    @Test
    void resolve_reportsAnUnknownIdOncePerRun() {
        ConfigLayer global = ConfigLayer.builder("global").enable("no-such-rule").build();
        ConfigLayer module = ConfigLayer.builder("module").disable("no-such-rule").build();

        EffectiveConfig config = resolver.resolve(List.of(global, module), registry, true);

        assertThat(config.warnings()).containsExactly("Unknown rule id 'no-such-rule' in configuration");
    }

    @Test
    void resolve_degradedModeDisablesTypeResolutionRules() {
        EffectiveConfig config = resolver.resolve(List.of(), registry, false);

        assertThat(config.isActive("lambda")).isFalse();
        assertThat(config.isActive("empty-block")).isTrue();
        assertThat(config.notes()).hasSize(1);
        assertThat(config.notes().get(0)).contains("'lambda'");
    }

    @Test
    void resolve_degradedModeWinsOverExplicitEnable() {
        ConfigLayer layer = ConfigLayer.builder("module").enable("lambda").build();

        EffectiveConfig config = resolver.resolve(List.of(layer), registry, false);

        assertThat(config.isActive("lambda")).isFalse();
    }

    @Test
    void resolve_layerFlagsOverrideModuleFailFast() {
        ConfigLayer layer = ConfigLayer.builder("module").failFast(false).maxIssues(10).build();

        EffectiveConfig config = resolver.resolve(new ModuleConfig(List.of(layer), true), registry, true);

        assertThat(config.failFast()).isFalse();
        assertThat(config.maxIssues()).isEqualTo(10);
    }

    @Test
    void merge_isAssociativeUnderResolve() {
        ConfigLayer a = ConfigLayer.builder("a")
                .rule("empty-block", RuleOverride.builder().severity(Severity.ERROR).parameter("x", 1).build())
                .exclude("**/a/**")
                .enable("retired-rule")
                .maxIssues(5)
                .build();
        ConfigLayer b = ConfigLayer.builder("b")
                .rule("empty-block", RuleOverride.builder().active(false)
                        .excludes(Set.of("**/b/**")).build())
                .enable("magic-number")
                .disable("retired-rule")
                .failFast(true)
                .build();
        ConfigLayer c = ConfigLayer.builder("c")
                .rule("empty-block", RuleOverride.builder().active(true).build())
                .rule("magic-number", RuleOverride.builder().parameter("y", 2).build())
                .enable("another-unknown")
                .build();

        EffectiveConfig sequential = resolver.resolve(List.of(a, b, c), registry, true);
        EffectiveConfig leftMerged = resolver.resolve(List.of(a.merge(b), c), registry, true);
        EffectiveConfig rightMerged = resolver.resolve(List.of(a, b.merge(c)), registry, true);

        assertThat(leftMerged).isEqualTo(sequential);
        assertThat(rightMerged).isEqualTo(sequential);
        assertThat(sequential.warnings()).containsExactly(
                "Unknown rule id 'another-unknown' in configuration",
                "Unknown rule id 'retired-rule' in configuration");
        assertThat(sequential.setting("empty-block").orElseThrow().excludes())
                .containsExactlyInAnyOrder("**/b/**");
    }

    @Test
    void isExcludedForRule_matchesPerRuleExcludes() {
        ConfigLayer layer = ConfigLayer.builder("module")
                .rule("empty-block", RuleOverride.builder().excludes(Set.of("**/legacy/**")).build())
                .build();

        EffectiveConfig config = resolver.resolve(List.of(layer), registry, true);

        assertThat(config.isExcludedForRule("empty-block", "src/legacy/Old.kt")).isTrue();
        assertThat(config.isExcludedForRule("lambda", "src/legacy/Old.kt")).isFalse();
    }
}
