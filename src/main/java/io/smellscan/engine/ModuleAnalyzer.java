package io.smellscan.engine;

import io.smellscan.ast.AstProvider;
import io.smellscan.config.ConfigurationResolver;
import io.smellscan.config.EffectiveConfig;
import io.smellscan.model.AnalysisResult;
import io.smellscan.rules.RuleRegistry;
import io.smellscan.suppress.Baseline;
import io.smellscan.suppress.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Entry point for analyzing a module: resolves its configuration, loads the baseline, runs the
 * files through the {@link AnalysisCoordinator} and, in update mode, writes the regenerated
 * baseline back. The stored baseline is left untouched when a file failed to parse or was not
 * fully analyzed.
 * <p>
 * Creating an analyzer seals the registry; rules cannot be added once analysis can start.
 */
public class ModuleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ModuleAnalyzer.class);

    private final RuleRegistry registry;
    private final ConfigurationResolver resolver;
    private final AnalysisCoordinator coordinator;

    public ModuleAnalyzer(RuleRegistry registry, AstProvider astProvider) {
        this(registry, new ConfigurationResolver(), new AnalysisCoordinator(registry, astProvider));
    }

    public ModuleAnalyzer(RuleRegistry registry, ConfigurationResolver resolver, AnalysisCoordinator coordinator) {
        registry.seal();
        this.registry = registry;
        this.resolver = resolver;
        this.coordinator = coordinator;
    }

    /**
     * Analyzes one module.
     *
     * @throws IOException if the baseline cannot be read, or cannot be written in update mode
     */
    public AnalysisResult analyze(ModuleRequest request) throws IOException {
        EffectiveConfig config = resolver.resolve(request.config(), registry, request.typeResolutionAvailable());
        log.debug("Module {} resolved to {}", request.moduleName(), config);

        BaselineStore store = request.baselineStore();
        boolean update = request.options().updateBaseline();
        Baseline baseline = store != null && !update ? store.load() : Baseline.empty();

        AnalysisResult result = coordinator.analyzeModule(
                request.moduleName(), request.files(), config, baseline, request.options());

        if (update && store != null) {
            if (result.baselineUpdate().isPresent()) {
                Baseline regenerated = Baseline.of(result.baselineUpdate().get());
                store.save(regenerated);
                log.info("Wrote baseline with {} fingerprint(s) for module {}", regenerated.size(), request.moduleName());
            } else {
                log.warn("Keeping the existing baseline of module {}: not every file was analyzed", request.moduleName());
            }
        }
        return result;
    }
}
