package io.smellscan.engine;

import io.smellscan.config.ModuleConfig;
import io.smellscan.suppress.BaselineStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to analyze one module.
 *
 * @param moduleName              name reported in the result
 * @param files                   files to analyze
 * @param config                  ordered configuration layers of the module
 * @param baselineStore           where the baseline is read from and, in update mode, written to; may be null
 * @param options                 execution options
 * @param typeResolutionAvailable false to run in degraded mode
 */
public record ModuleRequest(
        String moduleName,
        List<Path> files,
        ModuleConfig config,
        BaselineStore baselineStore,
        ExecutionOptions options,
        boolean typeResolutionAvailable
) {
    public ModuleRequest {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("moduleName cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        files = files == null ? List.of() : List.copyOf(files);
        if (options == null) {
            options = ExecutionOptions.defaults();
        }
    }

    public static Builder builder(String moduleName) {
        return new Builder(moduleName);
    }

    public static class Builder {
        private final String moduleName;
        private final List<Path> files = new ArrayList<>();
        private ModuleConfig config = ModuleConfig.of();
        private BaselineStore baselineStore;
        private ExecutionOptions options = ExecutionOptions.defaults();
        private boolean typeResolutionAvailable = true;

        private Builder(String moduleName) {
            this.moduleName = moduleName;
        }

        public Builder file(Path file) {
            this.files.add(file);
            return this;
        }

        public Builder files(List<Path> files) {
            this.files.addAll(files);
            return this;
        }

        public Builder config(ModuleConfig config) {
            this.config = config;
            return this;
        }

        public Builder baselineStore(BaselineStore baselineStore) {
            this.baselineStore = baselineStore;
            return this;
        }

        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder typeResolutionAvailable(boolean available) {
            this.typeResolutionAvailable = available;
            return this;
        }

        public ModuleRequest build() {
            return new ModuleRequest(moduleName, files, config, baselineStore, options, typeResolutionAvailable);
        }
    }
}
