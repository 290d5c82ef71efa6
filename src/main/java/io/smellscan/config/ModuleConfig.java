package io.smellscan.config;

import java.util.List;

/**
 * Caller-supplied configuration for one module: ordered layers, lowest precedence first,
 * and the fail-fast flag requested by the caller. Layers may override the flag.
 */
public record ModuleConfig(List<ConfigLayer> layers, boolean failFast) {

    public ModuleConfig {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    public static ModuleConfig of(ConfigLayer... layers) {
        return new ModuleConfig(List.of(layers), false);
    }
}
