package io.smellscan.config;

import io.smellscan.model.Severity;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a configuration layer from a YAML file.
 * <p>
 * Layout:
 * <pre>
 * build:
 *   maxIssues: 0
 *   failFast: false
 * excludes:
 *   - '**&#47;generated/**'
 * style:                      # rule set
 *   active: true              # false deactivates every rule listed in this section
 *   no-empty-block:           # rule id
 *     active: true
 *     severity: warning
 *     autoCorrect: false
 *     excludes: ['**&#47;test/**']
 *     threshold: 3            # any other key is a rule parameter
 * </pre>
 * Rule ids are not validated here; unknown ids are reported by {@link ConfigurationResolver}.
 */
public final class YamlConfigLoader {

    private static final String BUILD = "build";
    private static final String EXCLUDES = "excludes";
    private static final String ACTIVE = "active";
    private static final String SEVERITY = "severity";
    private static final String AUTO_CORRECT = "autoCorrect";
    private static final Set<String> RESERVED_RULE_KEYS = Set.of(ACTIVE, SEVERITY, AUTO_CORRECT, EXCLUDES);

    private YamlConfigLoader() {
    }

    /**
     * Loads a layer from a file. The layer is named after the file.
     */
    public static ConfigLayer load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /**
     * Loads a layer from a classpath resource.
     */
    public static ConfigLayer loadResource(String resource) throws IOException {
        try (InputStream in = YamlConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return load(in, resource);
        }
    }

    /**
     * Loads a layer from a stream.
     *
     * @param in   YAML document
     * @param name layer name used in warnings
     */
    public static ConfigLayer load(InputStream in, String name) throws ConfigurationException {
        Object document;
        try {
            document = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + name + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return ConfigLayer.empty(name);
        }
        Map<String, Object> root = asMap(document, name, "document root");

        ConfigLayer.Builder layer = ConfigLayer.builder(name);
        for (Map.Entry<String, Object> entry : root.entrySet()) {
            String key = entry.getKey();
            switch (key) {
                case BUILD -> readBuild(asMap(entry.getValue(), name, BUILD), layer, name);
                case EXCLUDES -> toStringSet(entry.getValue(), name, EXCLUDES).forEach(layer::exclude);
                default -> readRuleSet(key, asMap(entry.getValue(), name, key), layer, name);
            }
        }
        return layer.build();
    }

    private static void readBuild(Map<String, Object> build, ConfigLayer.Builder layer, String name)
            throws ConfigurationException {
        Object maxIssues = build.get("maxIssues");
        if (maxIssues != null) {
            if (!(maxIssues instanceof Integer value)) {
                throw new ConfigurationException(name + ": build.maxIssues must be an integer");
            }
            layer.maxIssues(value);
        }
        Object failFast = build.get("failFast");
        if (failFast != null) {
            layer.failFast(toBoolean(failFast, name, "build.failFast"));
        }
    }

    private static void readRuleSet(String ruleSetId, Map<String, Object> section, ConfigLayer.Builder layer, String name)
            throws ConfigurationException {
        boolean ruleSetActive = true;
        Object active = section.get(ACTIVE);
        if (active != null) {
            ruleSetActive = toBoolean(active, name, ruleSetId + "." + ACTIVE);
        }

        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String ruleId = entry.getKey();
            if (ACTIVE.equals(ruleId)) {
                continue;
            }
            String where = ruleSetId + "." + ruleId;
            RuleOverride override = readRule(asMap(entry.getValue(), name, where), name, where);
            if (!ruleSetActive) {
                override = override.toBuilder().active(false).build();
            }
            layer.rule(ruleId, override);
        }
    }

    private static RuleOverride readRule(Map<String, Object> rule, String name, String where)
            throws ConfigurationException {
        RuleOverride.Builder override = RuleOverride.builder();

        Object active = rule.get(ACTIVE);
        if (active != null) {
            override.active(toBoolean(active, name, where + "." + ACTIVE));
        }
        Object severity = rule.get(SEVERITY);
        if (severity != null) {
            try {
                override.severity(Severity.parse(severity.toString()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(name + ": " + where + ": " + e.getMessage(), e);
            }
        }
        Object autoCorrect = rule.get(AUTO_CORRECT);
        if (autoCorrect != null) {
            override.autoCorrect(toBoolean(autoCorrect, name, where + "." + AUTO_CORRECT));
        }
        Object excludes = rule.get(EXCLUDES);
        if (excludes != null) {
            override.excludes(toStringSet(excludes, name, where + "." + EXCLUDES));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        rule.forEach((key, value) -> {
            if (!RESERVED_RULE_KEYS.contains(key)) {
                parameters.put(key, value);
            }
        });
        if (!parameters.isEmpty()) {
            override.parameters(parameters);
        }
        return override.build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String name, String where) throws ConfigurationException {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException(name + ": '" + where + "' must be a mapping");
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new ConfigurationException(name + ": '" + where + "' has a non-string key: " + key);
            }
        }
        return (Map<String, Object>) map;
    }

    private static boolean toBoolean(Object value, String name, String where) throws ConfigurationException {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ConfigurationException(name + ": '" + where + "' must be true or false");
    }

    private static Set<String> toStringSet(Object value, String name, String where) throws ConfigurationException {
        if (value instanceof String single) {
            return Set.of(single.trim());
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(name + ": '" + where + "' must be a list of patterns");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }
}
