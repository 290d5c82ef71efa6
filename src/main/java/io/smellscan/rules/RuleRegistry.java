package io.smellscan.rules;

import io.smellscan.rules.formatting.FunKeywordSpacingRule;
import io.smellscan.rules.style.EmptyBlockRule;
import io.smellscan.rules.style.ObjectLiteralToLambdaRule;
import io.smellscan.rules.style.TooManyFunctionsRule;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Catalog of all known rules.
 * <p>
 * The registry starts open; after {@link #seal()} it is read-only and can be shared by reference
 * across worker threads. Registration after sealing fails with {@link RegistryClosedException}.
 */
public class RuleRegistry {

    private enum State { OPEN, SEALED }

    private final Map<String, RuleDescriptor> rules = new TreeMap<>();
    private volatile State state = State.OPEN;

    /**
     * Creates a sealed registry with all built-in rules.
     */
    public static RuleRegistry createDefault() {
        RuleRegistry registry = of(
                EmptyBlockRule.descriptor(),
                ObjectLiteralToLambdaRule.descriptor(),
                TooManyFunctionsRule.descriptor(),
                FunKeywordSpacingRule.descriptor()
        );
        registry.seal();
        return registry;
    }

    /**
     * Creates an open registry with the given rules.
     */
    public static RuleRegistry of(RuleDescriptor... descriptors) {
        RuleRegistry registry = new RuleRegistry();
        for (RuleDescriptor descriptor : descriptors) {
            registry.register(descriptor);
        }
        return registry;
    }

    /**
     * Registers a rule.
     *
     * @throws DuplicateRuleIdException if a rule with the same id is already registered
     * @throws RegistryClosedException  if the registry has been sealed
     */
    public synchronized void register(RuleDescriptor descriptor) {
        if (state == State.SEALED) {
            throw new RegistryClosedException(descriptor.id());
        }
        if (rules.containsKey(descriptor.id())) {
            throw new DuplicateRuleIdException(descriptor.id());
        }
        rules.put(descriptor.id(), descriptor);
    }

    /**
     * Closes the registration phase. Calling it again has no effect.
     */
    public synchronized void seal() {
        state = State.SEALED;
    }

    public boolean isSealed() {
        return state == State.SEALED;
    }

    /**
     * Returns a rule by id, if present.
     */
    public Optional<RuleDescriptor> lookup(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    /**
     * Returns all registered rules, sorted by id.
     */
    public synchronized List<RuleDescriptor> all() {
        return List.copyOf(rules.values());
    }

    public int size() {
        return rules.size();
    }
}
