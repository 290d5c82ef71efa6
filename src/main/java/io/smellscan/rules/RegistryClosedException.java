package io.smellscan.rules;

/**
 * Thrown when a rule is registered after the registry was sealed.
 */
public class RegistryClosedException extends RegistryException {

    public RegistryClosedException(String ruleId) {
        super("Rule registry is sealed, cannot register: " + ruleId);
    }
}
