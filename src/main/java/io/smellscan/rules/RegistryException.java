package io.smellscan.rules;

/**
 * Misuse of the {@link RuleRegistry}. Always fatal: the analysis request fails before any file is processed.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }
}
