package io.smellscan.rules;

/**
 * Thrown when a rule id is registered twice.
 */
public class DuplicateRuleIdException extends RegistryException {

    private final String ruleId;

    public DuplicateRuleIdException(String ruleId) {
        super("Rule id already registered: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
