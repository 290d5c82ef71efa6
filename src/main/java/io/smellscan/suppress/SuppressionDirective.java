package io.smellscan.suppress;

import java.util.Locale;
import java.util.Set;

/**
 * Request in the source to hide findings of some rules.
 *
 * @param ruleIds rule ids or rule set ids to suppress; {@code all} suppresses everything
 * @param scope   whether the directive covers its node's subtree or the whole file
 */
public record SuppressionDirective(Set<String> ruleIds, Scope scope) {

    public static final String ALL = "all";

    public enum Scope {
        NODE,
        FILE
    }

    public SuppressionDirective {
        if (ruleIds == null || ruleIds.isEmpty()) {
            throw new IllegalArgumentException("A suppression directive must name at least one rule id or 'all'");
        }
        if (scope == null) {
            scope = Scope.NODE;
        }
        ruleIds = Set.copyOf(ruleIds);
    }

    /**
     * Returns true if this directive hides findings of the given rule.
     */
    public boolean covers(String ruleId, String ruleSetId) {
        for (String id : ruleIds) {
            if (id.toLowerCase(Locale.ROOT).equals(ALL) || id.equals(ruleId) || id.equals(ruleSetId)) {
                return true;
            }
        }
        return false;
    }
}
