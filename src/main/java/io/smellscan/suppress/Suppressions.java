package io.smellscan.suppress;

import java.util.Collection;

/**
 * Decides whether a finding is hidden by the directives in scope at its node.
 * <p>
 * Suppression is cumulative: a match on any enclosing node (or on the file) is enough. An inner
 * directive cannot narrow or re-enable what an outer one suppresses.
 */
public final class Suppressions {

    private Suppressions() {
    }

    public static boolean isSuppressed(String ruleId, String ruleSetId, Collection<SuppressionDirective> directivesInScope) {
        for (SuppressionDirective directive : directivesInScope) {
            if (directive.covers(ruleId, ruleSetId)) {
                return true;
            }
        }
        return false;
    }
}
