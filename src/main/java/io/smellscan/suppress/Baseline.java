package io.smellscan.suppress;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fingerprints of findings accepted in an earlier run.
 * Read-only while filtering; regenerated as a whole in update mode.
 *
 * @param fingerprints accepted fingerprint values, sorted
 */
public record Baseline(Set<String> fingerprints) {

    private static final Baseline EMPTY = new Baseline(Set.of());

    public Baseline {
        fingerprints = fingerprints == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(fingerprints));
    }

    public static Baseline empty() {
        return EMPTY;
    }

    public static Baseline of(Collection<String> fingerprints) {
        return new Baseline(new TreeSet<>(fingerprints));
    }

    public boolean contains(String fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    public boolean isEmpty() {
        return fingerprints.isEmpty();
    }

    public int size() {
        return fingerprints.size();
    }
}
