package io.smellscan.suppress;

import java.io.IOException;

/**
 * Persistent storage for a {@link Baseline}. The storage format is up to the implementation.
 */
public interface BaselineStore {

    /**
     * Loads the baseline, or returns an empty one if none has been saved yet.
     */
    Baseline load() throws IOException;

    /**
     * Replaces the stored baseline.
     */
    void save(Baseline baseline) throws IOException;
}
