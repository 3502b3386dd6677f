package me.golemcore.toolrouter.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Candidates returned by the catalog for one (capability, platform) lookup.
 * {@code stale} is set when the store could not be reached and the value is
 * the last one known to be good.
 */
@Value
public class CandidateSet {

    List<Candidate> candidates;
    boolean stale;
    Instant loadedAt;

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
