package me.golemcore.toolrouter.domain.model;

/**
 * A candidate with its score breakdown, as ranked by the scoring engine.
 */
public record ScoredCandidate(Candidate candidate, ScoreBreakdown breakdown) {

    public double composite() {
        return breakdown.getComposite();
    }

    public String key() {
        return candidate.key();
    }
}
