package me.golemcore.toolrouter.domain.model;

/**
 * Outcome of a tie-break escalation. Every value other than
 * {@link #JUDGE_CHOICE} means the pre-escalation top candidate was kept.
 */
public enum TieBreakResolution {
    JUDGE_CHOICE,
    FALLBACK_TIMEOUT,
    FALLBACK_MALFORMED_OUTPUT,
    FALLBACK_UNKNOWN_CANDIDATE,
    FALLBACK_ERROR;

    public boolean isFallback() {
        return this != JUDGE_CHOICE;
    }
}
