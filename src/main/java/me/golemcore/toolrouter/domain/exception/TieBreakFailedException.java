package me.golemcore.toolrouter.domain.exception;

import me.golemcore.toolrouter.domain.model.TieBreakResolution;

/**
 * Escalation to the tie-break judge did not produce a usable choice. Always
 * absorbed by the escalator, which falls back to the deterministic winner.
 */
public class TieBreakFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TieBreakResolution resolution;

    public TieBreakFailedException(TieBreakResolution resolution, String message) {
        super(message);
        this.resolution = resolution;
    }

    public TieBreakFailedException(TieBreakResolution resolution, String message, Throwable cause) {
        super(message, cause);
        this.resolution = resolution;
    }

    public TieBreakResolution getResolution() {
        return resolution;
    }
}
