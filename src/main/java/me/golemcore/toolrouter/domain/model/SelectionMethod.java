package me.golemcore.toolrouter.domain.model;

/**
 * How the final candidate was chosen.
 */
public enum SelectionMethod {
    DETERMINISTIC, TIE_BREAK
}
