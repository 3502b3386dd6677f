package me.golemcore.toolrouter.domain.exception;

import java.util.List;

/**
 * A tool definition failed import validation. Every violation found is listed,
 * not just the first.
 */
public class CatalogValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public CatalogValidationException(String toolIdentity, List<String> violations) {
        super("Tool definition " + toolIdentity + " is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
