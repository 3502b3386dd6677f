package me.golemcore.toolrouter.domain.costmodel;

/**
 * Raised when a cost or time expression cannot be parsed or evaluated.
 */
public class CostExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public CostExpressionException(String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
