package me.golemcore.toolrouter.domain.exception;

/**
 * Backend adapter failure for a single step. The dispatcher converts it into a
 * failed step result; it never escapes a plan.
 */
public class StepExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Integer exitCode;
    private final String output;

    public StepExecutionException(String message) {
        this(message, null, null, null);
    }

    public StepExecutionException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public StepExecutionException(String message, Integer exitCode, String output, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.output = output;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
