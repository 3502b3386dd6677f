package me.golemcore.toolrouter.domain.exception;

/**
 * Cold key during a catalog outage: nothing cached can answer the request.
 * Carries a positive retry hint in seconds.
 */
public class ServiceUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long retryAfterSeconds;

    public ServiceUnavailableException(String message, long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
