package io.ration.error;

/**
 * Root of the admission and scheduling error taxonomy.
 */
public class SchedulingException extends RuntimeException {
    private final FailureReason reason;

    public SchedulingException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchedulingException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason reason() { return reason; }
}
