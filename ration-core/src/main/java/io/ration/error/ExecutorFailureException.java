package io.ration.error;

/** Downstream worker returned an error, a non-success response, or did not answer in time. */
public class ExecutorFailureException extends SchedulingException {
    public ExecutorFailureException(String message) {
        super(FailureReason.EXECUTOR_FAILURE, message);
    }

    public ExecutorFailureException(String message, Throwable cause) {
        super(FailureReason.EXECUTOR_FAILURE, message, cause);
    }

    public ExecutorFailureException(FailureReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
