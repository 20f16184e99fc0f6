package io.ration.error;

import java.util.Locale;

/** Reason codes written to durable records and notifications. */
public enum FailureReason {
    QUOTA_EXCEEDED,
    INSUFFICIENT_RESOURCES,
    BUDGET_EXCEEDED,
    EXECUTOR_FAILURE,
    EXECUTOR_TIMEOUT,
    MAX_REQUEUE_EXCEEDED,
    CANCELLED;

    public String code() { return name().toLowerCase(Locale.ROOT); }
}
