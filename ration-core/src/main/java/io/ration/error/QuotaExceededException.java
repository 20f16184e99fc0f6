package io.ration.error;

/** A sliding-window ceiling was hit; the caller may retry after {@link #resetTimeMillis()}. */
public class QuotaExceededException extends SchedulingException {
    private final String resourceType;
    private final long resetTimeMillis;

    public QuotaExceededException(String resourceType, long resetTimeMillis) {
        super(FailureReason.QUOTA_EXCEEDED, "Quota exceeded for " + resourceType + ", resets in " + resetTimeMillis + "ms");
        this.resourceType = resourceType;
        this.resetTimeMillis = resetTimeMillis;
    }

    public String resourceType() { return resourceType; }
    public long resetTimeMillis() { return resetTimeMillis; }
}
