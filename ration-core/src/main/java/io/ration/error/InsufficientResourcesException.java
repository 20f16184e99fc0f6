package io.ration.error;

/** The bucket cannot supply the amount within the wait the request's urgency accepts. */
public class InsufficientResourcesException extends SchedulingException {
    private final String resourceType;
    private final long waitTimeMillis;
    private final long available;

    public InsufficientResourcesException(String resourceType, long waitTimeMillis, long available) {
        super(FailureReason.INSUFFICIENT_RESOURCES,
                "Insufficient " + resourceType + ": " + available + " available, wait " + waitTimeMillis + "ms");
        this.resourceType = resourceType;
        this.waitTimeMillis = waitTimeMillis;
        this.available = available;
    }

    public String resourceType() { return resourceType; }
    public long waitTimeMillis() { return waitTimeMillis; }
    public long available() { return available; }
}
