package io.ration.error;

/** Resource contention kept the request from being reserved too many times in a row. */
public class MaxRequeueExceededException extends SchedulingException {
    private final int requeueCount;

    public MaxRequeueExceededException(String requestId, int requeueCount) {
        super(FailureReason.MAX_REQUEUE_EXCEEDED, "Request " + requestId + " requeued " + requeueCount + " times");
        this.requeueCount = requeueCount;
    }

    public int requeueCount() { return requeueCount; }
}
