package io.ration.admission;

import io.ration.queue.EnqueueResult;

/** Placement of an admitted request together with the cost estimate it was admitted on. */
public record AdmissionResult(EnqueueResult placement, double estimatedCost) {
    public String requestId() { return placement.requestId(); }
    public String queueName() { return placement.queueName(); }
    public int position() { return placement.position(); }
    public long estimatedWaitMillis() { return placement.estimatedWaitMillis(); }
    public int priority() { return placement.priority(); }
}
