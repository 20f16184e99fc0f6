package io.ration.notify;

/** Outcome of a best-effort notification. A failed notification never fails the request it is about. */
public record NotificationResult(Status status, String detail) {
    public enum Status { NOTIFIED, FAILED, SKIPPED }

    public static NotificationResult notified() { return new NotificationResult(Status.NOTIFIED, null); }
    public static NotificationResult failed(String detail) { return new NotificationResult(Status.FAILED, detail); }
    public static NotificationResult skipped(String detail) { return new NotificationResult(Status.SKIPPED, detail); }

    public boolean delivered() { return status == Status.NOTIFIED; }
}
