package io.ration.pool;

/** Side-effect-free answer to "could this amount be had now, and if not, how long until it could". */
public record Availability(boolean available, long waitTimeMillis, long sharedAvailable, long reservedAvailable, boolean known) {
    public static Availability unknown() {
        return new Availability(false, Long.MAX_VALUE, 0, 0, false);
    }
}
