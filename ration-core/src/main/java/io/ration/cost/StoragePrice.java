package io.ration.cost;

/** USD per read, per write and per GB-month. */
public record StoragePrice(double perRead, double perWrite, double perGbMonth) {
    static final double HOURS_PER_MONTH = 24 * 30;

    public double cost(StorageUsage usage) {
        return usage.reads() * perRead
                + usage.writes() * perWrite
                + (usage.gbHours() / HOURS_PER_MONTH) * perGbMonth;
    }
}
