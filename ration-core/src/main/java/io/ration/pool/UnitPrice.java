package io.ration.pool;

/**
 * Price of one unit of a resource. Flat resources cost {@code flat} per unit; dual-priced resources (LLM tokens)
 * are quoted per thousand input and output units.
 */
public record UnitPrice(double flat, double input, double output, boolean dual) {
    /** Share of a dual-priced amount assumed to be input when the real split is unknown. */
    public static final double ESTIMATED_INPUT_SHARE = 0.6;

    public static UnitPrice flat(double perUnit) { return new UnitPrice(perUnit, 0, 0, false); }

    public static UnitPrice perThousand(double input, double output) { return new UnitPrice(0, input, output, true); }

    public static UnitPrice free() { return flat(0); }

    /**
     * Pre-flight cost of {@code amount} units. For dual-priced resources this is an estimate that assumes a
     * 60/40 input/output split; billing uses the provider-reported split after execution.
     */
    public double estimate(double amount) {
        if (!dual) return amount * flat;
        double in = amount * ESTIMATED_INPUT_SHARE;
        double out = amount - in;
        return (in * input / 1000.0) + (out * output / 1000.0);
    }
}
