package acagent.rl;

/**
 * Result of one forward pass: the action distribution and the value estimate
 * for every worker. A model may return a value vector per worker; callers use
 * {@link #scalarValues()}.
 */
public class PolicyValueOutput {

    public final ActionDistribution distribution;
    public final double[][] values;

    public PolicyValueOutput(ActionDistribution distribution, double[][] values) {
        if (distribution == null || values == null) {
            throw new IllegalArgumentException("distribution and values are required");
        }
        if (distribution.size() != values.length) {
            throw new IllegalArgumentException("distribution covers " + distribution.size()
                    + " workers but " + values.length + " value rows were given");
        }
        this.distribution = distribution;
        this.values = values;
    }

    /**
     * Convenience for models with a single value head.
     */
    public static PolicyValueOutput of(ActionDistribution distribution, double[] values) {
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[]{values[i]};
        }
        return new PolicyValueOutput(distribution, rows);
    }

    public double[] scalarValues() {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double sum = 0.0;
            for (double v : values[i]) {
                sum += v;
            }
            out[i] = sum;
        }
        return out;
    }
}
