package acagent.rl;

import java.util.Random;

/**
 * Independent normal distribution per worker for one-dimensional continuous
 * actions.
 */
public class GaussianDistribution implements ActionDistribution {

    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2.0 * Math.PI);

    private final double[] mean;
    private final double[] std;
    private final Random random;

    public GaussianDistribution(double[] mean, double[] std, Random random) {
        if (mean == null || std == null || mean.length != std.length || mean.length == 0) {
            throw new IllegalArgumentException("mean and std must be non-empty and of equal length");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        for (int i = 0; i < std.length; i++) {
            if (!(std[i] > 0.0) || !Double.isFinite(std[i])) {
                throw new IllegalArgumentException("std must be positive and finite at worker " + i + ": " + std[i]);
            }
        }
        this.mean = mean.clone();
        this.std = std.clone();
        this.random = random;
    }

    @Override
    public int size() {
        return mean.length;
    }

    @Override
    public double[] sample() {
        double[] out = new double[mean.length];
        for (int i = 0; i < mean.length; i++) {
            out[i] = mean[i] + std[i] * random.nextGaussian();
        }
        return out;
    }

    @Override
    public double[] logProb(double[] actions) {
        if (actions.length != mean.length) {
            throw new IllegalArgumentException("expected " + mean.length + " actions, got " + actions.length);
        }
        double[] out = new double[actions.length];
        for (int i = 0; i < actions.length; i++) {
            double z = (actions[i] - mean[i]) / std[i];
            out[i] = -0.5 * z * z - Math.log(std[i]) - LOG_SQRT_2PI;
        }
        return out;
    }

    @Override
    public double[] entropy() {
        double[] out = new double[mean.length];
        for (int i = 0; i < mean.length; i++) {
            out[i] = 0.5 + LOG_SQRT_2PI + Math.log(std[i]);
        }
        return out;
    }
}
