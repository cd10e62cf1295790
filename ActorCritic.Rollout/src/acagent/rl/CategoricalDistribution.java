package acagent.rl;

import java.util.Random;

/**
 * Categorical distribution over {@code numActions} discrete actions, built from
 * unnormalized logits. Actions are category indices stored as doubles.
 */
public class CategoricalDistribution implements ActionDistribution {

    private final double[][] probs;
    private final double[][] logProbs;
    private final Random random;

    public CategoricalDistribution(double[][] logits, Random random) {
        if (logits == null || logits.length == 0) {
            throw new IllegalArgumentException("logits must cover at least one worker");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        int numActions = logits[0].length;
        if (numActions == 0) {
            throw new IllegalArgumentException("logits must have at least one action");
        }
        this.probs = new double[logits.length][numActions];
        this.logProbs = new double[logits.length][numActions];
        this.random = random;
        for (int i = 0; i < logits.length; i++) {
            if (logits[i].length != numActions) {
                throw new IllegalArgumentException("ragged logits at worker " + i + ": expected "
                        + numActions + " got " + logits[i].length);
            }
            // log-sum-exp with max shift
            double max = Double.NEGATIVE_INFINITY;
            for (double l : logits[i]) {
                if (Double.isNaN(l)) {
                    throw new IllegalArgumentException("NaN logit at worker " + i);
                }
                max = Math.max(max, l);
            }
            double sum = 0.0;
            for (double l : logits[i]) {
                sum += Math.exp(l - max);
            }
            double logZ = max + Math.log(sum);
            for (int a = 0; a < numActions; a++) {
                logProbs[i][a] = logits[i][a] - logZ;
                probs[i][a] = Math.exp(logProbs[i][a]);
            }
        }
    }

    public int numActions() {
        return probs[0].length;
    }

    public double[] probabilities(int worker) {
        return probs[worker].clone();
    }

    @Override
    public int size() {
        return probs.length;
    }

    @Override
    public double[] sample() {
        double[] actions = new double[probs.length];
        for (int i = 0; i < probs.length; i++) {
            double u = random.nextDouble();
            double cdf = 0.0;
            int chosen = probs[i].length - 1;
            for (int a = 0; a < probs[i].length; a++) {
                cdf += probs[i][a];
                if (u < cdf) {
                    chosen = a;
                    break;
                }
            }
            actions[i] = chosen;
        }
        return actions;
    }

    @Override
    public double[] logProb(double[] actions) {
        if (actions.length != probs.length) {
            throw new IllegalArgumentException("expected " + probs.length + " actions, got " + actions.length);
        }
        double[] out = new double[actions.length];
        for (int i = 0; i < actions.length; i++) {
            int a = (int) actions[i];
            if (a != actions[i] || a < 0 || a >= probs[i].length) {
                throw new IllegalArgumentException("action " + actions[i] + " is not a valid category for worker " + i);
            }
            out[i] = logProbs[i][a];
        }
        return out;
    }

    @Override
    public double[] entropy() {
        double[] out = new double[probs.length];
        for (int i = 0; i < probs.length; i++) {
            double h = 0.0;
            for (int a = 0; a < probs[i].length; a++) {
                if (probs[i][a] > 0.0) {
                    h -= probs[i][a] * logProbs[i][a];
                }
            }
            out[i] = h;
        }
        return out;
    }
}
