package acagent.rl;

/**
 * Generalized Advantage Estimation over a full rollout, vectorized over
 * workers.
 *
 * <pre>
 * mask[t]   = 1 - terminal[t]
 * target[t] = reward[t] + next[t] * mask[t]     next[t] = value[t+1], or the bootstrap at t = T-1
 * delta[t]  = target[t] - value[t]
 * adv[t]    = sum_{k=t}^{T-1} delta[k] * (discount * gaeLambda)^(k - t)
 * </pre>
 *
 * The residual carries no discount factor, and the advantage sum is not cut
 * at terminals: a terminal only removes the bootstrapped continuation from its
 * own residual, while residuals of the following episode still decay into the
 * advantages before the boundary. The sum is evaluated as the equivalent
 * backward recurrence {@code adv[t] = delta[t] + decay * adv[t+1]}.
 */
public class AdvantageEstimator {

    private final double discount;
    private final double gaeLambda;

    public AdvantageEstimator(double discount, double gaeLambda) {
        if (!(discount >= 0.0 && discount <= 1.0) || !(gaeLambda >= 0.0 && gaeLambda <= 1.0)) {
            throw new IllegalArgumentException("discount and gaeLambda must be in [0, 1]");
        }
        this.discount = discount;
        this.gaeLambda = gaeLambda;
    }

    public AdvantageEstimator(AgentConfig config) {
        this(config.getDiscount(), config.getGaeLambda());
    }

    public double decayRate() {
        return discount * gaeLambda;
    }

    /**
     * @param rewards   {@code [T][n]}
     * @param terminals {@code [T][n]}
     * @param values    {@code [T][n]} values cached when the actions were drawn
     * @param bootstrap {@code [n]} value of the state following the last stored transition
     */
    public AdvantageEstimate estimate(double[][] rewards, boolean[][] terminals, double[][] values, double[] bootstrap) {
        int horizon = rewards.length;
        if (horizon == 0) {
            throw new IllegalArgumentException("rollout is empty");
        }
        if (terminals.length != horizon || values.length != horizon) {
            throw new IllegalArgumentException("rewards, terminals and values must share the horizon length " + horizon);
        }
        int n = bootstrap.length;
        for (int t = 0; t < horizon; t++) {
            if (rewards[t].length != n || terminals[t].length != n || values[t].length != n) {
                throw new IllegalArgumentException("timestep " + t + " does not cover " + n + " workers");
            }
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(bootstrap[i])) {
                throw new IllegalArgumentException("bootstrap value for worker " + i + " is not finite");
            }
        }

        double[][] targets = new double[horizon][n];
        double[][] deltas = new double[horizon][n];
        for (int t = 0; t < horizon; t++) {
            double[] next = t + 1 < horizon ? values[t + 1] : bootstrap;
            for (int i = 0; i < n; i++) {
                double mask = terminals[t][i] ? 0.0 : 1.0;
                targets[t][i] = rewards[t][i] + next[i] * mask;
                deltas[t][i] = targets[t][i] - values[t][i];
            }
        }

        double decay = decayRate();
        double[][] advantages = new double[horizon][n];
        advantages[horizon - 1] = deltas[horizon - 1].clone();
        for (int t = horizon - 2; t >= 0; t--) {
            for (int i = 0; i < n; i++) {
                advantages[t][i] = deltas[t][i] + decay * advantages[t + 1][i];
            }
        }
        return new AdvantageEstimate(targets, deltas, advantages);
    }
}
