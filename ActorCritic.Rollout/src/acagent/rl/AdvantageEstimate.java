package acagent.rl;

/**
 * TD targets, residuals and GAE advantages of one rollout, time-major.
 */
public class AdvantageEstimate {

    public final double[][] targets;
    public final double[][] deltas;
    public final double[][] advantages;

    public AdvantageEstimate(double[][] targets, double[][] deltas, double[][] advantages) {
        this.targets = targets;
        this.deltas = deltas;
        this.advantages = advantages;
    }
}
