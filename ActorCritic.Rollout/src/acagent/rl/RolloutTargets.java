package acagent.rl;

/**
 * Training targets produced from one full rollout: advantages together with
 * the log-probabilities and entropies cached when the actions were drawn.
 * Time-major, {@code [horizon][numWorkers]}.
 */
public class RolloutTargets {

    public final double[][] advantages;
    public final double[][] logProbs;
    public final double[][] entropies;

    public RolloutTargets(double[][] advantages, double[][] logProbs, double[][] entropies) {
        if (advantages.length != logProbs.length || advantages.length != entropies.length) {
            throw new IllegalArgumentException("advantages, logProbs and entropies must share the horizon length");
        }
        this.advantages = advantages;
        this.logProbs = logProbs;
        this.entropies = entropies;
    }

    public int horizon() {
        return advantages.length;
    }

    public int numWorkers() {
        return advantages.length == 0 ? 0 : advantages[0].length;
    }
}
