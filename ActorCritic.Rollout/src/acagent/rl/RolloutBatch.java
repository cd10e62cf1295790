package acagent.rl;

/**
 * Full-horizon snapshot of an {@link ExperienceStore}, time-major: the first
 * index is the timestep, the second the worker.
 */
public class RolloutBatch {

    public final double[][][] observations;
    public final double[][] actions;
    public final double[][] rewards;
    public final boolean[][] terminals;
    public final double[][] values;
    public final double[][] logProbs;
    public final double[][] entropies;

    public RolloutBatch(double[][][] observations, double[][] actions, double[][] rewards,
            boolean[][] terminals, double[][] values, double[][] logProbs, double[][] entropies) {
        int t = rewards.length;
        if (observations.length != t || actions.length != t || terminals.length != t
                || values.length != t || logProbs.length != t || entropies.length != t) {
            throw new IllegalArgumentException("all rollout columns must share the horizon length " + t);
        }
        this.observations = observations;
        this.actions = actions;
        this.rewards = rewards;
        this.terminals = terminals;
        this.values = values;
        this.logProbs = logProbs;
        this.entropies = entropies;
    }

    public int horizon() {
        return rewards.length;
    }

    public int numWorkers() {
        return rewards.length == 0 ? 0 : rewards[0].length;
    }
}
