package acagent.rl;

/**
 * Statistics of one completed episode of one worker, with the per-step rewards
 * and actions it was computed from.
 */
public class EpisodeSummary {

    public final int workerId;
    public final long episodeIndex;
    public final double totalReward;
    public final int length;
    public final double[] rewards;
    public final double[] actions;

    public EpisodeSummary(int workerId, long episodeIndex, double totalReward, double[] rewards, double[] actions) {
        if (rewards.length != actions.length) {
            throw new IllegalArgumentException("rewards and actions differ in length: "
                    + rewards.length + " vs " + actions.length);
        }
        this.workerId = workerId;
        this.episodeIndex = episodeIndex;
        this.totalReward = totalReward;
        this.length = rewards.length;
        this.rewards = rewards;
        this.actions = actions;
    }

    @Override
    public String toString() {
        return String.format("Episode{worker=%d, index=%d, reward=%.4f, length=%d}",
                workerId, episodeIndex, totalReward, length);
    }
}
