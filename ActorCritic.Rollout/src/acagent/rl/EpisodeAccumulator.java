package acagent.rl;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewards and actions of one worker since its last episode boundary, plus the
 * number of episodes that worker has completed.
 */
public class EpisodeAccumulator {

    private final int workerId;
    private final List<Double> rewards = new ArrayList<>();
    private final List<Double> actions = new ArrayList<>();
    private long episodeIndex = 0;

    public EpisodeAccumulator(int workerId) {
        this.workerId = workerId;
    }

    public int getWorkerId() {
        return workerId;
    }

    public void append(double action, double reward) {
        actions.add(action);
        rewards.add(reward);
    }

    public int length() {
        return rewards.size();
    }

    public boolean isEmpty() {
        return rewards.isEmpty();
    }

    /**
     * Index of the episode in progress; never decreases.
     */
    public long getEpisodeIndex() {
        return episodeIndex;
    }

    public double[] rewards() {
        return toArray(rewards);
    }

    public double[] actions() {
        return toArray(actions);
    }

    /**
     * Closes the finished episode: clears the lists, advances the episode index
     * and returns the raw rewards and actions collected.
     */
    EpisodeSummary complete() {
        if (rewards.isEmpty()) {
            throw new IllegalStateException("worker " + workerId + " has no steps in episode " + episodeIndex);
        }
        double[] r = rewards();
        double[] a = actions();
        double total = 0.0;
        for (double v : r) {
            total += v;
        }
        EpisodeSummary summary = new EpisodeSummary(workerId, episodeIndex, total, r, a);
        episodeIndex++;
        rewards.clear();
        actions.clear();
        return summary;
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
