package acagent.rl;

/**
 * Fixed-horizon, per-worker transition storage with windowed state
 * reconstruction.
 *
 * Writes are two-phase: {@link #beginTimestep()} reserves the next slot,
 * {@link #cacheStatistics} stores the value, log-probability and entropy
 * computed when the action was drawn, and {@link #commit} stores the
 * transition in the same slot. Out-of-order use fails with
 * {@link IllegalStateException}.
 */
public interface ExperienceStore {

    int horizon();

    int numWorkers();

    /**
     * Committed timesteps in the current rollout.
     */
    int size();

    default boolean isFull() {
        return size() >= horizon();
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    TimestepHandle beginTimestep();

    void cacheStatistics(TimestepHandle handle, double[] values, double[] logProbs, double[] entropies);

    void commit(TimestepHandle handle, double[][] observations, double[] actions, double[] rewards,
            boolean[] terminals);

    /**
     * Advances the observation windows without storing a transition. Used when
     * acting outside of training.
     */
    void advanceWindow(double[][] observations, boolean[] terminals);

    /**
     * Windowed state for each worker, ending with the given observations. Does
     * not mutate the store.
     */
    double[][] getRecentState(double[][] observations);

    /**
     * @throws IllegalStateException if the horizon is not full
     */
    RolloutBatch sample();

    /**
     * Empties the rollout. Handles issued before the reset become invalid.
     */
    void reset();
}
