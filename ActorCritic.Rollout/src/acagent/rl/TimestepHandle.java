package acagent.rl;

/**
 * Ties the statistics cached at action-selection time to the transition that
 * later commits them. Issued by {@link ExperienceStore#beginTimestep()} and
 * valid for exactly one commit within the rollout that issued it.
 */
public final class TimestepHandle {

    private final long generation;
    private final int index;
    private boolean statisticsCached;

    TimestepHandle(long generation, int index) {
        this.generation = generation;
        this.index = index;
    }

    public long getGeneration() {
        return generation;
    }

    /**
     * Timestep slot inside the rollout.
     */
    public int getIndex() {
        return index;
    }

    public boolean isStatisticsCached() {
        return statisticsCached;
    }

    void markStatisticsCached() {
        statisticsCached = true;
    }

    @Override
    public String toString() {
        return "TimestepHandle{generation=" + generation + ", index=" + index + "}";
    }
}
