package acagent.rl;

import java.util.List;
import java.util.Map;

/**
 * Training-loop facing contract of an on-policy agent driving
 * {@code numWorkers} workers in lockstep. Every training {@link #predict} must
 * be followed by exactly one {@link #observe} for the same timestep before the
 * next {@code predict}.
 */
public interface Agent extends AutoCloseable {

    /**
     * @param observations one raw observation per worker
     * @param training     when set, the statistics of the drawn actions are
     *                     cached for the next {@link #observe}
     * @return one sampled action per worker
     */
    double[] predict(double[][] observations, boolean training);

    /**
     * Stores the transition of the timestep whose actions the preceding
     * {@link #predict} produced.
     *
     * @param infos per-worker environment info, may be {@code null}
     */
    void observe(double[][] observations, double[] actions, double[] rewards, boolean[] terminals,
            List<Map<String, Object>> infos, boolean training);

    /**
     * Turns the full rollout into training targets and empties the rollout.
     *
     * @throws IllegalStateException if the rollout is not full or no bootstrap
     *                               observation was supplied
     */
    RolloutTargets aggregateExperiences();

    @Override
    default void close() {
    }
}
