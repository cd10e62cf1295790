package acagent.rl;

import java.util.List;
import java.util.Map;

/**
 * A batch of simulated workers stepped together. A worker whose episode ends
 * resets itself; the observation returned for it is the first observation of
 * its next episode.
 */
public interface VectorEnvironment extends AutoCloseable {

    int numWorkers();

    double[][] reset();

    StepResult step(double[] actions);

    @Override
    default void close() {
    }

    class StepResult {

        public final double[][] observations;
        public final double[] rewards;
        public final boolean[] terminals;
        public final List<Map<String, Object>> infos;

        public StepResult(double[][] observations, double[] rewards, boolean[] terminals,
                List<Map<String, Object>> infos) {
            this.observations = observations;
            this.rewards = rewards;
            this.terminals = terminals;
            this.infos = infos;
        }
    }
}
