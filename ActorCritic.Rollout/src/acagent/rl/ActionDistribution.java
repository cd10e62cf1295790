package acagent.rl;

/**
 * Batched action distribution, one independent distribution per worker. Each
 * worker draws a single scalar action (a category index for discrete action
 * spaces).
 */
public interface ActionDistribution {

    /**
     * Number of workers this distribution covers.
     */
    int size();

    double[] sample();

    double[] logProb(double[] actions);

    double[] entropy();
}
