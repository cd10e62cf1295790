package acagent.rl;

/**
 * Transforms a raw per-worker observation into the feature vector the model
 * consumes. Implementations must be pure.
 */
@FunctionalInterface
public interface FeatureProcessor {

    double[] process(double[] rawObservation);
}
