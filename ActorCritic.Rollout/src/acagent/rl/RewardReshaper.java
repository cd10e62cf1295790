package acagent.rl;

/**
 * Optional transform applied to rewards before they are stored for training.
 * Episode telemetry keeps the raw rewards.
 */
@FunctionalInterface
public interface RewardReshaper {

    double reshape(double reward);
}
