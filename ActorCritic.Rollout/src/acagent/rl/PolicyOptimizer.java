package acagent.rl;

/**
 * External gradient step. Receives the rollout targets together with the loss
 * breakdown computed from them, and the agent's config for the optimizer
 * settings ({@link AgentConfig#getLearningRate()},
 * {@link AgentConfig#getMaxGradNorm()}, {@link AgentConfig#getBatchSize()}).
 */
@FunctionalInterface
public interface PolicyOptimizer {

    void step(RolloutTargets targets, ActorCriticLoss.Breakdown loss, AgentConfig config);
}
