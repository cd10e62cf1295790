package acagent.rl;

/**
 * Caller-supplied construction function for the policy/value model.
 */
@FunctionalInterface
public interface ModelFactory {

    PolicyValueModel build(AgentConfig config);
}
