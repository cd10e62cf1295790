package acagent.rl;

/**
 * Shared policy/value network. The network architecture and its gradient
 * machinery live outside this module; the rollout engine only needs forward
 * passes.
 */
public interface PolicyValueModel extends AutoCloseable {

    /**
     * @param states one windowed state per worker
     * @return the action distribution and value estimate for every worker
     */
    PolicyValueOutput forward(double[][] states);

    /**
     * Release external resources (sockets, processes). No-op by default.
     */
    default void shutdown() {
    }

    @Override
    default void close() {
        shutdown();
    }
}
