package acagent.rl;

/**
 * Methods the Python process hosting the policy/value network exposes over
 * Py4J.
 */
public interface PythonPolicyEntryPoint {

    /**
     * Build (or load) the network for the given shapes.
     */
    void initializeModel(int stateDim, int numActions, int valueDim);

    /**
     * One forward pass over a batch of states.
     * <p>
     * Input: {@code batchSize * stateDim} little-endian float32 values, row
     * major. Return format: for each batch item, {@code numActions} float32
     * logits followed by {@code valueDim} float32 value estimates.
     */
    byte[] forward(byte[] statesBytes, int batchSize, int stateDim);

    /**
     * Short diagnostic string about device placement (CUDA vs CPU).
     */
    String getDeviceInfo();
}
