package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Random;

import org.junit.jupiter.api.Test;

import py4j.Py4JException;

class PythonPolicyBridgeTest {

    /**
     * Stand-in for the Python side: logits are fixed, and each value head
     * echoes the sum of the received state.
     */
    static class FakeEntryPoint implements PythonPolicyEntryPoint {

        final int numActions;
        final int valueDim;
        float[] lastStates;
        byte[] override;
        RuntimeException failure;

        FakeEntryPoint(int numActions, int valueDim) {
            this.numActions = numActions;
            this.valueDim = valueDim;
        }

        @Override
        public void initializeModel(int stateDim, int numActions, int valueDim) {
        }

        @Override
        public byte[] forward(byte[] statesBytes, int batchSize, int stateDim) {
            if (failure != null) {
                throw failure;
            }
            if (override != null) {
                return override;
            }
            ByteBuffer in = ByteBuffer.wrap(statesBytes).order(ByteOrder.LITTLE_ENDIAN);
            lastStates = new float[batchSize * stateDim];
            for (int k = 0; k < lastStates.length; k++) {
                lastStates[k] = in.getFloat();
            }
            ByteBuffer out = ByteBuffer.allocate(batchSize * (numActions + valueDim) * Float.BYTES)
                    .order(ByteOrder.LITTLE_ENDIAN);
            for (int i = 0; i < batchSize; i++) {
                float sum = 0f;
                for (int d = 0; d < stateDim; d++) {
                    sum += lastStates[i * stateDim + d];
                }
                for (int a = 0; a < numActions; a++) {
                    out.putFloat(a == 0 ? 0f : (float) Math.log(3.0));
                }
                for (int v = 0; v < valueDim; v++) {
                    out.putFloat(sum);
                }
            }
            return out.array();
        }

        @Override
        public String getDeviceInfo() {
            return "cpu";
        }
    }

    @Test
    void packsStatesAndDecodesLogitsAndValues() {
        FakeEntryPoint python = new FakeEntryPoint(2, 2);
        PythonPolicyBridge bridge = new PythonPolicyBridge(python, null, 2, 2, new Random(1));

        PolicyValueOutput out = bridge.forward(new double[][]{{0.5, 1.5}, {-1.0, 0.25}});

        assertArrayEquals(new float[]{0.5f, 1.5f, -1.0f, 0.25f}, python.lastStates, 0f);
        assertArrayEquals(new double[]{2.0, 2.0}, out.values[0], 1e-6);
        assertArrayEquals(new double[]{4.0, -1.5}, out.scalarValues(), 1e-6);
        CategoricalDistribution dist = (CategoricalDistribution) out.distribution;
        assertEquals(2, dist.size());
        assertArrayEquals(new double[]{0.25, 0.75}, dist.probabilities(1), 1e-6);
    }

    @Test
    void wrongResultLengthIsRejected() {
        FakeEntryPoint python = new FakeEntryPoint(2, 1);
        python.override = new byte[4];
        PythonPolicyBridge bridge = new PythonPolicyBridge(python, null, 2, 1, new Random(1));

        assertThrows(IllegalStateException.class, () -> bridge.forward(new double[][]{{1.0}}));
    }

    @Test
    void py4jFailuresAreWrapped() {
        FakeEntryPoint python = new FakeEntryPoint(2, 1);
        Py4JException cause = new Py4JException("python crashed");
        python.failure = cause;
        PythonPolicyBridge bridge = new PythonPolicyBridge(python, null, 2, 1, new Random(1));

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> bridge.forward(new double[][]{{1.0}}));
        assertSame(cause, thrown.getCause());
    }

    @Test
    void raggedStatesAreRejected() {
        PythonPolicyBridge bridge = new PythonPolicyBridge(new FakeEntryPoint(2, 1), null, 2, 1, new Random(1));

        assertThrows(IllegalArgumentException.class, () -> bridge.forward(new double[][]{{1.0, 2.0}, {1.0}}));
    }

    @Test
    void worksAsAgentModel() {
        FakeEntryPoint python = new FakeEntryPoint(2, 1);
        AgentConfig config = AgentConfig.defaults(2).withNumFramesPerProc(1);
        ActorCriticAgent agent = new ActorCriticAgent(config,
                c -> new PythonPolicyBridge(python, null, 2, 1, new Random(3)), null, new RecordingSink());

        double[] actions = agent.predict(new double[][]{{1.0}, {2.0}}, true);
        agent.observe(new double[][]{{1.0}, {2.0}}, actions, new double[]{0, 0}, new boolean[]{false, false},
                null, true);

        assertArrayEquals(new double[]{1.0, 2.0}, agent.getMemory().sample().values[0], 1e-6);
        assertTrue(actions[0] == 0.0 || actions[0] == 1.0);
        agent.close();
    }
}
