package acagent.rl;

import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Random;

import javax.net.ServerSocketFactory;
import javax.net.SocketFactory;

import org.apache.log4j.Logger;

import py4j.ClientServer;
import py4j.Py4JException;

/**
 * {@link PolicyValueModel} backed by a network that lives in a Python process,
 * reached through a Py4J {@link ClientServer}. States are shipped as packed
 * float32 buffers; the returned logits become a
 * {@link CategoricalDistribution}.
 */
public class PythonPolicyBridge implements PolicyValueModel {

    private static final Logger logger = Logger.getLogger(PythonPolicyBridge.class);

    public static final int DEFAULT_PY4J_PORT = 25334;
    private static final int MAX_CONNECTION_RETRIES = EnvConfig.i32("AC_PY4J_CONNECT_RETRIES", 15);
    private static final int CONNECTION_RETRY_DELAY_MS = EnvConfig.i32("AC_PY4J_RETRY_DELAY_MS", 2000);

    private final PythonPolicyEntryPoint entryPoint;
    private final ClientServer clientServer;
    private final int numActions;
    private final int valueDim;
    private final Random random;
    private final Object py4jLock = new Object();

    PythonPolicyBridge(PythonPolicyEntryPoint entryPoint, ClientServer clientServer, int numActions, int valueDim,
            Random random) {
        if (entryPoint == null || random == null) {
            throw new IllegalArgumentException("entryPoint and random are required");
        }
        if (numActions <= 0 || valueDim <= 0) {
            throw new IllegalArgumentException("numActions and valueDim must be positive");
        }
        this.entryPoint = entryPoint;
        this.clientServer = clientServer;
        this.numActions = numActions;
        this.valueDim = valueDim;
        this.random = random;
    }

    /**
     * Connects to a Python gateway already listening on {@code pythonPort} and
     * initializes its model, retrying while the Python side starts up.
     */
    public static PythonPolicyBridge connect(int pythonPort, int stateDim, int numActions, int valueDim, Random random) {
        Exception lastException = null;
        for (int attempt = 1; attempt <= MAX_CONNECTION_RETRIES; attempt++) {
            ClientServer clientServer = null;
            try {
                // No Python -> Java callbacks, so the Java side binds no fixed port.
                clientServer = new ClientServer(
                        0,
                        InetAddress.getByName("127.0.0.1"),
                        pythonPort,
                        InetAddress.getByName("127.0.0.1"),
                        0,
                        0,
                        ServerSocketFactory.getDefault(),
                        SocketFactory.getDefault(),
                        null,
                        false,
                        true
                );
                clientServer.startServer();
                PythonPolicyEntryPoint entryPoint = (PythonPolicyEntryPoint) clientServer
                        .getPythonServerEntryPoint(new Class[]{PythonPolicyEntryPoint.class});
                entryPoint.initializeModel(stateDim, numActions, valueDim);
                logger.info("Connected to Python policy on port " + pythonPort + " (" + entryPoint.getDeviceInfo() + ")");
                return new PythonPolicyBridge(entryPoint, clientServer, numActions, valueDim, random);
            } catch (Exception e) {
                lastException = e;
                logger.warn("Failed to connect to Python gateway (attempt " + attempt + "): " + e.getMessage());
                if (clientServer != null) {
                    try {
                        clientServer.shutdown();
                    } catch (Exception ex) {
                        logger.warn("Error shutting down failed connection: " + ex.getMessage());
                    }
                }
                if (attempt < MAX_CONNECTION_RETRIES) {
                    try {
                        Thread.sleep(CONNECTION_RETRY_DELAY_MS);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RuntimeException("Interrupted while connecting to Python gateway", ie);
                    }
                }
            }
        }
        throw new RuntimeException("Failed to connect to Python gateway after " + MAX_CONNECTION_RETRIES + " attempts",
                lastException);
    }

    /**
     * Model factory connecting to the default port configured by
     * {@code AC_PY4J_PORT}.
     */
    public static ModelFactory factory(int stateDim, int numActions, int valueDim, long seed) {
        return config -> connect(EnvConfig.i32("AC_PY4J_PORT", DEFAULT_PY4J_PORT), stateDim, numActions, valueDim,
                new Random(seed));
    }

    @Override
    public PolicyValueOutput forward(double[][] states) {
        if (states.length == 0) {
            throw new IllegalArgumentException("empty state batch");
        }
        int batch = states.length;
        int stateDim = states[0].length;
        ByteBuffer in = ByteBuffer.allocate(batch * stateDim * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < batch; i++) {
            if (states[i].length != stateDim) {
                throw new IllegalArgumentException("state " + i + " has dimension " + states[i].length
                        + ", expected " + stateDim);
            }
            for (double v : states[i]) {
                in.putFloat((float) v);
            }
        }

        byte[] result;
        try {
            synchronized (py4jLock) {
                result = entryPoint.forward(in.array(), batch, stateDim);
            }
        } catch (Py4JException e) {
            logger.error("Py4J error during forward pass: " + e.getMessage());
            throw new RuntimeException("Failed to run policy forward pass", e);
        }

        int perItem = numActions + valueDim;
        int expected = batch * perItem * Float.BYTES;
        if (result == null || result.length != expected) {
            throw new IllegalStateException("unexpected forward result length "
                    + (result == null ? "null" : result.length) + ", expected " + expected);
        }
        ByteBuffer out = ByteBuffer.wrap(result).order(ByteOrder.LITTLE_ENDIAN);
        double[][] logits = new double[batch][numActions];
        double[][] values = new double[batch][valueDim];
        for (int i = 0; i < batch; i++) {
            for (int a = 0; a < numActions; a++) {
                logits[i][a] = out.getFloat();
            }
            for (int v = 0; v < valueDim; v++) {
                values[i][v] = out.getFloat();
            }
        }
        return new PolicyValueOutput(new CategoricalDistribution(logits, random), values);
    }

    @Override
    public void shutdown() {
        if (clientServer != null) {
            try {
                clientServer.shutdown();
                logger.info("Python policy bridge shutdown complete");
            } catch (Exception e) {
                logger.error("Error during shutdown: " + e.getMessage());
            }
        }
    }
}
