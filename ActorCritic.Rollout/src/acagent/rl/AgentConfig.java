package acagent.rl;

/**
 * Immutable hyperparameters for an {@link ActorCriticAgent}.
 *
 * Defaults can be overridden through {@code AC_*} environment variables (see
 * {@link #fromEnv(int)}) or programmatically through the {@code with*} copy
 * methods.
 */
public final class AgentConfig {

    public static final double DEFAULT_DISCOUNT = 0.99;
    public static final double DEFAULT_GAE_LAMBDA = 0.95;
    public static final int DEFAULT_NUM_FRAMES_PER_PROC = 5;
    public static final int DEFAULT_WINDOW_LENGTH = 1;
    public static final int DEFAULT_SMOOTH_LENGTH = 100;
    public static final int DEFAULT_BATCH_SIZE = 256;
    public static final double DEFAULT_LEARNING_RATE = 7e-4;
    public static final double DEFAULT_ENTROPY_COEF = 0.01;
    public static final double DEFAULT_VALUE_LOSS_COEF = 0.5;
    public static final double DEFAULT_MAX_GRAD_NORM = 0.5;
    public static final String DEFAULT_LOG_DIR = "./logs";

    private final int numWorkers;
    private final double discount;
    private final double gaeLambda;
    private final int numFramesPerProc;
    private final int windowLength;
    private final int smoothLength;
    private final int batchSize;
    private final double learningRate;
    private final double entropyCoef;
    private final double valueLossCoef;
    private final double maxGradNorm;
    private final String logDir;
    private final boolean clearLogDir;
    private final int metricsPort;

    private AgentConfig(int numWorkers, double discount, double gaeLambda, int numFramesPerProc,
            int windowLength, int smoothLength, int batchSize, double learningRate,
            double entropyCoef, double valueLossCoef, double maxGradNorm,
            String logDir, boolean clearLogDir, int metricsPort) {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("numWorkers must be positive: " + numWorkers);
        }
        if (!(discount >= 0.0 && discount <= 1.0)) {
            throw new IllegalArgumentException("discount must be in [0, 1]: " + discount);
        }
        if (!(gaeLambda >= 0.0 && gaeLambda <= 1.0)) {
            throw new IllegalArgumentException("gaeLambda must be in [0, 1]: " + gaeLambda);
        }
        if (numFramesPerProc <= 0) {
            throw new IllegalArgumentException("numFramesPerProc must be positive: " + numFramesPerProc);
        }
        if (windowLength <= 0) {
            throw new IllegalArgumentException("windowLength must be positive: " + windowLength);
        }
        if (smoothLength <= 0) {
            throw new IllegalArgumentException("smoothLength must be positive: " + smoothLength);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (!(learningRate > 0.0) || !Double.isFinite(learningRate)) {
            throw new IllegalArgumentException("learningRate must be positive: " + learningRate);
        }
        if (!(entropyCoef >= 0.0) || !(valueLossCoef >= 0.0) || !(maxGradNorm > 0.0)) {
            throw new IllegalArgumentException("loss coefficients must be non-negative and maxGradNorm positive");
        }
        if (logDir == null || logDir.trim().isEmpty()) {
            throw new IllegalArgumentException("logDir must not be empty");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort out of range: " + metricsPort);
        }
        this.numWorkers = numWorkers;
        this.discount = discount;
        this.gaeLambda = gaeLambda;
        this.numFramesPerProc = numFramesPerProc;
        this.windowLength = windowLength;
        this.smoothLength = smoothLength;
        this.batchSize = batchSize;
        this.learningRate = learningRate;
        this.entropyCoef = entropyCoef;
        this.valueLossCoef = valueLossCoef;
        this.maxGradNorm = maxGradNorm;
        this.logDir = logDir;
        this.clearLogDir = clearLogDir;
        this.metricsPort = metricsPort;
    }

    /**
     * Defaults for the given number of workers.
     */
    public static AgentConfig defaults(int numWorkers) {
        return new AgentConfig(numWorkers, DEFAULT_DISCOUNT, DEFAULT_GAE_LAMBDA,
                DEFAULT_NUM_FRAMES_PER_PROC, DEFAULT_WINDOW_LENGTH, DEFAULT_SMOOTH_LENGTH,
                DEFAULT_BATCH_SIZE, DEFAULT_LEARNING_RATE, DEFAULT_ENTROPY_COEF,
                DEFAULT_VALUE_LOSS_COEF, DEFAULT_MAX_GRAD_NORM, DEFAULT_LOG_DIR, true, 0);
    }

    /**
     * Reads {@code AC_*} overrides on top of the defaults. {@code AC_NUM_WORKERS}
     * wins over the argument when present.
     */
    public static AgentConfig fromEnv(int numWorkers) {
        return new AgentConfig(
                EnvConfig.i32("AC_NUM_WORKERS", numWorkers),
                EnvConfig.f64("AC_DISCOUNT", DEFAULT_DISCOUNT),
                EnvConfig.f64("AC_GAE_LAMBDA", DEFAULT_GAE_LAMBDA),
                EnvConfig.i32("AC_NUM_FRAMES_PER_PROC", DEFAULT_NUM_FRAMES_PER_PROC),
                EnvConfig.i32("AC_WINDOW_LENGTH", DEFAULT_WINDOW_LENGTH),
                EnvConfig.i32("AC_SMOOTH_LENGTH", DEFAULT_SMOOTH_LENGTH),
                EnvConfig.i32("AC_BATCH_SIZE", DEFAULT_BATCH_SIZE),
                EnvConfig.f64("AC_LR", DEFAULT_LEARNING_RATE),
                EnvConfig.f64("AC_ENTROPY_COEF", DEFAULT_ENTROPY_COEF),
                EnvConfig.f64("AC_VALUE_LOSS_COEF", DEFAULT_VALUE_LOSS_COEF),
                EnvConfig.f64("AC_MAX_GRAD_NORM", DEFAULT_MAX_GRAD_NORM),
                EnvConfig.str("AC_LOG_DIR", DEFAULT_LOG_DIR),
                EnvConfig.bool("AC_CLEAR_LOG_DIR", true),
                EnvConfig.i32("AC_METRICS_PORT", 0));
    }

    public AgentConfig withDiscount(double v) {
        return new AgentConfig(numWorkers, v, gaeLambda, numFramesPerProc, windowLength, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withGaeLambda(double v) {
        return new AgentConfig(numWorkers, discount, v, numFramesPerProc, windowLength, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withNumFramesPerProc(int v) {
        return new AgentConfig(numWorkers, discount, gaeLambda, v, windowLength, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withWindowLength(int v) {
        return new AgentConfig(numWorkers, discount, gaeLambda, numFramesPerProc, v, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withSmoothLength(int v) {
        return new AgentConfig(numWorkers, discount, gaeLambda, numFramesPerProc, windowLength, v,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withLossCoefficients(double entropy, double value, double gradNorm) {
        return new AgentConfig(numWorkers, discount, gaeLambda, numFramesPerProc, windowLength, smoothLength,
                batchSize, learningRate, entropy, value, gradNorm, logDir, clearLogDir, metricsPort);
    }

    public AgentConfig withMetricsPort(int port) {
        return new AgentConfig(numWorkers, discount, gaeLambda, numFramesPerProc, windowLength, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir, clearLogDir, port);
    }

    public AgentConfig withLogDir(String dir, boolean clear) {
        return new AgentConfig(numWorkers, discount, gaeLambda, numFramesPerProc, windowLength, smoothLength,
                batchSize, learningRate, entropyCoef, valueLossCoef, maxGradNorm, dir, clear, metricsPort);
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public double getDiscount() {
        return discount;
    }

    public double getGaeLambda() {
        return gaeLambda;
    }

    /**
     * Per-step decay of the advantage sum, {@code discount * gaeLambda}.
     */
    public double getDecayRate() {
        return discount * gaeLambda;
    }

    public int getNumFramesPerProc() {
        return numFramesPerProc;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getSmoothLength() {
        return smoothLength;
    }

    /**
     * Minibatch size for the {@link PolicyOptimizer}. The rollout engine itself
     * always hands over the full horizon.
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Step size for the {@link PolicyOptimizer}; not read by the rollout engine.
     */
    public double getLearningRate() {
        return learningRate;
    }

    public double getEntropyCoef() {
        return entropyCoef;
    }

    public double getValueLossCoef() {
        return valueLossCoef;
    }

    /**
     * Gradient clipping threshold for the {@link PolicyOptimizer}; not read by
     * the rollout engine.
     */
    public double getMaxGradNorm() {
        return maxGradNorm;
    }

    public String getLogDir() {
        return logDir;
    }

    public boolean isClearLogDir() {
        return clearLogDir;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    @Override
    public String toString() {
        return String.format("AgentConfig{workers=%d, discount=%.4f, gaeLambda=%.4f, framesPerProc=%d, window=%d, "
                + "smooth=%d, batch=%d, lr=%.2e, entropyCoef=%.4f, valueLossCoef=%.4f, maxGradNorm=%.4f, logDir=%s}",
                numWorkers, discount, gaeLambda, numFramesPerProc, windowLength, smoothLength, batchSize,
                learningRate, entropyCoef, valueLossCoef, maxGradNorm, logDir);
    }
}
