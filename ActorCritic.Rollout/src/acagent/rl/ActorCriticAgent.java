package acagent.rl;

import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * On-policy actor-critic agent over {@code numWorkers} lockstep workers.
 *
 * Collects {@code numFramesPerProc} timesteps into an {@link ExperienceStore}
 * through paired {@link #predict}/{@link #observe} calls, then
 * {@link #aggregateExperiences()} bootstraps from the observation given to
 * {@link #setNewObs} and turns the rollout into GAE advantages.
 */
public class ActorCriticAgent implements Agent {

    private static final Logger logger = Logger.getLogger(ActorCriticAgent.class);

    public static final String TAG_LOSS = "train/loss";
    public static final String TAG_ACTOR_LOSS = "train/actor_loss";
    public static final String TAG_CRITIC_LOSS = "train/critic_loss";
    public static final String TAG_ENTROPY = "train/entropy";
    public static final String TAG_ADVANTAGE_MEAN = "train/advantage_mean";

    private final AgentConfig config;
    private final PolicyValueModel model;
    private final PolicyOptimizer optimizer;
    private final FeatureProcessor processor;
    private final RewardReshaper rewardReshaper;
    private final ExperienceStore memory;
    private final EpisodeTracker tracker;
    private final AdvantageEstimator estimator;
    private final TelemetrySink sink;

    private final SmoothedWindow lossRecord;
    private final SmoothedWindow actorLossRecord;
    private final SmoothedWindow criticLossRecord;
    private final SmoothedWindow entropyRecord;

    private TimestepHandle pending;
    private double[][] newObs;
    private AdvantageEstimate lastEstimate;
    private long updates = 0;
    private long telemetryFailures = 0;

    public ActorCriticAgent(AgentConfig config, ModelFactory modelFactory, PolicyOptimizer optimizer,
            TelemetrySink sink) {
        this(config, modelFactory, optimizer, null, null, new RolloutMemory(config), sink);
    }

    /**
     * @param optimizer      may be {@code null} when the caller performs the
     *                       update itself from {@link #aggregateExperiences()}
     * @param processor      may be {@code null}
     * @param rewardReshaper may be {@code null}
     */
    public ActorCriticAgent(AgentConfig config, ModelFactory modelFactory, PolicyOptimizer optimizer,
            FeatureProcessor processor, RewardReshaper rewardReshaper, ExperienceStore memory,
            TelemetrySink sink) {
        if (config == null || modelFactory == null || memory == null || sink == null) {
            throw new IllegalArgumentException("config, modelFactory, memory and sink are required");
        }
        if (memory.horizon() != config.getNumFramesPerProc() || memory.numWorkers() != config.getNumWorkers()) {
            throw new IllegalArgumentException("experience store shape " + memory.horizon() + "x" + memory.numWorkers()
                    + " does not match config " + config.getNumFramesPerProc() + "x" + config.getNumWorkers());
        }
        this.config = config;
        this.model = modelFactory.build(config);
        if (this.model == null) {
            throw new IllegalArgumentException("modelFactory returned null");
        }
        this.optimizer = optimizer;
        this.processor = processor;
        this.rewardReshaper = rewardReshaper;
        this.memory = memory;
        this.sink = sink;
        this.tracker = new EpisodeTracker(config.getNumWorkers(), config.getSmoothLength(), sink);
        this.estimator = new AdvantageEstimator(config);
        this.lossRecord = new SmoothedWindow(config.getSmoothLength());
        this.actorLossRecord = new SmoothedWindow(config.getSmoothLength());
        this.criticLossRecord = new SmoothedWindow(config.getSmoothLength());
        this.entropyRecord = new SmoothedWindow(config.getSmoothLength());
        logger.info("Actor-critic agent ready: " + config);
    }

    @Override
    public double[] predict(double[][] observations, boolean training) {
        checkWorkers("observations", observations.length);
        if (training && pending != null) {
            throw new IllegalStateException("predict called again before observe for timestep " + pending.getIndex());
        }
        double[][] state = memory.getRecentState(process(observations));
        PolicyValueOutput out = model.forward(state);
        if (out == null) {
            throw new IllegalStateException("model returned no output");
        }
        checkWorkers("model output", out.distribution.size());
        double[] actions = out.distribution.sample();
        if (training) {
            double[] values = out.scalarValues();
            double[] logProbs = out.distribution.logProb(actions);
            double[] entropies = out.distribution.entropy();
            TimestepHandle handle = memory.beginTimestep();
            memory.cacheStatistics(handle, values, logProbs, entropies);
            pending = handle;
        }
        return actions.clone();
    }

    @Override
    public void observe(double[][] observations, double[] actions, double[] rewards, boolean[] terminals,
            List<Map<String, Object>> infos, boolean training) {
        checkWorkers("observations", observations.length);
        checkWorkers("actions", actions.length);
        checkWorkers("rewards", rewards.length);
        checkWorkers("terminals", terminals.length);
        if (infos != null) {
            checkWorkers("infos", infos.size());
        }
        for (int i = 0; i < rewards.length; i++) {
            if (!Double.isFinite(rewards[i])) {
                throw new IllegalArgumentException("reward for worker " + i + " is not finite: " + rewards[i]);
            }
        }

        double[][] processed = process(observations);
        if (training) {
            if (pending == null) {
                throw new IllegalStateException("observe(training) without a preceding predict(training)");
            }
            memory.commit(pending, processed, actions, reshape(rewards), terminals);
            pending = null;
        } else {
            if (pending != null) {
                throw new IllegalStateException("timestep " + pending.getIndex() + " was predicted for training but observed without it");
            }
            memory.advanceWindow(processed, terminals);
        }
        tracker.record(actions, rewards, terminals);
    }

    /**
     * Supplies the observation that follows the last stored transition. It is
     * only used to bootstrap the next {@link #aggregateExperiences()} and is
     * never stored.
     */
    public void setNewObs(double[][] observations) {
        checkWorkers("observations", observations.length);
        this.newObs = process(observations);
    }

    public double[][] getNewestState() {
        if (newObs == null) {
            throw new IllegalStateException("no bootstrap observation; call setNewObs first");
        }
        return memory.getRecentState(newObs);
    }

    @Override
    public RolloutTargets aggregateExperiences() {
        if (!memory.isFull()) {
            throw new IllegalStateException("rollout holds " + memory.size() + " of " + memory.horizon() + " timesteps");
        }
        if (pending != null) {
            throw new IllegalStateException("timestep " + pending.getIndex() + " is still waiting for observe");
        }
        RolloutBatch batch = memory.sample();
        double[] bootstrap = model.forward(getNewestState()).scalarValues();
        checkWorkers("bootstrap values", bootstrap.length);

        AdvantageEstimate estimate = estimator.estimate(batch.rewards, batch.terminals, batch.values, bootstrap);
        memory.reset();
        newObs = null;
        lastEstimate = estimate;
        return new RolloutTargets(estimate.advantages, batch.logProbs, batch.entropies);
    }

    /**
     * Aggregates the full rollout, computes the loss breakdown and hands both to
     * the optimizer.
     */
    public ActorCriticLoss.Breakdown fit() {
        RolloutTargets targets = aggregateExperiences();
        ActorCriticLoss.Breakdown loss = ActorCriticLoss.compute(targets, config);
        if (optimizer != null) {
            optimizer.step(targets, loss, config);
        }
        lossRecord.add(loss.total);
        actorLossRecord.add(loss.policyLoss);
        criticLossRecord.add(loss.valueLoss);
        entropyRecord.add(loss.entropy);

        safeScalar(TAG_LOSS, lossRecord.mean());
        safeScalar(TAG_ACTOR_LOSS, actorLossRecord.mean());
        safeScalar(TAG_CRITIC_LOSS, criticLossRecord.mean());
        safeScalar(TAG_ENTROPY, entropyRecord.mean());
        safeScalar(TAG_ADVANTAGE_MEAN, loss.advantageMean);
        updates++;
        if (logger.isDebugEnabled()) {
            logger.debug("Update " + updates + ": " + loss);
        }
        return loss;
    }

    private void safeScalar(String tag, double value) {
        try {
            sink.addScalar(tag, value, updates);
        } catch (RuntimeException e) {
            telemetryFailures++;
            logger.warn("Telemetry write failed for " + tag + " (update " + updates + "): " + e.getMessage());
        }
    }

    private double[][] process(double[][] observations) {
        double[][] out = new double[observations.length][];
        for (int i = 0; i < observations.length; i++) {
            if (observations[i] == null) {
                throw new IllegalArgumentException("observation for worker " + i + " is null");
            }
            out[i] = processor != null ? processor.process(observations[i]) : observations[i].clone();
        }
        return out;
    }

    private double[] reshape(double[] rewards) {
        if (rewardReshaper == null) {
            return rewards;
        }
        double[] out = new double[rewards.length];
        for (int i = 0; i < rewards.length; i++) {
            out[i] = rewardReshaper.reshape(rewards[i]);
        }
        return out;
    }

    private void checkWorkers(String what, int length) {
        if (length != config.getNumWorkers()) {
            throw new IllegalArgumentException(what + " has " + length + " entries, expected "
                    + config.getNumWorkers() + " workers");
        }
    }

    public AgentConfig getConfig() {
        return config;
    }

    public ExperienceStore getMemory() {
        return memory;
    }

    public EpisodeTracker getTracker() {
        return tracker;
    }

    /**
     * Residuals and advantages of the most recent aggregation, or {@code null}.
     */
    public AdvantageEstimate getLastEstimate() {
        return lastEstimate;
    }

    public long getUpdates() {
        return updates;
    }

    public double getSmoothedLoss() {
        return lossRecord.mean();
    }

    public long getTelemetryFailures() {
        return telemetryFailures + tracker.getTelemetryFailures();
    }

    @Override
    public void close() {
        try {
            model.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing model: " + e.getMessage());
        }
        try {
            sink.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing telemetry sink: " + e.getMessage());
        }
    }
}
