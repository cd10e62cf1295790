package acagent.rl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

import org.apache.log4j.Logger;

/**
 * Training loop driver: for each update, steps all workers through one rollout
 * horizon with paired predict/observe calls, hands the next observations to
 * the agent for bootstrapping, and fits.
 */
public class RolloutRunner {

    private static final Logger logger = Logger.getLogger(RolloutRunner.class);

    private static final int LOG_EVERY = EnvConfig.i32("AC_LOG_EVERY", 10);

    private final ActorCriticAgent agent;
    private final VectorEnvironment env;
    private final MetricsCollector metrics;
    private final Path rolloutStatsPath;

    private double[][] observations;
    private long totalSteps = 0;

    /**
     * @param metrics          may be {@code null}
     * @param rolloutStatsPath per-update CSV, may be {@code null}
     */
    public RolloutRunner(ActorCriticAgent agent, VectorEnvironment env, MetricsCollector metrics, Path rolloutStatsPath) {
        if (agent == null || env == null) {
            throw new IllegalArgumentException("agent and env are required");
        }
        if (env.numWorkers() != agent.getConfig().getNumWorkers()) {
            throw new IllegalArgumentException("environment has " + env.numWorkers() + " workers, agent expects "
                    + agent.getConfig().getNumWorkers());
        }
        this.agent = agent;
        this.env = env;
        this.metrics = metrics;
        this.rolloutStatsPath = rolloutStatsPath;
    }

    /**
     * Wires an agent with CSV and Prometheus telemetry under the configured log
     * directory, starting the metrics server when {@code metricsPort} is set.
     */
    public static RolloutRunner withTelemetry(AgentConfig config, ModelFactory modelFactory, PolicyOptimizer optimizer,
            VectorEnvironment env) throws IOException {
        AgentLogPaths paths = new AgentLogPaths(config.getLogDir());
        MetricsCollector metrics = new MetricsCollector();
        if (config.getMetricsPort() > 0) {
            metrics.startMetricsServer(config.getMetricsPort());
        }
        try {
            TelemetrySink sink = new CompositeTelemetrySink(new CsvTelemetrySink(paths, config.isClearLogDir()), metrics);
            ActorCriticAgent agent = new ActorCriticAgent(config, modelFactory, optimizer, sink);
            return new RolloutRunner(agent, env, metrics, paths.rolloutsPath());
        } catch (RuntimeException e) {
            logger.warn("Agent setup failed, stopping metrics server", e);
            metrics.stop();
            throw e;
        }
    }

    /**
     * Runs {@code numUpdates} rollouts and updates.
     *
     * @return the loss of the last update, or {@code null} if none ran
     */
    public ActorCriticLoss.Breakdown run(int numUpdates) {
        if (observations == null) {
            observations = env.reset();
        }
        int horizon = agent.getConfig().getNumFramesPerProc();
        int workers = agent.getConfig().getNumWorkers();
        ActorCriticLoss.Breakdown last = null;
        for (int update = 0; update < numUpdates; update++) {
            int finished = 0;
            for (int t = 0; t < horizon; t++) {
                long start = System.nanoTime();
                double[] actions = agent.predict(observations, true);
                if (metrics != null) {
                    metrics.recordPredictLatencyNanos(System.nanoTime() - start);
                }
                VectorEnvironment.StepResult step = env.step(actions);
                agent.observe(observations, actions, step.rewards, step.terminals, step.infos, true);
                for (boolean done : step.terminals) {
                    if (done) {
                        finished++;
                    }
                }
                observations = step.observations;
                totalSteps += workers;
            }
            agent.setNewObs(observations);
            last = agent.fit();

            if (metrics != null) {
                metrics.recordTransitions(horizon * workers);
                metrics.recordEpisodesCompleted(finished);
                metrics.recordRolloutCompleted();
            }
            writeRolloutStats(agent.getUpdates(), finished, last);
            if (LOG_EVERY > 0 && agent.getUpdates() % LOG_EVERY == 0) {
                logger.info("Update " + agent.getUpdates() + " (" + totalSteps + " steps, "
                        + finished + " episodes this rollout): " + last);
            }
        }
        return last;
    }

    private void writeRolloutStats(long update, int episodes, ActorCriticLoss.Breakdown loss) {
        if (rolloutStatsPath == null) {
            return;
        }
        try {
            boolean writeHeader = !Files.exists(rolloutStatsPath);
            StringBuilder sb = new StringBuilder();
            if (writeHeader) {
                if (rolloutStatsPath.getParent() != null) {
                    Files.createDirectories(rolloutStatsPath.getParent());
                }
                sb.append("update,total_steps,episodes,loss,policy_loss,value_loss,entropy,adv_mean,adv_std\n");
            }
            sb.append(String.format(Locale.ROOT, "%d,%d,%d,%.6f,%.6f,%.6f,%.6f,%.6f,%.6f\n",
                    update, totalSteps, episodes, loss.total, loss.policyLoss, loss.valueLoss, loss.entropy,
                    loss.advantageMean, loss.advantageStd));
            Files.write(rolloutStatsPath, sb.toString().getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.warn("Failed to write rollout stats CSV", e);
            if (metrics != null) {
                metrics.recordError();
            }
        }
    }

    public long getTotalSteps() {
        return totalSteps;
    }

    public ActorCriticAgent getAgent() {
        return agent;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Closes the agent (model and telemetry) and the environment.
     */
    public void close() {
        agent.close();
        try {
            env.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing environment: " + e.getMessage());
        }
    }
}
