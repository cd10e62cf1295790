package acagent.rl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Per-worker episode bookkeeping. Every step appends each worker's reward and
 * action to its running episode and to a smoothed reward window; a terminal
 * flag emits the episode summary to the telemetry sink, then clears the
 * worker's episode and advances its episode index.
 *
 * Accumulators exist for every worker from construction on.
 */
public class EpisodeTracker {

    private static final Logger logger = Logger.getLogger(EpisodeTracker.class);

    public static final String TAG_REWARD_SUM = "data/episode_reward_sum_";
    public static final String TAG_LENGTH = "data/episode_length_";
    public static final String TAG_SMOOTHED_REWARD = "data/smoothed_reward_";
    public static final String TAG_ACTIONS = "data/episode_action_";
    public static final String TAG_REWARD_DIST = "data/episode_reward_dist_";

    private final int numWorkers;
    private final Map<Integer, EpisodeAccumulator> episodes;
    private final Map<Integer, SmoothedWindow> rewardRecord;
    private final TelemetrySink sink;

    private long recordStep = 0;
    private long telemetryFailures = 0;

    public EpisodeTracker(int numWorkers, int smoothLength, TelemetrySink sink) {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("numWorkers must be positive: " + numWorkers);
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        this.numWorkers = numWorkers;
        this.sink = sink;
        Map<Integer, EpisodeAccumulator> eps = new LinkedHashMap<>();
        Map<Integer, SmoothedWindow> rec = new LinkedHashMap<>();
        for (int i = 0; i < numWorkers; i++) {
            eps.put(i, new EpisodeAccumulator(i));
            rec.put(i, new SmoothedWindow(smoothLength));
        }
        this.episodes = Collections.unmodifiableMap(eps);
        this.rewardRecord = Collections.unmodifiableMap(rec);
    }

    /**
     * Records one timestep for all workers.
     *
     * @return summaries of the episodes that ended at this step, in worker order
     */
    public List<EpisodeSummary> record(double[] actions, double[] rewards, boolean[] terminals) {
        checkLength("actions", actions.length);
        checkLength("rewards", rewards.length);
        checkLength("terminals", terminals.length);
        for (int i = 0; i < numWorkers; i++) {
            if (!Double.isFinite(rewards[i])) {
                throw new IllegalArgumentException("reward for worker " + i + " is not finite: " + rewards[i]);
            }
        }

        List<EpisodeSummary> finished = new ArrayList<>();
        for (int i = 0; i < numWorkers; i++) {
            SmoothedWindow window = rewardRecord.get(i);
            window.add(rewards[i]);
            EpisodeAccumulator episode = episodes.get(i);
            episode.append(actions[i], rewards[i]);
            if (terminals[i]) {
                EpisodeSummary summary = episode.complete();
                emit(summary, window.mean());
                finished.add(summary);
            }
        }
        recordStep++;
        return finished;
    }

    private void emit(EpisodeSummary summary, double smoothedReward) {
        int i = summary.workerId;
        long step = summary.episodeIndex;
        safeScalar(TAG_REWARD_SUM + i, summary.totalReward, step);
        safeScalar(TAG_LENGTH + i, summary.length, step);
        safeScalar(TAG_SMOOTHED_REWARD + i, smoothedReward, step);
        safeHistogram(TAG_ACTIONS + i, summary.actions, step);
        safeHistogram(TAG_REWARD_DIST + i, summary.rewards, step);
        if (logger.isDebugEnabled()) {
            logger.debug("Finished " + summary);
        }
    }

    private void safeScalar(String tag, double value, long step) {
        try {
            sink.addScalar(tag, value, step);
        } catch (RuntimeException e) {
            telemetryFailures++;
            logger.warn("Telemetry write failed for " + tag + " (step " + step + "): " + e.getMessage());
        }
    }

    private void safeHistogram(String tag, double[] data, long step) {
        try {
            sink.addHistogram(tag, Histogram.auto(data), step);
        } catch (RuntimeException e) {
            telemetryFailures++;
            logger.warn("Telemetry write failed for " + tag + " (step " + step + "): " + e.getMessage());
        }
    }

    private void checkLength(String what, int length) {
        if (length != numWorkers) {
            throw new IllegalArgumentException(what + " has " + length + " entries, expected " + numWorkers + " workers");
        }
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public EpisodeAccumulator episode(int worker) {
        EpisodeAccumulator acc = episodes.get(worker);
        if (acc == null) {
            throw new IllegalArgumentException("unknown worker " + worker);
        }
        return acc;
    }

    public SmoothedWindow smoothedRewards(int worker) {
        SmoothedWindow w = rewardRecord.get(worker);
        if (w == null) {
            throw new IllegalArgumentException("unknown worker " + worker);
        }
        return w;
    }

    public long getRecordStep() {
        return recordStep;
    }

    public long getTelemetryFailures() {
        return telemetryFailures;
    }
}
