package acagent.rl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * In-memory {@link ExperienceStore}. Preallocates {@code horizon x numWorkers}
 * slots and keeps the last {@code windowLength - 1} observations of every
 * worker for state stacking. A worker's window is cleared when one of its
 * transitions is committed with the terminal flag set, so the next episode
 * starts zero padded. Windows survive {@link #reset()}.
 */
public class RolloutMemory implements ExperienceStore {

    private static final Logger logger = Logger.getLogger(RolloutMemory.class);

    private final int horizon;
    private final int windowLength;
    private final int numWorkers;

    private final double[][][] observations;
    private final double[][] actions;
    private final double[][] rewards;
    private final boolean[][] terminals;
    private final double[][] values;
    private final double[][] logProbs;
    private final double[][] entropies;

    private final List<ArrayDeque<double[]>> windows;
    private int observationDim = -1;

    private int size = 0;
    private long generation = 0;
    private TimestepHandle pending;

    public RolloutMemory(int horizon, int windowLength, int numWorkers) {
        if (horizon <= 0 || windowLength <= 0 || numWorkers <= 0) {
            throw new IllegalArgumentException("horizon, windowLength and numWorkers must be positive");
        }
        this.horizon = horizon;
        this.windowLength = windowLength;
        this.numWorkers = numWorkers;
        this.observations = new double[horizon][numWorkers][];
        this.actions = new double[horizon][numWorkers];
        this.rewards = new double[horizon][numWorkers];
        this.terminals = new boolean[horizon][numWorkers];
        this.values = new double[horizon][numWorkers];
        this.logProbs = new double[horizon][numWorkers];
        this.entropies = new double[horizon][numWorkers];
        this.windows = new ArrayList<>(numWorkers);
        for (int i = 0; i < numWorkers; i++) {
            windows.add(new ArrayDeque<>(Math.max(1, windowLength - 1)));
        }
    }

    public RolloutMemory(AgentConfig config) {
        this(config.getNumFramesPerProc(), config.getWindowLength(), config.getNumWorkers());
    }

    @Override
    public int horizon() {
        return horizon;
    }

    @Override
    public int numWorkers() {
        return numWorkers;
    }

    public int windowLength() {
        return windowLength;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public TimestepHandle beginTimestep() {
        if (pending != null) {
            throw new IllegalStateException("timestep " + pending.getIndex() + " was started but never committed");
        }
        if (size >= horizon) {
            throw new IllegalStateException("rollout horizon of " + horizon + " timesteps is full; aggregate before continuing");
        }
        pending = new TimestepHandle(generation, size);
        return pending;
    }

    @Override
    public void cacheStatistics(TimestepHandle handle, double[] values, double[] logProbs, double[] entropies) {
        checkHandle(handle);
        checkWorkers("values", values.length);
        checkWorkers("logProbs", logProbs.length);
        checkWorkers("entropies", entropies.length);
        int t = handle.getIndex();
        System.arraycopy(values, 0, this.values[t], 0, numWorkers);
        System.arraycopy(logProbs, 0, this.logProbs[t], 0, numWorkers);
        System.arraycopy(entropies, 0, this.entropies[t], 0, numWorkers);
        handle.markStatisticsCached();
    }

    @Override
    public void commit(TimestepHandle handle, double[][] observations, double[] actions, double[] rewards,
            boolean[] terminals) {
        checkHandle(handle);
        if (!handle.isStatisticsCached()) {
            throw new IllegalStateException("no value/log-prob/entropy cached for " + handle);
        }
        checkWorkers("observations", observations.length);
        checkWorkers("actions", actions.length);
        checkWorkers("rewards", rewards.length);
        checkWorkers("terminals", terminals.length);
        checkObservationDims(observations);

        int t = handle.getIndex();
        for (int i = 0; i < numWorkers; i++) {
            this.observations[t][i] = observations[i].clone();
        }
        System.arraycopy(actions, 0, this.actions[t], 0, numWorkers);
        System.arraycopy(rewards, 0, this.rewards[t], 0, numWorkers);
        System.arraycopy(terminals, 0, this.terminals[t], 0, numWorkers);
        size++;
        pending = null;
        pushWindows(observations, terminals);
    }

    @Override
    public void advanceWindow(double[][] observations, boolean[] terminals) {
        checkWorkers("observations", observations.length);
        checkWorkers("terminals", terminals.length);
        checkObservationDims(observations);
        pushWindows(observations, terminals);
    }

    @Override
    public double[][] getRecentState(double[][] observations) {
        checkWorkers("observations", observations.length);
        checkObservationDims(observations);
        int dim = observations[0].length;
        double[][] states = new double[numWorkers][windowLength * dim];
        for (int i = 0; i < numWorkers; i++) {
            ArrayDeque<double[]> window = windows.get(i);
            // zero padding occupies the leading slots
            int offset = (windowLength - 1 - window.size()) * dim;
            Iterator<double[]> it = window.iterator();
            while (it.hasNext()) {
                System.arraycopy(it.next(), 0, states[i], offset, dim);
                offset += dim;
            }
            System.arraycopy(observations[i], 0, states[i], offset, dim);
        }
        return states;
    }

    @Override
    public RolloutBatch sample() {
        if (size < horizon) {
            throw new IllegalStateException("rollout holds " + size + " of " + horizon + " timesteps");
        }
        if (pending != null) {
            throw new IllegalStateException("timestep " + pending.getIndex() + " is still pending");
        }
        double[][][] obsCopy = new double[horizon][numWorkers][];
        for (int t = 0; t < horizon; t++) {
            for (int i = 0; i < numWorkers; i++) {
                obsCopy[t][i] = observations[t][i].clone();
            }
        }
        return new RolloutBatch(obsCopy, deepCopy(actions), deepCopy(rewards), deepCopy(terminals),
                deepCopy(values), deepCopy(logProbs), deepCopy(entropies));
    }

    @Override
    public void reset() {
        size = 0;
        pending = null;
        generation++;
        for (double[][] row : observations) {
            Arrays.fill(row, null);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Rollout memory reset (generation " + generation + ")");
        }
    }

    private void pushWindows(double[][] observations, boolean[] terminals) {
        for (int i = 0; i < numWorkers; i++) {
            ArrayDeque<double[]> window = windows.get(i);
            if (terminals[i]) {
                window.clear();
                continue;
            }
            if (windowLength == 1) {
                continue;
            }
            if (window.size() == windowLength - 1) {
                window.pollFirst();
            }
            window.addLast(observations[i].clone());
        }
    }

    private void checkHandle(TimestepHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle must not be null");
        }
        if (handle != pending || handle.getGeneration() != generation) {
            throw new IllegalStateException("stale or foreign " + handle + " (current generation " + generation + ")");
        }
    }

    private void checkWorkers(String what, int length) {
        if (length != numWorkers) {
            throw new IllegalArgumentException(what + " has " + length + " entries, expected " + numWorkers + " workers");
        }
    }

    private void checkObservationDims(double[][] obs) {
        for (int i = 0; i < obs.length; i++) {
            if (obs[i] == null) {
                throw new IllegalArgumentException("observation for worker " + i + " is null");
            }
            if (observationDim < 0) {
                observationDim = obs[i].length;
            } else if (obs[i].length != observationDim) {
                throw new IllegalArgumentException("observation for worker " + i + " has dimension "
                        + obs[i].length + ", expected " + observationDim);
            }
        }
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }

    private static boolean[][] deepCopy(boolean[][] src) {
        boolean[][] out = new boolean[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
