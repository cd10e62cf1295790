package acagent.rl;

import java.util.ArrayDeque;

/**
 * Fixed-capacity FIFO of recent values; the oldest entry is evicted once the
 * capacity is reached.
 */
public class SmoothedWindow {

    private final int capacity;
    private final ArrayDeque<Double> values;

    public SmoothedWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public void add(double value) {
        if (values.size() == capacity) {
            values.pollFirst();
        }
        values.addLast(value);
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Mean of the retained values, 0 when empty. Summed afresh on every call.
     */
    public double mean() {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public double oldest() {
        if (values.isEmpty()) {
            throw new IllegalStateException("window is empty");
        }
        return values.peekFirst();
    }

    public double[] toArray() {
        double[] out = new double[values.size()];
        int i = 0;
        for (Double v : values) {
            out[i++] = v;
        }
        return out;
    }
}
