package acagent.rl;

/**
 * Destination for training telemetry. Sinks are best-effort: callers catch and
 * log whatever they throw.
 */
public interface TelemetrySink extends AutoCloseable {

    void addScalar(String tag, double value, long step);

    void addHistogram(String tag, Histogram histogram, long step);

    default void flush() {
    }

    @Override
    default void close() {
        flush();
    }

    /**
     * Sink that drops everything.
     */
    static TelemetrySink noop() {
        return new TelemetrySink() {
            @Override
            public void addScalar(String tag, double value, long step) {
            }

            @Override
            public void addHistogram(String tag, Histogram histogram, long step) {
            }
        };
    }
}
