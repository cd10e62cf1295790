package acagent.rl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Fans telemetry out to several sinks; a failing sink does not keep the others
 * from receiving the entry.
 */
public class CompositeTelemetrySink implements TelemetrySink {

    private static final Logger logger = Logger.getLogger(CompositeTelemetrySink.class);

    private final List<TelemetrySink> sinks;

    public CompositeTelemetrySink(TelemetrySink... sinks) {
        this(Arrays.asList(sinks));
    }

    public CompositeTelemetrySink(List<TelemetrySink> sinks) {
        for (TelemetrySink s : sinks) {
            if (s == null) {
                throw new IllegalArgumentException("sinks must not contain null");
            }
        }
        this.sinks = new ArrayList<>(sinks);
    }

    @Override
    public void addScalar(String tag, double value, long step) {
        for (TelemetrySink s : sinks) {
            try {
                s.addScalar(tag, value, step);
            } catch (RuntimeException e) {
                logger.warn(s.getClass().getSimpleName() + " rejected scalar " + tag + ": " + e.getMessage());
            }
        }
    }

    @Override
    public void addHistogram(String tag, Histogram histogram, long step) {
        for (TelemetrySink s : sinks) {
            try {
                s.addHistogram(tag, histogram, step);
            } catch (RuntimeException e) {
                logger.warn(s.getClass().getSimpleName() + " rejected histogram " + tag + ": " + e.getMessage());
            }
        }
    }

    @Override
    public void flush() {
        for (TelemetrySink s : sinks) {
            try {
                s.flush();
            } catch (RuntimeException e) {
                logger.warn("Flush failed for " + s.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        for (TelemetrySink s : sinks) {
            try {
                s.close();
            } catch (RuntimeException e) {
                logger.warn("Close failed for " + s.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }
}
