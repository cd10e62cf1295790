package acagent.rl;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends telemetry to CSV files under the log directory. Write failures are
 * logged and counted, never thrown.
 */
public class CsvTelemetrySink implements TelemetrySink {

    private static final Logger logger = LoggerFactory.getLogger(CsvTelemetrySink.class);

    static final String SCALAR_HEADER = "timestamp,tag,step,value\n";
    static final String HISTOGRAM_HEADER = "timestamp,tag,step,count,min,max,mean,std,edges,counts\n";

    private final AgentLogPaths paths;
    private final ReentrantLock fileLock = new ReentrantLock();
    private final AtomicLong writeFailures = new AtomicLong(0);

    public CsvTelemetrySink(AgentLogPaths paths, boolean clearExisting) {
        this.paths = paths;
        if (clearExisting) {
            deleteOldLogs();
        }
        ensureHeader(paths.scalarsPath(), SCALAR_HEADER);
        ensureHeader(paths.histogramsPath(), HISTOGRAM_HEADER);
    }

    public CsvTelemetrySink(AgentConfig config) {
        this(new AgentLogPaths(config.getLogDir()), config.isClearLogDir());
    }

    private void deleteOldLogs() {
        Path dir = paths.logDir();
        if (!Files.isDirectory(dir)) {
            return;
        }
        logger.info("Deleting old telemetry logs in {}", dir);
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete old log file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.error("Failed to clear log directory " + dir, e);
        }
    }

    private void ensureHeader(Path path, String header) {
        fileLock.lock();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            if (!Files.exists(path)) {
                Files.write(path, header.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            writeFailures.incrementAndGet();
            logger.error("Failed to initialize telemetry file " + path, e);
        } finally {
            fileLock.unlock();
        }
    }

    @Override
    public void addScalar(String tag, double value, long step) {
        String line = String.format(Locale.ROOT, "%d,%s,%d,%.6f\n",
                System.currentTimeMillis(), escape(tag), step, value);
        append(paths.scalarsPath(), line);
    }

    @Override
    public void addHistogram(String tag, Histogram histogram, long step) {
        StringBuilder edges = new StringBuilder();
        for (double e : histogram.getEdges()) {
            if (edges.length() > 0) {
                edges.append(';');
            }
            edges.append(String.format(Locale.ROOT, "%.6f", e));
        }
        StringBuilder counts = new StringBuilder();
        for (long c : histogram.getCounts()) {
            if (counts.length() > 0) {
                counts.append(';');
            }
            counts.append(c);
        }
        String line = String.format(Locale.ROOT, "%d,%s,%d,%d,%.6f,%.6f,%.6f,%.6f,%s,%s\n",
                System.currentTimeMillis(), escape(tag), step, histogram.getCount(),
                histogram.getMin(), histogram.getMax(), histogram.getMean(), histogram.getStd(),
                edges, counts);
        append(paths.histogramsPath(), line);
    }

    private void append(Path path, String line) {
        fileLock.lock();
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(line);
        } catch (IOException e) {
            writeFailures.incrementAndGet();
            logger.error("Failed to write telemetry entry to " + path, e);
        } finally {
            fileLock.unlock();
        }
    }

    private static String escape(String tag) {
        if (tag.indexOf(',') < 0 && tag.indexOf('"') < 0) {
            return tag;
        }
        return "\"" + tag.replace("\"", "\"\"") + "\"";
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    public AgentLogPaths getPaths() {
        return paths;
    }
}
