package acagent.rl;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Telemetry file layout under the configured log directory.
 *
 * <pre>
 * logs/
 * ├── scalars.csv       (tag, step, value)
 * ├── histograms.csv    (tag, step, count, min, max, bucket edges and counts)
 * └── rollouts.csv      (update, transitions, advantage mean/std, losses)
 * </pre>
 */
public final class AgentLogPaths {

    public static final String SCALARS_FILE = "scalars.csv";
    public static final String HISTOGRAMS_FILE = "histograms.csv";
    public static final String ROLLOUTS_FILE = "rollouts.csv";

    private final Path logDir;

    public AgentLogPaths(String logDir) {
        this(Paths.get(logDir));
    }

    public AgentLogPaths(Path logDir) {
        if (logDir == null) {
            throw new IllegalArgumentException("logDir must not be null");
        }
        this.logDir = logDir;
    }

    public Path logDir() {
        return logDir;
    }

    public Path scalarsPath() {
        return logDir.resolve(SCALARS_FILE);
    }

    public Path histogramsPath() {
        return logDir.resolve(HISTOGRAMS_FILE);
    }

    public Path rolloutsPath() {
        return logDir.resolve(ROLLOUTS_FILE);
    }
}
