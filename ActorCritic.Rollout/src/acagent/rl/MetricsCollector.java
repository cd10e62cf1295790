package acagent.rl;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Prometheus-compatible telemetry sink. Keeps the latest value of every scalar
 * tag and the latest histogram of every histogram tag, plus rollout counters,
 * and serves them on {@code /metrics} ({@code /health} answers OK).
 */
public class MetricsCollector implements TelemetrySink {

    private static final Logger logger = Logger.getLogger(MetricsCollector.class);

    static final String PREFIX = "ac_";

    private final AtomicLong episodesCompleted = new AtomicLong(0);
    private final AtomicLong transitionsCollected = new AtomicLong(0);
    private final AtomicLong rolloutsCompleted = new AtomicLong(0);
    private final AtomicLong errorsTotal = new AtomicLong(0);
    private final AtomicLong predictCount = new AtomicLong(0);
    private final AtomicLong predictSumNanos = new AtomicLong(0);
    private final AtomicLong predictMaxNanos = new AtomicLong(0);

    // Latest scalar per tag, stored as raw double bits
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    private HttpServer server;
    private ExecutorService httpExecutor;

    @Override
    public void addScalar(String tag, double value, long step) {
        gauges.computeIfAbsent(tag, k -> new AtomicLong(Double.doubleToRawLongBits(0.0)))
                .set(Double.doubleToRawLongBits(value));
    }

    @Override
    public void addHistogram(String tag, Histogram histogram, long step) {
        histograms.put(tag, histogram);
    }

    public void recordEpisodesCompleted(int count) {
        if (count > 0) {
            episodesCompleted.addAndGet(count);
        }
    }

    public void recordTransitions(int count) {
        if (count > 0) {
            transitionsCollected.addAndGet(count);
        }
    }

    public void recordRolloutCompleted() {
        rolloutsCompleted.incrementAndGet();
    }

    public void recordError() {
        errorsTotal.incrementAndGet();
    }

    public void recordPredictLatencyNanos(long nanos) {
        if (nanos < 0) {
            return;
        }
        predictCount.incrementAndGet();
        predictSumNanos.addAndGet(nanos);
        long prev;
        do {
            prev = predictMaxNanos.get();
            if (nanos <= prev) {
                break;
            }
        } while (!predictMaxNanos.compareAndSet(prev, nanos));
    }

    public long getEpisodesCompleted() {
        return episodesCompleted.get();
    }

    public long getTransitionsCollected() {
        return transitionsCollected.get();
    }

    public long getRolloutsCompleted() {
        return rolloutsCompleted.get();
    }

    /**
     * Latest value recorded for the tag, or NaN if none.
     */
    public double getGauge(String tag) {
        AtomicLong bits = gauges.get(tag);
        return bits == null ? Double.NaN : Double.longBitsToDouble(bits.get());
    }

    /**
     * Start the metrics HTTP server on the given port (0 picks a free port).
     *
     * @return the bound port
     */
    public int startMetricsServer(int port) throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/health", new HealthHandler());
        httpExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "METRICS-HTTP");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(httpExecutor);
        server.start();
        int bound = server.getAddress().getPort();
        logger.info("Metrics server started on port " + bound);
        return bound;
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (httpExecutor != null) {
            httpExecutor.shutdownNow();
            httpExecutor = null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    static String metricName(String tag) {
        StringBuilder sb = new StringBuilder(PREFIX);
        for (char c : tag.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) && c < 128 ? c : '_');
        }
        return sb.toString();
    }

    /**
     * Prometheus text exposition of everything recorded so far.
     */
    public String generatePrometheusMetrics() {
        StringBuilder sb = new StringBuilder();

        counter(sb, "ac_episodes_completed_total", "Total number of episodes completed across workers",
                episodesCompleted.get());
        counter(sb, "ac_transitions_total", "Total number of worker transitions stored", transitionsCollected.get());
        counter(sb, "ac_rollouts_total", "Total number of rollouts aggregated", rolloutsCompleted.get());
        counter(sb, "ac_errors_total", "Total number of errors", errorsTotal.get());

        double predictAvgMs = 0.0;
        long cnt = predictCount.get();
        if (cnt > 0) {
            predictAvgMs = predictSumNanos.get() / (double) cnt / 1e6;
        }
        sb.append("# HELP ac_predict_latency_avg_ms Average predict latency (ms)\n");
        sb.append("# TYPE ac_predict_latency_avg_ms gauge\n");
        sb.append("ac_predict_latency_avg_ms ").append(format(predictAvgMs)).append("\n");
        sb.append("# HELP ac_predict_latency_max_ms Max predict latency observed (ms)\n");
        sb.append("# TYPE ac_predict_latency_max_ms gauge\n");
        sb.append("ac_predict_latency_max_ms ").append(format(predictMaxNanos.get() / 1e6)).append("\n");

        for (Map.Entry<String, AtomicLong> e : new TreeMap<>(gauges).entrySet()) {
            String name = metricName(e.getKey());
            sb.append("# TYPE ").append(name).append(" gauge\n");
            sb.append(name).append(' ').append(format(Double.longBitsToDouble(e.getValue().get()))).append("\n");
        }

        for (Map.Entry<String, Histogram> e : new TreeMap<>(histograms).entrySet()) {
            String name = metricName(e.getKey());
            Histogram h = e.getValue();
            double[] edges = h.getEdges();
            long[] counts = h.getCounts();
            sb.append("# TYPE ").append(name).append(" histogram\n");
            long cumulative = 0;
            for (int b = 0; b < counts.length; b++) {
                cumulative += counts[b];
                sb.append(name).append("_bucket{le=\"").append(format(edges[b + 1])).append("\"} ")
                        .append(cumulative).append("\n");
            }
            sb.append(name).append("_bucket{le=\"+Inf\"} ").append(h.getCount()).append("\n");
            sb.append(name).append("_sum ").append(format(h.getSum())).append("\n");
            sb.append(name).append("_count ").append(h.getCount()).append("\n");
        }
        return sb.toString();
    }

    private static void counter(StringBuilder sb, String name, String help, long value) {
        sb.append("# HELP ").append(name).append(' ').append(help).append("\n");
        sb.append("# TYPE ").append(name).append(" counter\n");
        sb.append(name).append(' ').append(value).append("\n");
    }

    private static String format(double v) {
        if (Double.isNaN(v)) {
            return "NaN";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "+Inf" : "-Inf";
        }
        return String.format(Locale.ROOT, "%.6f", v);
    }

    private class MetricsHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if ("GET".equals(exchange.getRequestMethod())) {
                byte[] body = generatePrometheusMetrics().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            } else {
                exchange.sendResponseHeaders(405, -1);
                exchange.close();
            }
        }
    }

    private static class HealthHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            byte[] body = "OK".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }
}
