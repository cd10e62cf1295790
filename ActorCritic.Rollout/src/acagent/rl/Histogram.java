package acagent.rl;

import java.util.Arrays;

/**
 * Equal-width histogram. {@link #auto(double[])} chooses the bin width the way
 * numpy's {@code bins='auto'} does: the smaller of the Sturges and
 * Freedman-Diaconis widths, falling back to Sturges when the interquartile
 * range is zero. The automatic bin count is capped at {@link #MAX_AUTO_BINS}.
 */
public final class Histogram {

    public static final int MAX_AUTO_BINS = 512;

    private final double min;
    private final double max;
    private final long count;
    private final double sum;
    private final double sumSquares;
    private final double[] edges;
    private final long[] counts;

    private Histogram(double min, double max, long count, double sum, double sumSquares, double[] edges, long[] counts) {
        this.min = min;
        this.max = max;
        this.count = count;
        this.sum = sum;
        this.sumSquares = sumSquares;
        this.edges = edges;
        this.counts = counts;
    }

    public static Histogram auto(double[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("cannot build a histogram of no data");
        }
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double lo = sorted[0];
        double hi = sorted[sorted.length - 1];
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            throw new IllegalArgumentException("histogram data must be finite");
        }
        int bins = autoBinCount(sorted);
        return build(sorted, bins);
    }

    public static Histogram withBins(double[] data, int bins) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("cannot build a histogram of no data");
        }
        if (bins <= 0) {
            throw new IllegalArgumentException("bins must be positive: " + bins);
        }
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        return build(sorted, bins);
    }

    static int autoBinCount(double[] sorted) {
        int n = sorted.length;
        double range = sorted[n - 1] - sorted[0];
        if (range == 0.0) {
            return 1;
        }
        double sturgesWidth = range / (log2(n) + 1.0);
        double iqr = percentile(sorted, 75.0) - percentile(sorted, 25.0);
        double fdWidth = 2.0 * iqr * Math.pow(n, -1.0 / 3.0);
        double width = fdWidth > 0.0 ? Math.min(fdWidth, sturgesWidth) : sturgesWidth;
        double bins = Math.ceil(range / width);
        // a narrow IQR with one far outlier would otherwise ask for billions of bins
        if (!(bins < MAX_AUTO_BINS)) {
            return MAX_AUTO_BINS;
        }
        return Math.max(1, (int) bins);
    }

    /**
     * Linear interpolation between closest ranks, numpy's default.
     */
    static double percentile(double[] sorted, double p) {
        double rank = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double frac = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }

    private static Histogram build(double[] sorted, int bins) {
        double lo = sorted[0];
        double hi = sorted[sorted.length - 1];
        if (lo == hi) {
            lo -= 0.5;
            hi += 0.5;
        }
        double[] edges = new double[bins + 1];
        double width = (hi - lo) / bins;
        for (int b = 0; b <= bins; b++) {
            edges[b] = lo + b * width;
        }
        edges[bins] = hi;
        long[] counts = new long[bins];
        double sum = 0.0;
        double sumSquares = 0.0;
        for (double v : sorted) {
            int b = (int) ((v - lo) / width);
            // last bin is closed on the right
            if (b >= bins) {
                b = bins - 1;
            }
            counts[b]++;
            sum += v;
            sumSquares += v * v;
        }
        return new Histogram(sorted[0], sorted[sorted.length - 1], sorted.length, sum, sumSquares, edges, counts);
    }

    private static double log2(int n) {
        return Math.log(n) / Math.log(2.0);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    public double getSumSquares() {
        return sumSquares;
    }

    public double getMean() {
        return sum / count;
    }

    /**
     * Population standard deviation.
     */
    public double getStd() {
        double mean = getMean();
        return Math.sqrt(Math.max(0.0, sumSquares / count - mean * mean));
    }

    public int numBins() {
        return counts.length;
    }

    public double[] getEdges() {
        return edges.clone();
    }

    public long[] getCounts() {
        return counts.clone();
    }
}
