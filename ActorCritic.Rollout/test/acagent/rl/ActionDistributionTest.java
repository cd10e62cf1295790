package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;

class ActionDistributionTest {

    @Test
    void categoricalNormalizesLogits() {
        CategoricalDistribution dist = new CategoricalDistribution(
                new double[][]{{0.0, Math.log(3.0)}, {1000.0, 1000.0}}, new Random(1));

        assertArrayEquals(new double[]{0.25, 0.75}, dist.probabilities(0), 1e-12);
        assertArrayEquals(new double[]{0.5, 0.5}, dist.probabilities(1), 1e-12);
        assertArrayEquals(new double[]{Math.log(0.75), Math.log(0.5)}, dist.logProb(new double[]{1, 0}), 1e-12);
        double h0 = -(0.25 * Math.log(0.25) + 0.75 * Math.log(0.75));
        assertArrayEquals(new double[]{h0, Math.log(2.0)}, dist.entropy(), 1e-12);
    }

    @Test
    void categoricalSamplingFollowsProbabilities() {
        double[][] logits = new double[1][];
        logits[0] = new double[]{0.0, Math.log(3.0)};
        CategoricalDistribution dist = new CategoricalDistribution(logits, new Random(11));

        int ones = 0;
        int draws = 20000;
        for (int k = 0; k < draws; k++) {
            double a = dist.sample()[0];
            if (a == 1.0) {
                ones++;
            }
        }
        assertEquals(0.75, ones / (double) draws, 0.02);
    }

    @Test
    void categoricalRejectsInvalidActions() {
        CategoricalDistribution dist = new CategoricalDistribution(new double[][]{{0, 0, 0}}, new Random(1));

        assertThrows(IllegalArgumentException.class, () -> dist.logProb(new double[]{1.5}));
        assertThrows(IllegalArgumentException.class, () -> dist.logProb(new double[]{3}));
        assertThrows(IllegalArgumentException.class, () -> dist.logProb(new double[]{0, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> new CategoricalDistribution(new double[][]{{0, 0}, {0}}, new Random(1)));
    }

    @Test
    void gaussianDensityAndEntropy() {
        GaussianDistribution dist = new GaussianDistribution(new double[]{0.0, 1.0}, new double[]{1.0, 2.0},
                new Random(5));
        double logSqrt2Pi = 0.5 * Math.log(2.0 * Math.PI);

        double[] logp = dist.logProb(new double[]{0.0, 3.0});

        assertEquals(-logSqrt2Pi, logp[0], 1e-12);
        assertEquals(-0.5 - Math.log(2.0) - logSqrt2Pi, logp[1], 1e-12);
        assertEquals(0.5 + logSqrt2Pi, dist.entropy()[0], 1e-12);
        assertEquals(0.5 + logSqrt2Pi + Math.log(2.0), dist.entropy()[1], 1e-12);
        assertEquals(2, dist.sample().length);
    }

    @Test
    void gaussianRejectsNonPositiveStd() {
        assertThrows(IllegalArgumentException.class,
                () -> new GaussianDistribution(new double[]{0}, new double[]{0}, new Random(1)));
    }
}
