package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class EpisodeTrackerTest {

    @Test
    void accumulatorsExistForEveryWorkerBeforeFirstStep() {
        EpisodeTracker tracker = new EpisodeTracker(3, 10, new RecordingSink());

        for (int i = 0; i < 3; i++) {
            assertTrue(tracker.episode(i).isEmpty());
            assertEquals(0, tracker.episode(i).getEpisodeIndex());
        }
        assertThrows(IllegalArgumentException.class, () -> tracker.episode(3));
    }

    @Test
    void terminalClearsEpisodeAndAdvancesIndexByOne() {
        EpisodeTracker tracker = new EpisodeTracker(2, 10, new RecordingSink());
        tracker.record(new double[]{1, 0}, new double[]{0.5, 1.0}, new boolean[]{false, false});
        tracker.record(new double[]{0, 1}, new double[]{1.5, 2.0}, new boolean[]{false, false});

        long before = tracker.episode(1).getEpisodeIndex();
        List<EpisodeSummary> finished = tracker.record(new double[]{1, 1}, new double[]{2.0, 3.0},
                new boolean[]{false, true});

        assertTrue(tracker.episode(1).isEmpty());
        assertEquals(before + 1, tracker.episode(1).getEpisodeIndex());
        assertEquals(3, tracker.episode(0).length());
        assertEquals(0, tracker.episode(0).getEpisodeIndex());

        assertEquals(1, finished.size());
        EpisodeSummary summary = finished.get(0);
        assertEquals(1, summary.workerId);
        assertEquals(0, summary.episodeIndex);
        assertEquals(6.0, summary.totalReward, 1e-12);
        assertEquals(3, summary.length);
        assertArrayEquals(new double[]{0, 1, 1}, summary.actions, 0.0);
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, summary.rewards, 0.0);
        assertEquals(3, tracker.getRecordStep());
    }

    @Test
    void episodeSummaryIsEmittedUnderWorkerTagsAtEpisodeIndex() {
        RecordingSink sink = new RecordingSink();
        EpisodeTracker tracker = new EpisodeTracker(2, 10, sink);

        tracker.record(new double[]{0, 0}, new double[]{1, 4}, new boolean[]{true, false});
        tracker.record(new double[]{1, 0}, new double[]{2, 4}, new boolean[]{true, true});

        List<RecordingSink.Entry> sums0 = sink.withTag(EpisodeTracker.TAG_REWARD_SUM + "0");
        assertEquals(2, sums0.size());
        assertEquals(1.0, sums0.get(0).value, 1e-12);
        assertEquals(0, sums0.get(0).step);
        assertEquals(2.0, sums0.get(1).value, 1e-12);
        assertEquals(1, sums0.get(1).step);

        RecordingSink.Entry sum1 = sink.byTag().get(EpisodeTracker.TAG_REWARD_SUM + "1");
        assertEquals(8.0, sum1.value, 1e-12);
        assertEquals(0, sum1.step);

        RecordingSink.Entry actions = sink.byTag().get(EpisodeTracker.TAG_ACTIONS + "1");
        assertNotNull(actions.histogram);
        assertEquals(2, actions.histogram.getCount());
        RecordingSink.Entry rewards = sink.byTag().get(EpisodeTracker.TAG_REWARD_DIST + "1");
        assertEquals(4.0, rewards.histogram.getMean(), 1e-12);
        assertEquals(2.0, sink.byTag().get(EpisodeTracker.TAG_LENGTH + "1").value, 0.0);
    }

    @Test
    void smoothedRewardWindowNeverExceedsCapacityAndEvictsOldestFirst() {
        EpisodeTracker tracker = new EpisodeTracker(1, 4, new RecordingSink());
        for (int step = 0; step < 50; step++) {
            tracker.record(new double[]{0}, new double[]{step}, new boolean[]{step % 7 == 6});
            assertTrue(tracker.smoothedRewards(0).size() <= 4);
        }
        assertArrayEquals(new double[]{46, 47, 48, 49}, tracker.smoothedRewards(0).toArray(), 0.0);
    }

    @Test
    void failingSinkDoesNotInterruptBookkeeping() {
        RecordingSink sink = new RecordingSink();
        sink.failing = true;
        EpisodeTracker tracker = new EpisodeTracker(1, 10, sink);

        List<EpisodeSummary> finished = tracker.record(new double[]{0}, new double[]{1.0}, new boolean[]{true});

        assertEquals(1, finished.size());
        assertEquals(1, tracker.episode(0).getEpisodeIndex());
        assertTrue(tracker.getTelemetryFailures() > 0);
    }

    @Test
    void rejectsShapeMismatchAndNonFiniteRewardWithoutMutating() {
        EpisodeTracker tracker = new EpisodeTracker(2, 10, new RecordingSink());

        assertThrows(IllegalArgumentException.class,
                () -> tracker.record(new double[]{0}, new double[]{1, 1}, new boolean[]{false, false}));
        assertThrows(IllegalArgumentException.class,
                () -> tracker.record(new double[]{0, 0}, new double[]{1, Double.NaN}, new boolean[]{false, false}));

        assertTrue(tracker.episode(0).isEmpty());
        assertFalse(tracker.smoothedRewards(0).size() > 0);
        assertEquals(0, tracker.getRecordStep());
    }

    @Test
    void outlierEpisodeStillResetsAndEmitsBoundedHistogram() {
        RecordingSink sink = new RecordingSink();
        EpisodeTracker tracker = new EpisodeTracker(1, 10, sink);
        double[] rewards = {0, 1e-12, 2e-12, 3e-12, 1e6};

        for (int t = 0; t < rewards.length; t++) {
            tracker.record(new double[]{0}, new double[]{rewards[t]}, new boolean[]{t == rewards.length - 1});
        }

        assertTrue(tracker.episode(0).isEmpty());
        assertEquals(1, tracker.episode(0).getEpisodeIndex());
        Histogram dist = sink.byTag().get(EpisodeTracker.TAG_REWARD_DIST + "0").histogram;
        assertEquals(Histogram.MAX_AUTO_BINS, dist.numBins());
        assertEquals(5, dist.getCount());
        assertEquals(0, tracker.getTelemetryFailures());
    }

    @Test
    void histogramFailureIsCountedAndEpisodeStillResets() {
        RecordingSink sink = new RecordingSink();
        EpisodeTracker tracker = new EpisodeTracker(2, 10, sink);

        // an infinite action cannot be binned
        List<EpisodeSummary> finished = tracker.record(new double[]{Double.POSITIVE_INFINITY, 1},
                new double[]{1.0, 2.0}, new boolean[]{true, true});

        assertEquals(2, finished.size());
        assertTrue(tracker.episode(0).isEmpty());
        assertEquals(1, tracker.episode(0).getEpisodeIndex());
        assertEquals(1, tracker.episode(1).getEpisodeIndex());
        assertEquals(1, tracker.getTelemetryFailures());
        assertEquals(1.0, sink.byTag().get(EpisodeTracker.TAG_REWARD_SUM + "0").value, 0.0);
        assertNotNull(sink.byTag().get(EpisodeTracker.TAG_REWARD_DIST + "0"));
        assertNotNull(sink.byTag().get(EpisodeTracker.TAG_ACTIONS + "1"));
    }
}
