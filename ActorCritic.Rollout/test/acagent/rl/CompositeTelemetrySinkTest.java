package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CompositeTelemetrySinkTest {

    @Test
    void failingSinkDoesNotStarveTheOthers() {
        RecordingSink broken = new RecordingSink();
        broken.failing = true;
        RecordingSink healthy = new RecordingSink();
        CompositeTelemetrySink sink = new CompositeTelemetrySink(broken, healthy);

        sink.addScalar("train/loss", 1.0, 2);
        sink.addHistogram("data/episode_action_0", Histogram.auto(new double[]{0, 1}), 2);
        sink.close();

        assertEquals(2, healthy.entries.size());
        assertEquals(2, healthy.entries.get(0).step);
        assertTrue(broken.closed);
        assertTrue(healthy.closed);
    }

    @Test
    void rejectsNullSinks() {
        assertThrows(IllegalArgumentException.class, () -> new CompositeTelemetrySink(new RecordingSink(), null));
    }
}
