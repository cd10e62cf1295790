package acagent.rl;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SmoothedWindowTest {

    @Test
    void evictsOldestOnceFull() {
        SmoothedWindow window = new SmoothedWindow(3);
        for (int i = 1; i <= 5; i++) {
            window.add(i);
        }

        assertEquals(3, window.size());
        assertEquals(3.0, window.oldest(), 0.0);
        assertArrayEquals(new double[]{3, 4, 5}, window.toArray(), 0.0);
        assertEquals(4.0, window.mean(), 1e-12);
    }

    @Test
    void emptyWindowHasZeroMean() {
        SmoothedWindow window = new SmoothedWindow(2);

        assertTrue(window.isEmpty());
        assertEquals(0.0, window.mean(), 0.0);
        assertThrows(IllegalStateException.class, window::oldest);
        assertThrows(IllegalArgumentException.class, () -> new SmoothedWindow(0));
    }

    @Test
    void meanIsUnaffectedByEvictedMagnitudes() {
        SmoothedWindow window = new SmoothedWindow(2);
        window.add(1.0);
        window.add(1e17);
        window.add(3.0);
        window.add(5.0);

        assertEquals(4.0, window.mean(), 0.0);
    }
}
