package acagent.rl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test sink keeping every entry in memory, optionally failing on demand.
 */
class RecordingSink implements TelemetrySink {

    static class Entry {
        final String tag;
        final double value;
        final Histogram histogram;
        final long step;

        Entry(String tag, double value, Histogram histogram, long step) {
            this.tag = tag;
            this.value = value;
            this.histogram = histogram;
            this.step = step;
        }
    }

    final List<Entry> entries = new ArrayList<>();
    boolean failing;
    boolean closed;

    @Override
    public void addScalar(String tag, double value, long step) {
        if (failing) {
            throw new IllegalStateException("sink offline");
        }
        entries.add(new Entry(tag, value, null, step));
    }

    @Override
    public void addHistogram(String tag, Histogram histogram, long step) {
        if (failing) {
            throw new IllegalStateException("sink offline");
        }
        entries.add(new Entry(tag, Double.NaN, histogram, step));
    }

    @Override
    public void close() {
        closed = true;
    }

    Map<String, Entry> byTag() {
        Map<String, Entry> out = new LinkedHashMap<>();
        for (Entry e : entries) {
            out.put(e.tag, e);
        }
        return out;
    }

    List<Entry> withTag(String tag) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.tag.equals(tag)) {
                out.add(e);
            }
        }
        return out;
    }
}
