package com.companya.ledgersync.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Suppresses near-duplicate change events for the same record inside a sliding wall-clock window.
 * <p>
 * Eviction is lazy: every {@link #shouldSkip} call first sweeps expired entries. Entries are kept in
 * last-seen order so the sweep stops at the first live entry. A heuristic, not an idempotence
 * guarantee: the ledger API must tolerate the duplicates that slip through.
 */
public class DeduplicationWindow {

    private final Clock clock;
    private final long windowMs;
    private final long toleranceMs;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

    public DeduplicationWindow(Clock clock, Duration window, Duration tolerance) {
        this.clock = clock;
        this.windowMs = window.toMillis();
        this.toleranceMs = tolerance.toMillis();
    }

    /**
     * @return {@code true} when an entry seen within the window has a modification time closer than
     * the tolerance; the entry is left untouched. Otherwise records the candidate and returns {@code false}.
     */
    public synchronized boolean shouldSkip(String recordId, Instant modifiedAt) {
        long now = clock.millis();
        evictExpired(now);

        Entry existing = entries.get(recordId);
        if (existing != null
                && Math.abs(Duration.between(existing.lastModifiedAt(), modifiedAt).toMillis()) < toleranceMs) {
            return true;
        }
        entries.remove(recordId);
        entries.put(recordId, new Entry(now, modifiedAt));
        return false;
    }

    private void evictExpired(long now) {
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue().lastSeenWallClock() <= windowMs) {
                return;
            }
            it.remove();
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    record Entry(long lastSeenWallClock, Instant lastModifiedAt) {
    }
}
