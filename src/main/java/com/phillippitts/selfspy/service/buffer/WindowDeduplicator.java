package com.phillippitts.selfspy.service.buffer;

import com.phillippitts.selfspy.domain.WindowEvent;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.domain.WindowRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses repeated observations of the same foreground window into one open record
 * and accounts foreground time per window.
 *
 * <p>Per window key a record moves Unseen, Open, Closed. An observation without an open
 * match creates one; a match updates last-seen in place. {@link #closeAll()} emits every
 * open record and leaves nothing open.
 *
 * <p>A successor starts with no open records but remembers the window that was current. The
 * first record it opens for that window is marked continued: focus did not move, the record
 * only exists because the previous cycle was drained.
 *
 * <p>Foreground time: the window observed most recently is current. When focus moves
 * from A to B at {@code t}, A's last-seen advances to {@code t} and A accrues the time
 * since it was last seen. A current window re-observed accrues the gap as well.
 *
 * <p>Not thread-safe. {@link EventBuffer} confines each instance to its lock.
 */
public class WindowDeduplicator {

    /** What an observation did to the open set. */
    public enum Observation {
        /** A new open record was created and became current. */
        CREATED,
        /** A new open record was created for the window that was already current before the drain. */
        RESUMED,
        /** An existing open record became current. */
        SWITCHED,
        /** The current window was seen again. */
        REPEATED
    }

    private final Map<WindowKey, OpenWindow> open = new LinkedHashMap<>();
    private WindowKey current;
    private Instant currentLastSeen;

    public WindowDeduplicator() {
    }

    private WindowDeduplicator(WindowKey current, Instant currentLastSeen) {
        this.current = current;
        this.currentLastSeen = currentLastSeen;
    }

    /**
     * Empty deduplicator that still knows which window was current, so the next
     * observation of it accrues the time since its last sighting.
     */
    public WindowDeduplicator successor() {
        return new WindowDeduplicator(current, currentLastSeen);
    }

    public Observation observe(WindowEvent event) {
        WindowKey key = event.key();
        Instant at = event.timestamp();

        OpenWindow previous = current == null ? null : open.get(current);
        if (previous != null) {
            previous.advanceTo(at);
        }

        OpenWindow target = open.get(key);
        Observation result;
        if (target == null) {
            target = new OpenWindow(key, event);
            // carried over from the previous drain cycle
            if (key.equals(current) && previous == null && currentLastSeen != null) {
                target.activeMillis = positiveMillis(currentLastSeen, at);
                target.continued = true;
                result = Observation.RESUMED;
            } else {
                result = Observation.CREATED;
            }
            open.put(key, target);
        } else {
            target.update(event);
            result = key.equals(current) ? Observation.REPEATED : Observation.SWITCHED;
        }
        current = key;
        currentLastSeen = target.lastSeen;
        return result;
    }

    /**
     * Focus moved to a window that is not tracked: the current window stops accruing at {@code at}
     * and nothing is current afterwards.
     */
    public void release(Instant at) {
        OpenWindow previous = current == null ? null : open.get(current);
        if (previous != null) {
            previous.advanceTo(at);
        }
        current = null;
        currentLastSeen = null;
    }

    public int openCount() {
        return open.size();
    }

    public WindowKey current() {
        return current;
    }

    /**
     * Closes every open record, in first-observed order.
     */
    public List<WindowRecord> closeAll() {
        List<WindowRecord> closed = new ArrayList<>(open.size());
        for (OpenWindow w : open.values()) {
            closed.add(w.toRecord());
        }
        open.clear();
        return closed;
    }

    private static long positiveMillis(Instant from, Instant to) {
        return Math.max(0, Duration.between(from, to).toMillis());
    }

    private static final class OpenWindow {
        private final WindowKey key;
        private final Instant firstSeen;
        private String bundleId;
        private int x;
        private int y;
        private int width;
        private int height;
        private Instant lastSeen;
        private long activeMillis;
        private boolean continued;

        OpenWindow(WindowKey key, WindowEvent event) {
            this.key = key;
            this.firstSeen = event.timestamp();
            this.lastSeen = event.timestamp();
            applyGeometry(event);
        }

        void update(WindowEvent event) {
            if (event.timestamp().isAfter(lastSeen)) {
                lastSeen = event.timestamp();
            }
            applyGeometry(event);
        }

        void advanceTo(Instant at) {
            if (at.isAfter(lastSeen)) {
                activeMillis += positiveMillis(lastSeen, at);
                lastSeen = at;
            }
        }

        private void applyGeometry(WindowEvent event) {
            bundleId = event.bundleId();
            x = event.x();
            y = event.y();
            width = event.width();
            height = event.height();
        }

        WindowRecord toRecord() {
            return new WindowRecord(key, bundleId, x, y, width, height, firstSeen, lastSeen, activeMillis,
                    continued);
        }
    }
}
