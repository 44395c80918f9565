package com.phillippitts.selfspy.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable contents of the event buffer at the moment it was drained.
 *
 * @param itemCount buffered item count that was accounted for these records
 */
public record Snapshot(List<WindowRecord> windows,
                       List<KeystrokeBatch> keystrokes,
                       List<PointerEvent> pointerEvents,
                       int itemCount) {

    private static final Snapshot EMPTY = new Snapshot(List.of(), List.of(), List.of(), 0);

    public Snapshot {
        windows = List.copyOf(windows);
        keystrokes = List.copyOf(keystrokes);
        pointerEvents = List.copyOf(pointerEvents);
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return windows.isEmpty() && keystrokes.isEmpty() && pointerEvents.isEmpty();
    }

    /** Total number of records this snapshot will write. */
    public int recordCount() {
        return windows.size() + keystrokes.size() + pointerEvents.size();
    }

    /** Earliest timestamp among all records, for audit logging of discarded batches. */
    public Optional<Instant> earliest() {
        return timestamps().min(Instant::compareTo);
    }

    /** Latest timestamp among all records. */
    public Optional<Instant> latest() {
        return Stream.concat(timestamps(), windows.stream().map(WindowRecord::lastSeen))
                .max(Instant::compareTo);
    }

    private Stream<Instant> timestamps() {
        return Stream.of(
                windows.stream().map(WindowRecord::firstSeen),
                keystrokes.stream().map(KeystrokeBatch::recordedAt),
                pointerEvents.stream().map(PointerEvent::timestamp)
        ).flatMap(s -> s);
    }
}
