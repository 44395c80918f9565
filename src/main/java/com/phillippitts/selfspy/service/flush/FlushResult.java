package com.phillippitts.selfspy.service.flush;

/**
 * Outcome of one flush cycle that did not throw.
 *
 * @param records rows written; zero unless {@code PERSISTED}
 */
public record FlushResult(Outcome outcome, int records) {

    public enum Outcome {
        /** Nothing was buffered. */
        EMPTY,
        /** The snapshot was committed. */
        PERSISTED,
        /** The store was unreachable; nothing was drained. */
        STORE_UNAVAILABLE
    }

    static final FlushResult EMPTY = new FlushResult(Outcome.EMPTY, 0);
    static final FlushResult STORE_UNAVAILABLE = new FlushResult(Outcome.STORE_UNAVAILABLE, 0);

    static FlushResult persisted(int records) {
        return new FlushResult(Outcome.PERSISTED, records);
    }
}
