package com.phillippitts.selfspy.service.buffer;

/**
 * Callback the buffer uses to ask for a flush. Implementations must not block the producer.
 */
@FunctionalInterface
public interface FlushTrigger {

    enum Reason { THRESHOLD, SOFT_CAP }

    void requestFlush(Reason reason);

    static FlushTrigger none() {
        return reason -> { };
    }
}
