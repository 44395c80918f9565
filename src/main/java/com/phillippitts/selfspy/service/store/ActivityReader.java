package com.phillippitts.selfspy.service.store;

import com.phillippitts.selfspy.exception.StoreUnavailableException;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the activity store, used by stats and export.
 *
 * <p>All ranges are inclusive of both ends. Methods throw {@link StoreUnavailableException}
 * when the store cannot be reached.
 */
public interface ActivityReader {

    ActivityCounts counts(Instant from, Instant to);

    /** Sessions whose lifetime intersects the range; a null end means still running. */
    List<SessionRow> sessionsOverlapping(Instant from, Instant to);

    /** Per-application foreground time for windows first seen in the range. */
    List<AppDurationRow> appDurations(Instant from, Instant to);

    ExportData export(Instant from, Instant to);

    boolean isAvailable();
}
