package com.phillippitts.selfspy.service.stats;

import com.phillippitts.selfspy.config.properties.ReportingProperties;
import com.phillippitts.selfspy.domain.ActivityStats;
import com.phillippitts.selfspy.domain.AppUsage;
import com.phillippitts.selfspy.service.store.ActivityCounts;
import com.phillippitts.selfspy.service.store.ActivityReader;
import com.phillippitts.selfspy.service.store.AppDurationRow;
import com.phillippitts.selfspy.service.store.SessionRow;
import com.phillippitts.selfspy.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rolling activity statistics over the last {@code days} days, read from the store only.
 *
 * <p>Results lag live capture by at most one flush interval. Active time is the sum of session
 * durations clipped to the range; a session still running counts up to now. Applications are
 * ranked by foreground time, then window count, then name.
 */
@Service
public class StatsAggregator {

    private static final Logger LOG = LogManager.getLogger(StatsAggregator.class);

    static final Comparator<AppDurationRow> RANKING = Comparator
            .comparingLong(AppDurationRow::durationMillis).reversed()
            .thenComparing(Comparator.comparingLong(AppDurationRow::windowCount).reversed())
            .thenComparing(AppDurationRow::name);

    private final ActivityReader reader;
    private final ReportingProperties props;
    private final Clock clock;

    public StatsAggregator(ActivityReader reader, ReportingProperties props, Clock clock) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param days size of the window ending now; 0 yields an all-zero result
     * @throws IllegalArgumentException if days is negative
     * @throws com.phillippitts.selfspy.exception.StoreUnavailableException if the store cannot be read
     */
    public ActivityStats getStats(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, was " + days);
        }
        Instant to = clock.instant();
        if (days == 0) {
            return ActivityStats.empty(to, to);
        }
        Instant from = to.minus(Duration.ofDays(days));

        ActivityCounts counts = reader.counts(from, to);
        long activeMillis = 0;
        for (SessionRow s : reader.sessionsOverlapping(from, to)) {
            activeMillis += TimeUtils.overlapMillis(s.startTime(), s.endTime(), from, to);
        }
        List<AppUsage> topApps = rank(reader.appDurations(from, to), props.getTopApps());

        LOG.debug("Stats for {} day(s): keystrokes={}, clicks={}, windows={}, apps={}",
                days, counts.keystrokes(), counts.clicks(), counts.windows(), topApps.size());
        return new ActivityStats(counts.keystrokes(), counts.pointerEvents(), counts.clicks(), counts.windows(),
                activeMillis / 1000, topApps, from, to);
    }

    static List<AppUsage> rank(List<AppDurationRow> rows, int limit) {
        long total = 0;
        for (AppDurationRow r : rows) {
            total += r.durationMillis();
        }
        final long totalMillis = total;
        return rows.stream()
                .sorted(RANKING)
                .limit(limit)
                .map(r -> new AppUsage(r.name(), r.durationMillis(), r.windowCount(), r.eventCount(),
                        totalMillis == 0 ? 0.0 : 100.0 * r.durationMillis() / totalMillis))
                .toList();
    }
}
