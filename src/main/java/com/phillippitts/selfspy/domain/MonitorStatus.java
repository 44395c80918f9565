package com.phillippitts.selfspy.domain;

import java.time.Instant;

/**
 * Status answered without a store read.
 *
 * @param sessionId current session id, or {@code null} when not monitoring
 */
public record MonitorStatus(boolean monitoringActive,
                            int bufferedCount,
                            LiveCounters liveCounters,
                            Instant lastActivity,
                            Long sessionId) {
}
