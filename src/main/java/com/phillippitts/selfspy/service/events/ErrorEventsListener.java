package com.phillippitts.selfspy.service.events;

import com.phillippitts.selfspy.service.buffer.event.BufferOverflowWarningEvent;
import com.phillippitts.selfspy.service.buffer.event.EventsDroppedEvent;
import com.phillippitts.selfspy.service.capture.event.CapturePermissionDeniedEvent;
import com.phillippitts.selfspy.service.flush.event.FlushFailedEvent;
import com.phillippitts.selfspy.service.flush.event.StoreUnavailableEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error and warning events. Privacy-safe and throttled
 * to one line per key per minute to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCapturePermissionDenied(CapturePermissionDeniedEvent e) {
        if (shouldLog("capture-permission-" + e.source())) {
            LOG.warn("Input capture permission denied. On macOS grant Accessibility and Input Monitoring: "
                    + "System Settings → Privacy & Security (then restart app)");
        }
    }

    @EventListener
    void onBufferOverflow(BufferOverflowWarningEvent e) {
        if (shouldLog("buffer-soft-cap")) {
            LOG.warn("Event buffer above soft cap: buffered={}, softCap={}. Forcing a flush.",
                    e.bufferedCount(), e.softCap());
        }
    }

    @EventListener
    void onEventsDropped(EventsDroppedEvent e) {
        if (shouldLog("buffer-hard-cap")) {
            LOG.error("Event buffer full: hardCap={}, droppedTotal={}. Check the activity store.",
                    e.hardCap(), e.droppedTotal());
        }
    }

    @EventListener
    void onFlushFailed(FlushFailedEvent e) {
        if (shouldLog("flush-failed-" + e.reason())) {
            LOG.error("Activity snapshot lost after {} attempt(s): records={}, range={} .. {}, reason={}",
                    e.attempts(), e.recordCount(), e.earliest(), e.latest(), e.reason());
        }
    }

    @EventListener
    void onStoreUnavailable(StoreUnavailableEvent e) {
        if (shouldLog("store-unavailable")) {
            LOG.warn("Activity store unreachable; {} item(s) held in memory. Check selfspy.monitor.data-dir.",
                    e.bufferedCount());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
