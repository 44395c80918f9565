package com.phillippitts.selfspy.service.engine;

import com.phillippitts.selfspy.config.properties.MonitorProperties;
import com.phillippitts.selfspy.domain.KeystrokeEvent;
import com.phillippitts.selfspy.domain.LiveCounters;
import com.phillippitts.selfspy.domain.MonitorStatus;
import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.PointerEventType;
import com.phillippitts.selfspy.domain.WindowEvent;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.service.buffer.EventBuffer;
import com.phillippitts.selfspy.service.flush.FlushCoordinator;
import com.phillippitts.selfspy.service.privacy.ExclusionPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Owns all monitor state: the event buffer, the flush coordinator and the current
 * foreground window.
 *
 * <p>Capture sources feed it through {@link ActivityEventSink}. Privacy rules are applied
 * here, before anything is buffered: excluded applications, text capture, pointer and
 * window toggles, and pointer moves. Keystrokes and pointer events without an explicit
 * window are attributed to the last observed foreground window.
 *
 * <p>Events arriving while the engine is stopped are ignored.
 */
@Service
public class ActivityEngine implements ActivityEventSink {

    private static final Logger LOG = LogManager.getLogger(ActivityEngine.class);

    private final EventBuffer buffer;
    private final FlushCoordinator coordinator;
    private final ExclusionPolicy exclusions;
    private final MonitorProperties props;

    private volatile boolean active;
    private volatile WindowKey currentWindow;

    public ActivityEngine(EventBuffer buffer,
                          FlushCoordinator coordinator,
                          ExclusionPolicy exclusions,
                          MonitorProperties props) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
        this.props = Objects.requireNonNull(props, "props");
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        coordinator.start();
        active = true;
        LOG.info("Activity engine started (text={}, pointer={}, windows={}, moves={})",
                props.isCaptureText(), props.isCapturePointer(), props.isCaptureWindows(),
                props.isRecordPointerMoves());
    }

    /**
     * Stops accepting events, then runs and awaits the final flush.
     */
    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        coordinator.stop();
        currentWindow = null;
        LOG.info("Activity engine stopped");
    }

    public boolean isActive() {
        return active;
    }

    public MonitorStatus status() {
        LiveCounters counters = buffer.liveCounters();
        return new MonitorStatus(active, buffer.size(), counters, counters.lastActivity(),
                coordinator.currentSessionId());
    }

    @Override
    public void onKeystroke(String text, Set<String> modifiers, WindowKey windowKey, Instant timestamp) {
        if (!active) {
            return;
        }
        try {
            WindowKey owner = windowKey != null ? windowKey : currentWindow;
            if (exclusions.isExcluded(owner)) {
                return;
            }
            String recorded = props.isCaptureText() ? text : "";
            buffer.addKeystroke(new KeystrokeEvent(recorded, modifiers, owner, timestamp));
        } catch (RuntimeException e) {
            LOG.warn("Rejected keystroke event: {}", e.toString());
        }
    }

    @Override
    public void onPointerEvent(int x, int y, String button, PointerEventType type, WindowKey windowKey,
                               Instant timestamp) {
        if (!active || !props.isCapturePointer()) {
            return;
        }
        if (type == PointerEventType.MOVE && !props.isRecordPointerMoves()) {
            return;
        }
        try {
            WindowKey owner = windowKey != null ? windowKey : currentWindow;
            if (exclusions.isExcluded(owner)) {
                return;
            }
            buffer.addPointerEvent(new PointerEvent(x, y, button, type, owner, timestamp));
        } catch (RuntimeException e) {
            LOG.warn("Rejected pointer event: {}", e.toString());
        }
    }

    @Override
    public void onWindowChange(String title, String processName, int processId, String bundleId,
                               int x, int y, int width, int height, Instant timestamp) {
        if (!active || !props.isCaptureWindows()) {
            return;
        }
        try {
            WindowEvent event = new WindowEvent(title, processName, processId, bundleId, x, y, width, height,
                    timestamp);
            // tracked even when excluded so that input in that window is excluded too
            currentWindow = event.key();
            if (exclusions.isExcluded(processName)) {
                buffer.releaseFocus(timestamp);
                return;
            }
            buffer.addWindow(event);
        } catch (RuntimeException e) {
            LOG.warn("Rejected window event: {}", e.toString());
        }
    }
}
