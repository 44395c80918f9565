package com.phillippitts.selfspy.service.buffer;

import com.phillippitts.selfspy.config.properties.BufferProperties;
import com.phillippitts.selfspy.domain.KeystrokeBatch;
import com.phillippitts.selfspy.domain.KeystrokeEvent;
import com.phillippitts.selfspy.domain.LiveCounters;
import com.phillippitts.selfspy.domain.PointerEvent;
import com.phillippitts.selfspy.domain.PointerEventType;
import com.phillippitts.selfspy.domain.Snapshot;
import com.phillippitts.selfspy.domain.WindowEvent;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.service.buffer.event.BufferOverflowWarningEvent;
import com.phillippitts.selfspy.service.buffer.event.EventsDroppedEvent;
import com.phillippitts.selfspy.service.metrics.ActivityMetrics;
import com.phillippitts.selfspy.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe accumulation of pending keystrokes, pointer events and window records.
 *
 * <p>Any number of producers call the {@code add*} methods; one consumer calls {@link #drain()}.
 * A single lock guards the reference to the pending storage. {@link #drain()} swaps in fresh
 * storage and builds the snapshot after the lock is released, so producers are never
 * blocked by record conversion or I/O.
 *
 * <p>Size accounting counts raw keystrokes, pointer events and newly opened windows.
 * Reaching {@code flush-threshold} requests a flush; reaching {@code soft-cap} publishes
 * {@link BufferOverflowWarningEvent} and forces one; at {@code hard-cap} new events are
 * dropped and counted.
 *
 * <p>Producer-side failures are logged and never propagate to the caller.
 */
@Component
public class EventBuffer {

    private static final Logger LOG = LogManager.getLogger(EventBuffer.class);

    private final BufferProperties props;
    private final ApplicationEventPublisher publisher;
    private final ActivityMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private Pending pending = new Pending(new WindowDeduplicator());

    private final AtomicLong keystrokes = new AtomicLong();
    private final AtomicLong clicks = new AtomicLong();
    private final AtomicLong windowChanges = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicReference<Instant> lastActivity = new AtomicReference<>();

    private final AtomicBoolean softCapWarned = new AtomicBoolean(false);
    private final AtomicBoolean dropping = new AtomicBoolean(false);

    private volatile FlushTrigger flushTrigger = FlushTrigger.none();

    public EventBuffer(BufferProperties props, ApplicationEventPublisher publisher, ActivityMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        metrics.registerBufferSize(this::size);
    }

    /**
     * Registers the callback used to request flushes. Replaces any previous one.
     */
    public void onFlushNeeded(FlushTrigger trigger) {
        this.flushTrigger = trigger == null ? FlushTrigger.none() : trigger;
    }

    public void addKeystroke(KeystrokeEvent event) {
        try {
            int size;
            lock.lock();
            try {
                if (pending.size >= props.getHardCap()) {
                    size = -1;
                } else {
                    pending.addKeystroke(event, props.getKeystrokeMergeGap());
                    size = pending.size;
                }
            } finally {
                lock.unlock();
            }
            if (size < 0) {
                onDropped("keystroke");
                return;
            }
            keystrokes.incrementAndGet();
            touch(event.timestamp());
            afterAdd(size);
        } catch (RuntimeException e) {
            LOG.error("Failed to buffer keystroke", e);
        }
    }

    public void addPointerEvent(PointerEvent event) {
        try {
            int size;
            lock.lock();
            try {
                if (pending.size >= props.getHardCap()) {
                    size = -1;
                } else {
                    pending.pointerEvents.add(event);
                    pending.size++;
                    size = pending.size;
                }
            } finally {
                lock.unlock();
            }
            if (size < 0) {
                onDropped("pointer");
                return;
            }
            if (event.type() == PointerEventType.CLICK) {
                clicks.incrementAndGet();
            }
            touch(event.timestamp());
            afterAdd(size);
        } catch (RuntimeException e) {
            LOG.error("Failed to buffer pointer event", e);
        }
    }

    public void addWindow(WindowEvent event) {
        try {
            int size;
            WindowDeduplicator.Observation observation = null;
            lock.lock();
            try {
                if (pending.size >= props.getHardCap()) {
                    size = -1;
                } else {
                    observation = pending.windows.observe(event);
                    if (observation == WindowDeduplicator.Observation.CREATED
                            || observation == WindowDeduplicator.Observation.RESUMED) {
                        pending.size++;
                    }
                    size = pending.size;
                }
            } finally {
                lock.unlock();
            }
            if (size < 0) {
                onDropped("window");
                return;
            }
            if (observation == WindowDeduplicator.Observation.CREATED
                    || observation == WindowDeduplicator.Observation.SWITCHED) {
                windowChanges.incrementAndGet();
                LOG.debug("Foreground window: process={}, title={}",
                        event.processName(), LogSanitizer.title(event.title()));
            }
            touch(event.timestamp());
            afterAdd(size);
        } catch (RuntimeException e) {
            LOG.error("Failed to buffer window event", e);
        }
    }

    /**
     * Records that focus moved to a window that is not captured, ending the current
     * window's foreground time at {@code at}. Adds no item.
     */
    public void releaseFocus(Instant at) {
        try {
            lock.lock();
            try {
                pending.windows.release(at);
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to release window focus", e);
        }
    }

    /**
     * Number of buffered items, consistent with the last completed add or drain.
     */
    public int size() {
        lock.lock();
        try {
            return pending.size;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically claims everything buffered so far and leaves the buffer empty.
     * Open windows are closed into the snapshot.
     */
    public Snapshot drain() {
        Pending claimed;
        lock.lock();
        try {
            if (pending.size == 0 && pending.windows.openCount() == 0) {
                return Snapshot.empty();
            }
            claimed = pending;
            pending = new Pending(claimed.windows.successor());
        } finally {
            lock.unlock();
        }
        softCapWarned.set(false);
        dropping.set(false);
        return claimed.toSnapshot();
    }

    public LiveCounters liveCounters() {
        return new LiveCounters(keystrokes.get(), clicks.get(), windowChanges.get(), dropped.get(),
                lastActivity.get());
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void afterAdd(int size) {
        if (size >= props.getSoftCap()) {
            if (softCapWarned.compareAndSet(false, true)) {
                LOG.warn("Event buffer reached soft cap: size={}, softCap={}", size, props.getSoftCap());
                publisher.publishEvent(new BufferOverflowWarningEvent(size, props.getSoftCap(), Instant.now()));
                flushTrigger.requestFlush(FlushTrigger.Reason.SOFT_CAP);
            }
        } else if (size >= props.getFlushThreshold()) {
            flushTrigger.requestFlush(FlushTrigger.Reason.THRESHOLD);
        }
    }

    private void onDropped(String kind) {
        long total = dropped.incrementAndGet();
        metrics.incrementDropped();
        if (dropping.compareAndSet(false, true)) {
            LOG.warn("Event buffer full (hardCap={}); dropping {} events until the next flush",
                    props.getHardCap(), kind);
            publisher.publishEvent(new EventsDroppedEvent(props.getHardCap(), total, Instant.now()));
        }
    }

    private void touch(Instant at) {
        lastActivity.accumulateAndGet(at, (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
    }

    /**
     * Storage swapped out on drain. Only touched under the buffer lock until claimed.
     */
    private static final class Pending {
        private final WindowDeduplicator windows;
        private final List<BatchBuilder> keystrokes = new ArrayList<>();
        private final List<PointerEvent> pointerEvents = new ArrayList<>();
        private int size;

        Pending(WindowDeduplicator windows) {
            this.windows = windows;
        }

        void addKeystroke(KeystrokeEvent event, Duration mergeGap) {
            BatchBuilder last = keystrokes.isEmpty() ? null : keystrokes.get(keystrokes.size() - 1);
            if (last != null && last.accepts(event, mergeGap)) {
                last.append(event);
            } else {
                keystrokes.add(new BatchBuilder(event));
            }
            size++;
        }

        Snapshot toSnapshot() {
            List<KeystrokeBatch> batches = new ArrayList<>(keystrokes.size());
            for (BatchBuilder b : keystrokes) {
                batches.add(b.build());
            }
            return new Snapshot(windows.closeAll(), batches, pointerEvents, size);
        }
    }

    private static final class BatchBuilder {
        private final StringBuilder text;
        private final Set<String> modifiers;
        private final WindowKey windowKey;
        private final Instant first;
        private Instant last;
        private int count;

        BatchBuilder(KeystrokeEvent event) {
            this.text = new StringBuilder(event.text());
            this.modifiers = event.modifiers();
            this.windowKey = event.windowKey();
            this.first = event.timestamp();
            this.last = event.timestamp();
            this.count = 1;
        }

        boolean accepts(KeystrokeEvent event, Duration mergeGap) {
            if (!Objects.equals(windowKey, event.windowKey()) || !modifiers.equals(event.modifiers())) {
                return false;
            }
            Duration gap = Duration.between(last, event.timestamp());
            return !gap.isNegative() && gap.compareTo(mergeGap) <= 0;
        }

        void append(KeystrokeEvent event) {
            text.append(event.text());
            last = event.timestamp();
            count++;
        }

        KeystrokeBatch build() {
            return new KeystrokeBatch(text.toString(), modifiers, count, windowKey, first);
        }
    }
}
