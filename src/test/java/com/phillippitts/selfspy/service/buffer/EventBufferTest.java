package com.phillippitts.selfspy.service.buffer;

import com.phillippitts.selfspy.config.properties.BufferProperties;
import com.phillippitts.selfspy.domain.KeystrokeBatch;
import com.phillippitts.selfspy.domain.KeystrokeEvent;
import com.phillippitts.selfspy.domain.Snapshot;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.service.buffer.event.BufferOverflowWarningEvent;
import com.phillippitts.selfspy.service.buffer.event.EventsDroppedEvent;
import com.phillippitts.selfspy.service.metrics.ActivityMetrics;
import com.phillippitts.selfspy.testutil.CapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.phillippitts.selfspy.testutil.TestEvents.click;
import static com.phillippitts.selfspy.testutil.TestEvents.key;
import static com.phillippitts.selfspy.testutil.TestEvents.window;
import static org.assertj.core.api.Assertions.assertThat;

class EventBufferTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
    private static final WindowKey W1 = new WindowKey("Doc", "editor", 10);
    private static final WindowKey W2 = new WindowKey("Shell", "terminal", 11);

    private final CapturingPublisher publisher = new CapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private EventBuffer buffer(BufferProperties props) {
        return new EventBuffer(props, publisher, new ActivityMetrics(registry));
    }

    @Test
    void emptyDrainReturnsEmptySnapshot() {
        Snapshot snapshot = buffer(BufferProperties.defaults()).drain();

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.recordCount()).isZero();
    }

    @Test
    void drainClaimsEverythingAndLeavesBufferEmpty() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        buffer.addWindow(window("Doc", "editor", 10, T0));
        buffer.addKeystroke(key("a", W1, T0.plusMillis(100)));
        buffer.addPointerEvent(click(W1, T0.plusMillis(200)));

        Snapshot first = buffer.drain();
        Snapshot second = buffer.drain();

        assertThat(first.windows()).hasSize(1);
        assertThat(first.keystrokes()).hasSize(1);
        assertThat(first.pointerEvents()).hasSize(1);
        assertThat(second.isEmpty()).isTrue();
        assertThat(buffer.size()).isZero();
    }

    @Test
    void mergesCloseKeystrokesInSameWindow() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        buffer.addKeystroke(key("a", W1, T0));
        buffer.addKeystroke(key("b", W1, T0.plusMillis(500)));
        buffer.addKeystroke(key("c", W1, T0.plusMillis(900)));

        List<KeystrokeBatch> batches = buffer.drain().keystrokes();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).text()).isEqualTo("abc");
        assertThat(batches.get(0).count()).isEqualTo(3);
        assertThat(batches.get(0).recordedAt()).isEqualTo(T0);
    }

    @Test
    void doesNotMergeAcrossWindowsModifiersOrGaps() {
        EventBuffer buffer = buffer(new BufferProperties(null, null, null, Duration.ofSeconds(1)));
        buffer.addKeystroke(key("a", W1, T0));
        buffer.addKeystroke(key("b", W2, T0.plusMillis(100)));
        buffer.addKeystroke(new KeystrokeEvent("c", Set.of("Ctrl"), W2, T0.plusMillis(200)));
        buffer.addKeystroke(new KeystrokeEvent("d", Set.of("Ctrl"), W2, T0.plusSeconds(5)));

        List<KeystrokeBatch> batches = buffer.drain().keystrokes();

        assertThat(batches).extracting(KeystrokeBatch::text).containsExactly("a", "b", "c", "d");
        assertThat(batches).extracting(KeystrokeBatch::count).containsOnly(1);
    }

    @Test
    void sizeCountsRawEventsAndNewWindows() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        buffer.addWindow(window("Doc", "editor", 10, T0));
        buffer.addWindow(window("Doc", "editor", 10, T0.plusSeconds(1)));
        buffer.addKeystroke(key("a", W1, T0));
        buffer.addKeystroke(key("b", W1, T0));

        assertThat(buffer.size()).isEqualTo(3);
    }

    @Test
    void thresholdRequestsFlush() {
        EventBuffer buffer = buffer(new BufferProperties(2, 10, 20, null));
        List<FlushTrigger.Reason> reasons = new ArrayList<>();
        buffer.onFlushNeeded(reasons::add);

        buffer.addPointerEvent(click(W1, T0));
        assertThat(reasons).isEmpty();
        buffer.addPointerEvent(click(W1, T0));

        assertThat(reasons).containsExactly(FlushTrigger.Reason.THRESHOLD);
    }

    @Test
    void softCapWarnsOnceAndForcesFlush() {
        EventBuffer buffer = buffer(new BufferProperties(1, 3, 100, null));
        List<FlushTrigger.Reason> reasons = new ArrayList<>();
        buffer.onFlushNeeded(reasons::add);

        for (int i = 0; i < 6; i++) {
            buffer.addPointerEvent(click(W1, T0.plusMillis(i)));
        }

        assertThat(publisher.eventsOfType(BufferOverflowWarningEvent.class)).hasSize(1);
        assertThat(publisher.eventsOfType(BufferOverflowWarningEvent.class).get(0).softCap()).isEqualTo(3);
        assertThat(reasons).containsOnlyOnce(FlushTrigger.Reason.SOFT_CAP);
    }

    @Test
    void hardCapDropsAndCounts() {
        EventBuffer buffer = buffer(new BufferProperties(1, 2, 3, null));

        for (int i = 0; i < 5; i++) {
            buffer.addPointerEvent(click(W1, T0.plusMillis(i)));
        }

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.droppedCount()).isEqualTo(2);
        assertThat(buffer.liveCounters().dropped()).isEqualTo(2);
        assertThat(publisher.eventsOfType(EventsDroppedEvent.class)).hasSize(1);
        assertThat(registry.get("selfspy.buffer.dropped").counter().count()).isEqualTo(2.0);

        buffer.drain();
        buffer.addPointerEvent(click(W1, T0));
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void liveCountersTrackActivity() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        buffer.addWindow(window("Doc", "editor", 10, T0));
        buffer.addWindow(window("Doc", "editor", 10, T0.plusSeconds(1)));
        buffer.addWindow(window("Shell", "terminal", 11, T0.plusSeconds(2)));
        buffer.addKeystroke(key("a", W1, T0.plusSeconds(3)));
        buffer.addPointerEvent(click(W2, T0.plusSeconds(4)));

        var counters = buffer.liveCounters();

        assertThat(counters.keystrokes()).isEqualTo(1);
        assertThat(counters.clicks()).isEqualTo(1);
        assertThat(counters.windows()).isEqualTo(2);
        assertThat(counters.lastActivity()).isEqualTo(T0.plusSeconds(4));
    }

    @Test
    void drainsWithoutFocusChangeDoNotCountAsWindowChanges() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        List<Snapshot> drained = new ArrayList<>();

        for (int cycle = 0; cycle < 5; cycle++) {
            buffer.addWindow(window("Doc", "editor", 10, T0.plusSeconds(cycle * 10L)));
            buffer.addWindow(window("Doc", "editor", 10, T0.plusSeconds(cycle * 10L + 5)));
            drained.add(buffer.drain());
        }

        assertThat(buffer.liveCounters().windows()).isEqualTo(1);
        assertThat(drained).allSatisfy(s -> assertThat(s.windows()).hasSize(1));
        assertThat(drained.get(0).windows().get(0).continued()).isFalse();
        assertThat(drained.subList(1, 5)).allSatisfy(s -> assertThat(s.windows().get(0).continued()).isTrue());

        buffer.addWindow(window("Shell", "terminal", 11, T0.plusSeconds(60)));
        assertThat(buffer.liveCounters().windows()).isEqualTo(2);
    }

    @Test
    void bufferSizeGaugeIsRegistered() {
        EventBuffer buffer = buffer(BufferProperties.defaults());
        buffer.addPointerEvent(click(W1, T0));

        assertThat(registry.get("selfspy.buffer.size").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void concurrentProducersLoseNothingAcrossDrains() throws Exception {
        EventBuffer buffer = buffer(new BufferProperties(1_000_000, 1_000_000, 1_000_000, Duration.ZERO));
        int producers = 4;
        int perProducer = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers);
        List<Snapshot> drained = new CopyOnWriteArrayList<>();
        AtomicBoolean running = new AtomicBoolean(true);

        for (int p = 0; p < producers; p++) {
            int id = p;
            pool.execute(() -> {
                try {
                    start.await();
                    WindowKey w = new WindowKey("w" + id, "proc" + id, id);
                    for (int i = 0; i < perProducer; i++) {
                        // distinct windows keep batches from merging
                        buffer.addPointerEvent(click(w, T0.plusMillis(i)));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        Thread consumer = new Thread(() -> {
            while (running.get()) {
                drained.add(buffer.drain());
            }
        });
        consumer.start();
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        running.set(false);
        consumer.join();
        drained.add(buffer.drain());
        pool.shutdown();

        int total = drained.stream().mapToInt(s -> s.pointerEvents().size()).sum();
        assertThat(total).isEqualTo(producers * perProducer);
    }
}
