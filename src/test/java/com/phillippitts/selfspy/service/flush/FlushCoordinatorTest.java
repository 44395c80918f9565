package com.phillippitts.selfspy.service.flush;

import com.phillippitts.selfspy.config.properties.BufferProperties;
import com.phillippitts.selfspy.config.properties.FlushProperties;
import com.phillippitts.selfspy.domain.WindowKey;
import com.phillippitts.selfspy.exception.EncryptionException;
import com.phillippitts.selfspy.exception.FlushException;
import com.phillippitts.selfspy.service.buffer.EventBuffer;
import com.phillippitts.selfspy.service.crypto.AesGcmPayloadCodec;
import com.phillippitts.selfspy.service.crypto.KeyDerivation;
import com.phillippitts.selfspy.service.crypto.KeystrokeProtector;
import com.phillippitts.selfspy.service.crypto.PayloadCodec;
import com.phillippitts.selfspy.service.flush.event.FlushFailedEvent;
import com.phillippitts.selfspy.service.flush.event.StoreUnavailableEvent;
import com.phillippitts.selfspy.service.metrics.ActivityMetrics;
import com.phillippitts.selfspy.service.store.PreparedSnapshot;
import com.phillippitts.selfspy.testutil.CapturingPublisher;
import com.phillippitts.selfspy.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.phillippitts.selfspy.testutil.TestEvents.click;
import static com.phillippitts.selfspy.testutil.TestEvents.key;
import static com.phillippitts.selfspy.testutil.TestEvents.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class FlushCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
    private static final WindowKey W1 = new WindowKey("Doc", "editor", 10);

    private final CapturingPublisher publisher = new CapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ActivityMetrics metrics = new ActivityMetrics(registry);
    private final FakeActivityWriter writer = new FakeActivityWriter();
    private final MutableClock clock = new MutableClock(T0);
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskScheduler scheduler;
    private EventBuffer buffer;
    private FlushProperties props;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("flush-test-");
        scheduler.initialize();
        buffer = new EventBuffer(new BufferProperties(5, 50, 100, null), publisher, metrics);
        props = new FlushProperties();
        props.setMaxAttempts(3);
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        scheduler.shutdown();
    }

    private FlushCoordinator coordinator(KeystrokeProtector protector) {
        return new FlushCoordinator(buffer, writer, protector, props, scheduler, publisher, metrics, clock,
                sleeps::add);
    }

    private FlushCoordinator coordinator() {
        return coordinator(KeystrokeProtector.plaintext());
    }

    @Test
    void emptyBufferIsANoOp() {
        FlushResult result = coordinator().flushNow();

        assertThat(result.outcome()).isEqualTo(FlushResult.Outcome.EMPTY);
        assertThat(writer.persistCalls.get()).isZero();
    }

    @Test
    void persistsDrainedSnapshot() {
        buffer.addWindow(window("Doc", "editor", 10, T0));
        buffer.addKeystroke(key("a", W1, T0));
        buffer.addPointerEvent(click(W1, T0));

        FlushResult result = coordinator().flushNow();

        assertThat(result.outcome()).isEqualTo(FlushResult.Outcome.PERSISTED);
        assertThat(result.records()).isEqualTo(3);
        assertThat(writer.committed).hasSize(1);
        assertThat(buffer.size()).isZero();
        assertThat(registry.get("selfspy.flush.records").counter().count()).isEqualTo(3.0);
    }

    @Test
    void retriesThenSucceedsWithBackoff() {
        writer.failuresBeforeSuccess = 2;
        buffer.addPointerEvent(click(W1, T0));

        FlushResult result = coordinator().flushNow();

        assertThat(result.outcome()).isEqualTo(FlushResult.Outcome.PERSISTED);
        assertThat(writer.persistCalls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(400));
        assertThat(registry.get("selfspy.flush.failure").tag("reason", "unavailable").counter().count())
                .isEqualTo(2.0);
        assertThat(publisher.eventsOfType(FlushFailedEvent.class)).isEmpty();
    }

    @Test
    void discardsAfterExhaustingAttempts() {
        writer.failuresBeforeSuccess = 10;
        buffer.addKeystroke(key("a", W1, T0));
        buffer.addPointerEvent(click(W1, T0.plusSeconds(2)));
        FlushCoordinator coordinator = coordinator();

        assertThatThrownBy(coordinator::flushNow)
                .isInstanceOf(FlushException.class)
                .satisfies(e -> {
                    FlushException fe = (FlushException) e;
                    assertThat(fe.getAttempts()).isEqualTo(3);
                    assertThat(fe.getRecordCount()).isEqualTo(2);
                    assertThat(fe.getEarliest()).isEqualTo(T0);
                    assertThat(fe.getLatest()).isEqualTo(T0.plusSeconds(2));
                });

        List<FlushFailedEvent> failures = publisher.eventsOfType(FlushFailedEvent.class);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).recordCount()).isEqualTo(2);
        assertThat(buffer.size()).isZero();
        assertThat(registry.get("selfspy.flush.discarded").counter().count()).isEqualTo(2.0);

        // the discarded snapshot is not retried by the next flush
        writer.failuresBeforeSuccess = 0;
        assertThat(coordinator.flushNow().outcome()).isEqualTo(FlushResult.Outcome.EMPTY);
    }

    @Test
    void unavailableStoreLeavesBufferIntact() {
        writer.available = false;
        buffer.addPointerEvent(click(W1, T0));
        FlushCoordinator coordinator = coordinator();

        FlushResult first = coordinator.flushNow();
        FlushResult second = coordinator.flushNow();

        assertThat(first.outcome()).isEqualTo(FlushResult.Outcome.STORE_UNAVAILABLE);
        assertThat(second.outcome()).isEqualTo(FlushResult.Outcome.STORE_UNAVAILABLE);
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(publisher.eventsOfType(StoreUnavailableEvent.class)).hasSize(1);

        writer.available = true;
        assertThat(coordinator.flushNow().records()).isEqualTo(1);
        assertThat(buffer.size()).isZero();
    }

    @Test
    void encryptsKeystrokesBeforeWriting() {
        SecretKey key = KeyDerivation.derive("pw", 10_000);
        AesGcmPayloadCodec codec = new AesGcmPayloadCodec();
        buffer.addKeystroke(key("secret", W1, T0));

        coordinator(KeystrokeProtector.encrypting(codec, key)).flushNow();

        PreparedSnapshot written = writer.committed.get(0);
        assertThat(written.keystrokes()).hasSize(1);
        assertThat(written.keystrokes().get(0).payload().encrypted()).isTrue();
        assertThat(codec.decrypt(written.keystrokes().get(0).payload().payload(), key)).isEqualTo("secret");
    }

    @Test
    void encryptionFailureDropsOnlyThatRecord() {
        PayloadCodec failing = new PayloadCodec() {
            @Override
            public String encrypt(String plaintext, SecretKey key) {
                throw new EncryptionException("cipher unavailable");
            }

            @Override
            public String decrypt(String ciphertext, SecretKey key) {
                throw new EncryptionException("cipher unavailable");
            }
        };
        buffer.addKeystroke(key("secret", W1, T0));
        buffer.addPointerEvent(click(W1, T0));

        FlushResult result = coordinator(KeystrokeProtector.encrypting(failing, KeyDerivation.derive("pw", 10_000)))
                .flushNow();

        assertThat(result.records()).isEqualTo(1);
        assertThat(writer.committed.get(0).keystrokes()).isEmpty();
        assertThat(writer.committed.get(0).pointerEvents()).hasSize(1);
    }

    @Test
    void startOpensSessionAndStopClosesIt() {
        FlushCoordinator coordinator = coordinator();

        coordinator.start();
        Long sessionId = coordinator.currentSessionId();
        assertThat(sessionId).isNotNull();
        assertThat(writer.sessionStarts).containsEntry(sessionId, T0);

        buffer.addPointerEvent(click(W1, T0));
        clock.advance(Duration.ofSeconds(3));
        coordinator.stop();

        assertThat(coordinator.isRunning()).isFalse();
        assertThat(writer.committedRecords()).isEqualTo(1);
        assertThat(writer.closedSessions).containsExactly(sessionId);
        assertThat(writer.sessionEnds).containsEntry(sessionId, T0.plusSeconds(3));
        assertThat(coordinator.currentSessionId()).isNull();
    }

    @Test
    void sessionIsOpenedLaterWhenStoreWasDownAtStart() {
        writer.failSessions = true;
        FlushCoordinator coordinator = coordinator();
        coordinator.start();
        assertThat(coordinator.currentSessionId()).isNull();

        writer.failSessions = false;
        coordinator.flushNow();

        assertThat(coordinator.currentSessionId()).isNotNull();
        assertThat(writer.sessionStarts.values()).containsExactly(T0);
        coordinator.stop();
    }

    @Test
    void thresholdTriggersAsyncFlush() {
        FlushCoordinator coordinator = coordinator();
        coordinator.start();

        for (int i = 0; i < 5; i++) {
            buffer.addPointerEvent(click(W1, T0.plusMillis(i)));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> writer.committedRecords() == 5);
        coordinator.stop();
    }

    @Test
    void asyncFlushCarriesCallerThreadContext() {
        FlushCoordinator coordinator = coordinator();
        coordinator.start();
        ThreadContext.put("requestId", "r-9");

        for (int i = 0; i < 5; i++) {
            buffer.addPointerEvent(click(W1, T0.plusMillis(i)));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> writer.committedRecords() == 5);
        assertThat(writer.persistRequestIds).containsExactly("r-9");
        coordinator.stop();
    }

    @Test
    void tickFlushesOnceIntervalElapsed() {
        props.setInterval(Duration.ofMinutes(1));
        FlushCoordinator coordinator = coordinator();
        coordinator.start();
        buffer.addPointerEvent(click(W1, T0));

        coordinator.onTick();
        assertThat(writer.committedRecords()).isZero();

        clock.advance(Duration.ofMinutes(1));
        coordinator.onTick();
        assertThat(writer.committedRecords()).isEqualTo(1);
        coordinator.stop();
    }

    @Test
    void stopRunsFinalFlushInlineWhenSchedulerIsGone() {
        FlushCoordinator coordinator = coordinator();
        coordinator.start();
        buffer.addPointerEvent(click(W1, T0));
        scheduler.shutdown();

        coordinator.stop();

        assertThat(writer.committedRecords()).isEqualTo(1);
        assertThat(writer.closedSessions).hasSize(1);
    }
}
