package com.phillippitts.selfspy.service.events;

import com.phillippitts.selfspy.service.buffer.event.BufferOverflowWarningEvent;
import com.phillippitts.selfspy.service.buffer.event.EventsDroppedEvent;
import com.phillippitts.selfspy.service.capture.event.CapturePermissionDeniedEvent;
import com.phillippitts.selfspy.service.flush.event.FlushFailedEvent;
import com.phillippitts.selfspy.service.flush.event.StoreUnavailableEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThat(l.shouldLog("store-unavailable")).isTrue();
        assertThat(l.shouldLog("store-unavailable")).isFalse();
        // keys are throttled independently
        assertThat(l.shouldLog("buffer-hard-cap")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        Instant now = Instant.now();
        assertThatCode(() -> {
            l.onCapturePermissionDenied(new CapturePermissionDeniedEvent("input-hook", now));
            l.onBufferOverflow(new BufferOverflowWarningEvent(5001, 5000, now));
            l.onEventsDropped(new EventsDroppedEvent(20000, 3, now));
            l.onFlushFailed(new FlushFailedEvent(12, 3, null, null, "timeout", now));
            l.onFlushFailed(new FlushFailedEvent(12, 3, now.minusSeconds(5), now, "timeout", now));
            l.onStoreUnavailable(new StoreUnavailableEvent(40, now));
        }).doesNotThrowAnyException();
    }
}
