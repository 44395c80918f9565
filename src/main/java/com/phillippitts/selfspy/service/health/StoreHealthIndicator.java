package com.phillippitts.selfspy.service.health;

import com.phillippitts.selfspy.service.engine.ActivityEngine;
import com.phillippitts.selfspy.domain.MonitorStatus;
import com.phillippitts.selfspy.service.store.ActivityReader;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the activity store.
 *
 * <p>DOWN when the store does not answer a trivial query. Monitoring details (buffered
 * items, dropped events, session) are attached either way.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class StoreHealthIndicator implements HealthIndicator {

    private final ActivityReader reader;
    private final ActivityEngine engine;

    public StoreHealthIndicator(ActivityReader reader, ActivityEngine engine) {
        this.reader = reader;
        this.engine = engine;
    }

    @Override
    public Health health() {
        boolean reachable = reader.isAvailable();
        MonitorStatus status = engine.status();

        Health.Builder builder = reachable ? Health.up() : Health.down();
        return builder
                .withDetail("store", reachable ? "reachable" : "NOT reachable")
                .withDetail("monitoring", status.monitoringActive())
                .withDetail("buffered", status.bufferedCount())
                .withDetail("dropped", status.liveCounters().dropped())
                .withDetail("sessionId", status.sessionId() == null ? "none" : status.sessionId())
                .build();
    }
}
