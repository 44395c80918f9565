package com.phillippitts.selfspy;

import com.phillippitts.selfspy.service.capture.ActivityMonitor;
import com.phillippitts.selfspy.service.store.ActivityReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "selfspy.monitor.autostart=false",
        "selfspy.encryption.enabled=false"
})
@AutoConfigureMockMvc
class SelfspyApplicationTests {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataDirectory(DynamicPropertyRegistry registry) {
        registry.add("selfspy.monitor.data-dir", () -> dataDir.toString());
        registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + dataDir.resolve("selfspy.db"));
    }

    @Autowired
    private ActivityMonitor monitor;

    @Autowired
    private ActivityReader reader;

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoadsWithoutStartingCapture() {
        assertThat(monitor.isRunning()).isFalse();
        assertThat(reader.isAvailable()).isTrue();
    }

    @Test
    void statusEndpointReportsIdleMonitor() throws Exception {
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoringActive").value(false))
                .andExpect(jsonPath("$.bufferedCount").value(0));
    }

    @Test
    void statsOverEmptyStoreAreZero() throws Exception {
        mvc.perform(get("/api/stats").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keystrokes").value(0))
                .andExpect(jsonPath("$.topApps").isEmpty());
    }

    @Test
    void healthReportsStoreReachable() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.store.details.store").value("reachable"));
    }
}
