package com.phillippitts.selfspy.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates the data directory before the DataSource opens the SQLite file inside it.
 * Registered in {@code META-INF/spring.factories}.
 */
public class DataDirectoryInitializer implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    private static final Logger LOG = LogManager.getLogger(DataDirectoryInitializer.class);

    static final String DATA_DIR_PROPERTY = "selfspy.monitor.data-dir";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        ConfigurableEnvironment env = event.getEnvironment();
        String dataDir = env.getProperty(DATA_DIR_PROPERTY);
        if (dataDir == null || dataDir.isBlank()) {
            return;
        }
        createIfMissing(Path.of(dataDir));
    }

    static void createIfMissing(Path dir) {
        if (Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.createDirectories(dir);
            LOG.info("Created data directory {}", dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + dir, e);
        }
    }
}
