package com.phillippitts.selfspy.config;

import com.phillippitts.selfspy.service.capture.ActiveWindowProvider;
import com.phillippitts.selfspy.service.capture.impl.CommandActiveWindowProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Platform adapters and the clock shared by capture, flush and reporting.
 */
@Configuration
public class CaptureConfig {

    @Bean
    @ConditionalOnMissingBean
    public ActiveWindowProvider activeWindowProvider() {
        return new CommandActiveWindowProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
