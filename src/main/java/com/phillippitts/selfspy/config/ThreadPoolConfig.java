package com.phillippitts.selfspy.config;

import com.phillippitts.selfspy.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Schedulers backing the background work of the engine.
 *
 * <p>Both schedulers are single-threaded. The flush scheduler is the only thread
 * that ever writes to the store, which serializes flushes without extra locking.
 *
 * <p>Tasks submitted to these schedulers are wrapped by the caller with
 * {@link com.phillippitts.selfspy.config.logging.MdcTaskDecorator} so the Log4j2
 * ThreadContext survives the hop onto the worker.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler running periodic ticks, size-triggered flushes and the final flush.
     */
    @Bean(name = "flushScheduler")
    public ThreadPoolTaskScheduler flushScheduler() {
        return singleThreadScheduler(threadPoolProperties.getFlush());
    }

    /**
     * Scheduler polling the foreground window.
     */
    @Bean(name = "watcherScheduler")
    public ThreadPoolTaskScheduler watcherScheduler() {
        return singleThreadScheduler(threadPoolProperties.getWatcher());
    }

    private static ThreadPoolTaskScheduler singleThreadScheduler(ThreadPoolProperties.SchedulerProperties props) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
