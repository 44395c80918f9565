package com.phillippitts.selfspy.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the schedulers backing the flush coordinator and
 * the window watcher. Both are single-threaded; only naming and shutdown are tunable.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SchedulerProperties flush = new SchedulerProperties("flush-coordinator-");
    private SchedulerProperties watcher = new SchedulerProperties("window-watcher-");

    public SchedulerProperties getFlush() {
        return flush;
    }

    public void setFlush(SchedulerProperties flush) {
        this.flush = flush;
    }

    public SchedulerProperties getWatcher() {
        return watcher;
    }

    public void setWatcher(SchedulerProperties watcher) {
        this.watcher = watcher;
    }

    /**
     * Single-thread scheduler configuration.
     */
    public static class SchedulerProperties {
        private String threadNamePrefix;
        private int awaitTerminationSeconds = 30;

        public SchedulerProperties() {
        }

        SchedulerProperties(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
