package com.phillippitts.selfspy.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the in-memory event buffer.
 *
 * Three thresholds, in increasing order:
 * - flush-threshold: buffered items that request a normal flush
 * - soft-cap: items that raise an overflow warning and force a flush
 * - hard-cap: items beyond which new events are dropped and counted
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "selfspy.buffer")
public class BufferProperties {

    @Positive
    private final int flushThreshold;

    @Positive
    private final int softCap;

    @Positive
    private final int hardCap;

    /** Keystrokes closer together than this, same window and modifiers, share one batch. */
    private final Duration keystrokeMergeGap;

    @ConstructorBinding
    public BufferProperties(Integer flushThreshold,
                            Integer softCap,
                            Integer hardCap,
                            Duration keystrokeMergeGap) {
        this.flushThreshold = flushThreshold == null ? 1000 : flushThreshold;
        this.softCap = softCap == null ? 5000 : softCap;
        this.hardCap = hardCap == null ? 50_000 : hardCap;
        this.keystrokeMergeGap = keystrokeMergeGap == null ? Duration.ofSeconds(2) : keystrokeMergeGap;
    }

    public static BufferProperties defaults() {
        return new BufferProperties(null, null, null, null);
    }

    public int getFlushThreshold() {
        return flushThreshold;
    }

    public int getSoftCap() {
        return softCap;
    }

    public int getHardCap() {
        return hardCap;
    }

    public Duration getKeystrokeMergeGap() {
        return keystrokeMergeGap;
    }

    @AssertTrue(message = "Expected flush-threshold <= soft-cap <= hard-cap")
    public boolean isThresholdOrderValid() {
        return flushThreshold <= softCap && softCap <= hardCap;
    }
}
