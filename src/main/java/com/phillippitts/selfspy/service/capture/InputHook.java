package com.phillippitts.selfspy.service.capture;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard and pointer hook (e.g., JNativeHook).
 *
 * Provides a test seam so unit tests can inject a fake implementation
 * and remain hermetic (no OS-level hooks required in CI).
 */
public interface InputHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException if the OS refuses the hook (e.g., missing accessibility permission)
     */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /** Subscribe to normalized key events. Replaces any previous listener. */
    void setKeyListener(Consumer<NormalizedKeyEvent> listener);

    /** Subscribe to normalized pointer events. Replaces any previous listener. */
    void setPointerListener(Consumer<NormalizedPointerEvent> listener);
}
