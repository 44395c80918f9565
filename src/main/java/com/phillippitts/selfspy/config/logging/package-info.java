/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) keys.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, set by {@link com.phillippitts.selfspy.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - the capture session being flushed</li>
 *   <li>{@code flushId} - sequence number of the flush cycle</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 09:14:07.311 [flush-coordinator-1] [sessionId=12] [flushId=48] INFO logger.name - message
 * </pre>
 */
package com.phillippitts.selfspy.config.logging;
