/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.selfspy.exception.StoreUnavailableException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link java.lang.IllegalArgumentException} (negative days, unknown format) → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "StoreUnavailableException",
 *   "message": "Activity store temporarily unavailable",
 *   "details": "Please retry in a few seconds",
 *   "timestamp": "2026-03-02T09:14:07.311Z"
 * }
 * </pre>
 */
package com.phillippitts.selfspy.presentation.exception;
