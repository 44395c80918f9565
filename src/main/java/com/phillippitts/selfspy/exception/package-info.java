/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.selfspy.exception.SelfspyException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.selfspy.exception.CaptureException} - A capture source
 *       (keyboard/pointer hook, window watcher) could not start</li>
 *   <li>{@link com.phillippitts.selfspy.exception.EncryptionException} - Key invalid or
 *       ciphertext tampered; fails a single record</li>
 *   <li>{@link com.phillippitts.selfspy.exception.FlushException} - A drained batch could not
 *       be persisted after retries and was discarded</li>
 *   <li>{@link com.phillippitts.selfspy.exception.StoreUnavailableException} - The store
 *       cannot be reached</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP
 * status codes in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.selfspy.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.selfspy.exception;
