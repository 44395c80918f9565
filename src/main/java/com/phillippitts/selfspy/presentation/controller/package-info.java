/**
 * REST API controllers for the local reporting surface.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/status} - live monitor status, no store read</li>
 *   <li>{@code GET /api/stats?days=N} - aggregated statistics for the last N days</li>
 *   <li>{@code GET /api/export?days=N&format=json|csv|sql} - stored records for the last N days</li>
 * </ul>
 *
 * @see com.phillippitts.selfspy.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.selfspy.presentation.controller;
