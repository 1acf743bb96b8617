/**
 * REST and SSE controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.presentation.controller.CommandController} -
 *       {@code POST /command}, {@code GET /status/{requestId}}, {@code POST /dispense_treat}, {@code POST /speak}</li>
 *   <li>{@link com.phillippitts.petpal.presentation.controller.EventStreamController} -
 *       {@code GET /events} push channel ({@code text/event-stream})</li>
 *   <li>{@link com.phillippitts.petpal.presentation.controller.DetectionController} -
 *       {@code POST /api/detections}, {@code GET /api/events}</li>
 *   <li>{@link com.phillippitts.petpal.presentation.controller.HealthController} - {@code GET /health}</li>
 * </ul>
 *
 * <p>Command-level failures (timeouts, low confidence, interruption) are never raised here; they are
 * terminal states read through the status endpoint or the push channel.
 */
package com.phillippitts.petpal.presentation.controller;
