/**
 * Domain models shared by the orchestrator, the broadcast layer and the client subscriber.
 *
 * <p>All domain models are immutable records or enums that validate themselves in their
 * constructors. None of them know about HTTP, Redis or persistence.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.domain.CommandKind} - whitelisted commands, one of them preemptive</li>
 *   <li>{@link com.phillippitts.petpal.domain.CommandSnapshot} - what status polls and push
 *       notifications carry</li>
 *   <li>{@link com.phillippitts.petpal.domain.ActivityEvent} - append-only event derived from detections</li>
 *   <li>{@link com.phillippitts.petpal.domain.ArtifactRequest} - bookmark/clip request for the media pipeline</li>
 *   <li>{@link com.phillippitts.petpal.domain.Notification} - unit of fan-out</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.petpal.domain;
