/**
 * Notification fan-out: the broadcast hub, its subscriber sinks and the optional Redis-backed
 * shared bus for multi-instance deployments.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.petpal.service.broadcast.BroadcastHub} - per-subscriber FIFO
 *       delivery without a lock across I/O</li>
 *   <li>{@link com.phillippitts.petpal.service.broadcast.RedisSharedBus} /
 *       {@link com.phillippitts.petpal.service.broadcast.SharedBusListener} - outbound and inbound
 *       halves of the bus, with origin tagging for loop prevention</li>
 *   <li>{@link com.phillippitts.petpal.service.broadcast.NotificationCodec} - JSON wire format</li>
 * </ul>
 */
package com.phillippitts.petpal.service.broadcast;
