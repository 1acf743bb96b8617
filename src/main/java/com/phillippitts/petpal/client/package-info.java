/**
 * Client-side status subscriber for UI back ends and tools that observe commands remotely.
 *
 * <p>{@link com.phillippitts.petpal.client.StatusSubscriber} consumes the {@code /events} push channel
 * ({@link com.phillippitts.petpal.client.SsePushChannel}), reconnects with
 * {@link com.phillippitts.petpal.client.BackoffPolicy} and falls back to polling {@code /status/{id}}
 * ({@link com.phillippitts.petpal.client.RestStatusEndpointClient}) when push keeps failing.
 */
package com.phillippitts.petpal.client;
