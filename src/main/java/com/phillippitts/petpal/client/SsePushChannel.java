package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * {@link PushChannel} reading the server's {@code /events} SSE stream with the JDK {@link HttpClient}.
 *
 * <p>Each connection is read line by line on a thread from {@code readerExecutor}. The SSE event name
 * is informational; the {@code type} field of the JSON payload decides how it is decoded.
 */
public final class SsePushChannel implements PushChannel {

    private static final Logger LOG = LogManager.getLogger(SsePushChannel.class);

    private final HttpClient httpClient;
    private final URI eventsUri;
    private final NotificationCodec codec;
    private final Executor readerExecutor;
    private final Duration connectTimeout;

    public SsePushChannel(HttpClient httpClient, String baseUrl, NotificationCodec codec,
                          Executor readerExecutor, Duration connectTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.eventsUri = URI.create(RestStatusEndpointClient.stripTrailingSlash(baseUrl) + "/events");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.readerExecutor = Objects.requireNonNull(readerExecutor, "readerExecutor");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public Connection open(Listener listener) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(eventsUri)
                .header("Accept", "text/event-stream")
                .timeout(connectTimeout)
                .GET()
                .build();
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while opening push stream", e);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (response.statusCode() != 200 || !contentType.startsWith("text/event-stream")) {
            response.body().close();
            throw new IOException("Push not available: status=" + response.statusCode()
                    + ", contentType=" + contentType);
        }

        SseConnection connection = new SseConnection(response.body(), listener);
        try {
            readerExecutor.execute(connection::read);
        } catch (RejectedExecutionException e) {
            response.body().close();
            throw new IOException("No reader thread available for push stream", e);
        }
        LOG.info("Push stream open: {}", eventsUri);
        return connection;
    }

    private final class SseConnection implements Connection {

        private final Stream<String> lines;
        private final Listener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        SseConnection(Stream<String> lines, Listener listener) {
            this.lines = lines;
            this.listener = listener;
        }

        void read() {
            StringBuilder data = new StringBuilder();
            Throwable failure = null;
            try {
                Iterator<String> it = lines.iterator();
                while (!closed.get() && it.hasNext()) {
                    String line = it.next();
                    if (line.isEmpty()) {
                        dispatch(data);
                        data.setLength(0);
                    } else if (line.startsWith("data:")) {
                        if (data.length() > 0) {
                            data.append('\n');
                        }
                        data.append(fieldValue(line, "data:"));
                    }
                    // other fields and comments are ignored
                }
            } catch (UncheckedIOException | IllegalStateException e) {
                failure = e;
            } finally {
                lines.close();
            }
            if (closed.compareAndSet(false, true)) {
                LOG.info("Push stream ended: {}", failure == null ? "closed by server" : failure.toString());
                listener.onDisconnected(failure);
            }
        }

        private void dispatch(StringBuilder data) {
            if (data.length() == 0) {
                return;
            }
            Notification notification;
            try {
                notification = codec.decode(data.toString());
            } catch (IllegalArgumentException e) {
                LOG.warn("Dropping malformed push message: {}", e.getMessage());
                return;
            }
            listener.onNotification(notification);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                lines.close();
            }
        }
    }

    static String fieldValue(String line, String field) {
        String value = line.substring(field.length());
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
