package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.Notification;
import com.phillippitts.petpal.domain.StatusNotification;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Client-side status observer with a push backend and a pull backend behind one interface.
 *
 * <p>Starts on the push channel. When the stream cannot be opened or drops, reconnection is attempted
 * with {@link BackoffPolicy} delays; a successful connection resets the attempt counter. Once
 * {@code maxReconnectAttempts} reconnections have failed in a row the subscriber switches to polling
 * the status endpoint for the tracked request, permanently for this session, and stops polling when
 * that request reaches a terminal state.
 *
 * <p>Consumers only see {@link CommandSnapshot}s for the tracked request id, whichever backend
 * delivered them. Thread-safe.
 */
public final class StatusSubscriber implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StatusSubscriber.class);

    private final PushChannel push;
    private final StatusEndpointClient pull;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService ownedReaders;
    private final BackoffPolicy backoff;
    private final StatusSubscriberSettings settings;
    private final Consumer<CommandSnapshot> listener;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private PushChannel.Connection connection;
    private ScheduledFuture<?> pollTask;
    private String trackedRequestId;
    private CommandSnapshot latest;
    private int reconnectAttempts;
    private boolean closed;

    public StatusSubscriber(PushChannel push,
                            StatusEndpointClient pull,
                            ScheduledExecutorService scheduler,
                            BackoffPolicy backoff,
                            StatusSubscriberSettings settings,
                            Consumer<CommandSnapshot> listener) {
        this(push, pull, scheduler, null, backoff, settings, listener);
    }

    private StatusSubscriber(PushChannel push,
                             StatusEndpointClient pull,
                             ScheduledExecutorService scheduler,
                             ExecutorService ownedReaders,
                             BackoffPolicy backoff,
                             StatusSubscriberSettings settings,
                             Consumer<CommandSnapshot> listener) {
        this.push = Objects.requireNonNull(push, "push");
        this.pull = Objects.requireNonNull(pull, "pull");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownedReaders = ownedReaders;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Subscriber for a server at {@code baseUrl} over SSE and REST, with its own daemon threads.
     */
    public static StatusSubscriber connectTo(String baseUrl,
                                             StatusSubscriberSettings settings,
                                             Consumer<CommandSnapshot> listener) {
        NotificationCodec codec = new NotificationCodec();
        Duration connectTimeout = Duration.ofMillis(settings.connectTimeoutMs());
        ExecutorService readers = Executors.newCachedThreadPool(daemonThreads("status-push-"));
        HttpClient http = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        PushChannel push = new SsePushChannel(http, baseUrl, codec, readers, connectTimeout);
        StatusEndpointClient pull = new RestStatusEndpointClient(new RestTemplate(), baseUrl, codec);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("status-sub-"));
        return new StatusSubscriber(push, pull, scheduler, readers, new BackoffPolicy(settings), settings,
                listener);
    }

    /**
     * Begins connecting on the push channel.
     */
    public void start() {
        synchronized (this) {
            if (closed || state != ConnectionState.DISCONNECTED) {
                return;
            }
            state = ConnectionState.CONNECTING;
        }
        submit(this::connect, 0);
    }

    /**
     * Switches the observed request. Its snapshots are delivered from now on; in polling mode the new
     * request is polled until terminal.
     */
    public void track(String requestId) {
        boolean startPolling;
        synchronized (this) {
            trackedRequestId = requestId;
            latest = null;
            startPolling = state == ConnectionState.CONNECTED_POLL;
        }
        if (startPolling) {
            restartPolling();
        }
    }

    public synchronized ConnectionState getConnectionState() {
        return state;
    }

    public synchronized Optional<CommandSnapshot> latest() {
        return Optional.ofNullable(latest);
    }

    public synchronized int getReconnectAttempts() {
        return reconnectAttempts;
    }

    @Override
    public void close() {
        PushChannel.Connection toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            state = ConnectionState.DISCONNECTED;
            toClose = connection;
            connection = null;
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
        }
        if (toClose != null) {
            toClose.close();
        }
        if (ownedReaders != null) {
            scheduler.shutdownNow();
            ownedReaders.shutdownNow();
        }
    }

    private void connect() {
        synchronized (this) {
            if (closed || state == ConnectionState.CONNECTED_POLL) {
                return;
            }
            state = ConnectionState.CONNECTING;
        }
        PushChannel.Connection opened;
        try {
            opened = push.open(new PushListener());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Push connection failed: {}", e.getMessage());
            onPushFailure();
            return;
        }
        boolean discard;
        synchronized (this) {
            discard = closed || state == ConnectionState.CONNECTED_POLL;
            if (!discard) {
                connection = opened;
                state = ConnectionState.CONNECTED_PUSH;
                reconnectAttempts = 0;
            }
        }
        if (discard) {
            opened.close();
        } else {
            LOG.info("Receiving status updates by push");
        }
    }

    private void onPushFailure() {
        long delay;
        int attempt;
        synchronized (this) {
            connection = null;
            if (closed || state == ConnectionState.CONNECTED_POLL) {
                return;
            }
            if (reconnectAttempts >= settings.maxReconnectAttempts()) {
                state = ConnectionState.CONNECTED_POLL;
                LOG.warn("Push unavailable after {} reconnection attempts; polling every {} ms for the rest"
                        + " of the session", reconnectAttempts, settings.pollIntervalMs());
                delay = -1;
                attempt = reconnectAttempts;
            } else {
                attempt = reconnectAttempts++;
                state = ConnectionState.DISCONNECTED;
                delay = backoff.delayFor(attempt);
            }
        }
        if (delay < 0) {
            restartPolling();
            return;
        }
        LOG.info("Reconnecting push in {} ms (attempt {}/{})", delay, attempt + 1, settings.maxReconnectAttempts());
        submit(this::connect, delay);
    }

    private void restartPolling() {
        synchronized (this) {
            if (closed) {
                return;
            }
            if (pollTask != null) {
                pollTask.cancel(false);
            }
            if (trackedRequestId == null) {
                pollTask = null;
                return;
            }
            try {
                pollTask = scheduler.scheduleAtFixedRate(this::poll, 0, settings.pollIntervalMs(),
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.warn("Status polling could not be scheduled: {}", e.getMessage());
                pollTask = null;
            }
        }
    }

    private void poll() {
        String requestId;
        synchronized (this) {
            requestId = trackedRequestId;
        }
        if (requestId == null) {
            return;
        }
        Optional<CommandSnapshot> snapshot;
        try {
            snapshot = pull.fetch(requestId);
        } catch (RuntimeException e) {
            LOG.debug("Status poll for {} failed: {}", requestId, e.getMessage());
            return;
        }
        snapshot.ifPresent(this::apply);
    }

    private void apply(CommandSnapshot snapshot) {
        synchronized (this) {
            if (closed || !snapshot.requestId().equals(trackedRequestId)) {
                return;
            }
            latest = snapshot;
            if (snapshot.isTerminal() && state == ConnectionState.CONNECTED_POLL && pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
                LOG.debug("Request {} is {}; polling stopped", snapshot.requestId(), snapshot.state().wireName());
            }
        }
        try {
            listener.accept(snapshot);
        } catch (RuntimeException e) {
            LOG.warn("Status listener failed for {}: {}", snapshot.requestId(), e.getMessage(), e);
        }
    }

    private void submit(Runnable task, long delayMs) {
        try {
            scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Subscriber scheduler rejected task: {}", e.getMessage());
        }
    }

    private final class PushListener implements PushChannel.Listener {

        @Override
        public void onNotification(Notification notification) {
            if (notification instanceof StatusNotification status) {
                apply(status.snapshot());
            }
        }

        @Override
        public void onDisconnected(Throwable cause) {
            LOG.info("Push stream lost: {}", cause == null ? "closed by server" : cause.toString());
            onPushFailure();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
