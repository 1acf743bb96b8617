package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hand-written push channels, status clients and schedulers for subscriber tests.
 */
final class ClientTestDoubles {

    private ClientTestDoubles() {
        // Utility class
    }

    static CommandSnapshot snapshot(String requestId, CommandState state) {
        return new CommandSnapshot(requestId, "pick up the ball", state, "grasp", 0.9,
                state.isTerminal() ? "Completed: pick up the ball" : "grasping", 100, List.of("detect"));
    }

    /**
     * Scheduler that records every requested one-shot delay and then runs the task right away.
     */
    static final class RecordingScheduler extends ScheduledThreadPoolExecutor {
        final List<Long> delays = new CopyOnWriteArrayList<>();

        RecordingScheduler() {
            super(1);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            delays.add(unit.toMillis(delay));
            return super.schedule(command, 0, unit);
        }
    }

    /**
     * Push channel whose {@code open} outcomes are scripted; refuses once the script runs out.
     */
    static final class ScriptedPushChannel implements PushChannel {
        private final Deque<Boolean> outcomes = new ConcurrentLinkedDeque<>();
        final AtomicInteger opens = new AtomicInteger();
        final AtomicInteger closes = new AtomicInteger();
        volatile Listener listener;

        ScriptedPushChannel(Boolean... outcomes) {
            this.outcomes.addAll(List.of(outcomes));
        }

        @Override
        public Connection open(Listener listener) throws IOException {
            opens.incrementAndGet();
            Boolean accept = outcomes.poll();
            if (accept == null || !accept) {
                throw new IOException("Connection refused");
            }
            this.listener = listener;
            return closes::incrementAndGet;
        }
    }

    /**
     * Status endpoint answering from a per-request script; the last answer repeats.
     */
    static final class ScriptedStatusClient implements StatusEndpointClient {
        private final Map<String, Deque<CommandSnapshot>> scripts = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();

        ScriptedStatusClient script(String requestId, CommandSnapshot... answers) {
            scripts.put(requestId, new ArrayDeque<>(List.of(answers)));
            return this;
        }

        @Override
        public synchronized Optional<CommandSnapshot> fetch(String requestId) {
            calls.incrementAndGet();
            Deque<CommandSnapshot> script = scripts.get(requestId);
            if (script == null || script.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(script.size() > 1 ? script.poll() : script.peek());
        }
    }
}
