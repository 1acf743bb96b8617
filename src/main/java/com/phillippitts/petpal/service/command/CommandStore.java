package com.phillippitts.petpal.service.command;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.exception.CommandNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory table of command records keyed by request identifier, bounded to the most recent
 * {@code retention} records. Inserting beyond the bound evicts the oldest record.
 */
public final class CommandStore {

    private final Lock lock = new ReentrantLock();
    private final Map<String, CommandRecord> records;
    private final int retention;

    public CommandStore(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be >= 1, got: " + retention);
        }
        this.retention = retention;
        this.records = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CommandRecord> eldest) {
                return size() > CommandStore.this.retention;
            }
        };
    }

    void put(CommandRecord record) {
        lock.lock();
        try {
            records.put(record.requestId(), record);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CommandRecord> find(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(records.get(requestId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current snapshot of a record.
     *
     * @throws CommandNotFoundException if the identifier is unknown or was evicted
     */
    public CommandSnapshot snapshot(String requestId) {
        return find(requestId)
                .map(CommandRecord::snapshot)
                .orElseThrow(() -> new CommandNotFoundException(requestId));
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int getRetention() {
        return retention;
    }
}
