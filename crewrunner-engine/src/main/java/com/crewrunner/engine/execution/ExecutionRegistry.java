package com.crewrunner.engine.execution;

import com.crewrunner.core.exception.DuplicateExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory index of execution records by id.
 * Holds at most one live record per id; terminal records are retained up to a cap.
 */
class ExecutionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRegistry.class);

    private final ConcurrentMap<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Object pruneLock = new Object();

    /**
     * Add a record, replacing a retained terminal record with the same id.
     *
     * @throws DuplicateExecutionException if a live record with the same id exists
     */
    void register(ExecutionRecord record) {
        records.compute(record.executionId(), (id, existing) -> {
            if (existing != null && !existing.isTerminal()) {
                throw new DuplicateExecutionException(id);
            }
            if (existing != null) {
                log.debug("Replacing retained record for execution {} ({})", id, existing.status());
            }
            return record;
        });
    }

    Optional<ExecutionRecord> find(String executionId) {
        return Optional.ofNullable(records.get(executionId));
    }

    Collection<ExecutionRecord> records() {
        return List.copyOf(records.values());
    }

    int size() {
        return records.size();
    }

    long terminalCount() {
        return records.values().stream().filter(ExecutionRecord::isTerminal).count();
    }

    /**
     * Evict the terminal records with the oldest end times until at most {@code cap} remain.
     * Live records are never evicted.
     *
     * @return the number of records evicted
     */
    int pruneTerminal(int cap) {
        synchronized (pruneLock) {
            List<ExecutionRecord> terminal = records.values().stream()
                .filter(ExecutionRecord::isTerminal)
                .sorted(Comparator.comparing(ExecutionRecord::endTime))
                .toList();

            int excess = terminal.size() - cap;
            int evicted = 0;
            for (int i = 0; i < excess; i++) {
                ExecutionRecord record = terminal.get(i);
                if (records.remove(record.executionId(), record)) {
                    evicted++;
                }
            }
            if (evicted > 0) {
                log.debug("Pruned {} terminal execution records (cap {})", evicted, cap);
            }
            return evicted;
        }
    }
}
