package com.crewrunner.engine.execution;

import com.crewrunner.core.exception.DuplicateExecutionException;
import com.crewrunner.core.model.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class ExecutionRegistryTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private final ExecutionRegistry registry = new ExecutionRegistry();

    private static ExecutionRecord record(String id) {
        return new ExecutionRecord(id, T0, new CompletableFuture<String>());
    }

    private static ExecutionRecord finished(String id, long endSecond) {
        ExecutionRecord record = record(id);
        record.transitionTo(ExecutionStatus.COMPLETED, T0.plusSeconds(endSecond));
        return record;
    }

    @Test
    void register_withLiveId_shouldThrowAndKeepExisting() {
        ExecutionRecord live = record("a");
        registry.register(live);

        assertThatThrownBy(() -> registry.register(record("a")))
            .isInstanceOf(DuplicateExecutionException.class)
            .hasMessageContaining("'a'");
        assertThat(registry.find("a")).containsSame(live);
    }

    @Test
    void register_withTerminalId_shouldReplace() {
        registry.register(finished("a", 1));
        ExecutionRecord replacement = record("a");

        registry.register(replacement);

        assertThat(registry.find("a")).containsSame(replacement);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void pruneTerminal_shouldEvictOldestEndTimesFirst() {
        registry.register(finished("third", 30));
        registry.register(finished("first", 10));
        registry.register(finished("second", 20));

        assertThat(registry.pruneTerminal(2)).isEqualTo(1);

        assertThat(registry.find("first")).isEmpty();
        assertThat(registry.find("second")).isPresent();
        assertThat(registry.find("third")).isPresent();
    }

    @Test
    void pruneTerminal_shouldNeverEvictLiveRecords() {
        registry.register(record("live-1"));
        registry.register(record("live-2"));
        registry.register(finished("done", 5));

        assertThat(registry.pruneTerminal(0)).isEqualTo(1);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.terminalCount()).isZero();
    }

    @Test
    void pruneTerminal_underCap_shouldEvictNothing() {
        registry.register(finished("a", 1));
        registry.register(finished("b", 2));

        assertThat(registry.pruneTerminal(100)).isZero();
        assertThat(registry.records()).hasSize(2);
    }
}
