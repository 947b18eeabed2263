package com.crewrunner.core.model;

import com.crewrunner.core.exception.ExecutionCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void requestStop_shouldRaiseFlagOnce() {
        CancellationToken token = new CancellationToken("exec-1");
        assertThat(token.isStopRequested()).isFalse();

        token.requestStop();
        token.requestStop();

        assertThat(token.isStopRequested()).isTrue();
        assertThat(token.getExecutionId()).isEqualTo("exec-1");
    }

    @Test
    void throwIfStopRequested_shouldThrowOnlyAfterStop() {
        CancellationToken token = new CancellationToken("exec-1");
        assertThatCode(token::throwIfStopRequested).doesNotThrowAnyException();

        token.requestStop();

        assertThatThrownBy(token::throwIfStopRequested)
            .isInstanceOf(ExecutionCancelledException.class)
            .hasMessageContaining("exec-1");
    }

    @Test
    void awaitStop_shouldTimeOutWithoutStop() throws Exception {
        CancellationToken token = new CancellationToken("exec-1");

        assertThat(token.awaitStop(Duration.ofMillis(10))).isFalse();
    }

    @Test
    void awaitStop_shouldWakeWaiterWhenStopped() throws Exception {
        CancellationToken token = new CancellationToken("exec-1");
        CountDownLatch woke = new CountDownLatch(1);
        AtomicBoolean observed = new AtomicBoolean();

        Thread waiter = new Thread(() -> {
            try {
                observed.set(token.awaitStop(Duration.ofSeconds(10)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            woke.countDown();
        });
        waiter.start();

        token.requestStop();

        assertThat(woke.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observed).isTrue();
    }
}
