package io.github.drompincen.taskclaw.runtime.retry;

import io.github.drompincen.taskclaw.protocol.error.DurableUpdate;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private Sleeper sleeper;

    @Test
    void retriesRetryableFailuresUntilSuccess() throws InterruptedException {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), sleeper, clock);
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TaskClawException(ErrorCode.LOCK_TIMEOUT, "busy");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        verify(sleeper).sleep(Duration.ofMillis(100));
        verify(sleeper).sleep(Duration.ofMillis(200));
    }

    @Test
    void givesUpAfterMaxAttempts() {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), sleeper, clock);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("op", () -> {
            calls.incrementAndGet();
            throw new TaskClawException(ErrorCode.CHECKSUM_MISMATCH, "changed");
        })).isInstanceOf(TaskClawException.class);

        assertThat(calls).hasValue(3);
    }

    @Test
    void policyFailuresAreNotRetried() throws InterruptedException {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), sleeper, clock);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("op", () -> {
            calls.incrementAndGet();
            throw new TaskClawException(ErrorCode.SCOPE_CONFLICT, "overlap");
        })).hasMessage("overlap");

        assertThat(calls).hasValue(1);
        verify(sleeper, never()).sleep(any());
    }

    @Test
    void durableFailuresAreNotRetried() {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), sleeper, clock);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("op", () -> {
            calls.incrementAndGet();
            throw new TaskClawException(ErrorCode.LOCK_TIMEOUT, "half written").inWrite(DurableUpdate.SESSION_REGISTRY);
        })).isInstanceOf(TaskClawException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void elapsedBudgetStopsRetrying() {
        RetryPolicy tight = new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofMillis(500));
        RetryExecutor executor = new RetryExecutor(tight, sleeper, clock);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("op", () -> {
            calls.incrementAndGet();
            throw new TaskClawException(ErrorCode.LOCK_TIMEOUT, "busy");
        })).isInstanceOf(TaskClawException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void unexpectedExceptionsPropagate() {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), sleeper, clock);

        assertThatThrownBy(() -> executor.run("op", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
    }
}
