package io.github.drompincen.taskclaw.runtime.retry;

import io.github.drompincen.taskclaw.protocol.error.DurableUpdate;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Re-runs a whole operation when it fails with a retryable {@link TaskClawException}.
 * Anything else propagates on the first failure, as does a failure that left a document
 * durably changed.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, Clock clock) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public RetryPolicy policy() { return policy; }

    public <T> T execute(String operation, Supplier<T> action) {
        Instant start = clock.instant();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TaskClawException e) {
                if (!e.isRetryable() || e.getDurableUpdate() != DurableUpdate.NONE
                        || attempt >= policy.maxAttempts()) {
                    throw e;
                }
                Duration delay = policy.delayBefore(attempt + 1);
                Duration elapsed = Duration.between(start, clock.instant());
                if (elapsed.plus(delay).compareTo(policy.maxElapsed()) > 0) {
                    log.warn("{} failed with {} and the retry budget of {}ms is spent",
                            operation, e.getErrorCode(), policy.maxElapsed().toMillis());
                    throw e;
                }
                log.info("{} failed with {} (attempt {}/{}), retrying in {}ms",
                        operation, e.getErrorCode(), attempt, policy.maxAttempts(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
