package io.github.drompincen.taskclaw.persistence.file;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class FileLockServiceTest {

    @TempDir
    Path tempDir;

    private FileLockService lockService;
    private ExecutorService executor;
    private Path document;

    @BeforeEach
    void setUp() {
        lockService = new FileLockService();
        executor = Executors.newSingleThreadExecutor();
        document = tempDir.resolve("todo.json");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void acquireCreatesSidecarLockFile() {
        try (FileLockHandle handle = lockService.acquire(document, Duration.ofSeconds(1))) {
            assertThat(handle.isHeld()).isTrue();
            assertThat(Files.exists(tempDir.resolve("todo.json.lock"))).isTrue();
        }
    }

    @Test
    void releasedLockCanBeAcquiredAgain() {
        FileLockHandle first = lockService.acquire(document, Duration.ofSeconds(1));
        first.close();

        try (FileLockHandle second = lockService.acquire(document, Duration.ofSeconds(1))) {
            assertThat(second.isHeld()).isTrue();
        }
        assertThat(first.isHeld()).isFalse();
    }

    @Test
    void otherThreadTimesOutWhileLockIsHeld() throws Exception {
        try (FileLockHandle ignored = lockService.acquire(document, Duration.ofSeconds(1))) {
            Future<?> contender = executor.submit(() -> lockService.acquire(document, Duration.ofMillis(100)).close());

            Throwable thrown = catchThrowable(() -> contender.get(5, TimeUnit.SECONDS));

            assertThat(thrown).isInstanceOf(ExecutionException.class);
            assertThat(thrown.getCause()).isInstanceOfSatisfying(LockTimeoutException.class, timeout -> {
                assertThat(timeout.getErrorCode()).isEqualTo(ErrorCode.LOCK_TIMEOUT);
                assertThat(timeout.isRetryable()).isTrue();
            });
        }
    }

    @Test
    void waiterAcquiresOnceHolderReleases() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        Future<?> holder = executor.submit(() -> {
            try (FileLockHandle ignored = lockService.acquire(document, Duration.ofSeconds(1))) {
                held.countDown();
                Thread.sleep(150);
            }
            return null;
        });
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try (FileLockHandle handle = lockService.acquire(document, Duration.ofSeconds(5))) {
            assertThat(handle.isHeld()).isTrue();
        }
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void reacquiringOnTheSameThreadIsAnError() {
        try (FileLockHandle ignored = lockService.acquire(document, Duration.ofSeconds(1))) {
            assertThatThrownBy(() -> lockService.acquire(document, Duration.ofMillis(50)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void locksOnDifferentDocumentsAreIndependent() {
        try (FileLockHandle a = lockService.acquire(document, Duration.ofSeconds(1));
             FileLockHandle b = lockService.acquire(tempDir.resolve("sessions.json"), Duration.ofSeconds(1))) {
            assertThat(a.isHeld()).isTrue();
            assertThat(b.isHeld()).isTrue();
        }
    }

    @Test
    void closingTwiceIsHarmless() {
        FileLockHandle handle = lockService.acquire(document, Duration.ofSeconds(1));
        handle.close();
        handle.close();

        assertThat(handle.isHeld()).isFalse();
    }
}
