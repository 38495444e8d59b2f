package io.github.drompincen.taskclaw.persistence.file;

import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive advisory locks on documents, with bounded wait.
 * <p>
 * The OS lock is taken on a sidecar {@code <file>.lock} so the document itself can be
 * replaced by rename while locked. Because the JVM does not allow two channels of the same
 * process to lock one file, threads are first serialized on a per-path {@link ReentrantLock}.
 * <p>
 * Callers needing both documents must lock the session registry before the task store.
 */
public class FileLockService {

    private static final Logger log = LoggerFactory.getLogger(FileLockService.class);

    public static final String LOCK_SUFFIX = ".lock";
    private static final long POLL_INTERVAL_MS = 20;

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    public FileLockHandle acquire(Path file, Duration timeout) {
        Path key = file.toAbsolutePath().normalize();
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        if (local.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock on " + key + " is already held by this thread");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!local.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeout, e);
        }

        FileChannel channel = null;
        boolean acquired = false;
        try {
            Path lockFile = lockFileFor(key);
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            while (true) {
                FileLock fileLock = channel.tryLock();
                if (fileLock != null) {
                    acquired = true;
                    log.debug("Acquired lock on {}", key);
                    return new FileLockHandle(key, channel, fileLock, local);
                }
                if (System.nanoTime() >= deadline) {
                    throw new LockTimeoutException(key, timeout);
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeout, e);
        } catch (IOException e) {
            throw new TaskClawException(ErrorCode.WRITE_FAILED, "Cannot open lock file for " + key, e)
                    .addContext("file", key.toString());
        } finally {
            if (!acquired) {
                closeQuietly(channel, key);
                local.unlock();
            }
        }
    }

    public static Path lockFileFor(Path file) {
        return file.resolveSibling(file.getFileName() + LOCK_SUFFIX);
    }

    private static void closeQuietly(FileChannel channel, Path key) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel for {}: {}", key, e.getMessage());
        }
    }
}
