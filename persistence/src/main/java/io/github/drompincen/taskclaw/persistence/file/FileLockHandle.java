package io.github.drompincen.taskclaw.persistence.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An exclusive lock on one document. Closing it releases both the OS-level advisory lock
 * and the in-process guard; closing twice is harmless.
 */
public final class FileLockHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileLockHandle.class);

    private final Path file;
    private final FileChannel channel;
    private final FileLock fileLock;
    private final ReentrantLock localLock;
    private boolean released;

    FileLockHandle(Path file, FileChannel channel, FileLock fileLock, ReentrantLock localLock) {
        this.file = file;
        this.channel = channel;
        this.fileLock = fileLock;
        this.localLock = localLock;
    }

    public Path file() { return file; }

    public boolean isHeld() {
        return !released && fileLock.isValid();
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            if (fileLock.isValid()) {
                fileLock.release();
            }
        } catch (IOException e) {
            log.warn("Failed to release file lock on {}: {}", file, e.getMessage());
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close lock channel for {}: {}", file, e.getMessage());
            }
            localLock.unlock();
            log.debug("Released lock on {}", file);
        }
    }
}
