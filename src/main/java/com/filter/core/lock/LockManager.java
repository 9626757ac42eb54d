package com.filter.core.lock;

import com.filter.core.error.BusyException;
import com.filter.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive advisory locks keyed by lock file path.
 *
 * <p>Two levels are needed: the OS file lock serialises separate processes, while the in-JVM
 * {@link ReentrantLock} serialises threads of one process (the JVM refuses overlapping file
 * locks from the same process). Lock files are never deleted, so two processes always contend
 * on the same inode.
 *
 * <p>Locks are not re-entrant across the file level: a holder must not acquire the same path again.
 * An in-JVM lock lives in the map only while some thread holds or waits for it.
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final ConcurrentHashMap<Path, LocalLock> localLocks = new ConcurrentHashMap<>();

    /** Guarded by the map's per-key compute; {@code users} counts holders and waiters. */
    private static final class LocalLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    /**
     * Acquires the lock guarding {@code lockFile}, waiting at most {@code timeout}.
     *
     * @param lockFile file whose OS lock represents the guarded resource; created if absent
     * @param owner    free-form description written into the lock file for diagnostics
     * @param timeout  maximum wait; {@link Duration#ZERO} fails fast
     * @return the held lock
     * @throws BusyException when the lock is still held after {@code timeout}
     */
    public LockHandle acquire(Path lockFile, String owner, Duration timeout) {
        Path key = lockFile.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        LocalLock local = localLocks.compute(key, (k, existing) -> {
            LocalLock entry = existing != null ? existing : new LocalLock();
            entry.users++;
            return entry;
        });

        try {
            if (!local.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.info("Lock {} busy in this process after {}ms", key, timeout.toMillis());
                forget(key);
                throw new BusyException(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forget(key);
            throw new BusyException(key, timeout);
        }

        FileChannel channel = null;
        try {
            Files.createDirectories(key.getParent());
            channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = pollFileLock(channel, deadline);
            if (fileLock == null) {
                log.info("Lock {} held by another process after {}ms", key, timeout.toMillis());
                closeQuietly(channel);
                unlockLocal(key, local);
                throw new BusyException(key, timeout);
            }
            writeOwner(channel, owner);
            log.debug("Acquired lock {} for {}", key, owner);
            return new FileLockHandle(key, channel, fileLock, local);
        } catch (IOException e) {
            closeQuietly(channel);
            unlockLocal(key, local);
            throw new StorageException("Failed to acquire lock " + key, e);
        }
    }

    /**
     * @return number of paths with a live in-JVM lock
     */
    int trackedLocks() {
        return localLocks.size();
    }

    private void unlockLocal(Path key, LocalLock local) {
        local.lock.unlock();
        forget(key);
    }

    private void forget(Path key) {
        localLocks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static FileLock pollFileLock(FileChannel channel, long deadline) throws IOException {
        while (true) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                return lock;
            }
            if (System.nanoTime() >= deadline) {
                return null;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }

    private static void writeOwner(FileChannel channel, String owner) throws IOException {
        channel.truncate(0);
        channel.write(ByteBuffer.wrap((owner + "\n").getBytes(StandardCharsets.UTF_8)), 0);
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Could not close lock channel: {}", e.getMessage());
        }
    }

    private final class FileLockHandle implements LockHandle {

        private final Path lockFile;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final LocalLock local;
        private boolean released;

        FileLockHandle(Path lockFile, FileChannel channel, FileLock fileLock, LocalLock local) {
            this.lockFile = lockFile;
            this.channel = channel;
            this.fileLock = fileLock;
            this.local = local;
        }

        @Override
        public Path lockFile() {
            return lockFile;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                fileLock.release();
            } catch (IOException e) {
                log.warn("Failed to release file lock {}: {}", lockFile, e.getMessage());
            } finally {
                closeQuietly(channel);
                unlockLocal(lockFile, local);
                log.debug("Released lock {}", lockFile);
            }
        }
    }
}
