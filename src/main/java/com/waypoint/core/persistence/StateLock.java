package com.waypoint.core.persistence;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.error.LockContentionException;
import com.waypoint.core.metrics.WaypointMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Exclusive cross-process lock on the state directory.
 * <p>
 * Backed by an OS file lock, so a crashed holder never blocks later invocations:
 * the kernel drops the lock with the process. The holder writes its pid and
 * acquisition time into the lock file; contention errors name that holder, and
 * metadata older than {@code waypoint.lock.stale-after} found on acquisition is
 * reported as left behind by a crashed process.
 */
@Component
public class StateLock {

    private static final Logger log = LoggerFactory.getLogger(StateLock.class);

    private final WaypointProperties properties;
    private final WaypointMetrics metrics;
    private final Clock clock;

    public StateLock(WaypointProperties properties, WaypointMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Acquires the lock, polling until the configured timeout elapses.
     *
     * @throws LockContentionException if another holder keeps the lock past the timeout
     */
    public Held acquire(StateFiles files) {
        Duration timeout = properties.getLock().getTimeout();
        long pollMs = Math.max(1, properties.getLock().getPollInterval().toMillis());
        Path lockFile = files.lockFile();
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();

        FileChannel channel = open(lockFile);
        try {
            while (true) {
                FileLock lock = tryLock(channel);
                if (lock != null) {
                    long waitedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
                    metrics.recordLockWait(waitedMs, true);
                    claim(channel, lockFile);
                    log.debug("Acquired state lock {} after {}ms", lockFile, waitedMs);
                    return new Held(channel, lock, lockFile);
                }
                if (System.nanoTime() >= deadline) {
                    metrics.recordLockWait(timeout.toMillis(), false);
                    String holder = readHolder(lockFile);
                    close(channel);
                    throw new LockContentionException(lockFile, timeout, holder);
                }
                Thread.sleep(pollMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(channel);
            throw new LockContentionException(lockFile, Duration.ofNanos(System.nanoTime() - start), "interrupted wait");
        } catch (IOException e) {
            close(channel);
            throw new UncheckedIOException("Cannot record lock holder in " + lockFile, e);
        }
    }

    /**
     * Current holder description, or null when the lock is free.
     */
    public String holder(StateFiles files) {
        Path lockFile = files.lockFile();
        if (!Files.exists(lockFile)) {
            return null;
        }
        FileChannel channel = open(lockFile);
        try {
            FileLock trial = tryLock(channel);
            if (trial != null) {
                trial.release();
                return null;
            }
            return readHolder(lockFile);
        } catch (IOException e) {
            log.warn("Cannot check state lock {}: {}", lockFile, e.getMessage());
            return readHolder(lockFile);
        } finally {
            close(channel);
        }
    }

    private FileChannel open(Path lockFile) {
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            return FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open lock file " + lockFile, e);
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // held by another channel in this JVM
            return null;
        }
    }

    private void claim(FileChannel channel, Path lockFile) throws IOException {
        String previous = readHolder(channel);
        if (previous != null && isStale(previous)) {
            log.warn("Recovered stale state lock {} left by {}", lockFile, previous);
        }
        String holder = "pid=" + ProcessHandle.current().pid() + " acquired_at=" + Instant.now(clock);
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(holder.getBytes(StandardCharsets.UTF_8)), 0);
        channel.force(false);
    }

    private boolean isStale(String holder) {
        int at = holder.indexOf("acquired_at=");
        if (at < 0) {
            return true;
        }
        try {
            Instant acquired = Instant.parse(holder.substring(at + "acquired_at=".length()).trim());
            return acquired.plus(properties.getLock().getStaleAfter()).isBefore(Instant.now(clock));
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private static String readHolder(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(size, 1024));
        channel.read(buffer, 0);
        String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8).trim();
        return text.isEmpty() ? null : text;
    }

    private static String readHolder(Path lockFile) {
        try {
            String text = Files.readString(lockFile, StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? null : text;
        } catch (IOException e) {
            return null;
        }
    }

    private static void close(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel: {}", e.getMessage());
        }
    }

    /**
     * A held lock. Closing clears the holder metadata and releases the OS lock.
     */
    public static final class Held implements AutoCloseable {

        private final FileChannel channel;
        private final FileLock lock;
        private final Path lockFile;

        private Held(FileChannel channel, FileLock lock, Path lockFile) {
            this.channel = channel;
            this.lock = lock;
            this.lockFile = lockFile;
        }

        public Path lockFile() {
            return lockFile;
        }

        @Override
        public void close() {
            try {
                if (lock.isValid()) {
                    channel.truncate(0);
                    lock.release();
                }
            } catch (IOException e) {
                log.warn("Failed to release state lock {} cleanly: {}", lockFile, e.getMessage());
            } finally {
                StateLock.close(channel);
            }
        }
    }
}
