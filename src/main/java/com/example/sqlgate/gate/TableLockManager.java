package com.example.sqlgate.gate;

import com.example.sqlgate.util.StatementNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusion per table. Locks are taken in name order, so two callers needing overlapping tables
 * cannot deadlock.
 *
 * <p>With a lock directory, each table lock is also an OS file lock on
 * {@code <dir>/<table>.lock}, which excludes other processes (the MCP server and CLI rollbacks)
 * sharing that directory. Without one, exclusion is limited to this manager.
 */
public class TableLockManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableLockManager.class);
    private static final long FILE_LOCK_POLL_MILLIS = 25;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Path lockDirectory;

    public TableLockManager() {
        this(null);
    }

    public TableLockManager(Path lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public Lease acquire(Collection<String> tables, Duration timeout)
            throws InterruptedException, LockTimeoutException, IOException {
        TreeSet<String> ordered = new TreeSet<>();
        for (String table : tables) {
            String name = StatementNormalizer.normalizeIdentifier(table);
            if (name != null && !name.isEmpty()) {
                ordered.add(name);
            }
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<Held> held = new ArrayList<>();
        try {
            for (String table : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(table, key -> new ReentrantLock());
                if (!lock.tryLock(remaining(deadline), TimeUnit.NANOSECONDS)) {
                    throw timedOut(table, timeout);
                }
                Held entry = new Held(lock);
                held.add(entry);
                if (lockDirectory != null) {
                    entry.fileLock = lockFile(table, deadline, timeout);
                }
            }
        } catch (InterruptedException | LockTimeoutException | IOException | RuntimeException e) {
            release(held);
            throw e;
        }
        return new Lease(new ArrayList<>(ordered), held);
    }

    /**
     * Whether this manager currently holds {@code table}.
     */
    public boolean isLocked(String table) {
        ReentrantLock lock = locks.get(StatementNormalizer.normalizeIdentifier(table));
        return lock != null && lock.isLocked();
    }

    private FileLock lockFile(String table, long deadline, Duration timeout)
            throws IOException, InterruptedException, LockTimeoutException {
        Files.createDirectories(lockDirectory);
        Path file = lockDirectory.resolve(URLEncoder.encode(table, StandardCharsets.UTF_8) + ".lock");
        while (true) {
            FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock;
            try {
                fileLock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // another manager in this JVM holds the file
                fileLock = null;
            } catch (ClosedByInterruptException e) {
                channel.close();
                InterruptedException interrupted = new InterruptedException("Interrupted locking " + file);
                interrupted.initCause(e);
                throw interrupted;
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }
            if (fileLock != null) {
                return fileLock;
            }
            channel.close();

            long remaining = remaining(deadline);
            if (remaining == 0) {
                throw timedOut(table, timeout);
            }
            Thread.sleep(Math.max(1, Math.min(FILE_LOCK_POLL_MILLIS, TimeUnit.NANOSECONDS.toMillis(remaining))));
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private static LockTimeoutException timedOut(String table, Duration timeout) {
        return new LockTimeoutException("Timed out after " + timeout + " waiting for table " + table);
    }

    private static void release(List<Held> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            Held entry = held.get(i);
            if (entry.fileLock != null) {
                try {
                    // closing the channel releases the OS lock
                    entry.fileLock.channel().close();
                } catch (IOException e) {
                    LOGGER.warn("Could not close lock file channel", e);
                }
            }
            entry.lock.unlock();
        }
        held.clear();
    }

    private static final class Held {
        private final ReentrantLock lock;
        private FileLock fileLock;

        private Held(ReentrantLock lock) {
            this.lock = lock;
        }
    }

    /**
     * Held locks; must be closed by the thread that acquired them.
     */
    public static final class Lease implements AutoCloseable {
        private final List<String> tables;
        private final List<Held> held;

        private Lease(List<String> tables, List<Held> held) {
            this.tables = Collections.unmodifiableList(tables);
            this.held = held;
        }

        public List<String> tables() {
            return tables;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
