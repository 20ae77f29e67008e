package com.example.sqlgate.gate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableLockManagerTest {

    private final TableLockManager locks = new TableLockManager();

    @Test
    void leaseNormalizesAndOrdersTables() throws Exception {
        try (TableLockManager.Lease lease = locks.acquire(List.of("Visits", "\"person\"", "visits"), Duration.ofSeconds(1))) {
            assertEquals(List.of("person", "visits"), lease.tables());
            assertTrue(locks.isLocked("VISITS"));
        }
        assertFalse(locks.isLocked("visits"));
    }

    @Test
    void secondCallerTimesOutWhileTableIsHeld() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
            try (TableLockManager.Lease ignored = locks.acquire(List.of("visits"), Duration.ofSeconds(1))) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException | LockTimeoutException | IOException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(held.await(5, TimeUnit.SECONDS));

        assertThrows(LockTimeoutException.class,
                () -> locks.acquire(List.of("person", "visits"), Duration.ofMillis(100)));
        assertFalse(locks.isLocked("person"));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        try (TableLockManager.Lease lease = locks.acquire(List.of("visits"), Duration.ofSeconds(1))) {
            assertEquals(List.of("visits"), lease.tables());
        }
    }

    @Test
    void disjointTablesDoNotBlockEachOther() throws Exception {
        try (TableLockManager.Lease first = locks.acquire(List.of("person"), Duration.ofSeconds(1))) {
            String table = CompletableFuture.supplyAsync(() -> {
                try (TableLockManager.Lease second = locks.acquire(List.of("visits"), Duration.ofMillis(200))) {
                    return second.tables().get(0);
                } catch (InterruptedException | LockTimeoutException | IOException e) {
                    throw new IllegalStateException(e);
                }
            }).get(5, TimeUnit.SECONDS);
            assertEquals("visits", table);
            assertEquals(List.of("person"), first.tables());
        }
    }

    @Test
    void emptyLeaseHoldsNothing() throws Exception {
        try (TableLockManager.Lease lease = locks.acquire(List.of(), Duration.ofMillis(10))) {
            assertTrue(lease.tables().isEmpty());
        }
    }

    @Test
    void managersSharingALockDirectoryExcludeEachOther(@TempDir Path lockDir) throws Exception {
        TableLockManager server = new TableLockManager(lockDir);
        TableLockManager cli = new TableLockManager(lockDir);

        try (TableLockManager.Lease lease = server.acquire(List.of("Visits"), Duration.ofSeconds(1))) {
            assertTrue(Files.exists(lockDir.resolve("visits.lock")));
            assertThrows(LockTimeoutException.class,
                    () -> cli.acquire(List.of("person", "visits"), Duration.ofMillis(150)));
            assertFalse(cli.isLocked("person"));

            try (TableLockManager.Lease other = cli.acquire(List.of("person"), Duration.ofMillis(150))) {
                assertEquals(List.of("person"), other.tables());
            }
        }

        try (TableLockManager.Lease lease = cli.acquire(List.of("visits"), Duration.ofSeconds(1))) {
            assertTrue(cli.isLocked("visits"));
        }
    }

    @Test
    void waiterAcquiresOnceTheOtherManagerReleases(@TempDir Path lockDir) throws Exception {
        TableLockManager server = new TableLockManager(lockDir);
        TableLockManager cli = new TableLockManager(lockDir);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> {
            try (TableLockManager.Lease ignored = server.acquire(List.of("visits"), Duration.ofSeconds(1))) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException | LockTimeoutException | IOException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(held.await(5, TimeUnit.SECONDS));

        CompletableFuture<List<String>> waiter = CompletableFuture.supplyAsync(() -> {
            try (TableLockManager.Lease lease = cli.acquire(List.of("visits"), Duration.ofSeconds(5))) {
                return lease.tables();
            } catch (InterruptedException | LockTimeoutException | IOException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        assertFalse(waiter.isDone());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("visits"), waiter.get(5, TimeUnit.SECONDS));
    }
}
