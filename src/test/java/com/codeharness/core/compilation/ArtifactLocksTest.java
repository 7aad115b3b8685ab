package com.codeharness.core.compilation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactLocksTest {

    private final ArtifactLocks locks = new ArtifactLocks();

    @Test
    @DisplayName("an entry is dropped once its lease is closed")
    void evictsReleasedEntries() throws Exception {
        for (int i = 0; i < 50; i++) {
            try (ArtifactLocks.Lease lease = locks.acquire(Path.of("build", "sol" + i))) {
                assertEquals(1, locks.size());
            }
        }
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("a second caller waits until the artifact is released")
    void serializesSameArtifact() throws Exception {
        ArtifactLocks.Lease first = locks.acquire(Path.of("out", "sol"));
        CountDownLatch acquired = new CountDownLatch(1);
        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try (ArtifactLocks.Lease lease = locks.acquire(Path.of("out", ".", "sol"))) {
                acquired.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        assertFalse(acquired.await(200, TimeUnit.MILLISECONDS), "same normalized path must be held");
        assertEquals(1, locks.size());

        first.close();
        second.get(5, TimeUnit.SECONDS);
        assertEquals(0, acquired.getCount());
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("different artifacts do not block each other")
    void independentArtifacts() throws Exception {
        try (ArtifactLocks.Lease a = locks.acquire(Path.of("a"))) {
            CompletableFuture<Integer> other = CompletableFuture.supplyAsync(() -> {
                try (ArtifactLocks.Lease b = locks.acquire(Path.of("b"))) {
                    return locks.size();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return -1;
                }
            });
            assertEquals(2, assertDoesNotThrow(() -> other.get(5, TimeUnit.SECONDS)));
        }
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("an interrupted waiter leaves no entry behind")
    void interruptedWaiter() throws Exception {
        Path artifact = Path.of("shared");
        ArtifactLocks.Lease held = locks.acquire(artifact);
        Thread waiter = new Thread(() -> {
            try (ArtifactLocks.Lease lease = locks.acquire(artifact)) {
                fail("lock should not be granted while held");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(5000);

        assertFalse(waiter.isAlive());
        assertEquals(1, locks.size());
        held.close();
        assertEquals(0, locks.size());
    }
}
