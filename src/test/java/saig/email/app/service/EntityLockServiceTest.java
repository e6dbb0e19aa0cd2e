package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.exception.ConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EntityLockServiceTest {
    private EntityLockService entityLockService;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getLocks().setEntityLockTimeout(Duration.ofMillis(200));
        entityLockService = new EntityLockService(properties);
    }

    @Test
    void withLock_ShouldReturnResultAndReleaseKey() {
        // When
        String result = entityLockService.withLock(EntityLockService.remoteKey("acc-1", "m1"), () -> "done");

        // Then
        assertEquals("done", result);
        assertEquals(0, entityLockService.activeKeys());
    }

    @Test
    void withLock_WhenActionThrows_ShouldStillRelease() {
        // When
        assertThrows(IllegalStateException.class, () -> entityLockService.withLock("k", () -> {
            throw new IllegalStateException("boom");
        }));

        // Then
        assertEquals(0, entityLockService.activeKeys());
    }

    @Test
    void withLock_SameKeyFromTwoThreads_ShouldNotOverlap() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(2);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        Runnable work = () -> entityLockService.runWithLock("remote:acc-1:m1", () -> {
            int now = inside.incrementAndGet();
            maxInside.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inside.decrementAndGet();
        });

        // When
        try {
            Future<?> first = pool.submit(work);
            Future<?> second = pool.submit(work);
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertEquals(1, maxInside.get());
    }

    @Test
    void withLock_HeldElsewhereBeyondTimeout_ShouldThrowConflict() throws Exception {
        // Given
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> entityLockService.runWithLock("huddle:h1", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        // When & Then
        try {
            assertThrows(ConflictException.class, () -> entityLockService.withLock("huddle:h1", () -> "late"));
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertEquals(0, entityLockService.activeKeys());
    }

    @Test
    void withLocks_ShouldAcceptDuplicateKeys() {
        // When
        Integer result = entityLockService.withLocks(List.of("b", "a", "b"), () -> 42);

        // Then
        assertEquals(42, result);
        assertEquals(0, entityLockService.activeKeys());
    }
}
