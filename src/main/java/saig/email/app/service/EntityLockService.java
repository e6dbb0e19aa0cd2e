package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes mutations of the same email between the sync tick, the trash sweep and
 * command execution. Locks are keyed by string and removed once nobody holds or waits for them.
 */
@Slf4j
@Service
public class EntityLockService {
    private final Map<String, Entry> locks = new ConcurrentHashMap<>();
    private final long timeoutMillis;

    public EntityLockService(EngineProperties properties) {
        this.timeoutMillis = properties.getLocks().getEntityLockTimeout().toMillis();
    }

    /**
     * Key for one email row. Keyed by remote id so that an insert racing a mutation of the same message shares it.
     */
    public static String remoteKey(String accountId, String remoteId) {
        return "remote:" + accountId + ":" + remoteId;
    }

    public static String actionItemKey(String actionItemId) {
        return "action:" + actionItemId;
    }

    public static String huddleKey(String huddleId) {
        return "huddle:" + huddleId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        return withLocks(List.of(key), action);
    }

    public void runWithLock(String key, Runnable action) {
        withLocks(List.of(key), () -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs {@code action} holding every key. Keys are taken in sorted order so that two
     * callers locking overlapping sets cannot deadlock.
     * @throws ConflictException if a key could not be taken within the timeout
     */
    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(keys));
        List<String> held = new ArrayList<>(ordered.size());
        try {
            for (String key : ordered) {
                acquire(key);
                held.add(key);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                release(held.get(i));
            }
        }
    }

    private void acquire(String key) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!acquired) {
                dereference(key);
            }
        }
        if (!acquired) {
            log.warn("Timed out waiting for lock {}", key);
            throw new ConflictException("Timed out waiting for lock on " + key);
        }
    }

    private void release(String key) {
        Entry entry = locks.get(key);
        if (entry != null) {
            entry.lock.unlock();
            dereference(key);
        }
    }

    private void dereference(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
