package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Database-backed, non-reentrant lock keeping at most one sync in flight per account,
 * across every node sharing the database. A held lock expires after
 * {@code saig.locks.account-lock-timeout} so a crashed node cannot block an account forever;
 * a running tick renews it after every committed page.
 */
@Slf4j
@Service
public class AccountLockService {
    private static final String LOCK_TABLE = "account_sync_locks";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final Duration lockTimeout;
    private final String nodeId;

    public AccountLockService(JdbcTemplate jdbcTemplate, Clock clock, EngineProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.lockTimeout = properties.getLocks().getAccountLockTimeout();
        this.nodeId = resolveNodeId();
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "account_id VARCHAR(255) PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Sync lock table initialized");
        } catch (DataAccessException e) {
            log.warn("Could not initialize sync lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * Attempts to take the account's sync lock without waiting.
     * @param accountId Account to lock
     * @return owner token to pass to {@link #releaseLock}, or null if the lock is held elsewhere
     */
    public String tryLock(String accountId) {
        String owner = nodeId + ":" + UUID.randomUUID();
        Instant now = clock.instant();
        Timestamp lockedAt = Timestamp.from(now);
        Timestamp expiresAt = Timestamp.from(now.plus(lockTimeout));

        try {
            if (insertLock(accountId, owner, lockedAt, expiresAt)) {
                log.debug("Acquired sync lock for account: {}", accountId);
                return owner;
            }
        } catch (DataIntegrityViolationException e) {
            log.debug("Sync lock already held for account: {}, checking if expired", accountId);
        }

        int expired = jdbcTemplate.update(
            "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND expires_at < ?",
            accountId, lockedAt
        );
        if (expired > 0) {
            log.warn("Removed expired sync lock for account {}", accountId);
            try {
                if (insertLock(accountId, owner, lockedAt, expiresAt)) {
                    log.debug("Acquired sync lock for account {} after removing expired lock", accountId);
                    return owner;
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("Another sync took the lock for account {} first", accountId);
            }
        }
        return null;
    }

    private boolean insertLock(String accountId, String owner, Timestamp lockedAt, Timestamp expiresAt) {
        int rows = jdbcTemplate.update(
            "INSERT INTO " + LOCK_TABLE + " (account_id, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
            accountId, owner, lockedAt, expiresAt
        );
        return rows > 0;
    }

    /**
     * Pushes the expiry of a held lock one timeout past now.
     * @return false if {@code owner} no longer holds the lock
     */
    public boolean renewLock(String accountId, String owner) {
        Timestamp expiresAt = Timestamp.from(clock.instant().plus(lockTimeout));
        try {
            int rows = jdbcTemplate.update(
                "UPDATE " + LOCK_TABLE + " SET expires_at = ? WHERE account_id = ? AND locked_by = ?",
                expiresAt, accountId, owner
            );
            if (rows == 0) {
                log.warn("Sync lock for account {} is no longer held by {}", accountId, owner);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.error("Error renewing sync lock for account {}: {}", accountId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Releases the lock if {@code owner} still holds it.
     */
    public void releaseLock(String accountId, String owner) {
        try {
            int rows = jdbcTemplate.update(
                "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND locked_by = ?",
                accountId, owner
            );
            if (rows > 0) {
                log.debug("Released sync lock for account: {}", accountId);
            } else {
                log.warn("Sync lock for account {} was not held by {} at release", accountId, owner);
            }
        } catch (DataAccessException e) {
            log.error("Error releasing sync lock for account {}: {}", accountId, e.getMessage(), e);
        }
    }

    private static String resolveNodeId() {
        String id = System.getenv("HOSTNAME");
        if (id == null || id.isEmpty()) {
            id = "node-" + UUID.randomUUID().toString().substring(0, 8);
        }
        return id;
    }
}
