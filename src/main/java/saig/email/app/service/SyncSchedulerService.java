package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.entity.MailAccount;
import saig.email.app.entity.SyncCursor;
import saig.email.app.entity.SyncStatus;
import saig.email.app.exception.AuthenticationException;
import saig.email.app.exception.MailEngineException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.provider.FetchPage;
import saig.email.app.provider.RemoteMailboxAdapter;
import saig.email.app.provider.TokenProvider;
import saig.email.app.repository.MailAccountRepository;
import saig.email.app.repository.SyncCursorRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reconciles each account's local mirror with its remote mailbox.
 *
 * Ticks for one account never overlap: every tick, scheduled or manual, first takes the
 * account's sync lock and skips if it is held. A tick fetches pages from the cursor until
 * the adapter reports no more pages or the per-tick page cap is reached. Each page is
 * committed together with the cursor advance. Failures back off exponentially; an
 * authentication failure suspends the account until a valid token is available again.
 */
@Slf4j
@Service
public class SyncSchedulerService {
    private final MailAccountRepository mailAccountRepository;
    private final SyncCursorRepository syncCursorRepository;
    private final RemoteMailboxAdapter remoteMailboxAdapter;
    private final TokenProvider tokenProvider;
    private final LocalStoreService localStoreService;
    private final AccountLockService accountLockService;
    private final BackoffPolicy backoffPolicy;
    private final EngineProperties properties;
    private final Executor syncExecutor;
    private final Clock clock;

    private final Map<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public SyncSchedulerService(MailAccountRepository mailAccountRepository,
                                SyncCursorRepository syncCursorRepository,
                                RemoteMailboxAdapter remoteMailboxAdapter,
                                TokenProvider tokenProvider,
                                LocalStoreService localStoreService,
                                AccountLockService accountLockService,
                                BackoffPolicy backoffPolicy,
                                EngineProperties properties,
                                @Qualifier("syncExecutor") Executor syncExecutor,
                                Clock clock) {
        this.mailAccountRepository = mailAccountRepository;
        this.syncCursorRepository = syncCursorRepository;
        this.remoteMailboxAdapter = remoteMailboxAdapter;
        this.tokenProvider = tokenProvider;
        this.localStoreService = localStoreService;
        this.accountLockService = accountLockService;
        this.backoffPolicy = backoffPolicy;
        this.properties = properties;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    /**
     * Submits a tick for every schedulable account whose backoff has elapsed.
     * Suspended accounts are probed on the same schedule so they resume on their own.
     */
    @Scheduled(fixedDelayString = "${saig.sync.tick-interval-ms:30000}",
            initialDelayString = "${saig.sync.initial-delay-ms:10000}")
    public void scheduledTick() {
        if (shuttingDown) {
            return;
        }
        Instant now = clock.instant();
        List<MailAccount> accounts = mailAccountRepository.findBySyncStatusIn(
                EnumSet.of(SyncStatus.ACTIVE, SyncStatus.UNAUTHENTICATED));
        int submitted = 0;
        for (MailAccount account : accounts) {
            SyncCursor cursor = syncCursorRepository.findById(account.getId()).orElse(null);
            if (cursor != null && cursor.getNextAttemptAt() != null && cursor.getNextAttemptAt().isAfter(now)) {
                log.debug("Account {} backing off until {}", account.getEmailAddress(), cursor.getNextAttemptAt());
                continue;
            }
            try {
                syncExecutor.execute(() -> runTick(account.getId()));
                submitted++;
            } catch (RejectedExecutionException e) {
                log.warn("Sync executor saturated, account {} waits for the next tick", account.getEmailAddress());
            }
        }
        log.debug("Submitted {} of {} accounts for sync", submitted, accounts.size());
    }

    /**
     * Runs one tick now, ignoring backoff. Still skips if a tick for the account is in flight.
     */
    public SyncResult triggerSync(String accountId) {
        if (!mailAccountRepository.existsById(accountId)) {
            throw new NotFoundException("Account not found: " + accountId);
        }
        log.info("Manual sync requested for account {}", accountId);
        return runTick(accountId);
    }

    /**
     * One bounded reconciliation pass for the account.
     */
    public SyncResult runTick(String accountId) {
        if (shuttingDown) {
            return SyncResult.of(accountId, SyncOutcome.CANCELLED);
        }
        String owner = accountLockService.tryLock(accountId);
        if (owner == null) {
            log.debug("Sync already in flight for account {}, skipping", accountId);
            return SyncResult.of(accountId, SyncOutcome.SKIPPED_IN_FLIGHT);
        }
        AtomicBoolean cancelled = new AtomicBoolean(false);
        inFlight.put(accountId, cancelled);
        try {
            MailAccount account = mailAccountRepository.findById(accountId).orElse(null);
            if (account == null || account.getSyncStatus() == SyncStatus.DISABLED) {
                return SyncResult.of(accountId, SyncOutcome.SKIPPED_DISABLED);
            }
            return tick(account, owner, cancelled);
        } finally {
            inFlight.remove(accountId);
            accountLockService.releaseLock(accountId, owner);
        }
    }

    private SyncResult tick(MailAccount account, String owner, AtomicBoolean cancelled) {
        String accountId = account.getId();
        SyncCursor cursor = syncCursorRepository.findById(accountId).orElseGet(() -> SyncCursor.initial(accountId));
        log.info("Sync tick started for account {} at cursor {}", account.getEmailAddress(), cursor.getPosition());

        String accessToken;
        try {
            accessToken = tokenProvider.getValidToken(account);
        } catch (AuthenticationException e) {
            return suspend(account, cursor, e);
        }
        if (account.getSyncStatus() == SyncStatus.UNAUTHENTICATED) {
            resume(account);
        }

        int maxPages = properties.getSync().getMaxPagesPerTick();
        int pageSize = properties.getSync().getPageSize();
        int pages = 0;
        int created = 0;
        int updated = 0;
        int extractionPasses = 0;
        int itemsCreated = 0;
        SyncOutcome outcome = SyncOutcome.COMPLETED;

        try {
            boolean hasMore = true;
            while (hasMore && pages < maxPages) {
                if (cancelled.get() || shuttingDown) {
                    log.info("Sync tick for account {} cancelled after {} pages", account.getEmailAddress(), pages);
                    outcome = SyncOutcome.CANCELLED;
                    break;
                }
                FetchPage page = remoteMailboxAdapter.fetchSince(account, accessToken, cursor.getPosition(), pageSize);
                PageApplyResult applied = localStoreService.applyPage(accountId, page, cursor);
                pages++;
                created += applied.getCreated();
                updated += applied.getUpdated();
                extractionPasses += applied.getExtractionPasses();
                itemsCreated += applied.getActionItemsCreated();
                hasMore = page.isHasMore();
                log.debug("Account {} page {}: {} records, hasMore={}", account.getEmailAddress(), pages,
                        page.getRecords().size(), hasMore);
                if (hasMore && !accountLockService.renewLock(accountId, owner)) {
                    log.warn("Lost sync lock for account {} after {} pages, stopping", account.getEmailAddress(), pages);
                    outcome = SyncOutcome.CANCELLED;
                    break;
                }
            }
        } catch (AuthenticationException e) {
            return suspend(account, cursor, e);
        } catch (MailEngineException | DataAccessException e) {
            return recordFailure(account, cursor, e, pages, created, updated, extractionPasses, itemsCreated);
        } catch (RuntimeException e) {
            log.error("Unexpected error syncing account {}: {}", account.getEmailAddress(), e.getMessage(), e);
            return recordFailure(account, cursor, e, pages, created, updated, extractionPasses, itemsCreated);
        }

        cursor.setConsecutiveFailures(0);
        cursor.setNextAttemptAt(null);
        cursor.setLastError(null);
        cursor.setLastIngestedCount(created);
        if (outcome == SyncOutcome.COMPLETED) {
            cursor.setLastSuccessAt(clock.instant());
        }
        syncCursorRepository.save(cursor);
        log.info("Sync tick {} for account {}: {} pages, {} new, {} updated, {} action items",
                outcome, account.getEmailAddress(), pages, created, updated, itemsCreated);

        return SyncResult.builder()
                .accountId(accountId)
                .outcome(outcome)
                .pages(pages)
                .created(created)
                .updated(updated)
                .extractionPasses(extractionPasses)
                .actionItemsCreated(itemsCreated)
                .cursor(cursor.getPosition())
                .build();
    }

    private SyncResult recordFailure(MailAccount account, SyncCursor cursor, RuntimeException e,
                                     int pages, int created, int updated, int extractionPasses, int itemsCreated) {
        boolean retryable = !(e instanceof MailEngineException) || ((MailEngineException) e).isRetryable();
        int failures = cursor.getConsecutiveFailures() + 1;
        Duration delay = backoffPolicy.delayAfter(failures);
        Instant nextAttempt = clock.instant().plus(delay);

        cursor.setConsecutiveFailures(failures);
        cursor.setNextAttemptAt(nextAttempt);
        cursor.setLastError(truncate(e.getMessage()));
        cursor.setLastIngestedCount(created);
        saveCursorQuietly(cursor);

        log.warn("Sync tick for account {} failed ({} consecutive, next attempt at {}): {}",
                account.getEmailAddress(), failures, nextAttempt, e.getMessage());

        return SyncResult.builder()
                .accountId(account.getId())
                .outcome(retryable ? SyncOutcome.FAILED_TRANSIENT : SyncOutcome.FAILED)
                .pages(pages)
                .created(created)
                .updated(updated)
                .extractionPasses(extractionPasses)
                .actionItemsCreated(itemsCreated)
                .cursor(cursor.getPosition())
                .error(e.getMessage())
                .build();
    }

    private SyncResult suspend(MailAccount account, SyncCursor cursor, AuthenticationException e) {
        Instant now = clock.instant();
        if (account.getSyncStatus() != SyncStatus.UNAUTHENTICATED) {
            account.setSyncStatus(SyncStatus.UNAUTHENTICATED);
            account.setSuspendedAt(now);
            account.setSuspendedReason(truncate(e.getMessage()));
            mailAccountRepository.save(account);
            log.warn("Sync suspended for account {}: {}", account.getEmailAddress(), e.getMessage());
        } else {
            log.debug("Account {} still unauthenticated", account.getEmailAddress());
        }
        cursor.setNextAttemptAt(now.plus(properties.getSync().getBackoffCap()));
        cursor.setLastError(truncate(e.getMessage()));
        saveCursorQuietly(cursor);
        return SyncResult.builder()
                .accountId(account.getId())
                .outcome(SyncOutcome.SUSPENDED)
                .cursor(cursor.getPosition())
                .error(e.getMessage())
                .build();
    }

    private void resume(MailAccount account) {
        account.setSyncStatus(SyncStatus.ACTIVE);
        account.setSuspendedAt(null);
        account.setSuspendedReason(null);
        mailAccountRepository.save(account);
        log.info("Valid token available again, sync resumed for account {}", account.getEmailAddress());
    }

    private void saveCursorQuietly(SyncCursor cursor) {
        try {
            syncCursorRepository.save(cursor);
        } catch (DataAccessException e) {
            log.error("Could not record sync state for account {}: {}", cursor.getAccountId(), e.getMessage(), e);
        }
    }

    /**
     * Asks the account's in-flight tick to stop before its next page.
     * @return true if a tick was in flight
     */
    public boolean cancel(String accountId) {
        AtomicBoolean flag = inFlight.get(accountId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        log.info("Cancellation requested for sync of account {}", accountId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        inFlight.values().forEach(flag -> flag.set(true));
    }

    public SyncState getSyncState(String accountId) {
        MailAccount account = mailAccountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        SyncCursor cursor = syncCursorRepository.findById(accountId).orElseGet(() -> SyncCursor.initial(accountId));
        return SyncState.builder()
                .accountId(accountId)
                .status(account.getSyncStatus())
                .inFlight(inFlight.containsKey(accountId))
                .lastSuccessAt(cursor.getLastSuccessAt())
                .consecutiveFailures(cursor.getConsecutiveFailures())
                .nextAttemptAt(cursor.getNextAttemptAt())
                .lastIngestedCount(cursor.getLastIngestedCount())
                .lastError(cursor.getLastError())
                .suspendedReason(account.getSuspendedReason())
                .build();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
