package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.entity.Email;
import saig.email.app.entity.MailAccount;
import saig.email.app.entity.PurgeTombstone;
import saig.email.app.exception.AuthenticationException;
import saig.email.app.exception.InvalidStateException;
import saig.email.app.exception.MailEngineException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.PermanentProviderException;
import saig.email.app.exception.TransientProviderException;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.provider.RemoteMailboxAdapter;
import saig.email.app.provider.TokenProvider;
import saig.email.app.repository.EmailRepository;
import saig.email.app.repository.MailAccountRepository;
import saig.email.app.repository.PurgeTombstoneRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Soft delete, restore and purge of emails.
 * Active to Trashed to Active or Purged; Purged is terminal. Every transition of one email
 * runs under that email's lock, so a restore and a purge of the same id never interleave.
 */
@Slf4j
@Service
public class TrashLifecycleService {
    private final EmailRepository emailRepository;
    private final PurgeTombstoneRepository purgeTombstoneRepository;
    private final MailAccountRepository mailAccountRepository;
    private final LocalStoreService localStoreService;
    private final ActionItemService actionItemService;
    private final RemoteMailboxAdapter remoteMailboxAdapter;
    private final TokenProvider tokenProvider;
    private final EntityLockService entityLockService;
    private final StoreTransactions transactions;
    private final NotificationFanout notificationFanout;
    private final EngineProperties properties;
    private final Clock clock;

    public TrashLifecycleService(EmailRepository emailRepository,
                                 PurgeTombstoneRepository purgeTombstoneRepository,
                                 MailAccountRepository mailAccountRepository,
                                 LocalStoreService localStoreService,
                                 ActionItemService actionItemService,
                                 RemoteMailboxAdapter remoteMailboxAdapter,
                                 TokenProvider tokenProvider,
                                 EntityLockService entityLockService,
                                 StoreTransactions transactions,
                                 NotificationFanout notificationFanout,
                                 EngineProperties properties,
                                 Clock clock) {
        this.emailRepository = emailRepository;
        this.purgeTombstoneRepository = purgeTombstoneRepository;
        this.mailAccountRepository = mailAccountRepository;
        this.localStoreService = localStoreService;
        this.actionItemService = actionItemService;
        this.remoteMailboxAdapter = remoteMailboxAdapter;
        this.tokenProvider = tokenProvider;
        this.entityLockService = entityLockService;
        this.transactions = transactions;
        this.notificationFanout = notificationFanout;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Moves an email to the trash locally, then pushes the trash to the remote mailbox.
     * A remote failure leaves the email trashed locally with the push pending for retry.
     * Trashing a trashed email is a no-op.
     */
    public Email moveToTrash(String accountId, String emailId) {
        Email email = localStoreService.requireOwned(accountId, emailId);
        boolean[] trashedNow = new boolean[1];
        Email result = withEmailLock(email, () -> {
            Email trashed = transactions.execute(() -> {
                Email current = localStoreService.requireOwned(accountId, emailId);
                if (current.isTrashed()) {
                    return current;
                }
                current.setDeletedAt(clock.instant());
                current.setTrashSyncPending(true);
                trashedNow[0] = true;
                return emailRepository.save(current);
            });
            if (trashedNow[0]) {
                return pushRemoteTrash(trashed);
            }
            return trashed;
        });
        if (trashedNow[0]) {
            log.info("Moved email {} to trash for account {}", emailId, accountId);
            notificationFanout.publish(accountId, MailboxChangeEvent.emailUpdated(accountId, emailId));
        } else {
            log.debug("Email {} already in trash", emailId);
        }
        return result;
    }

    /**
     * Takes an email out of the trash. If the trash already reached the remote mailbox, the
     * remote message is untrashed first and local state changes only after that succeeds.
     * @throws InvalidStateException if the email is not in the trash or was purged
     */
    public Email restore(String accountId, String emailId) {
        Email email = localStoreService.requireOwned(accountId, emailId);
        Email restored = withEmailLock(email, () -> {
            Email current = localStoreService.requireOwned(accountId, emailId);
            if (!current.isTrashed()) {
                throw new InvalidStateException("Email " + emailId + " is not in the trash");
            }
            if (!current.isTrashSyncPending()) {
                MailAccount account = requireAccount(accountId);
                remoteMailboxAdapter.untrash(account, tokenProvider.getValidToken(account), current.getRemoteId());
            }
            return transactions.execute(() -> {
                Email fresh = localStoreService.requireOwned(accountId, emailId);
                if (!fresh.isTrashed()) {
                    return fresh;
                }
                fresh.setDeletedAt(null);
                fresh.setTrashSyncPending(false);
                fresh.setTrashSyncFailedAt(null);
                fresh.setTrashSyncError(null);
                return emailRepository.save(fresh);
            });
        });
        log.info("Restored email {} for account {}", emailId, accountId);
        notificationFanout.publish(accountId, MailboxChangeEvent.emailUpdated(accountId, emailId));
        return restored;
    }

    /**
     * Permanently removes a trashed email. Linked action items are kept with their email
     * reference cleared. The purge is recorded so that the id stays purged.
     * @throws InvalidStateException if the email is not in the trash or was already purged
     */
    public void purge(String accountId, String emailId) {
        Email email = localStoreService.requireOwned(accountId, emailId);
        List<String> detached = withEmailLock(email, () -> transactions.execute(() -> {
            Email current = localStoreService.requireOwned(accountId, emailId);
            if (!current.isTrashed()) {
                throw new InvalidStateException("Email " + emailId + " must be in the trash before it can be purged");
            }
            return purgeInTransaction(current);
        }));
        publishPurge(accountId, emailId, detached);
    }

    private List<String> purgeInTransaction(Email email) {
        List<String> detached = actionItemService.detachFromEmail(email.getId());
        emailRepository.delete(email);
        purgeTombstoneRepository.save(new PurgeTombstone(email, clock.instant()));
        return detached;
    }

    private void publishPurge(String accountId, String emailId, List<String> detached) {
        log.info("Purged email {} for account {} ({} action items detached)", emailId, accountId, detached.size());
        List<MailboxChangeEvent> events = new ArrayList<>();
        events.add(MailboxChangeEvent.trashPurged(accountId, emailId));
        for (String actionItemId : detached) {
            events.add(MailboxChangeEvent.actionItemUpdated(accountId, actionItemId));
        }
        notificationFanout.publishAll(events);
    }

    /**
     * Purges every email of the account that is in the trash.
     * @return number of emails purged
     */
    public int emptyTrash(String accountId) {
        int purged = 0;
        for (String emailId : emailRepository.findTrashedIds(accountId)) {
            try {
                purge(accountId, emailId);
                purged++;
            } catch (MailEngineException e) {
                log.warn("Could not purge email {} while emptying trash for account {}: {}", emailId, accountId, e.getMessage());
            }
        }
        log.info("Emptied trash for account {}: {} emails purged", accountId, purged);
        return purged;
    }

    @Scheduled(fixedDelayString = "${saig.trash.sweep-interval-ms:3600000}",
            initialDelayString = "${saig.trash.sweep-interval-ms:3600000}")
    public void scheduledSweep() {
        sweepExpired(Duration.ofDays(properties.getTrash().getRetentionDays()));
    }

    /**
     * Purges every trashed email whose time in the trash exceeds the retention. Each id is
     * re-checked under its lock, so an email restored meanwhile is left alone.
     * @return number of emails purged
     */
    public int sweepExpired(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<String> candidates = emailRepository.findIdsTrashedBefore(cutoff);
        int purged = 0;
        for (String emailId : candidates) {
            try {
                if (purgeIfExpired(emailId, cutoff)) {
                    purged++;
                }
            } catch (RuntimeException e) {
                log.warn("Trash sweep could not purge email {}: {}", emailId, e.getMessage());
            }
        }
        if (purged > 0) {
            log.info("Trash sweep purged {} of {} expired emails", purged, candidates.size());
        }
        return purged;
    }

    private boolean purgeIfExpired(String emailId, Instant cutoff) {
        Email email = emailRepository.findById(emailId).orElse(null);
        if (email == null) {
            return false;
        }
        String accountId = email.getAccountId();
        List<String> detached = withEmailLock(email, () -> transactions.execute(() -> {
            Email current = emailRepository.findById(emailId).orElse(null);
            if (current == null || current.getDeletedAt() == null || !current.getDeletedAt().isBefore(cutoff)) {
                return null;
            }
            return purgeInTransaction(current);
        }));
        if (detached == null) {
            return false;
        }
        publishPurge(accountId, emailId, detached);
        return true;
    }

    /**
     * Retries remote trash calls that failed earlier.
     */
    @Scheduled(fixedDelayString = "${saig.trash.remote-retry-interval-ms:120000}",
            initialDelayString = "${saig.trash.remote-retry-interval-ms:120000}")
    public void retryPendingRemoteTrash() {
        for (String emailId : emailRepository.findIdsWithPendingRemoteTrash()) {
            try {
                emailRepository.findById(emailId).ifPresent(email -> withEmailLock(email, () -> {
                    Email current = emailRepository.findById(emailId).orElse(null);
                    if (current != null && current.isTrashed() && current.isTrashSyncPending()
                            && current.getTrashSyncFailedAt() == null) {
                        pushRemoteTrash(current);
                    }
                    return null;
                }));
            } catch (RuntimeException e) {
                log.warn("Remote trash retry failed for email {}: {}", emailId, e.getMessage());
            }
        }
    }

    /**
     * Calls the remote trash for an email that is trashed locally. Caller holds the email lock.
     */
    private Email pushRemoteTrash(Email email) {
        String rejection = null;
        try {
            MailAccount account = requireAccount(email.getAccountId());
            remoteMailboxAdapter.trash(account, tokenProvider.getValidToken(account), email.getRemoteId());
        } catch (TransientProviderException | AuthenticationException e) {
            log.warn("Remote trash of email {} deferred: {}", email.getId(), e.getMessage());
            return email;
        } catch (PermanentProviderException e) {
            // Retrying cannot succeed. The pending flag stays so sync keeps the local trash.
            log.warn("Remote trash of email {} rejected, no retry: {}", email.getId(), e.getMessage());
            rejection = e.getMessage() != null ? e.getMessage() : "rejected";
        }
        String error = rejection;
        return transactions.execute(() -> {
            Email current = emailRepository.findById(email.getId()).orElse(null);
            if (current == null || !current.isTrashSyncPending()) {
                return current != null ? current : email;
            }
            if (error != null) {
                current.setTrashSyncFailedAt(clock.instant());
                current.setTrashSyncError(error.length() > 2000 ? error.substring(0, 2000) : error);
            } else {
                current.setTrashSyncPending(false);
            }
            return emailRepository.save(current);
        });
    }

    private MailAccount requireAccount(String accountId) {
        return mailAccountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
    }

    private <T> T withEmailLock(Email email, Supplier<T> action) {
        return entityLockService.withLock(EntityLockService.remoteKey(email.getAccountId(), email.getRemoteId()), action);
    }
}
