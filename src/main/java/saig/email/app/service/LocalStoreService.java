package saig.email.app.service;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.Email;
import saig.email.app.entity.SyncCursor;
import saig.email.app.exception.InvalidStateException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.PermissionDeniedException;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.provider.FetchPage;
import saig.email.app.provider.OutgoingMessage;
import saig.email.app.provider.RemoteMessage;
import saig.email.app.repository.EmailFilter;
import saig.email.app.repository.EmailRepository;
import saig.email.app.repository.EmailSpecifications;
import saig.email.app.repository.PurgeTombstoneRepository;
import saig.email.app.repository.SyncCursorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Local mirror of the remote mailbox: page application during sync, the sent copy
 * written by compose and reply, and the read accessors used by the UI and the assistant.
 */
@Slf4j
@Service
public class LocalStoreService {
    public static final String SENT_LABEL = "SENT";
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "receivedAt");

    private final EmailRepository emailRepository;
    private final PurgeTombstoneRepository purgeTombstoneRepository;
    private final SyncCursorRepository syncCursorRepository;
    private final ActionExtractionService actionExtractionService;
    private final ActionItemService actionItemService;
    private final UrgencyDetectionService urgencyDetectionService;
    private final EntityLockService entityLockService;
    private final StoreTransactions transactions;
    private final NotificationFanout notificationFanout;
    private final Clock clock;

    public LocalStoreService(EmailRepository emailRepository,
                             PurgeTombstoneRepository purgeTombstoneRepository,
                             SyncCursorRepository syncCursorRepository,
                             ActionExtractionService actionExtractionService,
                             ActionItemService actionItemService,
                             UrgencyDetectionService urgencyDetectionService,
                             EntityLockService entityLockService,
                             StoreTransactions transactions,
                             NotificationFanout notificationFanout,
                             Clock clock) {
        this.emailRepository = emailRepository;
        this.purgeTombstoneRepository = purgeTombstoneRepository;
        this.syncCursorRepository = syncCursorRepository;
        this.actionExtractionService = actionExtractionService;
        this.actionItemService = actionItemService;
        this.urgencyDetectionService = urgencyDetectionService;
        this.entityLockService = entityLockService;
        this.transactions = transactions;
        this.notificationFanout = notificationFanout;
        this.clock = clock;
    }

    /**
     * Upserts every record of the page by remote id, runs extraction for new and content-changed
     * emails, and advances the cursor, all in one transaction. Nothing is kept if any step fails.
     * Change events are published after commit.
     */
    public PageApplyResult applyPage(String accountId, FetchPage page, SyncCursor cursor) {
        // Later records for the same remote id supersede earlier ones within a page.
        Map<String, RemoteMessage> records = new LinkedHashMap<>();
        for (RemoteMessage record : page.getRecords()) {
            records.put(record.getRemoteId(), record);
        }
        List<String> keys = records.keySet().stream()
                .map(remoteId -> EntityLockService.remoteKey(accountId, remoteId))
                .collect(Collectors.toList());

        List<MailboxChangeEvent> events = new ArrayList<>();
        PageApplyResult result = entityLockService.withLocks(keys, () -> transactions.execute(() -> {
            events.clear();
            PageApplyResult applied = applyRecords(accountId, records, events);
            // The caller's cursor only moves once the commit has succeeded.
            SyncCursor advanced = cursor.copy();
            advanced.setPosition(page.getNextCursor());
            syncCursorRepository.save(advanced);
            return applied;
        }));
        cursor.setPosition(page.getNextCursor());
        notificationFanout.publishAll(events);
        log.debug("Applied page for account {}: {} created, {} updated, {} skipped",
                accountId, result.getCreated(), result.getUpdated(), result.getSkipped());
        return result;
    }

    private PageApplyResult applyRecords(String accountId, Map<String, RemoteMessage> records,
                                         List<MailboxChangeEvent> events) {
        if (records.isEmpty()) {
            return new PageApplyResult(0, 0, 0, 0, 0);
        }
        Set<String> purged = purgeTombstoneRepository.findByAccountIdAndRemoteIdIn(accountId, records.keySet()).stream()
                .map(t -> t.getRemoteId())
                .collect(Collectors.toSet());
        Map<String, Email> existing = emailRepository.findByAccountIdAndRemoteIdIn(accountId, records.keySet()).stream()
                .collect(Collectors.toMap(Email::getRemoteId, Function.identity()));

        Instant now = clock.instant();
        int created = 0;
        int updated = 0;
        int skipped = 0;
        int extractionPasses = 0;
        int itemsCreated = 0;

        for (RemoteMessage record : records.values()) {
            if (purged.contains(record.getRemoteId())) {
                skipped++;
                continue;
            }
            Email email = existing.get(record.getRemoteId());
            boolean extract;
            if (email == null) {
                email = newEmail(accountId, record, now);
                extract = !email.isTrashed();
                if (extract) {
                    assessUrgency(email, now);
                }
                email = emailRepository.save(email);
                created++;
                events.add(MailboxChangeEvent.emailCreated(accountId, email.getId()));
            } else {
                MergeOutcome outcome = merge(email, record, now);
                if (outcome == MergeOutcome.UNCHANGED) {
                    skipped++;
                    continue;
                }
                extract = outcome == MergeOutcome.CONTENT_CHANGED && !email.isTrashed();
                if (extract) {
                    assessUrgency(email, now);
                }
                email = emailRepository.save(email);
                updated++;
                events.add(MailboxChangeEvent.emailUpdated(accountId, email.getId()));
            }
            if (extract) {
                extractionPasses++;
                List<ActionCandidate> candidates = actionExtractionService.extract(
                        email.getSubject(), email.getBody(), email.getReceivedAt());
                for (ActionItem item : actionItemService.recordExtraction(email, candidates)) {
                    itemsCreated++;
                    events.add(MailboxChangeEvent.actionItemCreated(accountId, item.getId()));
                }
            }
        }
        return new PageApplyResult(created, updated, skipped, extractionPasses, itemsCreated);
    }

    private void assessUrgency(Email email, Instant now) {
        UrgencyAssessment assessment = urgencyDetectionService.assess(
                email.getSubject(), email.getBody(), email.getSender(), email.getReceivedAt());
        email.setUrgent(assessment.isUrgent());
        email.setUrgencyScore(assessment.getScore());
        String reason = assessment.reasonText();
        email.setUrgencyReason(reason.length() > 1000 ? reason.substring(0, 1000) : reason);
        email.setUrgencyAnalyzedAt(now);
    }

    enum MergeOutcome { UNCHANGED, FLAGS_CHANGED, CONTENT_CHANGED }

    /**
     * Remote state overwrites local state, except that a local trash the remote mailbox has not
     * applied yet, whether still pending or refused, is kept.
     */
    static MergeOutcome merge(Email email, RemoteMessage record, Instant now) {
        if (record.getSyncVersion() > 0 && record.getSyncVersion() < email.getSyncVersion()) {
            return MergeOutcome.UNCHANGED;
        }
        boolean contentChanged = !Objects.equals(email.getSubject(), record.getSubject())
                || !Objects.equals(email.getBody(), record.getBody());
        boolean changed = contentChanged
                || email.isRead() != record.isRead()
                || email.isStarred() != record.isStarred()
                || !email.getLabels().equals(record.getLabels())
                || !Objects.equals(email.getSender(), record.getSender())
                || !Objects.equals(email.getRecipients(), record.getRecipients())
                || !Objects.equals(email.getThreadId(), record.getThreadId());

        email.setSubject(record.getSubject());
        email.setBody(record.getBody());
        email.setSender(record.getSender());
        email.setRecipients(record.getRecipients());
        email.setThreadId(record.getThreadId());
        if (record.getMessageIdHeader() != null) {
            email.setMessageIdHeader(record.getMessageIdHeader());
        }
        if (record.getReceivedAt() != null) {
            email.setReceivedAt(record.getReceivedAt());
        }
        email.setRead(record.isRead());
        email.setStarred(record.isStarred());
        email.setLabels(new HashSet<>(record.getLabels()));
        if (record.getSyncVersion() > 0) {
            email.setSyncVersion(record.getSyncVersion());
        }

        if (record.isTrashed()) {
            if (email.getDeletedAt() == null) {
                email.setDeletedAt(now);
                changed = true;
            }
            if (email.isTrashSyncPending()) {
                email.setTrashSyncPending(false);
                email.setTrashSyncFailedAt(null);
                email.setTrashSyncError(null);
                changed = true;
            }
        } else if (email.getDeletedAt() != null && !email.isTrashSyncPending()) {
            email.setDeletedAt(null);
            changed = true;
        }

        if (contentChanged) {
            return MergeOutcome.CONTENT_CHANGED;
        }
        return changed ? MergeOutcome.FLAGS_CHANGED : MergeOutcome.UNCHANGED;
    }

    private static Email newEmail(String accountId, RemoteMessage record, Instant now) {
        Email email = new Email();
        email.setAccountId(accountId);
        email.setRemoteId(record.getRemoteId());
        email.setThreadId(record.getThreadId());
        email.setMessageIdHeader(record.getMessageIdHeader());
        email.setSender(record.getSender());
        email.setRecipients(record.getRecipients());
        email.setSubject(record.getSubject());
        email.setBody(record.getBody());
        email.setReceivedAt(record.getReceivedAt() != null ? record.getReceivedAt() : now);
        email.setRead(record.isRead());
        email.setStarred(record.isStarred());
        email.setLabels(new HashSet<>(record.getLabels()));
        email.setSyncVersion(record.getSyncVersion());
        if (record.isTrashed()) {
            email.setDeletedAt(now);
        }
        return email;
    }

    /**
     * Stores the local copy of a message just sent. Sent copies are not run through extraction.
     * If sync already ingested the message, the existing row is returned.
     */
    public Email insertSentCopy(String accountId, String remoteId, OutgoingMessage message) {
        boolean[] inserted = new boolean[1];
        Email email = entityLockService.withLock(EntityLockService.remoteKey(accountId, remoteId), () -> transactions.execute(() -> {
            return emailRepository.findByAccountIdAndRemoteId(accountId, remoteId).orElseGet(() -> {
                Email sent = new Email();
                sent.setAccountId(accountId);
                sent.setRemoteId(remoteId);
                sent.setThreadId(message.getThreadId());
                sent.setSender(message.getFrom());
                sent.setRecipients(String.join(", ", message.getTo()));
                sent.setSubject(message.getSubject());
                sent.setBody(message.getBody());
                sent.setReceivedAt(clock.instant());
                sent.setRead(true);
                sent.getLabels().add(SENT_LABEL);
                inserted[0] = true;
                return emailRepository.save(sent);
            });
        }));
        if (inserted[0]) {
            notificationFanout.publish(accountId, MailboxChangeEvent.emailCreated(accountId, email.getId()));
        }
        return email;
    }

    /**
     * Loads an email for a lifecycle or flag operation.
     * @throws InvalidStateException if the email was purged
     * @throws NotFoundException if no such email ever existed
     * @throws PermissionDeniedException if the email belongs to another account
     */
    public Email requireOwned(String accountId, String emailId) {
        Email email = emailRepository.findById(emailId).orElse(null);
        if (email == null) {
            if (purgeTombstoneRepository.existsById(emailId)) {
                throw new InvalidStateException("Email " + emailId + " has been purged");
            }
            throw new NotFoundException("Email not found: " + emailId);
        }
        if (!accountId.equals(email.getAccountId())) {
            throw new PermissionDeniedException("Email " + emailId + " belongs to another account");
        }
        return email;
    }

    public Email getEmail(String accountId, String emailId) {
        return requireOwned(accountId, emailId);
    }

    public Page<Email> listInbox(String accountId, int page, int size) {
        return emailRepository.findByAccountIdAndDeletedAtIsNull(accountId, PageRequest.of(page, size, NEWEST_FIRST));
    }

    public Page<Email> listTrash(String accountId, int page, int size) {
        Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "deletedAt"));
        return emailRepository.findByAccountIdAndDeletedAtIsNotNull(accountId, pageable);
    }

    /**
     * Emails matching the filter against current state, newest first.
     */
    public List<Email> search(String accountId, EmailFilter filter) {
        return emailRepository.findAll(EmailSpecifications.matching(accountId, filter), NEWEST_FIRST);
    }

    public List<Email> search(String accountId, EmailFilter filter, int limit) {
        return emailRepository.findAll(EmailSpecifications.matching(accountId, filter), PageRequest.of(0, limit, NEWEST_FIRST))
                .getContent();
    }

    public long countUnread(String accountId) {
        return emailRepository.countByAccountIdAndDeletedAtIsNullAndReadFalse(accountId);
    }
}
