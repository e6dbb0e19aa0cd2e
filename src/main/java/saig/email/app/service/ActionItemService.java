package saig.email.app.service;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.ActionPriority;
import saig.email.app.entity.ActionSource;
import saig.email.app.entity.ActionStatus;
import saig.email.app.entity.Email;
import saig.email.app.exception.InvalidStateException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.PermissionDeniedException;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.repository.ActionItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ActionItemService {
    private static final Comparator<ActionItem> BY_PRIORITY_THEN_AGE = Comparator
            .comparing(ActionItem::getPriority, Comparator.reverseOrder())
            .thenComparing(ActionItem::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ActionItemRepository actionItemRepository;
    private final EntityLockService entityLockService;
    private final StoreTransactions transactions;
    private final NotificationFanout notificationFanout;
    private final Clock clock;

    public ActionItemService(ActionItemRepository actionItemRepository,
                             EntityLockService entityLockService,
                             StoreTransactions transactions,
                             NotificationFanout notificationFanout,
                             Clock clock) {
        this.actionItemRepository = actionItemRepository;
        this.entityLockService = entityLockService;
        this.transactions = transactions;
        this.notificationFanout = notificationFanout;
        this.clock = clock;
    }

    /**
     * Stores extracted candidates for an email, skipping any whose normalized title matches
     * an item already linked to the email that is not completed. Must run inside the
     * caller's transaction; the caller publishes the returned items after commit.
     */
    public List<ActionItem> recordExtraction(Email email, List<ActionCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<String> open = actionItemRepository.findByEmailIdAndStatusNot(email.getId(), ActionStatus.COMPLETED).stream()
                .map(ActionItem::getNormalizedTitle)
                .collect(Collectors.toSet());

        Instant now = clock.instant();
        List<ActionItem> created = new ArrayList<>();
        for (ActionCandidate candidate : candidates) {
            if (!open.add(candidate.getNormalizedTitle())) {
                continue;
            }
            ActionItem item = newItem(email.getAccountId(), candidate.getTitle(), candidate.getDescription(),
                    candidate.getDueDate(), candidate.getPriority(), ActionSource.EXTRACTED, now);
            item.setEmailId(email.getId());
            created.add(actionItemRepository.save(item));
        }
        if (!created.isEmpty()) {
            log.debug("Created {} action items for email {}", created.size(), email.getId());
        }
        return created;
    }

    public ActionItem create(String accountId, String title, String description, Instant dueDate,
                             ActionPriority priority, ActionSource source, String emailId) {
        Instant now = clock.instant();
        ActionItem saved = transactions.execute(() -> {
            ActionItem item = newItem(accountId, title, description, dueDate,
                    priority != null ? priority : ActionPriority.MEDIUM, source, now);
            item.setEmailId(emailId);
            return actionItemRepository.save(item);
        });
        log.info("Created action item {} for account {}", saved.getId(), accountId);
        notificationFanout.publish(accountId, MailboxChangeEvent.actionItemCreated(accountId, saved.getId()));
        return saved;
    }

    /**
     * PENDING to COMPLETED. Completing a completed item is a no-op; a dismissed item cannot be completed.
     */
    public ActionItem complete(String accountId, String actionItemId) {
        return transition(accountId, actionItemId, ActionStatus.COMPLETED);
    }

    /**
     * PENDING to DISMISSED. Dismissing a dismissed item is a no-op; a completed item cannot be dismissed.
     */
    public ActionItem dismiss(String accountId, String actionItemId) {
        return transition(accountId, actionItemId, ActionStatus.DISMISSED);
    }

    private ActionItem transition(String accountId, String actionItemId, ActionStatus target) {
        boolean[] changed = new boolean[1];
        ActionItem result = entityLockService.withLock(EntityLockService.actionItemKey(actionItemId), () -> transactions.execute(() -> {
            ActionItem item = requireOwned(accountId, actionItemId);
            if (item.getStatus() == target) {
                return item;
            }
            if (item.getStatus() != ActionStatus.PENDING) {
                throw new InvalidStateException("Action item " + actionItemId + " is " + item.getStatus()
                        + " and cannot become " + target);
            }
            Instant now = clock.instant();
            item.setStatus(target);
            item.setUpdatedAt(now);
            if (target == ActionStatus.COMPLETED) {
                item.setCompletedAt(now);
            }
            changed[0] = true;
            return actionItemRepository.save(item);
        }));
        if (changed[0]) {
            log.info("Action item {} is now {}", actionItemId, target);
            notificationFanout.publish(accountId, MailboxChangeEvent.actionItemUpdated(accountId, actionItemId));
        }
        return result;
    }

    public void delete(String accountId, String actionItemId) {
        entityLockService.runWithLock(EntityLockService.actionItemKey(actionItemId), () -> transactions.execute(() -> {
            actionItemRepository.delete(requireOwned(accountId, actionItemId));
            return null;
        }));
        log.info("Deleted action item {}", actionItemId);
        notificationFanout.publish(accountId, MailboxChangeEvent.actionItemUpdated(accountId, actionItemId));
    }

    /**
     * Clears the email reference of every item linked to the email. Runs inside the purge transaction.
     * @return ids of the detached items
     */
    public List<String> detachFromEmail(String emailId) {
        List<String> detached = new ArrayList<>();
        Instant now = clock.instant();
        for (ActionItem item : actionItemRepository.findByEmailId(emailId)) {
            item.setEmailId(null);
            item.setUpdatedAt(now);
            actionItemRepository.save(item);
            detached.add(item.getId());
        }
        return detached;
    }

    /**
     * Items of the account, highest priority first, oldest first within a priority.
     * @param status Optional status filter
     */
    public List<ActionItem> list(String accountId, ActionStatus status) {
        List<ActionItem> items = status != null
                ? actionItemRepository.findByAccountIdAndStatus(accountId, status)
                : actionItemRepository.findByAccountId(accountId);
        return items.stream().sorted(BY_PRIORITY_THEN_AGE).collect(Collectors.toList());
    }

    public List<ActionItem> listForEmail(String accountId, String emailId) {
        return actionItemRepository.findByEmailId(emailId).stream()
                .filter(item -> accountId.equals(item.getAccountId()))
                .sorted(BY_PRIORITY_THEN_AGE)
                .collect(Collectors.toList());
    }

    private ActionItem requireOwned(String accountId, String actionItemId) {
        ActionItem item = actionItemRepository.findById(actionItemId)
                .orElseThrow(() -> new NotFoundException("Action item not found: " + actionItemId));
        if (!accountId.equals(item.getAccountId())) {
            throw new PermissionDeniedException("Action item " + actionItemId + " belongs to another account");
        }
        return item;
    }

    private static ActionItem newItem(String accountId, String title, String description, Instant dueDate,
                                      ActionPriority priority, ActionSource source, Instant now) {
        ActionItem item = new ActionItem();
        item.setAccountId(accountId);
        item.setTitle(title);
        item.setNormalizedTitle(ActionExtractionService.normalizeTitle(title));
        item.setDescription(description);
        item.setDueDate(dueDate);
        item.setPriority(priority);
        item.setSource(source);
        item.setStatus(ActionStatus.PENDING);
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }
}
