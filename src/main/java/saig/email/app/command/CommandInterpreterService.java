package saig.email.app.command;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.ActionPriority;
import saig.email.app.entity.ActionSource;
import saig.email.app.entity.ActionStatus;
import saig.email.app.entity.Email;
import saig.email.app.entity.Huddle;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.MailEngineException;
import saig.email.app.exception.UnsupportedIntentException;
import saig.email.app.repository.EmailFilter;
import saig.email.app.service.ActionItemService;
import saig.email.app.service.EmailActionService;
import saig.email.app.service.HuddleService;
import saig.email.app.service.LocalStoreService;
import saig.email.app.service.TrashLifecycleService;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Executes structured intents against the local store and the remote mailbox.
 *
 * Batch intents resolve their targets when they run, then apply the operation to each target
 * on its own: one failing target never rolls back or stops the others, and every target gets
 * its own outcome. Compose, reply and trash are fully validated before anything is sent or changed.
 */
@Slf4j
@Service
public class CommandInterpreterService {
    private static final int DEFAULT_SEARCH_LIMIT = 20;
    private static final int MAX_SEARCH_LIMIT = 100;

    private final LocalStoreService localStoreService;
    private final EmailActionService emailActionService;
    private final TrashLifecycleService trashLifecycleService;
    private final ActionItemService actionItemService;
    private final HuddleService huddleService;

    public CommandInterpreterService(LocalStoreService localStoreService,
                                     EmailActionService emailActionService,
                                     TrashLifecycleService trashLifecycleService,
                                     ActionItemService actionItemService,
                                     HuddleService huddleService) {
        this.localStoreService = localStoreService;
        this.emailActionService = emailActionService;
        this.trashLifecycleService = trashLifecycleService;
        this.actionItemService = actionItemService;
        this.huddleService = huddleService;
    }

    /**
     * @throws UnsupportedIntentException if the intent name is not one of {@link IntentType}
     * @throws IncompleteIntentException if a required parameter is missing; nothing was changed
     */
    public CommandResult executeIntent(MailAccount account, Intent intent) {
        String name = intent != null ? intent.getName() : null;
        IntentType type = IntentType.fromName(name)
                .orElseThrow(() -> new UnsupportedIntentException(String.valueOf(name)));
        IntentParameters params = new IntentParameters(type.externalName(), intent.getParameters());
        log.info("Executing intent {} for account {}", type, account.getEmailAddress());

        switch (type) {
            case SEARCH:
                return search(account, params);
            case MARK_READ:
                return forEachEmail(type, account, params, false, "Marked %d of %d emails as read",
                        id -> emailActionService.setRead(account, id, true));
            case MARK_UNREAD:
                return forEachEmail(type, account, params, false, "Marked %d of %d emails as unread",
                        id -> emailActionService.setRead(account, id, false));
            case STAR:
                return forEachEmail(type, account, params, false, "Starred %d of %d emails",
                        id -> emailActionService.setStarred(account, id, true));
            case UNSTAR:
                return forEachEmail(type, account, params, false, "Unstarred %d of %d emails",
                        id -> emailActionService.setStarred(account, id, false));
            case MOVE_TO_TRASH:
                return forEachEmail(type, account, params, false, "Moved %d of %d emails to trash",
                        id -> trashLifecycleService.moveToTrash(account.getId(), id));
            case RESTORE:
                return forEachEmail(type, account, params, true, "Restored %d of %d emails",
                        id -> trashLifecycleService.restore(account.getId(), id));
            case COMPOSE:
                return compose(account, params);
            case REPLY:
                return reply(account, params);
            case CREATE_ACTION_ITEM:
                return createActionItem(account, params);
            case COMPLETE_ACTION_ITEM:
                return transitionActionItem(type, params, id -> actionItemService.complete(account.getId(), id), "Completed");
            case DISMISS_ACTION_ITEM:
                return transitionActionItem(type, params, id -> actionItemService.dismiss(account.getId(), id), "Dismissed");
            case LIST_ACTION_ITEMS:
                return listActionItems(account, params);
            case CREATE_HUDDLE:
                return createHuddle(account, params);
            case HELP:
                return help();
            default:
                throw new UnsupportedIntentException(type.externalName());
        }
    }

    private CommandResult search(MailAccount account, IntentParameters params) {
        EmailFilter filter = params.filter(Boolean.TRUE.equals(params.bool("inTrash")));
        int limit = DEFAULT_SEARCH_LIMIT;
        String requested = params.string("limit");
        if (requested != null) {
            try {
                limit = Math.max(1, Math.min(MAX_SEARCH_LIMIT, Integer.parseInt(requested)));
            } catch (NumberFormatException e) {
                throw new IncompleteIntentException(IntentType.SEARCH.externalName(), List.of("limit"));
            }
        }
        List<Email> emails = localStoreService.search(account.getId(), filter, limit);
        return CommandResult.builder()
                .intent(IntentType.SEARCH)
                .success(true)
                .message(emails.isEmpty() ? "No emails matched" : "Found " + emails.size() + " emails")
                .emails(emails)
                .build();
    }

    /**
     * Resolves the target emails: explicit ids, or the current matches of a constrained filter.
     */
    private List<String> resolveTargets(IntentType type, MailAccount account, IntentParameters params, boolean inTrash) {
        String single = params.string("emailId", "id");
        if (single != null) {
            return List.of(single);
        }
        List<String> ids = params.stringList("emailIds", "ids");
        if (!ids.isEmpty()) {
            return ids.stream().distinct().collect(Collectors.toList());
        }
        EmailFilter filter = params.filter(inTrash);
        if (!filter.isConstrained()) {
            throw new IncompleteIntentException(type.externalName(), List.of("emailId"));
        }
        return localStoreService.search(account.getId(), filter).stream()
                .map(Email::getId)
                .collect(Collectors.toList());
    }

    private CommandResult forEachEmail(IntentType type, MailAccount account, IntentParameters params, boolean inTrash,
                                       String summary, Consumer<String> operation) {
        List<String> targets = resolveTargets(type, account, params, inTrash);
        if (targets.isEmpty()) {
            return CommandResult.builder().intent(type).success(true).message("No emails matched").build();
        }
        List<TargetOutcome> outcomes = new ArrayList<>(targets.size());
        for (String emailId : targets) {
            outcomes.add(applyToTarget(type, emailId, operation));
        }
        long succeeded = outcomes.stream().filter(TargetOutcome::isSuccess).count();
        String message = String.format(summary, succeeded, targets.size());
        if (succeeded < targets.size()) {
            log.warn("Intent {} for account {}: {} of {} targets failed", type, account.getEmailAddress(),
                    targets.size() - succeeded, targets.size());
        }
        return CommandResult.builder()
                .intent(type)
                .success(succeeded == targets.size())
                .message(message)
                .outcomes(outcomes)
                .build();
    }

    private TargetOutcome applyToTarget(IntentType type, String targetId, Consumer<String> operation) {
        try {
            operation.accept(targetId);
            return TargetOutcome.ok(targetId);
        } catch (MailEngineException | DataAccessException e) {
            log.warn("Intent {} failed for target {}: {}", type, targetId, e.getMessage());
            return TargetOutcome.failed(targetId, e.getMessage());
        }
    }

    private static boolean isValidAddress(String address) {
        try {
            new InternetAddress(address, true);
            return true;
        } catch (AddressException e) {
            return false;
        }
    }

    private CommandResult compose(MailAccount account, IntentParameters params) {
        List<String> missing = params.missing("to", "subject", "body");
        if (!missing.isEmpty()) {
            throw new IncompleteIntentException(IntentType.COMPOSE.externalName(), missing);
        }
        List<String> to = params.stringList("to");
        if (!to.stream().allMatch(CommandInterpreterService::isValidAddress)) {
            throw new IncompleteIntentException(IntentType.COMPOSE.externalName(), List.of("to"));
        }
        Email sent = emailActionService.compose(account, to, params.stringList("cc"),
                params.string("subject"), params.string("body"));
        return CommandResult.builder()
                .intent(IntentType.COMPOSE)
                .success(true)
                .message("Sent to " + String.join(", ", to))
                .outcome(TargetOutcome.ok(sent.getId()))
                .email(sent)
                .build();
    }

    private CommandResult reply(MailAccount account, IntentParameters params) {
        List<String> missing = new ArrayList<>();
        String emailId = params.string("emailId", "id");
        if (emailId == null) {
            missing.add("emailId");
        }
        if (params.string("body") == null) {
            missing.add("body");
        }
        if (!missing.isEmpty()) {
            throw new IncompleteIntentException(IntentType.REPLY.externalName(), missing);
        }
        Email sent = emailActionService.reply(account, emailId, params.string("body"));
        return CommandResult.builder()
                .intent(IntentType.REPLY)
                .success(true)
                .message("Reply sent to " + sent.getRecipients())
                .outcome(TargetOutcome.ok(sent.getId()))
                .email(sent)
                .build();
    }

    private CommandResult createActionItem(MailAccount account, IntentParameters params) {
        String title = params.requireString("title");
        Instant due = params.instant("dueDate", "due_date", "due");
        ActionPriority priority = params.priority("priority");
        ActionItem item = actionItemService.create(account.getId(), title, params.string("description"), due,
                priority, ActionSource.ASSISTANT, params.string("emailId"));
        return CommandResult.builder()
                .intent(IntentType.CREATE_ACTION_ITEM)
                .success(true)
                .message("Created action item: " + item.getTitle())
                .outcome(TargetOutcome.ok(item.getId()))
                .actionItem(item)
                .build();
    }

    private CommandResult transitionActionItem(IntentType type, IntentParameters params,
                                               Function<String, ActionItem> transition,
                                               String verb) {
        String id = params.requireString("actionItemId", "id");
        ActionItem item = transition.apply(id);
        return CommandResult.builder()
                .intent(type)
                .success(true)
                .message(verb + " action item: " + item.getTitle())
                .outcome(TargetOutcome.ok(id))
                .actionItem(item)
                .build();
    }

    private CommandResult listActionItems(MailAccount account, IntentParameters params) {
        ActionStatus status = params.status("status");
        List<ActionItem> items = actionItemService.list(account.getId(), status);
        return CommandResult.builder()
                .intent(IntentType.LIST_ACTION_ITEMS)
                .success(true)
                .message(items.isEmpty() ? "No action items" : items.size() + " action items")
                .actionItems(items)
                .build();
    }

    private CommandResult createHuddle(MailAccount account, IntentParameters params) {
        String name = params.requireString("name");
        Huddle huddle = huddleService.create(account.getId(), account.getEmailAddress(), name,
                params.string("description"), params.stringList("members"));
        return CommandResult.builder()
                .intent(IntentType.CREATE_HUDDLE)
                .success(true)
                .message("Created huddle " + huddle.getName() + " with " + huddle.getMembers().size() + " members")
                .outcome(TargetOutcome.ok(huddle.getId()))
                .huddle(huddle)
                .build();
    }

    private CommandResult help() {
        String names = Arrays.stream(IntentType.values())
                .map(IntentType::externalName)
                .collect(Collectors.joining(", "));
        return CommandResult.builder()
                .intent(IntentType.HELP)
                .success(true)
                .message("I can help with: " + names)
                .build();
    }
}
