package saig.email.app.service;

import saig.email.app.entity.Email;
import saig.email.app.entity.MailAccount;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.provider.FlagChange;
import saig.email.app.provider.OutgoingMessage;
import saig.email.app.provider.RemoteMailboxAdapter;
import saig.email.app.provider.TokenProvider;
import saig.email.app.repository.EmailRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * User-driven mailbox operations that reach the remote mailbox: flag changes, compose and reply.
 */
@Slf4j
@Service
public class EmailActionService {
    private static final String REPLY_PREFIX = "Re: ";

    private final EmailRepository emailRepository;
    private final LocalStoreService localStoreService;
    private final RemoteMailboxAdapter remoteMailboxAdapter;
    private final TokenProvider tokenProvider;
    private final EntityLockService entityLockService;
    private final StoreTransactions transactions;
    private final NotificationFanout notificationFanout;

    public EmailActionService(EmailRepository emailRepository,
                              LocalStoreService localStoreService,
                              RemoteMailboxAdapter remoteMailboxAdapter,
                              TokenProvider tokenProvider,
                              EntityLockService entityLockService,
                              StoreTransactions transactions,
                              NotificationFanout notificationFanout) {
        this.emailRepository = emailRepository;
        this.localStoreService = localStoreService;
        this.remoteMailboxAdapter = remoteMailboxAdapter;
        this.tokenProvider = tokenProvider;
        this.entityLockService = entityLockService;
        this.transactions = transactions;
        this.notificationFanout = notificationFanout;
    }

    public Email setRead(MailAccount account, String emailId, boolean read) {
        return applyFlags(account, emailId, FlagChange.read(read));
    }

    public Email setStarred(MailAccount account, String emailId, boolean starred) {
        return applyFlags(account, emailId, FlagChange.starred(starred));
    }

    /**
     * Pushes the flag change to the remote mailbox, then records it locally. Local state is
     * untouched if the remote call fails.
     */
    public Email applyFlags(MailAccount account, String emailId, FlagChange flags) {
        String accountId = account.getId();
        Email email = localStoreService.requireOwned(accountId, emailId);
        boolean[] changed = new boolean[1];
        Email result = entityLockService.withLock(EntityLockService.remoteKey(accountId, email.getRemoteId()), () -> {
            Email current = localStoreService.requireOwned(accountId, emailId);
            if (!differs(current, flags)) {
                return current;
            }
            remoteMailboxAdapter.applyFlags(account, tokenProvider.getValidToken(account), current.getRemoteId(), flags);
            return transactions.execute(() -> {
                Email fresh = localStoreService.requireOwned(accountId, emailId);
                if (flags.getRead() != null) {
                    fresh.setRead(flags.getRead());
                }
                if (flags.getStarred() != null) {
                    fresh.setStarred(flags.getStarred());
                }
                changed[0] = true;
                return emailRepository.save(fresh);
            });
        });
        if (changed[0]) {
            log.debug("Updated flags {} on email {}", flags, emailId);
            notificationFanout.publish(accountId, MailboxChangeEvent.emailUpdated(accountId, emailId));
        }
        return result;
    }

    private static boolean differs(Email email, FlagChange flags) {
        return (flags.getRead() != null && flags.getRead() != email.isRead())
                || (flags.getStarred() != null && flags.getStarred() != email.isStarred());
    }

    /**
     * Sends a new message and stores the sent copy.
     * @throws IncompleteIntentException if there is no recipient
     */
    public Email compose(MailAccount account, List<String> to, List<String> cc, String subject, String body) {
        List<String> missing = new ArrayList<>();
        if (to == null || to.isEmpty()) {
            missing.add("to");
        }
        if (body == null) {
            missing.add("body");
        }
        if (!missing.isEmpty()) {
            throw new IncompleteIntentException("compose", missing);
        }
        OutgoingMessage message = OutgoingMessage.builder()
                .from(account.getEmailAddress())
                .to(List.copyOf(to))
                .cc(cc != null ? List.copyOf(cc) : List.of())
                .subject(subject != null ? subject : "")
                .body(body)
                .build();
        return send(account, message);
    }

    /**
     * Replies to the sender of an email, in the same thread.
     */
    public Email reply(MailAccount account, String emailId, String body) {
        if (body == null || body.isBlank()) {
            throw new IncompleteIntentException("reply", List.of("body"));
        }
        Email original = localStoreService.requireOwned(account.getId(), emailId);
        if (original.getSender() == null || original.getSender().isBlank()) {
            throw new IncompleteIntentException("reply", List.of("to"));
        }
        String subject = original.getSubject() != null ? original.getSubject() : "";
        if (!subject.regionMatches(true, 0, REPLY_PREFIX, 0, REPLY_PREFIX.length())) {
            subject = REPLY_PREFIX + subject;
        }
        OutgoingMessage message = OutgoingMessage.builder()
                .from(account.getEmailAddress())
                .to(List.of(original.getSender()))
                .cc(List.of())
                .subject(subject)
                .body(body)
                .threadId(original.getThreadId())
                .inReplyTo(original.getMessageIdHeader())
                .build();
        return send(account, message);
    }

    private Email send(MailAccount account, OutgoingMessage message) {
        String remoteId = remoteMailboxAdapter.send(account, tokenProvider.getValidToken(account), message);
        log.info("Sent message {} from account {}", remoteId, account.getEmailAddress());
        return localStoreService.insertSentCopy(account.getId(), remoteId, message);
    }
}
