package saig.email.app.service;

import saig.email.app.entity.Huddle;
import saig.email.app.entity.HuddleMember;
import saig.email.app.entity.HuddleMessage;
import saig.email.app.entity.HuddleRole;
import saig.email.app.entity.HuddleStatus;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.exception.InvalidStateException;
import saig.email.app.exception.NotFoundException;
import saig.email.app.exception.PermissionDeniedException;
import saig.email.app.notify.MailboxChangeEvent;
import saig.email.app.notify.NotificationFanout;
import saig.email.app.repository.HuddleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
@Service
public class HuddleService {
    private final HuddleRepository huddleRepository;
    private final EntityLockService entityLockService;
    private final StoreTransactions transactions;
    private final NotificationFanout notificationFanout;
    private final Clock clock;

    public HuddleService(HuddleRepository huddleRepository,
                         EntityLockService entityLockService,
                         StoreTransactions transactions,
                         NotificationFanout notificationFanout,
                         Clock clock) {
        this.huddleRepository = huddleRepository;
        this.entityLockService = entityLockService;
        this.transactions = transactions;
        this.notificationFanout = notificationFanout;
        this.clock = clock;
    }

    /**
     * Creates a huddle. The creator joins as owner; other members are de-duplicated
     * case-insensitively and join as members.
     */
    public Huddle create(String accountId, String creator, String name, String description, List<String> members) {
        if (name == null || name.isBlank()) {
            throw new IncompleteIntentException("create_huddle", List.of("name"));
        }
        Instant now = clock.instant();
        Huddle saved = transactions.execute(() -> {
            Huddle huddle = new Huddle();
            huddle.setAccountId(accountId);
            huddle.setName(name.strip());
            huddle.setDescription(description);
            huddle.setCreator(creator);
            huddle.setStatus(HuddleStatus.ACTIVE);
            huddle.setCreatedAt(now);
            huddle.setUpdatedAt(now);
            addMemberEntry(huddle, creator, HuddleRole.OWNER, now);

            Set<String> unique = new LinkedHashSet<>();
            if (members != null) {
                for (String member : members) {
                    if (member != null && !member.isBlank()) {
                        unique.add(member.strip().toLowerCase(Locale.ROOT));
                    }
                }
            }
            for (String member : unique) {
                if (!huddle.hasMember(member)) {
                    addMemberEntry(huddle, member, HuddleRole.MEMBER, now);
                }
            }
            return huddleRepository.save(huddle);
        });
        log.info("Created huddle {} '{}' with {} members", saved.getId(), saved.getName(), saved.getMembers().size());
        notificationFanout.publish(accountId, MailboxChangeEvent.huddleUpdated(accountId, saved.getId()));
        return saved;
    }

    /**
     * Adds a member. Adding an existing member returns the huddle unchanged.
     */
    public Huddle addMember(String accountId, String huddleId, String userEmail) {
        return mutate(accountId, huddleId, huddle -> {
            if (huddle.hasMember(userEmail)) {
                return false;
            }
            addMemberEntry(huddle, userEmail.strip().toLowerCase(Locale.ROOT), HuddleRole.MEMBER, clock.instant());
            return true;
        });
    }

    public Huddle postMessage(String accountId, String huddleId, String senderEmail, String text) {
        return mutate(accountId, huddleId, huddle -> {
            if (huddle.getStatus() != HuddleStatus.ACTIVE) {
                throw new InvalidStateException("Huddle " + huddleId + " is archived");
            }
            if (!huddle.hasMember(senderEmail)) {
                throw new PermissionDeniedException(senderEmail + " is not a member of huddle " + huddleId);
            }
            HuddleMessage message = new HuddleMessage();
            message.setHuddle(huddle);
            message.setSenderEmail(senderEmail);
            message.setBody(text);
            message.setSentAt(clock.instant());
            huddle.getMessages().add(message);
            return true;
        });
    }

    /**
     * Archives a huddle. Huddles are never hard-deleted.
     */
    public Huddle archive(String accountId, String huddleId) {
        return mutate(accountId, huddleId, huddle -> {
            if (huddle.getStatus() == HuddleStatus.ARCHIVED) {
                return false;
            }
            huddle.setStatus(HuddleStatus.ARCHIVED);
            return true;
        });
    }

    public List<Huddle> list(String accountId) {
        return huddleRepository.findByAccountId(accountId);
    }

    public Huddle get(String accountId, String huddleId) {
        return requireOwned(accountId, huddleId);
    }

    private Huddle mutate(String accountId, String huddleId, HuddleMutation mutation) {
        boolean[] changed = new boolean[1];
        Huddle result = entityLockService.withLock(EntityLockService.huddleKey(huddleId), () -> transactions.execute(() -> {
            Huddle huddle = requireOwned(accountId, huddleId);
            if (!mutation.apply(huddle)) {
                return huddle;
            }
            huddle.setUpdatedAt(clock.instant());
            changed[0] = true;
            return huddleRepository.save(huddle);
        }));
        if (changed[0]) {
            notificationFanout.publish(accountId, MailboxChangeEvent.huddleUpdated(accountId, huddleId));
        }
        return result;
    }

    private Huddle requireOwned(String accountId, String huddleId) {
        Huddle huddle = huddleRepository.findById(huddleId)
                .orElseThrow(() -> new NotFoundException("Huddle not found: " + huddleId));
        if (!accountId.equals(huddle.getAccountId())) {
            throw new PermissionDeniedException("Huddle " + huddleId + " belongs to another account");
        }
        return huddle;
    }

    private static void addMemberEntry(Huddle huddle, String userEmail, HuddleRole role, Instant now) {
        HuddleMember member = new HuddleMember();
        member.setHuddle(huddle);
        member.setUserEmail(userEmail);
        member.setRole(role);
        member.setJoinedAt(now);
        huddle.getMembers().add(member);
    }

    @FunctionalInterface
    private interface HuddleMutation {
        /** @return whether the huddle changed */
        boolean apply(Huddle huddle);
    }
}
