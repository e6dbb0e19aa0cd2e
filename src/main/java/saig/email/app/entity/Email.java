package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Local mirror of one remote message. A non-null {@code deletedAt} means the email is in the trash.
 */
@Entity
@Table(name = "emails",
        uniqueConstraints = @UniqueConstraint(name = "uk_emails_account_remote", columnNames = {"account_id", "remote_id"}),
        indexes = @Index(name = "idx_emails_deleted_at", columnList = "deleted_at"))
@Getter
@Setter
@ToString(exclude = {"body", "labels"})
public class Email {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "remote_id", nullable = false, updatable = false)
    private String remoteId;

    private String threadId;

    /** RFC 5322 Message-ID header, used for reply threading. */
    @Column(length = 1000)
    private String messageIdHeader;

    @Column(length = 1000)
    private String sender;

    @Column(length = 2000)
    private String recipients;

    @Column(length = 2000)
    private String subject;

    @Column(length = 65536)
    private String body;

    private Instant receivedAt;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "is_starred")
    private boolean starred;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "email_labels", joinColumns = @JoinColumn(name = "email_id"))
    @Column(name = "label")
    private Set<String> labels = new HashSet<>();

    @Column(name = "deleted_at")
    private Instant deletedAt;

    /** Set while a local trash has not yet been applied to the remote mailbox. */
    private boolean trashSyncPending;

    /** When the remote mailbox refused the trash outright. The local trash stays in place. */
    private Instant trashSyncFailedAt;

    @Column(length = 2000)
    private String trashSyncError;

    private long syncVersion;

    @Column(name = "is_urgent")
    private boolean urgent;

    private int urgencyScore;

    @Column(length = 1000)
    private String urgencyReason;

    private Instant urgencyAnalyzedAt;

    @Version
    private long revision;

    public boolean isTrashed() {
        return deletedAt != null;
    }
}
