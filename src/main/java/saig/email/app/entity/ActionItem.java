package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "action_items", indexes = @Index(name = "idx_action_items_email", columnList = "email_id"))
@Getter
@Setter
@ToString
public class ActionItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 500)
    private String normalizedTitle;

    @Column(length = 4000)
    private String description;

    private Instant dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActionPriority priority = ActionPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActionStatus status = ActionStatus.PENDING;

    @Enumerated(EnumType.STRING)
    private ActionSource source;

    // Plain id, no ownership: purging the email only clears this field.
    @Column(name = "email_id")
    private String emailId;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    @Version
    private long revision;
}
