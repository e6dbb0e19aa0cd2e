package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "mail_accounts")
@Getter
@Setter
@ToString(exclude = "token")
@EqualsAndHashCode(of = "id")
public class MailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true)
    private String emailAddress;

    @Embedded
    private OAuthToken token;

    @Enumerated(EnumType.STRING)
    private SyncStatus syncStatus = SyncStatus.ACTIVE;

    private Instant suspendedAt;

    @Column(length = 1000)
    private String suspendedReason;
}
