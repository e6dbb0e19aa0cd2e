package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Marks a purged email so that it stays purged: lifecycle calls on its id fail
 * and sync never re-inserts its remote id.
 */
@Entity
@Table(name = "purge_tombstones",
        uniqueConstraints = @UniqueConstraint(name = "uk_tombstone_account_remote", columnNames = {"account_id", "remote_id"}))
@Getter
@Setter
@NoArgsConstructor
public class PurgeTombstone {
    @Id
    @Column(name = "email_id")
    private String emailId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "remote_id", nullable = false)
    private String remoteId;

    private Instant purgedAt;

    public PurgeTombstone(Email email, Instant purgedAt) {
        this.emailId = email.getId();
        this.accountId = email.getAccountId();
        this.remoteId = email.getRemoteId();
        this.purgedAt = purgedAt;
    }
}
