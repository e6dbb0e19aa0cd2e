package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "huddle_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_huddle_member", columnNames = {"huddle_id", "user_email"}))
@Getter
@Setter
@ToString(exclude = "huddle")
public class HuddleMember {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "huddle_id", nullable = false)
    private Huddle huddle;

    @Column(name = "user_email", nullable = false)
    private String userEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "member_role")
    private HuddleRole role = HuddleRole.MEMBER;

    private Instant joinedAt;
}
