package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "huddles")
@Getter
@Setter
@ToString(exclude = {"members", "messages"})
public class Huddle {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false)
    private String creator;

    @Enumerated(EnumType.STRING)
    private HuddleStatus status = HuddleStatus.ACTIVE;

    private Instant createdAt;
    private Instant updatedAt;

    @OneToMany(mappedBy = "huddle", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC, id ASC")
    private List<HuddleMember> members = new ArrayList<>();

    @OneToMany(mappedBy = "huddle", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sentAt ASC, id ASC")
    private List<HuddleMessage> messages = new ArrayList<>();

    @Version
    private long revision;

    public boolean hasMember(String userEmail) {
        return members.stream().anyMatch(m -> m.getUserEmail().equalsIgnoreCase(userEmail));
    }
}
