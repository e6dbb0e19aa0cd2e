package saig.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "huddle_messages")
@Getter
@Setter
@ToString(exclude = "huddle")
public class HuddleMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "huddle_id", nullable = false)
    private Huddle huddle;

    @Column(nullable = false)
    private String senderEmail;

    @Column(name = "message_body", length = 4000)
    private String body;

    private Instant sentAt;
}
