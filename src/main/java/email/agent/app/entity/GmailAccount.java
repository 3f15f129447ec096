package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * The Gmail mailbox connected by a user. Holds the OAuth token used by the
 * poller and the sender, plus the history cursor for incremental sync.
 */
@Entity
@Table(name = "gmail_accounts")
@Getter
@Setter
@ToString(exclude = {"user", "token"})
@EqualsAndHashCode(exclude = "user")
public class GmailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", unique = true)
    private User user;

    private String emailAddress;

    @Embedded
    private OAuthToken token;

    private String lastHistoryId;

    private Instant lastPolledAt;

    @Enumerated(EnumType.STRING)
    private SyncStatus syncStatus;
}
