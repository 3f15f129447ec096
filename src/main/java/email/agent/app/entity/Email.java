package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored copy of an inbound Gmail message plus its processing status.
 */
@Entity
@Table(name = "emails", uniqueConstraints = @UniqueConstraint(name = "uq_user_gmail_id", columnNames = {"user_id", "gmail_id"}))
@Getter
@Setter
@ToString(exclude = {"user", "bodyText", "bodyHtml"})
@EqualsAndHashCode(exclude = "user")
public class Email {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "gmail_id", nullable = false)
    private String gmailId;

    private String threadId;

    // RFC 822 Message-ID header, used for In-Reply-To when answering
    private String messageId;

    private String fromEmail;
    private String fromName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "email_to_addresses", joinColumns = @JoinColumn(name = "email_id"))
    @Column(name = "address")
    private List<String> toEmails = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "email_cc_addresses", joinColumns = @JoinColumn(name = "email_id"))
    @Column(name = "address")
    private List<String> ccEmails = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    @Column(columnDefinition = "TEXT")
    private String bodyText;

    @Column(columnDefinition = "TEXT")
    private String bodyHtml;

    private boolean processed = false;
    private Boolean requiresResponse;

    private Instant receivedAt;
    private Instant processedAt;
}
