package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * AI generated reply, either awaiting approval or already sent.
 */
@Entity
@Table(name = "drafts", uniqueConstraints = @UniqueConstraint(name = "uq_draft_active_email", columnNames = "active_email_id"))
@Getter
@Setter
@ToString(exclude = {"user", "email", "bodyText"})
@EqualsAndHashCode(exclude = {"user", "email"})
public class Draft {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_id", nullable = false)
    private Email email;

    // Mirrors email id while the draft is active, null otherwise. Unique, so the
    // database rejects a second active draft for the same email.
    @Column(name = "active_email_id")
    private String activeEmailId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "draft_to_addresses", joinColumns = @JoinColumn(name = "draft_id"))
    @Column(name = "address")
    private List<String> toEmails = new ArrayList<>();

    @Column(columnDefinition = "TEXT", nullable = false)
    private String subject;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String bodyText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DraftStatus status = DraftStatus.PENDING;

    private String llmModelUsed;

    @Column(columnDefinition = "TEXT")
    private String llmReasoning;

    private Double llmConfidence;

    private String matchedRuleId;

    private boolean guardrailFlagged = false;

    @Column(columnDefinition = "TEXT")
    private String guardrailViolations;

    private Instant createdAt;
    private Instant sentAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        syncActiveEmailId();
    }

    @PreUpdate
    protected void onUpdate() {
        syncActiveEmailId();
    }

    private void syncActiveEmailId() {
        activeEmailId = status != null && status.isActive() && email != null ? email.getId() : null;
    }
}
