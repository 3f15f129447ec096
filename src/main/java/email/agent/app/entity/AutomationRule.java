package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user's stored automation rule. Conditions and action config are kept as the
 * JSON documents the rule editor produces and are parsed when a rule engine is built.
 */
@Entity
@Table(name = "automation_rules")
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(exclude = "user")
public class AutomationRule {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private String name;

    // Lower value is evaluated first
    private int priority = 100;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String conditions;

    @Column(nullable = false)
    private String action;

    @Column(columnDefinition = "TEXT")
    private String actionConfig;

    private boolean active = true;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
