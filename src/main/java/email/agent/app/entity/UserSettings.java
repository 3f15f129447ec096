package email.agent.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "user_settings")
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(exclude = "user")
public class UserSettings {
    public static final String DEFAULT_LLM_MODEL = "gpt-4o-mini";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", unique = true, nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApprovalMode approvalMode = ApprovalMode.DRAFT_APPROVAL;

    // LLM settings
    @Column(nullable = false)
    private String llmModel = DEFAULT_LLM_MODEL;

    private double llmTemperature = DEFAULT_TEMPERATURE;

    // Prompt customization
    @Column(columnDefinition = "TEXT")
    private String systemPrompt;

    @Column(columnDefinition = "TEXT")
    private String signature;

    // Guardrails
    private boolean guardrailProfanityEnabled = true;
    private boolean guardrailPiiEnabled = true;
    private boolean guardrailCommitmentEnabled = true;
    private boolean guardrailCustomKeywordsEnabled = true;
    private double guardrailConfidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_blocked_keywords", joinColumns = @JoinColumn(name = "settings_id"))
    @Column(name = "keyword")
    private List<String> guardrailBlockedKeywords = new ArrayList<>();

    /**
     * Settings a user starts with before editing anything. Nothing is persisted here.
     */
    public static UserSettings defaultsFor(User user) {
        UserSettings settings = new UserSettings();
        settings.setUser(user);
        return settings;
    }
}
