package email.agent.app.guardrails;

import email.agent.app.entity.UserSettings;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Which checks run and with what thresholds. Immutable; change guardrails by
 * building a new engine from a new config.
 */
@Value
@Builder(toBuilder = true)
public class GuardrailConfig {
    @Builder.Default
    boolean profanityFilterEnabled = true;
    @Builder.Default
    boolean piiFilterEnabled = true;
    @Builder.Default
    boolean commitmentFilterEnabled = true;
    @Builder.Default
    boolean customKeywordsEnabled = true;
    // 0.0 - 1.0
    @Builder.Default
    double confidenceThreshold = 0.7;
    @Builder.Default
    List<String> customBlockedKeywords = List.of();

    public static GuardrailConfig defaults() {
        return GuardrailConfig.builder().build();
    }

    public static GuardrailConfig from(UserSettings settings) {
        return GuardrailConfig.builder()
                .profanityFilterEnabled(settings.isGuardrailProfanityEnabled())
                .piiFilterEnabled(settings.isGuardrailPiiEnabled())
                .commitmentFilterEnabled(settings.isGuardrailCommitmentEnabled())
                .customKeywordsEnabled(settings.isGuardrailCustomKeywordsEnabled())
                .confidenceThreshold(settings.getGuardrailConfidenceThreshold())
                .customBlockedKeywords(settings.getGuardrailBlockedKeywords() != null
                        ? List.copyOf(settings.getGuardrailBlockedKeywords())
                        : List.of())
                .build();
    }
}
