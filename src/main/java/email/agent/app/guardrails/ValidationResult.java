package email.agent.app.guardrails;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class ValidationResult {
    boolean passed;
    List<GuardrailViolation> violations;

    public static ValidationResult of(List<GuardrailViolation> violations) {
        return new ValidationResult(violations.isEmpty(), List.copyOf(violations));
    }

    /** A failed check turns an auto-send into a pending draft. */
    public boolean shouldDowngradeToDraft() {
        return !passed;
    }

    public String getViolationSummary() {
        return violations.stream()
                .map(GuardrailViolation::getDescription)
                .collect(Collectors.joining("; "));
    }

    public boolean hasViolation(ViolationType type) {
        return violations.stream().anyMatch(v -> v.getViolationType() == type);
    }
}
