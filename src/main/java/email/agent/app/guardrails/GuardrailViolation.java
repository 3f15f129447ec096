package email.agent.app.guardrails;

import lombok.Value;

/**
 * One guardrail hit. {@code matchedText} is already masked for sensitive categories.
 */
@Value
public class GuardrailViolation {
    ViolationType violationType;
    String matchedText;
    String description;
}
