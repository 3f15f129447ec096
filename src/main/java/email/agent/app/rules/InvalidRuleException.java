package email.agent.app.rules;

/**
 * A stored rule that cannot be turned into an evaluable rule: unknown operator,
 * field or action, or a condition document that is not valid JSON.
 */
public class InvalidRuleException extends RuntimeException {
    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
