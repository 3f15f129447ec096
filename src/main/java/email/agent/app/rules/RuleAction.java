package email.agent.app.rules;

public enum RuleAction {
    AUTO_RESPOND("auto_respond"),
    DRAFT_ONLY("draft_only"),
    IGNORE("ignore"),
    FORWARD("forward");

    private final String value;

    RuleAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RuleAction fromValue(String value) {
        for (RuleAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new InvalidRuleException("Unknown rule action: " + value);
    }
}
