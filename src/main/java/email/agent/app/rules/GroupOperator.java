package email.agent.app.rules;

import java.util.Locale;

public enum GroupOperator {
    AND,
    OR;

    public static GroupOperator fromValue(String value) {
        if (value == null) {
            throw new InvalidRuleException("Group operator is missing");
        }
        try {
            return GroupOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Unknown group operator: " + value, e);
        }
    }
}
