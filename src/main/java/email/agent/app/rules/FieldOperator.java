package email.agent.app.rules;

public enum FieldOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    MATCHES_REGEX("matches_regex"),
    IN_LIST("in_list");

    private final String value;

    FieldOperator(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Only IN_LIST compares against a list of values. */
    public boolean takesList() {
        return this == IN_LIST;
    }

    public static FieldOperator fromValue(String value) {
        for (FieldOperator operator : values()) {
            if (operator.value.equals(value)) {
                return operator;
            }
        }
        throw new InvalidRuleException("Unknown condition operator: " + value);
    }
}
