package email.agent.app.rules;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Leaf predicate over one message field. The comparison value is either a single
 * string or a list of strings; a condition built with neither never matches.
 */
@Getter
@ToString(exclude = "pattern")
public final class RuleCondition implements RuleNode {
    private final ConditionField field;
    private final FieldOperator operator;
    private final String textValue;
    private final List<String> listValue;
    private final boolean caseSensitive;
    // Compiled once for MATCHES_REGEX; null when the expression is invalid
    private final Pattern pattern;

    private RuleCondition(ConditionField field, FieldOperator operator, String textValue,
                          List<String> listValue, boolean caseSensitive) {
        if (field == null || operator == null) {
            throw new InvalidRuleException("Condition requires a field and an operator");
        }
        this.field = field;
        this.operator = operator;
        this.textValue = textValue;
        this.listValue = listValue != null ? List.copyOf(listValue) : null;
        this.caseSensitive = caseSensitive;
        this.pattern = operator == FieldOperator.MATCHES_REGEX && textValue != null
                ? compileQuietly(textValue, caseSensitive)
                : null;
    }

    public static RuleCondition of(ConditionField field, FieldOperator operator, String value) {
        return new RuleCondition(field, operator, value, null, false);
    }

    public static RuleCondition of(ConditionField field, FieldOperator operator, String value, boolean caseSensitive) {
        return new RuleCondition(field, operator, value, null, caseSensitive);
    }

    public static RuleCondition ofList(ConditionField field, FieldOperator operator, List<String> values, boolean caseSensitive) {
        return new RuleCondition(field, operator, null, values, caseSensitive);
    }

    public static RuleCondition withoutValue(ConditionField field, FieldOperator operator) {
        return new RuleCondition(field, operator, null, null, false);
    }

    public boolean hasListValue() {
        return listValue != null;
    }

    public boolean hasTextValue() {
        return textValue != null;
    }

    String normalize(String value) {
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }

    private static Pattern compileQuietly(String regex, boolean caseSensitive) {
        try {
            int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
}
