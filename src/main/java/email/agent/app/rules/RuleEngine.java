package email.agent.app.rules;

import email.agent.app.message.InboundMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates a user's automation rules against a message.
 * Rules are ordered by ascending priority; equal priorities keep their definition order.
 * Instances are immutable and can be shared between threads; build a new engine when
 * the rule set changes.
 */
@Slf4j
public class RuleEngine {
    private final List<Rule> rules;

    public RuleEngine(List<Rule> rules) {
        List<Rule> sorted = new ArrayList<>(rules);
        // List.sort is stable, which keeps definition order for ties
        sorted.sort(Comparator.comparingInt(Rule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public static RuleEngine empty() {
        return new RuleEngine(List.of());
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * First active rule, in priority order, whose conditions match the message.
     */
    public Optional<Rule> evaluate(InboundMessage message) {
        for (Rule rule : rules) {
            if (rule.isActive() && matches(message, rule.getConditions())) {
                log.debug("Rule '{}' matched message {}", rule.getName(), message.getGmailId());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Every active matching rule in priority order.
     */
    public List<Rule> evaluateAll(InboundMessage message) {
        List<Rule> matching = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.isActive() && matches(message, rule.getConditions())) {
                matching.add(rule);
            }
        }
        return matching;
    }

    public boolean matches(InboundMessage message, RuleNode node) {
        if (node instanceof RuleGroup) {
            RuleGroup group = (RuleGroup) node;
            if (group.getChildren().isEmpty()) {
                return false;
            }
            if (group.getOperator() == GroupOperator.AND) {
                return group.getChildren().stream().allMatch(child -> matches(message, child));
            }
            return group.getChildren().stream().anyMatch(child -> matches(message, child));
        }
        if (node instanceof RuleCondition) {
            return evaluateCondition(message, (RuleCondition) node);
        }
        return false;
    }

    private boolean evaluateCondition(InboundMessage message, RuleCondition condition) {
        String rawFieldValue = condition.getField().extract(message);
        FieldOperator operator = condition.getOperator();

        if (operator.takesList()) {
            if (!condition.hasListValue()) {
                return false;
            }
            String fieldValue = condition.normalize(rawFieldValue);
            return condition.getListValue().stream()
                    .filter(v -> v != null)
                    .map(condition::normalize)
                    .anyMatch(fieldValue::equals);
        }

        // Every other operator compares against a single string
        if (!condition.hasTextValue()) {
            return false;
        }

        if (operator == FieldOperator.MATCHES_REGEX) {
            Pattern pattern = condition.getPattern();
            return pattern != null && pattern.matcher(rawFieldValue).find();
        }

        String fieldValue = condition.normalize(rawFieldValue);
        String target = condition.normalize(condition.getTextValue());
        switch (operator) {
            case EQUALS:
                return fieldValue.equals(target);
            case NOT_EQUALS:
                return !fieldValue.equals(target);
            case CONTAINS:
                return fieldValue.contains(target);
            case NOT_CONTAINS:
                return !fieldValue.contains(target);
            case STARTS_WITH:
                return fieldValue.startsWith(target);
            case ENDS_WITH:
                return fieldValue.endsWith(target);
            default:
                return false;
        }
    }
}
