package email.agent.app.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import email.agent.app.entity.AutomationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns stored rule documents into evaluable {@link Rule}s.
 *
 * <p>A condition document looks like:
 * <pre>
 * {"operator": "AND", "rules": [
 *     {"field": "from_email", "operator": "ends_with", "value": "@acme.com"},
 *     {"operator": "OR", "rules": [ ... ]}
 * ]}
 * </pre>
 * A node is a nested group when it has an {@code operator} and a {@code rules} (or
 * {@code children}) key; anything else is a condition. Unknown operators, fields and
 * actions fail here, never during evaluation.
 */
@Slf4j
@Component
public class RuleDefinitionParser {
    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RuleDefinitionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RuleEngine buildEngine(List<AutomationRule> storedRules) {
        List<Rule> rules = new ArrayList<>();
        for (AutomationRule stored : storedRules) {
            rules.add(toRule(stored));
        }
        return new RuleEngine(rules);
    }

    public Rule toRule(AutomationRule stored) {
        try {
            return Rule.builder()
                    .id(stored.getId())
                    .name(stored.getName())
                    .priority(stored.getPriority())
                    .conditions(parseConditions(stored.getConditions()))
                    .action(RuleAction.fromValue(stored.getAction()))
                    .actionConfig(parseActionConfig(stored.getActionConfig()))
                    .active(stored.isActive())
                    .build();
        } catch (InvalidRuleException e) {
            throw new InvalidRuleException("Rule '" + stored.getName() + "' is invalid: " + e.getMessage(), e);
        }
    }

    public RuleGroup parseConditions(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidRuleException("Rule has no condition document");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidRuleException("Condition document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidRuleException("Condition document must be a JSON object");
        }
        return parseGroup(root);
    }

    public Map<String, Object> parseActionConfig(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> config = objectMapper.readValue(json, CONFIG_TYPE);
            return config != null ? config : Map.of();
        } catch (JsonProcessingException e) {
            throw new InvalidRuleException("Action config is not valid JSON", e);
        }
    }

    private RuleGroup parseGroup(JsonNode node) {
        GroupOperator operator = node.has("operator")
                ? GroupOperator.fromValue(node.get("operator").asText())
                : GroupOperator.AND;
        JsonNode items = childrenOf(node);
        List<RuleNode> children = new ArrayList<>();
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                children.add(isGroup(item) ? parseGroup(item) : parseCondition(item));
            }
        }
        return new RuleGroup(operator, children);
    }

    private static boolean isGroup(JsonNode node) {
        return node.has("operator") && (node.has("rules") || node.has("children"));
    }

    private static JsonNode childrenOf(JsonNode node) {
        if (node.has("rules")) {
            return node.get("rules");
        }
        return node.get("children");
    }

    private RuleCondition parseCondition(JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidRuleException("Condition must be a JSON object: " + node);
        }
        ConditionField field = ConditionField.fromValue(textOrNull(node.get("field")));
        FieldOperator operator = FieldOperator.fromValue(textOrNull(node.get("operator")));
        boolean caseSensitive = caseSensitive(node);

        JsonNode value = node.get("value");
        if (value == null || value.isNull() || value.isObject()) {
            // Shape mismatch resolves to a condition that never matches
            log.debug("Condition on {} has no usable value: {}", field.getValue(), value);
            return RuleCondition.withoutValue(field, operator);
        }
        if (value.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : value) {
                if (element.isValueNode() && !element.isNull()) {
                    values.add(element.asText());
                }
            }
            return RuleCondition.ofList(field, operator, values, caseSensitive);
        }
        return RuleCondition.of(field, operator, value.asText(), caseSensitive);
    }

    private static boolean caseSensitive(JsonNode node) {
        JsonNode flag = node.has("case_sensitive") ? node.get("case_sensitive") : node.get("caseSensitive");
        return flag != null && flag.asBoolean(false);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
