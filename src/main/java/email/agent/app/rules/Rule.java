package email.agent.app.rules;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, evaluable form of an automation rule.
 */
@Value
@Builder
public class Rule {
    public static final String FORWARD_TO = "forward_to";
    public static final String CUSTOM_PROMPT = "custom_prompt";

    String id;
    String name;
    int priority;
    RuleGroup conditions;
    RuleAction action;
    @Builder.Default
    Map<String, Object> actionConfig = Map.of();
    @Builder.Default
    boolean active = true;

    /**
     * Addresses from {@code forward_to}: a single string, or the non-blank strings of a list.
     */
    public List<String> getForwardTargets() {
        Object targets = actionConfig != null ? actionConfig.get(FORWARD_TO) : null;
        if (targets instanceof String) {
            String target = (String) targets;
            return target.isBlank() ? List.of() : List.of(target);
        }
        if (targets instanceof List) {
            return ((List<?>) targets).stream()
                    .filter(t -> t instanceof String && !((String) t).isBlank())
                    .map(t -> (String) t)
                    .collect(Collectors.toList());
        }
        return List.of();
    }

    public Optional<String> getCustomPrompt() {
        Object prompt = actionConfig != null ? actionConfig.get(CUSTOM_PROMPT) : null;
        if (prompt instanceof String && !((String) prompt).isEmpty()) {
            return Optional.of((String) prompt);
        }
        return Optional.empty();
    }
}
