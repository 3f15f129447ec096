package email.agent.app.rules;

import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * AND/OR combinator over child nodes. A group with no children never matches,
 * whichever operator it carries.
 */
@Getter
@ToString
public final class RuleGroup implements RuleNode {
    private final GroupOperator operator;
    private final List<RuleNode> children;

    public RuleGroup(GroupOperator operator, List<RuleNode> children) {
        if (operator == null) {
            throw new InvalidRuleException("Group requires an operator");
        }
        this.operator = operator;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public static RuleGroup and(RuleNode... children) {
        return new RuleGroup(GroupOperator.AND, Arrays.asList(children));
    }

    public static RuleGroup or(RuleNode... children) {
        return new RuleGroup(GroupOperator.OR, Arrays.asList(children));
    }
}
