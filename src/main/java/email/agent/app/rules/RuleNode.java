package email.agent.app.rules;

/**
 * A node of a rule's condition tree: either a {@link RuleCondition} leaf or a nested {@link RuleGroup}.
 */
public interface RuleNode {
}
