package email.agent.app.entity;

/**
 * User-level policy deciding whether generated replies need human sign-off.
 */
public enum ApprovalMode {
    /** Every reply becomes a pending draft. */
    DRAFT_APPROVAL,
    /** Replies are sent automatically only when an auto_respond rule matched. */
    AUTO_WITH_RULES,
    /** Every reply that passes the guardrails is sent automatically. */
    FULLY_AUTOMATIC
}
