package email.agent.app.entity;

public enum ActivityType {
    DRAFT_CREATED,
    EMAIL_SENT,
    EMAIL_FORWARDED,
    EMAIL_IGNORED,
    GUARDRAIL_BLOCKED,
    BATCH_COMPLETED
}
