package email.agent.app.service;

/**
 * Terminal outcome of running one inbound message through the reply pipeline.
 */
public enum ProcessingResult {
    DRAFT_CREATED,
    AUTO_SENT,
    FORWARDED,
    IGNORED,
    NO_RESPONSE_NEEDED,
    GUARDRAIL_BLOCKED,
    ERROR
}
