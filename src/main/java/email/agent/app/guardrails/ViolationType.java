package email.agent.app.guardrails;

public enum ViolationType {
    PROFANITY,
    PII_CREDIT_CARD,
    PII_SSN,
    PII_PASSWORD,
    COMMITMENT_WORD,
    CUSTOM_KEYWORD,
    LOW_CONFIDENCE
}
