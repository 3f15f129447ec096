package email.agent.app.entity;

public enum BatchJobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
