package email.agent.app.entity;

public enum SyncStatus {
    ACTIVE,
    EXPIRED,
    ERROR
}
