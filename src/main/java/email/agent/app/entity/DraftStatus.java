package email.agent.app.entity;

import java.util.EnumSet;
import java.util.Set;

public enum DraftStatus {
    PENDING,
    APPROVED,
    REJECTED,
    SENT,
    AUTO_SENT;

    /**
     * Statuses that block a second draft for the same email.
     */
    public static final Set<DraftStatus> ACTIVE = EnumSet.of(PENDING, APPROVED, SENT, AUTO_SENT);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
