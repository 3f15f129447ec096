package email.agent.app.service;

import lombok.Value;

/**
 * Result of generating the draft for one email of a batch.
 */
@Value
public class BatchItemOutcome {
    public enum Status { DRAFTED, SKIPPED, FAILED }

    String emailId;
    Status status;
    String draftId;
    String reason;

    public static BatchItemOutcome drafted(String emailId, String draftId) {
        return new BatchItemOutcome(emailId, Status.DRAFTED, draftId, null);
    }

    public static BatchItemOutcome skipped(String emailId, String draftId) {
        return new BatchItemOutcome(emailId, Status.SKIPPED, draftId, "draft_exists");
    }

    public static BatchItemOutcome failed(String emailId, String reason) {
        return new BatchItemOutcome(emailId, Status.FAILED, null, reason);
    }

    // Skipped items count as completed: the email already has its draft
    public boolean countsAsCompleted() {
        return status != Status.FAILED;
    }
}
