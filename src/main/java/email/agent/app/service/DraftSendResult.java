package email.agent.app.service;

import lombok.Value;

@Value
public class DraftSendResult {
    boolean sent;
    String draftId;
    String messageId;
    String reason;

    public static DraftSendResult sent(String draftId, String messageId) {
        return new DraftSendResult(true, draftId, messageId, null);
    }

    public static DraftSendResult rejected(String draftId, String reason) {
        return new DraftSendResult(false, draftId, null, reason);
    }
}
