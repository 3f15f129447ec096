package email.agent.app.service;

import java.util.List;

/**
 * Outbound mail for one mailbox, as seen by the reply pipeline.
 */
public interface MailSender {
    /**
     * @param replyToMessageId Message-ID header being answered, or null
     * @param threadId Provider thread to append to, or null
     * @return Provider id of the sent message
     */
    String sendMessage(List<String> to, String subject, String body, String replyToMessageId, String threadId) throws Exception;

    /**
     * A sender for paths that must never send, such as batch drafting.
     */
    static MailSender unavailable(String reason) {
        return (to, subject, body, replyToMessageId, threadId) -> {
            throw new IllegalStateException("Sending is not available: " + reason);
        };
    }
}
