package email.agent.app.service;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the language model sees when drafting a reply.
 */
@Value
@Builder
public class ReplyContext {
    String originalEmail;
    String senderName;
    String senderEmail;
    String subject;
    String userSignature;
    String customInstructions;
}
