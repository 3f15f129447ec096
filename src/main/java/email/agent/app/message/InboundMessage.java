package email.agent.app.message;

import email.agent.app.entity.Email;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of one received message as it flows through the reply pipeline.
 */
@Value
@Builder(toBuilder = true)
public class InboundMessage {
    String gmailId;
    String threadId;
    // RFC 822 Message-ID of the original, target of In-Reply-To
    String messageId;
    String fromEmail;
    String fromName;
    @Builder.Default
    List<String> toEmails = List.of();
    @Builder.Default
    List<String> ccEmails = List.of();
    String subject;
    String snippet;
    String bodyText;
    String bodyHtml;
    Instant receivedAt;

    public static InboundMessage fromEmail(Email email) {
        return InboundMessage.builder()
                .gmailId(email.getGmailId())
                .threadId(email.getThreadId())
                .messageId(email.getMessageId())
                .fromEmail(email.getFromEmail())
                .fromName(email.getFromName())
                .toEmails(email.getToEmails() != null ? List.copyOf(email.getToEmails()) : List.of())
                .ccEmails(email.getCcEmails() != null ? List.copyOf(email.getCcEmails()) : List.of())
                .subject(email.getSubject())
                .snippet(email.getSnippet())
                .bodyText(email.getBodyText())
                .bodyHtml(email.getBodyHtml())
                .receivedAt(email.getReceivedAt())
                .build();
    }
}
