package email.agent.app.service;

import java.util.List;

/**
 * Sends through the Gmail API with an access token resolved when the sender was created.
 */
public class GmailMailSender implements MailSender {
    private final GmailApiService gmailApiService;
    private final String accessToken;
    private final String mailboxAddress;

    public GmailMailSender(GmailApiService gmailApiService, String accessToken, String mailboxAddress) {
        this.gmailApiService = gmailApiService;
        this.accessToken = accessToken;
        this.mailboxAddress = mailboxAddress;
    }

    @Override
    public String sendMessage(List<String> to, String subject, String body, String replyToMessageId, String threadId) throws Exception {
        OutgoingMessage message = OutgoingMessage.builder()
            .from(mailboxAddress)
            .to(to)
            .subject(subject)
            .body(body)
            .inReplyTo(replyToMessageId)
            .threadId(threadId)
            .build();
        return gmailApiService.sendMessage(accessToken, mailboxAddress, message);
    }
}
