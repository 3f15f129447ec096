package email.agent.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import email.agent.app.message.InboundMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

@Slf4j
@Service
public class GmailService implements GmailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Email Agent";
    static final String FALLBACK_QUERY = "is:inbox is:unread";

    private final NetHttpTransport httpTransport;
    private final long maxMessages;

    public GmailService(@Value("${agent.poll.max-messages:50}") long maxMessages) throws Exception {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.maxMessages = maxMessages;
    }

    public Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    /**
     * Fetch new emails using Gmail History API for efficient incremental fetching.
     * If lastHistoryId is provided, only fetches messages added since that point.
     * Otherwise, or when the history id has expired, falls back to unread inbox messages.
     */
    @Override
    public List<Message> fetchNewEmails(String accessToken, String userId, String lastHistoryId) throws Exception {
        Gmail service = getGmailService(accessToken);
        if (lastHistoryId == null || lastHistoryId.isEmpty()) {
            return fetchNewEmailsFallback(service, userId);
        }

        Set<String> messageIds = new LinkedHashSet<>();
        try {
            ListHistoryResponse historyResponse = service.users().history().list(userId)
                .setStartHistoryId(new BigInteger(lastHistoryId))
                .setHistoryTypes(List.of("messageAdded"))
                .setMaxResults(maxMessages)
                .execute();

            if (historyResponse.getHistory() != null) {
                for (History history : historyResponse.getHistory()) {
                    if (history.getMessagesAdded() == null) {
                        continue;
                    }
                    for (HistoryMessageAdded added : history.getMessagesAdded()) {
                        messageIds.add(added.getMessage().getId());
                    }
                }
            }
        } catch (Exception e) {
            // If historyId is invalid or expired, fall back to regular fetch
            log.warn("History API failed for user {}, falling back to regular fetch: {}", userId, e.getMessage());
            return fetchNewEmailsFallback(service, userId);
        }

        List<Message> messages = new ArrayList<>();
        for (String messageId : messageIds) {
            messages.add(service.users().messages().get(userId, messageId).setFormat("full").execute());
        }
        return messages;
    }

    private List<Message> fetchNewEmailsFallback(Gmail service, String userId) throws Exception {
        ListMessagesResponse response = service.users().messages().list(userId)
            .setQ(FALLBACK_QUERY)
            .setMaxResults(maxMessages)
            .execute();

        List<Message> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                messages.add(service.users().messages().get(userId, messageRef.getId()).setFormat("full").execute());
            }
        }
        return messages;
    }

    @Override
    public String getCurrentHistoryId(String accessToken, String userId) throws Exception {
        BigInteger historyId = getGmailService(accessToken).users().getProfile(userId).execute().getHistoryId();
        return historyId != null ? historyId.toString() : null;
    }

    @Override
    public InboundMessage toInboundMessage(Message message) {
        InboundMessage.InboundMessageBuilder builder = InboundMessage.builder()
            .gmailId(message.getId())
            .threadId(message.getThreadId())
            .snippet(message.getSnippet())
            .receivedAt(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : Instant.now());

        MessagePart payload = message.getPayload();
        if (payload == null) {
            return builder.subject("").bodyText("").build();
        }

        String subject = "";
        if (payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                String value = header.getValue() != null ? header.getValue() : "";
                switch (header.getName().toLowerCase(Locale.ROOT)) {
                    case "from":
                        InternetAddress from = parseSender(value);
                        builder.fromEmail(from.getAddress()).fromName(from.getPersonal());
                        break;
                    case "to":
                        builder.toEmails(parseAddressList(value));
                        break;
                    case "cc":
                        builder.ccEmails(parseAddressList(value));
                        break;
                    case "subject":
                        subject = value;
                        break;
                    case "message-id":
                        builder.messageId(value);
                        break;
                    default:
                        break;
                }
            }
        }

        BodyExtractionResult bodies = new BodyExtractionResult();
        extractBodyFromParts(payload, bodies);
        return builder
            .subject(subject)
            .bodyText(bodies.plainTextContent != null ? bodies.plainTextContent : "")
            .bodyHtml(bodies.htmlContent)
            .build();
    }

    static InternetAddress parseSender(String header) {
        try {
            return new InternetAddress(header, false);
        } catch (AddressException e) {
            log.debug("Unparseable From header '{}', keeping it as the address", header);
            InternetAddress address = new InternetAddress();
            address.setAddress(header.trim());
            return address;
        }
    }

    static List<String> parseAddressList(String header) {
        List<String> addresses = new ArrayList<>();
        try {
            for (InternetAddress address : InternetAddress.parseHeader(header, false)) {
                addresses.add(address.getAddress());
            }
        } catch (AddressException e) {
            log.debug("Unparseable address list '{}': {}", header, e.getMessage());
        }
        return addresses;
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    // First text/plain and first text/html part win; attachments are ignored
    private void extractBodyFromParts(MessagePart part, BodyExtractionResult result) {
        String mimeType = part.getMimeType();
        boolean isAttachment = part.getFilename() != null && !part.getFilename().isEmpty();
        if (!isAttachment && part.getBody() != null && part.getBody().getData() != null && mimeType != null) {
            if (mimeType.equals("text/plain") && result.plainTextContent == null) {
                result.plainTextContent = decodeBody(part.getBody().getData(), mimeType);
            } else if (mimeType.equals("text/html") && result.htmlContent == null) {
                result.htmlContent = decodeBody(part.getBody().getData(), mimeType);
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                extractBodyFromParts(subPart, result);
            }
        }
    }

    private String decodeBody(String data, String mimeType) {
        try {
            // Gmail uses URL-safe Base64 encoding
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String paddedData = data;
                int remainder = paddedData.length() % 4;
                if (remainder > 0) {
                    paddedData += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(paddedData), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }

    @Override
    public String sendMessage(String accessToken, String userId, OutgoingMessage outgoing) throws Exception {
        Message message = new Message().setRaw(encodeRaw(buildMimeMessage(outgoing)));
        if (outgoing.getThreadId() != null && !outgoing.getThreadId().isEmpty()) {
            message.setThreadId(outgoing.getThreadId());
        }

        Message sent = getGmailService(accessToken).users().messages().send(userId, message).execute();
        log.info("Sent message {} for {} to {}", sent.getId(), userId, outgoing.getTo());
        return sent.getId();
    }

    MimeMessage buildMimeMessage(OutgoingMessage outgoing) throws MessagingException {
        MimeMessage mime = new MimeMessage(Session.getInstance(new Properties()));
        if (outgoing.getFrom() != null && !outgoing.getFrom().isEmpty()) {
            mime.setFrom(new InternetAddress(outgoing.getFrom()));
        }
        for (String to : outgoing.getTo()) {
            mime.addRecipient(jakarta.mail.Message.RecipientType.TO, new InternetAddress(to));
        }
        mime.setSubject(outgoing.getSubject(), StandardCharsets.UTF_8.name());
        mime.setText(outgoing.getBody(), StandardCharsets.UTF_8.name());
        if (outgoing.getInReplyTo() != null && !outgoing.getInReplyTo().isEmpty()) {
            mime.setHeader("In-Reply-To", outgoing.getInReplyTo());
            mime.setHeader("References", outgoing.getInReplyTo());
        }
        return mime;
    }

    static String encodeRaw(MimeMessage mime) throws MessagingException, IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        mime.writeTo(buffer);
        return Base64.getUrlEncoder().encodeToString(buffer.toByteArray());
    }
}
