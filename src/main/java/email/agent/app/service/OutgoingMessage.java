package email.agent.app.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OutgoingMessage {
    // Optional, Gmail fills in the authenticated address when absent
    String from;
    List<String> to;
    String subject;
    String body;
    // Message-ID header of the message being answered
    String inReplyTo;
    String threadId;
}
