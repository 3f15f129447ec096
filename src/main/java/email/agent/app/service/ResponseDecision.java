package email.agent.app.service;

import lombok.Value;

@Value
public class ResponseDecision {
    boolean requiresResponse;
    String reason;
}
