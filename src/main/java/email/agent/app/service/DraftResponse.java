package email.agent.app.service;

import lombok.Value;

@Value
public class DraftResponse {
    String body;
    String reasoning;
    // 0.0 - 1.0, as reported by the model
    double confidence;
}
