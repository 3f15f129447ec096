package email.agent.app.service;

import email.agent.app.entity.ActivityType;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to persist one draft for a stored email.
 */
@Value
@Builder
public class NewDraft {
    Email email;
    List<String> toEmails;
    String subject;
    String body;
    DraftStatus status;
    String llmModel;
    String llmReasoning;
    Double llmConfidence;
    String matchedRuleId;
    boolean guardrailFlagged;
    String guardrailViolations;
    Instant sentAt;
    ActivityType activityType;
    String activityDescription;
}
