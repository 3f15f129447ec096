package email.agent.app.service;

import email.agent.app.entity.ActivityType;
import email.agent.app.entity.ApprovalMode;
import email.agent.app.entity.Draft;
import email.agent.app.entity.DraftStatus;
import email.agent.app.entity.Email;
import email.agent.app.entity.UserSettings;
import email.agent.app.guardrails.GuardrailConfig;
import email.agent.app.guardrails.GuardrailsEngine;
import email.agent.app.guardrails.ValidationResult;
import email.agent.app.message.InboundMessage;
import email.agent.app.repository.EmailRepository;
import email.agent.app.rules.Rule;
import email.agent.app.rules.RuleAction;
import email.agent.app.rules.RuleEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one inbound message through the reply pipeline for a single user:
 * needs-response check, rules, reply generation, guardrails and the final
 * send / draft decision. Instances are built per poll cycle by
 * {@link EmailProcessorFactory} and hold no state between messages.
 */
@Slf4j
public class EmailProcessor {
    private final String userId;
    private final MailSender mailSender;
    private final ReplyGenerationService replyGenerationService;
    private final RuleEngine ruleEngine;
    private final EmailRepository emailRepository;
    private final DraftService draftService;
    private final ActivityService activityService;

    public EmailProcessor(
            String userId,
            MailSender mailSender,
            ReplyGenerationService replyGenerationService,
            RuleEngine ruleEngine,
            EmailRepository emailRepository,
            DraftService draftService,
            ActivityService activityService) {
        this.userId = userId;
        this.mailSender = mailSender;
        this.replyGenerationService = replyGenerationService;
        this.ruleEngine = ruleEngine;
        this.emailRepository = emailRepository;
        this.draftService = draftService;
        this.activityService = activityService;
    }

    /**
     * Never throws: any failure is logged, the stored email is left unprocessed for
     * a later retry, and {@link ProcessingResult#ERROR} is returned.
     */
    public ProcessingResult processEmail(InboundMessage email, UserSettings settings) {
        try {
            ResponseDecision decision = replyGenerationService.shouldRespond(email.getBodyText(), email.getSubject());
            if (!decision.isRequiresResponse()) {
                log.info("Email {} doesn't need response: {}", email.getGmailId(), decision.getReason());
                updateEmailStatus(email.getGmailId(), true, false);
                return ProcessingResult.NO_RESPONSE_NEEDED;
            }

            Rule matchedRule = ruleEngine.evaluate(email).orElse(null);

            if (matchedRule != null && matchedRule.getAction() == RuleAction.IGNORE) {
                log.info("Email {} ignored by rule: {}", email.getGmailId(), matchedRule.getName());
                Email record = updateEmailStatus(email.getGmailId(), true, false);
                activityService.log(userId, ActivityType.EMAIL_IGNORED,
                    "Ignored email from " + email.getFromEmail() + " (rule: " + matchedRule.getName() + ")",
                    record != null ? record.getId() : null, null, matchedRule.getId());
                return ProcessingResult.IGNORED;
            }

            if (matchedRule != null && matchedRule.getAction() == RuleAction.FORWARD) {
                return forwardEmail(email, matchedRule);
            }

            DraftResponse reply = generateReply(email, settings, customInstructions(matchedRule, settings));

            GuardrailsEngine guardrails = new GuardrailsEngine(GuardrailConfig.from(settings));
            ValidationResult validation = guardrails.validate(reply.getBody(), reply.getConfidence());

            boolean autoSend = shouldAutoSend(settings.getApprovalMode(), matchedRule);

            if (autoSend && validation.shouldDowngradeToDraft()) {
                log.warn("Guardrails blocked auto-send for email {}: {}", email.getGmailId(), validation.getViolationSummary());
                Email record = requireEmailRecord(email.getGmailId());
                draftService.createDraft(userId, replyDraft(record, email, reply, settings, matchedRule)
                    .status(DraftStatus.PENDING)
                    .guardrailFlagged(true)
                    .guardrailViolations(validation.getViolationSummary())
                    .activityType(ActivityType.GUARDRAIL_BLOCKED)
                    .activityDescription("Guardrails blocked auto-send for email from " + email.getFromEmail()
                        + ": " + validation.getViolationSummary())
                    .build());
                updateEmailStatus(email.getGmailId(), true, true);
                return ProcessingResult.GUARDRAIL_BLOCKED;
            }

            if (autoSend) {
                return autoSendReply(email, reply, settings, matchedRule);
            }

            Email record = requireEmailRecord(email.getGmailId());
            draftService.createDraft(userId, replyDraft(record, email, reply, settings, matchedRule)
                .status(DraftStatus.PENDING)
                .guardrailFlagged(!validation.isPassed())
                .guardrailViolations(validation.isPassed() ? null : validation.getViolationSummary())
                .activityType(ActivityType.DRAFT_CREATED)
                .activityDescription("AI drafted response for email from " + email.getFromEmail())
                .build());
            updateEmailStatus(email.getGmailId(), true, true);
            log.info("Created draft for email from {}", email.getFromEmail());
            return ProcessingResult.DRAFT_CREATED;

        } catch (Exception e) {
            log.error("Error processing email {}: {}", email.getGmailId(), e.getMessage(), e);
            try {
                updateEmailStatus(email.getGmailId(), false, null);
            } catch (Exception statusError) {
                log.error("Failed to reset status of email {}: {}", email.getGmailId(), statusError.getMessage(), statusError);
            }
            return ProcessingResult.ERROR;
        }
    }

    /**
     * Drafts a reply without the needs-response check or rule matching; the user asked
     * for this draft explicitly. Guardrail results are attached as advisory flags.
     * Returns the existing active draft if there is one.
     */
    public Draft generateDraftOnly(InboundMessage email, UserSettings settings) {
        Email record = requireEmailRecord(email.getGmailId());
        Optional<Draft> existing = draftService.findActiveDraft(record);
        if (existing.isPresent()) {
            return existing.get();
        }

        DraftResponse reply = generateReply(email, settings, settings.getSystemPrompt());
        ValidationResult validation = new GuardrailsEngine(GuardrailConfig.from(settings))
            .validate(reply.getBody(), reply.getConfidence());

        return draftService.createDraft(userId, replyDraft(record, email, reply, settings, null)
            .status(DraftStatus.PENDING)
            .guardrailFlagged(!validation.isPassed())
            .guardrailViolations(validation.isPassed() ? null : validation.getViolationSummary())
            .activityType(ActivityType.DRAFT_CREATED)
            .activityDescription("AI drafted response for email from " + email.getFromEmail())
            .build());
    }

    static boolean shouldAutoSend(ApprovalMode approvalMode, Rule matchedRule) {
        if (matchedRule != null
                && (matchedRule.getAction() == RuleAction.DRAFT_ONLY || matchedRule.getAction() == RuleAction.FORWARD)) {
            return false;
        }
        if (approvalMode == ApprovalMode.FULLY_AUTOMATIC) {
            return true;
        }
        if (approvalMode == ApprovalMode.AUTO_WITH_RULES) {
            return matchedRule != null && matchedRule.getAction() == RuleAction.AUTO_RESPOND;
        }
        // DRAFT_APPROVAL always waits for the user
        return false;
    }

    static String formatForwardBody(InboundMessage email) {
        String fromName = email.getFromName() != null && !email.getFromName().isEmpty() ? email.getFromName() + " " : "";
        return String.join("\n",
            "Forwarded message:",
            "From: " + fromName + "<" + email.getFromEmail() + ">",
            "To: " + String.join(", ", email.getToEmails()),
            "Subject: " + nullToEmpty(email.getSubject()),
            "Date: " + (email.getReceivedAt() != null ? email.getReceivedAt().toString() : ""),
            "") + "\n" + nullToEmpty(email.getBodyText());
    }

    private ProcessingResult forwardEmail(InboundMessage email, Rule rule) throws Exception {
        List<String> targets = rule.getForwardTargets();
        if (targets.isEmpty()) {
            log.error("Forward rule {} missing forward targets for email {}", rule.getName(), email.getGmailId());
            updateEmailStatus(email.getGmailId(), true, false);
            return ProcessingResult.ERROR;
        }

        mailSender.sendMessage(targets, "Fwd: " + nullToEmpty(email.getSubject()), formatForwardBody(email), null, null);
        Email record = updateEmailStatus(email.getGmailId(), true, false);
        activityService.log(userId, ActivityType.EMAIL_FORWARDED,
            "Forwarded email from " + email.getFromEmail() + " to " + String.join(", ", targets),
            record != null ? record.getId() : null, null, rule.getId());
        log.info("Forwarded email {} to {}", email.getGmailId(), String.join(", ", targets));
        return ProcessingResult.FORWARDED;
    }

    private ProcessingResult autoSendReply(InboundMessage email, DraftResponse reply, UserSettings settings, Rule matchedRule) throws Exception {
        Email record = requireEmailRecord(email.getGmailId());

        // A reprocessed message must not be answered twice
        Optional<Draft> existing = draftService.findActiveDraft(record);
        if (existing.isPresent()) {
            log.info("Email {} already has draft {} ({}), not sending again",
                email.getGmailId(), existing.get().getId(), existing.get().getStatus());
            updateEmailStatus(email.getGmailId(), true, true);
            return existing.get().getStatus() == DraftStatus.AUTO_SENT || existing.get().getStatus() == DraftStatus.SENT
                ? ProcessingResult.AUTO_SENT
                : ProcessingResult.DRAFT_CREATED;
        }

        mailSender.sendMessage(List.of(email.getFromEmail()), "Re: " + nullToEmpty(email.getSubject()), reply.getBody(),
            email.getMessageId(), email.getThreadId());

        draftService.createDraft(userId, replyDraft(record, email, reply, settings, matchedRule)
            .status(DraftStatus.AUTO_SENT)
            .sentAt(Instant.now())
            .activityType(ActivityType.EMAIL_SENT)
            .activityDescription("Auto-sent response to " + email.getFromEmail())
            .build());
        updateEmailStatus(email.getGmailId(), true, true);
        log.info("Auto-sent response to {}", email.getFromEmail());
        return ProcessingResult.AUTO_SENT;
    }

    private DraftResponse generateReply(InboundMessage email, UserSettings settings, String customInstructions) {
        ReplyContext context = ReplyContext.builder()
            .originalEmail(nullToEmpty(email.getBodyText()))
            .senderName(email.getFromName() != null && !email.getFromName().isEmpty() ? email.getFromName() : email.getFromEmail())
            .senderEmail(email.getFromEmail())
            .subject(nullToEmpty(email.getSubject()))
            .userSignature(settings.getSignature())
            .customInstructions(customInstructions)
            .build();
        return replyGenerationService.generateReply(context, settings.getLlmModel(), settings.getLlmTemperature());
    }

    private String customInstructions(Rule matchedRule, UserSettings settings) {
        if (matchedRule != null) {
            Optional<String> customPrompt = matchedRule.getCustomPrompt();
            if (customPrompt.isPresent()) {
                return customPrompt.get();
            }
        }
        return settings.getSystemPrompt();
    }

    private NewDraft.NewDraftBuilder replyDraft(Email record, InboundMessage email, DraftResponse reply,
                                                UserSettings settings, Rule matchedRule) {
        return NewDraft.builder()
            .email(record)
            .toEmails(email.getFromEmail() != null ? List.of(email.getFromEmail()) : List.of())
            .subject("Re: " + nullToEmpty(email.getSubject()))
            .body(reply.getBody())
            .llmModel(settings.getLlmModel())
            .llmReasoning(reply.getReasoning())
            .llmConfidence(reply.getConfidence())
            .matchedRuleId(matchedRule != null ? matchedRule.getId() : null);
    }

    private Email requireEmailRecord(String gmailId) {
        return emailRepository.findByUserIdAndGmailId(userId, gmailId)
            .orElseThrow(() -> new IllegalStateException("Email " + gmailId + " not found in database"));
    }

    private Email updateEmailStatus(String gmailId, boolean processed, Boolean requiresResponse) {
        Optional<Email> found = emailRepository.findByUserIdAndGmailId(userId, gmailId);
        if (found.isEmpty()) {
            return null;
        }
        Email record = found.get();
        record.setProcessed(processed);
        if (requiresResponse != null) {
            record.setRequiresResponse(requiresResponse);
        }
        record.setProcessedAt(Instant.now());
        return emailRepository.save(record);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
