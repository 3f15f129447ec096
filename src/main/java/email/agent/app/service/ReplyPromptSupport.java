package email.agent.app.service;

import java.util.Locale;

/**
 * Prompt text and response parsing shared by the LLM providers.
 */
public final class ReplyPromptSupport {
    static final double DEFAULT_CONFIDENCE = 0.7;
    static final String UNKNOWN_REASON = "Unable to determine";

    private static final int NEEDS_RESPONSE_BODY_LIMIT = 1000;

    private ReplyPromptSupport() {
    }

    public static String buildSystemPrompt(ReplyContext context) {
        String prompt = "You are an AI email assistant helping to draft professional email responses.\n\n" +
                "Guidelines:\n" +
                "- Be professional, clear, and concise\n" +
                "- Match the tone of the original email (formal vs casual)\n" +
                "- Address all questions or points raised\n" +
                "- Keep responses focused and to the point\n" +
                "- Don't add unnecessary pleasantries or filler";
        if (context.getCustomInstructions() != null && !context.getCustomInstructions().isBlank()) {
            prompt += "\n\nAdditional instructions: " + context.getCustomInstructions();
        }
        return prompt;
    }

    public static String buildUserPrompt(ReplyContext context) {
        String prompt = String.format(
                "Please draft a response to this email:\n\n" +
                "From: %s <%s>\n" +
                "Subject: %s\n\n" +
                "---\n%s\n---\n\n" +
                "Provide your response in this format:\n" +
                "RESPONSE:\n[Your email response here]\n\n" +
                "REASONING:\n[Brief explanation of your approach]\n\n" +
                "CONFIDENCE: [0.0 to 1.0]",
                nullToEmpty(context.getSenderName()),
                nullToEmpty(context.getSenderEmail()),
                nullToEmpty(context.getSubject()),
                nullToEmpty(context.getOriginalEmail())
        );
        if (context.getUserSignature() != null && !context.getUserSignature().isBlank()) {
            prompt += "\n\nPlease end the email with this signature:\n" + context.getUserSignature();
        }
        return prompt;
    }

    public static String buildNeedsResponsePrompt(String emailBody, String subject) {
        String body = nullToEmpty(emailBody);
        if (body.length() > NEEDS_RESPONSE_BODY_LIMIT) {
            body = body.substring(0, NEEDS_RESPONSE_BODY_LIMIT);
        }
        return String.format(
                "Analyze this email and determine if it requires a response.\n\n" +
                "Subject: %s\n" +
                "Body: %s\n\n" +
                "Respond with:\n" +
                "1. REQUIRES_RESPONSE: yes or no\n" +
                "2. REASON: Brief explanation\n\n" +
                "Examples of emails that DON'T require response:\n" +
                "- Newsletters and marketing emails\n" +
                "- Automated notifications (shipping, receipts)\n" +
                "- No-reply sender addresses\n" +
                "- Calendar invitations (handled separately)\n" +
                "- Email threads where you're CC'd but not directly addressed\n\n" +
                "Examples that DO require response:\n" +
                "- Direct questions to you\n" +
                "- Meeting requests with specific asks\n" +
                "- Action items assigned to you\n" +
                "- Requests for information or help",
                nullToEmpty(subject), body);
    }

    /**
     * Splits a RESPONSE/REASONING/CONFIDENCE answer. Falls back to the whole content as
     * the body; confidence defaults to 0.7 and is clamped to [0, 1].
     */
    public static DraftResponse parseDraftResponse(String content) {
        String text = nullToEmpty(content);
        String body = "";
        String reasoning = "";
        double confidence = DEFAULT_CONFIDENCE;

        int responseAt = text.indexOf("RESPONSE:");
        if (responseAt >= 0) {
            String responsePart = text.substring(responseAt + "RESPONSE:".length());
            int end = responsePart.indexOf("REASONING:");
            if (end < 0) {
                end = responsePart.indexOf("CONFIDENCE:");
            }
            body = (end >= 0 ? responsePart.substring(0, end) : responsePart).trim();
        }

        int reasoningAt = text.indexOf("REASONING:");
        if (reasoningAt >= 0) {
            String reasoningPart = text.substring(reasoningAt + "REASONING:".length());
            int confidenceAt = reasoningPart.indexOf("CONFIDENCE:");
            reasoning = (confidenceAt >= 0 ? reasoningPart.substring(0, confidenceAt) : reasoningPart).trim();
        }

        int confidenceAt = text.indexOf("CONFIDENCE:");
        if (confidenceAt >= 0) {
            String rest = text.substring(confidenceAt + "CONFIDENCE:".length()).trim();
            String[] tokens = rest.split("\\s+");
            // Models sometimes end the value with punctuation ("0.85.")
            String value = tokens.length > 0 ? tokens[0].replaceAll("[^0-9]+$", "") : "";
            if (!value.isEmpty()) {
                try {
                    double parsed = Double.parseDouble(value);
                    if (Double.isFinite(parsed)) {
                        confidence = parsed;
                    }
                } catch (NumberFormatException e) {
                    // keep default
                }
            }
        }

        if (body.isEmpty()) {
            body = text;
        }
        return new DraftResponse(body, reasoning, Math.min(Math.max(confidence, 0.0), 1.0));
    }

    public static ResponseDecision parseResponseDecision(String content) {
        String text = nullToEmpty(content);
        boolean requiresResponse = false;
        String reason = UNKNOWN_REASON;

        for (String line : text.split("\\R")) {
            String stripped = line.trim();
            String lower = stripped.toLowerCase(Locale.ROOT);
            // Tolerate list numbering like "1. REQUIRES_RESPONSE: yes"
            String unnumbered = lower.replaceFirst("^\\d+\\.\\s*", "");
            int offset = stripped.length() - unnumbered.length();
            if (unnumbered.startsWith("requires_response:")) {
                String value = unnumbered.substring("requires_response:".length()).trim();
                requiresResponse = value.startsWith("y");
            } else if (unnumbered.startsWith("reason:")) {
                String parsed = stripped.substring(offset + "reason:".length()).trim();
                if (!parsed.isEmpty()) {
                    reason = parsed;
                }
            }
        }

        String lowerContent = text.toLowerCase(Locale.ROOT);
        if (!requiresResponse && lowerContent.contains("requires_response: yes")) {
            requiresResponse = true;
        }
        if (UNKNOWN_REASON.equals(reason) && lowerContent.contains("reason:")) {
            reason = text.substring(lowerContent.indexOf("reason:") + "reason:".length()).trim();
        }
        return new ResponseDecision(requiresResponse, reason);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
