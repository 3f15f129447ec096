package email.agent.app.service;

/**
 * Language-model operations the reply pipeline depends on.
 * This abstraction allows for easier testing and switching providers.
 */
public interface ReplyGenerationService {
    /**
     * Custom exception for AI service quota/rate limit errors.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Decide whether an email needs a reply at all.
     * @param emailBody Plain-text body
     * @param subject Subject line
     * @return The decision and the model's short reason
     * @throws QuotaException if AI service quota is exceeded
     */
    ResponseDecision shouldRespond(String emailBody, String subject);

    /**
     * Draft a reply.
     * @param context Original message plus signature and extra instructions
     * @param model Model name from the user's settings, or null for the provider default
     * @param temperature Sampling temperature from the user's settings
     * @return Body, reasoning and confidence
     * @throws QuotaException if AI service quota is exceeded
     */
    DraftResponse generateReply(ReplyContext context, String model, double temperature);
}
