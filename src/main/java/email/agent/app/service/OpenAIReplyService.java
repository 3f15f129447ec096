package email.agent.app.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Chat completion client for OpenAI and OpenAI-compatible endpoints (e.g. OpenRouter).
 */
@Slf4j
public class OpenAIReplyService implements ReplyGenerationService {
    private final OpenAiService openAiService;
    private final String defaultModel;

    public OpenAIReplyService(OpenAiService openAiService, String defaultModel) {
        this.openAiService = openAiService;
        this.defaultModel = defaultModel;
    }

    private void handleOpenAIError(Exception e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        // Only 429s and quota messages; bad keys or model names surface unchanged
        if ((e instanceof OpenAiHttpException && ((OpenAiHttpException) e).statusCode == 429) ||
            errorMessage.contains("quota") ||
            errorMessage.contains("rate limit") ||
            (e.getCause() != null && e.getCause().getMessage() != null &&
             e.getCause().getMessage().toLowerCase().contains("429"))) {
            throw new QuotaException("LLM quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }

        if (e instanceof RuntimeException) {
            throw (RuntimeException) e;
        }
        throw new RuntimeException("LLM API error during " + operation + ": " + e.getMessage(), e);
    }

    @Override
    public ResponseDecision shouldRespond(String emailBody, String subject) {
        try {
            ChatMessage message = new ChatMessage("user", ReplyPromptSupport.buildNeedsResponsePrompt(emailBody, subject));
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(defaultModel)
                .messages(List.of(message))
                .maxTokens(100)
                .temperature(0.3)
                .build();

            String content = openAiService.createChatCompletion(request)
                .getChoices().get(0).getMessage().getContent();
            return ReplyPromptSupport.parseResponseDecision(content);
        } catch (Exception e) {
            handleOpenAIError(e, "needs-response check");
            return null; // Never reached, but needed for compilation
        }
    }

    @Override
    public DraftResponse generateReply(ReplyContext context, String model, double temperature) {
        String modelName = model != null && !model.isBlank() ? model : defaultModel;
        try {
            ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(modelName)
                .messages(List.of(
                    new ChatMessage("system", ReplyPromptSupport.buildSystemPrompt(context)),
                    new ChatMessage("user", ReplyPromptSupport.buildUserPrompt(context))))
                .maxTokens(1000)
                .temperature(temperature)
                .build();

            String content = openAiService.createChatCompletion(request)
                .getChoices().get(0).getMessage().getContent();
            log.debug("Generated reply with model {} for {}", modelName, context.getSenderEmail());
            return ReplyPromptSupport.parseDraftResponse(content);
        } catch (Exception e) {
            handleOpenAIError(e, "reply generation");
            return null; // Never reached, but needed for compilation
        }
    }
}
