package email.agent.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation over the generateContent REST endpoint.
 * Models not named gemini-* (the user's OpenAI-style default) fall back to the configured Gemini model.
 */
@Slf4j
public class GeminiReplyService implements ReplyGenerationService {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String defaultModel;

    public GeminiReplyService(RestTemplate restTemplate, String apiKey, String defaultModel) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;
        this.defaultModel = defaultModel;

        if (apiKey == null || apiKey.isEmpty() || apiKey.startsWith("${")) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public ResponseDecision shouldRespond(String emailBody, String subject) {
        try {
            String content = callGeminiAPI(defaultModel,
                    ReplyPromptSupport.buildNeedsResponsePrompt(emailBody, subject), 100, 0.3);
            return ReplyPromptSupport.parseResponseDecision(content);
        } catch (Exception e) {
            handleError(e, "needs-response check");
            return null;
        }
    }

    @Override
    public DraftResponse generateReply(ReplyContext context, String model, double temperature) {
        String modelName = model != null && model.startsWith("gemini") ? model : defaultModel;
        try {
            // generateContent has no system role in v1beta text calls, so the instructions lead the prompt
            String prompt = ReplyPromptSupport.buildSystemPrompt(context) + "\n\n" + ReplyPromptSupport.buildUserPrompt(context);
            return ReplyPromptSupport.parseDraftResponse(callGeminiAPI(modelName, prompt, 1000, temperature));
        } catch (Exception e) {
            handleError(e, "reply generation");
            return null;
        }
    }

    String callGeminiAPI(String model, String prompt, int maxTokens, double temperature) throws Exception {
        if (apiKey == null || apiKey.isEmpty() || apiKey.startsWith("${")) {
            throw new QuotaException("Gemini API key not configured", new IllegalStateException("Missing API key"));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> contents = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        contents.put("parts", List.of(part));
        requestBody.put("contents", List.of(contents));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", temperature);
        requestBody.put("generationConfig", generationConfig);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);

        String url = String.format(GEMINI_API_URL, model) + "?key=" + apiKey;
        ResponseEntity<String> response = restTemplate.postForEntity(url, request, String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new RuntimeException("Gemini API error: " + response.getStatusCode() + " - " + response.getBody());
        }

        JsonNode candidates = objectMapper.readTree(response.getBody()).path("candidates");
        JsonNode parts = candidates.path(0).path("content").path("parts");
        if (parts.isArray() && parts.size() > 0 && parts.get(0).has("text")) {
            return parts.get(0).get("text").asText();
        }
        throw new RuntimeException("Unexpected Gemini API response format: " + response.getBody());
    }

    private void handleError(Exception e, String operation) {
        if (e instanceof QuotaException) {
            throw (QuotaException) e;
        }
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        // Check for quota/rate limit errors (429, 403 with quota message)
        if (errorMessage.contains("quota") ||
            errorMessage.contains("exceeded") ||
            errorMessage.contains("rate limit") ||
            errorMessage.contains("429") ||
            errorMessage.contains("resource exhausted")) {
            throw new QuotaException("Gemini quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }

        if (e instanceof RuntimeException) {
            throw (RuntimeException) e;
        }
        throw new RuntimeException("Gemini API error during " + operation + ": " + e.getMessage(), e);
    }
}
