package email.agent.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.client.OpenAiApi;
import com.theokanning.openai.service.OpenAiService;
import email.agent.app.service.GeminiReplyService;
import email.agent.app.service.OpenAIReplyService;
import email.agent.app.service.ReplyGenerationService;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import retrofit2.Retrofit;
import retrofit2.adapter.rxjava2.RxJava2CallAdapterFactory;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.time.Duration;

/**
 * Configuration to switch between AI providers.
 * Set ai.provider=gemini or ai.provider=openai in application.properties.
 * With openai.base-url set, the OpenAI client talks to any compatible endpoint (e.g. OpenRouter).
 */
@Configuration
public class AIServiceConfig {
    private static final Duration LLM_TIMEOUT = Duration.ofSeconds(60);

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini")
    public ReplyGenerationService geminiReplyService(
            RestTemplate restTemplate,
            @Value("${gemini.api.key:}") String apiKey,
            @Value("${gemini.default-model:gemini-1.5-flash}") String defaultModel) {
        return new GeminiReplyService(restTemplate, apiKey, defaultModel);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public ReplyGenerationService openAIReplyService(
            @Value("${openai.api.key:}") String apiKey,
            @Value("${openai.base-url:}") String baseUrl,
            @Value("${ai.default-model:gpt-4o-mini}") String defaultModel) {
        return new OpenAIReplyService(openAiService(apiKey, baseUrl), defaultModel);
    }

    static OpenAiService openAiService(String apiKey, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return new OpenAiService(apiKey, LLM_TIMEOUT);
        }
        ObjectMapper mapper = OpenAiService.defaultObjectMapper();
        OkHttpClient client = OpenAiService.defaultClient(apiKey, LLM_TIMEOUT);
        Retrofit retrofit = new Retrofit.Builder()
            .baseUrl(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/")
            .client(client)
            .addConverterFactory(JacksonConverterFactory.create(mapper))
            .addCallAdapterFactory(RxJava2CallAdapterFactory.create())
            .build();
        return new OpenAiService(retrofit.create(OpenAiApi.class));
    }
}
