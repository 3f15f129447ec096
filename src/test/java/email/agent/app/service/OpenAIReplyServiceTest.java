package email.agent.app.service;

import com.theokanning.openai.OpenAiError;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAIReplyServiceTest {

    @Mock
    private OpenAiService openAiService;

    private OpenAIReplyService replyService;
    private ReplyContext context;

    @BeforeEach
    void setUp() {
        replyService = new OpenAIReplyService(openAiService, "gpt-4o-mini");
        context = ReplyContext.builder()
                .originalEmail("Can we meet Tuesday?")
                .senderName("Ana")
                .senderEmail("ana@corp.com")
                .subject("Meeting")
                .userSignature("-- Sam")
                .customInstructions("Be brief")
                .build();
    }

    private static ChatCompletionResult completion(String content) {
        ChatCompletionChoice choice = new ChatCompletionChoice();
        choice.setMessage(new ChatMessage("assistant", content));
        ChatCompletionResult result = new ChatCompletionResult();
        result.setChoices(List.of(choice));
        return result;
    }

    @Test
    void generateReply_WithStructuredAnswer_ShouldParseBodyAndConfidence() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenReturn(completion("RESPONSE:\nTuesday works.\n\nREASONING:\nSimple yes\n\nCONFIDENCE: 0.92"));

        // When
        DraftResponse response = replyService.generateReply(context, "gpt-4o", 0.5);

        // Then
        assertEquals("Tuesday works.", response.getBody());
        assertEquals("Simple yes", response.getReasoning());
        assertEquals(0.92, response.getConfidence(), 1e-9);

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(openAiService).createChatCompletion(captor.capture());
        ChatCompletionRequest request = captor.getValue();
        assertEquals("gpt-4o", request.getModel());
        assertEquals(0.5, request.getTemperature(), 1e-9);
        assertEquals("system", request.getMessages().get(0).getRole());
        assertTrue(request.getMessages().get(0).getContent().contains("Additional instructions: Be brief"));
        assertTrue(request.getMessages().get(1).getContent().contains("From: Ana <ana@corp.com>"));
        assertTrue(request.getMessages().get(1).getContent().endsWith("-- Sam"));
    }

    @Test
    void generateReply_WithoutModel_ShouldUseDefault() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenReturn(completion("Sure, Tuesday."));

        // When
        DraftResponse response = replyService.generateReply(context, null, 0.7);

        // Then
        assertEquals("Sure, Tuesday.", response.getBody());
        assertEquals(0.7, response.getConfidence(), 1e-9);
        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(openAiService).createChatCompletion(captor.capture());
        assertEquals("gpt-4o-mini", captor.getValue().getModel());
    }

    @Test
    void shouldRespond_ShouldParseDecision() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenReturn(completion("1. REQUIRES_RESPONSE: no\n2. REASON: Automated receipt"));

        // When
        ResponseDecision decision = replyService.shouldRespond("Your order shipped", "Receipt");

        // Then
        assertFalse(decision.isRequiresResponse());
        assertEquals("Automated receipt", decision.getReason());
    }

    @Test
    void shouldRespond_WhenRateLimited_ShouldThrowQuotaException() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenThrow(new RuntimeException("You exceeded your current quota"));

        // When / Then
        assertThrows(ReplyGenerationService.QuotaException.class,
                () -> replyService.shouldRespond("Hi", "Hello"));
    }

    private static OpenAiHttpException httpError(String message, String code, int status) {
        return new OpenAiHttpException(
                new OpenAiError(new OpenAiError.OpenAiErrorDetails(message, "invalid_request_error", null, code)),
                null, status);
    }

    @Test
    void generateReply_WithTooManyRequests_ShouldThrowQuotaException() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenThrow(httpError("Slow down", "rate_limited", 429));

        // When / Then
        assertThrows(ReplyGenerationService.QuotaException.class,
                () -> replyService.generateReply(context, "gpt-4o", 0.7));
    }

    @Test
    void generateReply_WithInvalidApiKey_ShouldRethrowHttpError() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenThrow(httpError("Incorrect API key provided", "invalid_api_key", 401));

        // When / Then
        OpenAiHttpException exception = assertThrows(OpenAiHttpException.class,
                () -> replyService.generateReply(context, "gpt-4o", 0.7));
        assertEquals(401, exception.statusCode);
    }

    @Test
    void generateReply_WithOtherFailure_ShouldPropagate() {
        // Given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
                .thenThrow(new IllegalStateException("connection refused"));

        // When / Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> replyService.generateReply(context, "gpt-4o", 0.7));
        assertEquals("connection refused", exception.getMessage());
    }
}
