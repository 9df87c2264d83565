package com.example.ResearchGraph.client;

import com.example.ResearchGraph.capability.GenerationResult;
import com.example.ResearchGraph.config.RagProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatClientAnswerGeneratorTest {

    private ChatClient chatClient;
    private RagProperties properties;
    private ChatClientAnswerGenerator generator;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        properties = new RagProperties();
        generator = new ChatClientAnswerGenerator(Map.of("openaiChatClient", chatClient), properties);
    }

    @Test
    void answerCarriesTokenTotalAndReportedModel() {
        stubResponse(response("The paper has 2 authors.", "gpt-4o-mini-2024-07-18", 100, 20));

        GenerationResult result = generator.generate("How many authors?", List.of("Title: T", "passage"));

        GenerationResult.Generated generated = assertInstanceOf(GenerationResult.Generated.class, result);
        assertEquals("The paper has 2 authors.", generated.answer());
        assertEquals(120, generated.tokensUsed());
        assertEquals("gpt-4o-mini-2024-07-18", generated.model());
    }

    @Test
    void configuredModelIsUsedWhenProviderReportsNone() {
        properties.getGeneration().setModel("deepseek-chat");
        stubResponse(new ChatResponse(List.of(new Generation(new AssistantMessage("ok")))));

        GenerationResult.Generated generated = assertInstanceOf(
                GenerationResult.Generated.class, generator.generate("q", List.of("c")));

        assertEquals("deepseek-chat", generated.model());
        assertEquals(0, generated.tokensUsed());
    }

    @Test
    void quotaErrorBecomesRateLimited() {
        properties.getGeneration().setRateLimitRetryAfter(Duration.ofSeconds(30));
        when(chatClient.prompt().options(any()).user(anyString()).call().chatResponse())
                .thenThrow(new NonTransientAiException(
                        "429 - {\"error\":{\"message\":\"You exceeded your current quota\",\"code\":\"insufficient_quota\"}}"));

        GenerationResult result = generator.generate("q", List.of("c"));

        GenerationResult.RateLimited limited = assertInstanceOf(GenerationResult.RateLimited.class, result);
        assertEquals(Duration.ofSeconds(30), limited.retryAfter());
    }

    @Test
    void otherProviderErrorsBecomeFailed() {
        NonTransientAiException invalidKey = new NonTransientAiException("HTTP 401 - Incorrect API key provided");
        when(chatClient.prompt().options(any()).user(anyString()).call().chatResponse()).thenThrow(invalidKey);

        GenerationResult.Failed failed = assertInstanceOf(
                GenerationResult.Failed.class, generator.generate("q", List.of("c")));

        assertEquals(invalidKey, failed.cause());
    }

    @Test
    void badRequestMentioningTokenCountIsNotRateLimited() {
        when(chatClient.prompt().options(any()).user(anyString()).call().chatResponse())
                .thenThrow(new NonTransientAiException(
                        "400 - This model's maximum context length is 8192 tokens. However, you requested 14290 tokens"));

        assertInstanceOf(GenerationResult.Failed.class, generator.generate("q", List.of("c")));
    }

    @Test
    void blankAnswerIsAFailure() {
        stubResponse(response("  ", "gpt-4o-mini", 10, 0));

        assertInstanceOf(GenerationResult.Failed.class, generator.generate("q", List.of("c")));
    }

    @Test
    void providerIsSelectedByName() {
        ChatClient deepseek = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(deepseek.prompt().options(any()).user(anyString()).call().chatResponse())
                .thenReturn(response("from deepseek", "deepseek-chat", 5, 5));
        properties.getGeneration().setProvider("DeepSeek");
        ChatClientAnswerGenerator selecting = new ChatClientAnswerGenerator(
                Map.of("openaiChatClient", chatClient, "deepseekChatClient", deepseek), properties);

        GenerationResult.Generated generated = assertInstanceOf(
                GenerationResult.Generated.class, selecting.generate("q", List.of("c")));

        assertEquals("from deepseek", generated.answer());
        verify(chatClient, never()).prompt();
    }

    @Test
    void promptSeparatesContextBlocks() {
        String prompt = generator.buildPrompt("Who wrote it?", List.of("Title: T", "first passage", "second passage"));

        assertEquals("Context:\nTitle: T\n\n---\n\nfirst passage\n\n---\n\nsecond passage\n\n"
                + "Question: Who wrote it?", prompt);
    }

    @Test
    void rateLimitDetectionFollowsCauseChain() {
        assertTrue(ChatClientAnswerGenerator.isRateLimited(
                new RuntimeException("call failed", new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS))));
        assertTrue(ChatClientAnswerGenerator.isRateLimited(
                new IllegalStateException("call failed", new TransientAiException("429 - Too Many Requests"))));
        assertTrue(ChatClientAnswerGenerator.isRateLimited(new RuntimeException("status: RESOURCE_EXHAUSTED")));
        assertTrue(ChatClientAnswerGenerator.isRateLimited(
                new RuntimeException("{\"error\":{\"code\":\"rate_limit_exceeded\"}}")));
        assertFalse(ChatClientAnswerGenerator.isRateLimited(new NonTransientAiException(
                "400 - This model's maximum context length is 8192 tokens. However, you requested 14290 tokens")));
        assertFalse(ChatClientAnswerGenerator.isRateLimited(new RuntimeException("request id req_4291 failed")));
        assertFalse(ChatClientAnswerGenerator.isRateLimited(new NonTransientAiException("500 - quota service unavailable")));
        assertFalse(ChatClientAnswerGenerator.isRateLimited(
                new RuntimeException("call failed", new HttpServerErrorException(HttpStatus.BAD_GATEWAY))));
        assertFalse(ChatClientAnswerGenerator.isRateLimited(new IllegalStateException()));
    }

    private void stubResponse(ChatResponse response) {
        when(chatClient.prompt().options(any()).user(anyString()).call().chatResponse()).thenReturn(response);
    }

    private static ChatResponse response(String text, String model, int promptTokens, int completionTokens) {
        ChatResponseMetadata metadata = ChatResponseMetadata.builder()
                .model(model)
                .usage(new DefaultUsage(promptTokens, completionTokens))
                .build();
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))), metadata);
    }
}
