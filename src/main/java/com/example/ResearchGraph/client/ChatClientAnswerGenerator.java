package com.example.ResearchGraph.client;

import com.example.ResearchGraph.capability.AnswerGenerator;
import com.example.ResearchGraph.capability.GenerationResult;
import com.example.ResearchGraph.config.RagProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link AnswerGenerator} on top of a Spring AI {@link ChatClient}.
 *
 * <p>The client is picked by {@code rag.generation.provider}, looked up as
 * {@code "<provider>ChatClient"}, then {@code "<provider>"}, then any client.
 * Provider failures are returned as {@link GenerationResult.RateLimited} or
 * {@link GenerationResult.Failed}; nothing is retried here.</p>
 */
@Component
public class ChatClientAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAnswerGenerator.class);

    static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

    private static final int TOO_MANY_REQUESTS = 429;

    // OpenAI and DeepSeek error codes, plus the gRPC status used by Google providers.
    private static final Pattern RATE_LIMIT_ERROR_CODE =
            Pattern.compile("\\b(insufficient_quota|rate_limit_exceeded|RESOURCE_EXHAUSTED)\\b");

    private final Map<String, ChatClient> chatClients;
    private final RagProperties properties;

    public ChatClientAnswerGenerator(Map<String, ChatClient> chatClients, RagProperties properties) {
        this.chatClients = chatClients;
        this.properties = properties;
    }

    @Override
    public GenerationResult generate(String question, List<String> context) {
        RagProperties.Generation settings = properties.getGeneration();
        ChatClient chatClient = resolveClient(settings.getProvider());
        String prompt = buildPrompt(question, context);

        ChatResponse response;
        try {
            response = chatClient.prompt()
                    .options(ChatOptions.builder()
                            .temperature(settings.getTemperature())
                            .maxTokens(settings.getMaxTokens())
                            .build())
                    .user(prompt)
                    .call()
                    .chatResponse();
        } catch (RuntimeException ex) {
            if (isRateLimited(ex)) {
                log.warn("Generation provider rate limited: {}", ex.getMessage());
                return new GenerationResult.RateLimited(settings.getRateLimitRetryAfter(), ex.getMessage());
            }
            log.error("Generation provider call failed", ex);
            return new GenerationResult.Failed(ex.getMessage(), ex);
        }

        String answer = Optional.ofNullable(response)
                .map(ChatResponse::getResult)
                .map(result -> result.getOutput().getText())
                .orElse(null);
        if (answer == null || answer.isBlank()) {
            log.error("Generation provider returned an empty answer");
            return new GenerationResult.Failed("Empty answer from provider", null);
        }

        return new GenerationResult.Generated(answer, tokensUsed(response), modelName(response, settings));
    }

    /**
     * Context blocks are separated by a horizontal rule so the model can tell
     * the metadata block and each passage apart.
     */
    String buildPrompt(String question, List<String> context) {
        return "Context:\n" + String.join(CONTEXT_SEPARATOR, context) + "\n\n"
                + "Question: " + question;
    }

    private int tokensUsed(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return 0;
        }
        Usage usage = response.getMetadata().getUsage();
        int prompt = usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
        int completion = usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
        return prompt + completion;
    }

    private String modelName(ChatResponse response, RagProperties.Generation settings) {
        String reported = response.getMetadata() == null ? null : response.getMetadata().getModel();
        return reported == null || reported.isBlank() ? settings.getModel() : reported;
    }

    /**
     * Quota exhaustion is recognised by an HTTP 429 status, by Spring AI's error handler
     * message ({@code "429 - <body>"}), or by a provider error code naming it.
     */
    static boolean isRateLimited(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (hasTooManyRequestsStatus(current) || hasRateLimitErrorCode(current.getMessage())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static boolean hasTooManyRequestsStatus(Throwable ex) {
        if (ex instanceof RestClientResponseException http) {
            return http.getStatusCode().value() == TOO_MANY_REQUESTS;
        }
        if (ex instanceof WebClientResponseException http) {
            return http.getStatusCode().value() == TOO_MANY_REQUESTS;
        }
        if (ex instanceof NonTransientAiException || ex instanceof TransientAiException) {
            String message = ex.getMessage();
            return message != null && message.startsWith(TOO_MANY_REQUESTS + " ");
        }
        return false;
    }

    private static boolean hasRateLimitErrorCode(String message) {
        return message != null && RATE_LIMIT_ERROR_CODE.matcher(message).find();
    }

    private ChatClient resolveClient(String provider) {
        String key = Optional.ofNullable(provider)
                .map(p -> p.toLowerCase(Locale.ROOT))
                .orElse("openai");
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }
}
