package com.example.ResearchGraph.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    public static final String SYSTEM_PROMPT =
            "You are a helpful research assistant that answers questions about academic papers. "
                    + "You have access to the paper's full metadata including title, authors, publication date, "
                    + "abstract, categories, references, and more. "
                    + "Answer the question accurately based on the provided context. "
                    + "For factual questions (who wrote it, when was it published, how many references, etc.), "
                    + "answer directly from the metadata. "
                    + "For conceptual questions, provide helpful background knowledge to help the student understand. "
                    + "If the context doesn't fully answer the question, use your general knowledge to supplement, "
                    + "but clearly indicate when you're doing so.";

    /**
     * OpenAI ChatClient, the default provider.
     * Only created when an OpenAiChatModel bean exists, so a missing API key does not break startup.
     */
    @Bean
    @Primary
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
    }

    /**
     * DeepSeek ChatClient, selectable with rag.generation.provider=deepseek.
     */
    @Bean
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(SYSTEM_PROMPT)
                .build();
    }

    /**
     * If neither conditional bean matched, build a client from whichever model is available.
     */
    @Bean
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        DeepSeekChatModel deepSeekModel = deepSeekProvider.getIfAvailable();
        if (deepSeekModel != null) {
            return ChatClient.builder(deepSeekModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
