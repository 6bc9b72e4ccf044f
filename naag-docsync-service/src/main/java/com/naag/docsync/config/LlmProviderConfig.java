package com.naag.docsync.config;

import com.naag.docsync.llm.EmbeddingsClient;
import com.naag.docsync.llm.GenerativeClient;
import com.naag.docsync.llm.gemini.GeminiGenerativeClient;
import com.naag.docsync.llm.openai.OpenAIEmbeddingsClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmProviderConfig {

    // Gemini through its OpenAI-compatible endpoint (default)
    @Bean
    @ConditionalOnProperty(name = "naag.docsync.embedding.provider", havingValue = "gemini-openai", matchIfMissing = true)
    public EmbeddingsClient embeddingsGeminiOpenAI(DocSyncProperties properties) {
        return openAiCompatible(properties.getEmbedding());
    }

    // llama.cpp server with OpenAI-compatible API
    @Bean
    @ConditionalOnProperty(name = "naag.docsync.embedding.provider", havingValue = "llamacpp-openai")
    public EmbeddingsClient embeddingsLlamaCppOpenAI(DocSyncProperties properties) {
        return openAiCompatible(properties.getEmbedding());
    }

    // Ollama OpenAI-compatible API
    @Bean
    @ConditionalOnProperty(name = "naag.docsync.embedding.provider", havingValue = "ollama-openai")
    public EmbeddingsClient embeddingsOllamaOpenAI(DocSyncProperties properties) {
        return openAiCompatible(properties.getEmbedding());
    }

    @Bean
    public GenerativeClient generativeClient(DocSyncProperties properties) {
        DocSyncProperties.GeminiConfig gemini = properties.getGemini();
        return new GeminiGenerativeClient(gemini.getBaseUrl(), gemini.getApiKey(), gemini.getTimeout());
    }

    private static EmbeddingsClient openAiCompatible(DocSyncProperties.EmbeddingConfig embedding) {
        return new OpenAIEmbeddingsClient(embedding.getBaseUrl(), embedding.getPath(), embedding.getModel(), embedding.getApiKey());
    }
}
