package me.golemcore.commentator.adapter.outbound.embedding;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.commentator.domain.exception.EmbeddingUnavailableException;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j against an OpenAI-compatible endpoint.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code commentator.semantic.embedding.api-key} - API key, required
 * <li>{@code commentator.semantic.embedding.base-url} - optional endpoint
 * override (local embedding servers)
 * <li>{@code commentator.semantic.embedding.model} - embedding model name
 * <li>{@code commentator.semantic.embedding.dimension} - expected dimension, 0
 * to take it from the first embedding
 * </ul>
 *
 * <p>
 * The model is built lazily on first use. A missing key or a failed build
 * surfaces as {@link EmbeddingUnavailableException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final CommentatorProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        CommentatorProperties.EmbeddingProperties config = properties.getSemantic().getEmbedding();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[SemanticMemory] Embedding API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(getModel())
                    .timeout(Duration.ofMillis(config.getTimeoutMs()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getDimension() > 0) {
                builder.dimensions(config.getDimension());
            }
            embeddingModel = builder.build();
            log.info("[SemanticMemory] Embedding model initialized: {}", getModel());
        } catch (RuntimeException e) {
            log.error("[SemanticMemory] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new EmbeddingUnavailableException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public int getDimension() {
        return Math.max(0, properties.getSemantic().getEmbedding().getDimension());
    }

    @Override
    public String getModel() {
        String model = properties.getSemantic().getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : "text-embedding-3-small";
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
