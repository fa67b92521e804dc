package me.golemcore.commentator.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for generating text embeddings (dense vector representations) used by
 * semantic recall of past responses.
 */
public interface EmbeddingPort {

    /**
     * Generate embedding for a single text. Completes exceptionally with
     * {@link me.golemcore.commentator.domain.exception.EmbeddingUnavailableException}
     * when no backend is configured.
     *
     * @param text
     *            the text to embed
     * @return vector representation
     */
    CompletableFuture<float[]> embed(String text);

    /**
     * Get the configured embedding dimension.
     *
     * @return vector dimension, or 0 when it is only known after the first
     *         embedding
     */
    int getDimension();

    /**
     * Get the model name.
     */
    String getModel();

    /**
     * Check if the embedding service is available.
     */
    boolean isAvailable();
}
