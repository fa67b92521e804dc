package me.golemcore.commentator.adapter.outbound.llm;

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

import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.GenerationPort;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Generation adapter using langchain4j against an OpenAI-compatible chat
 * endpoint (hosted or a local server via {@code base-url}). The output ceiling
 * is applied per request from the computed token allocation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jGenerationAdapter implements GenerationPort {

    private static final String SYSTEM_PROMPT = "You are a live commentator for a game server. "
            + "Write short, lively commentary about the new events.";

    private final CommentatorProperties properties;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        CommentatorProperties.GenerationProperties config = properties.getGeneration();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Cycle] Generation API key not configured, generation unavailable");
            initialized = true;
            return;
        }

        try {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .timeout(Duration.ofMillis(config.getTimeoutMs()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            chatModel = builder.build();
            log.info("[Cycle] Generation model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Cycle] Failed to initialize generation model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<String> generate(String prompt, int numPredict, String ownerKey) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Generation model not available");
            }

            String system = SYSTEM_PROMPT;
            CommentatorProperties.OwnerProperties owner = properties.getOwners().get(ownerKey);
            if (owner != null && owner.getHeader() != null && !owner.getHeader().isBlank()) {
                system = system + " The commentary is posted under the heading: " + owner.getHeader();
            }

            ChatRequest request = ChatRequest.builder()
                    .messages(SystemMessage.from(system), UserMessage.from(prompt))
                    .maxOutputTokens(numPredict)
                    .build();

            log.debug("[Cycle] Generating for {} (num_predict={}, prompt chars={})",
                    ownerKey, numPredict, prompt.length());
            ChatResponse response = chatModel.chat(request);
            String text = response.aiMessage().text();
            return text != null ? text.trim() : "";
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }
}
