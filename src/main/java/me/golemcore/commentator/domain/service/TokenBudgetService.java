package me.golemcore.commentator.domain.service;

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

import me.golemcore.commentator.domain.model.TokenAllocation;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.TokenizerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token accounting for prompts and the generation budget that remains once a
 * prompt is placed in the context window.
 *
 * <p>
 * Counting goes through the {@link TokenizerPort}. When the tokenizer is
 * missing or fails, a {@code max(1, chars / 4)} heuristic is used and the
 * degradation is logged once. Summary token counts and budget checks both use
 * {@link #estimateTokens(String)}, so there is a single counting method.
 */
@Service
@Slf4j
public class TokenBudgetService {

    private static final String LOG_PREFIX = "[TokenBudget]";
    private static final int CHARS_PER_TOKEN = 4;
    private static final int ABSOLUTE_FLOOR = 8;
    private static final int FLOOR_WINDOW_DIVISOR = 8;

    private final TokenizerPort tokenizerPort;
    private final CommentatorProperties.BudgetProperties budget;
    private final AtomicBoolean fallbackLogged = new AtomicBoolean(false);

    public TokenBudgetService(TokenizerPort tokenizerPort, CommentatorProperties properties) {
        this.tokenizerPort = tokenizerPort;
        this.budget = properties.getBudget();
    }

    /**
     * Estimate the number of tokens in {@code text}. Never throws.
     *
     * @return 0 for null or empty text, at least 1 otherwise
     */
    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (tokenizerPort != null) {
            try {
                return Math.max(1, tokenizerPort.countTokens(text));
            } catch (RuntimeException | LinkageError e) {
                if (fallbackLogged.compareAndSet(false, true)) {
                    log.warn("{} Tokenizer unavailable, falling back to character heuristic: {}",
                            LOG_PREFIX, e.getMessage());
                }
            }
        } else if (fallbackLogged.compareAndSet(false, true)) {
            log.warn("{} No tokenizer configured, using character heuristic", LOG_PREFIX);
        }
        return heuristicCount(text);
    }

    /**
     * Allocate the generation budget for a fully assembled prompt using the
     * configured window, buffer and output bounds.
     */
    public TokenAllocation allocate(String prompt) {
        int promptTokens = estimateTokens(prompt);
        return computeAllocation(promptTokens, budget.getContextWindow(), budget.getSafetyBuffer(),
                budget.getMinOutputTokens(), budget.getMaxOutputTokens());
    }

    public int computeNumPredict(int promptTokens, int contextWindow, int safetyBuffer,
            int minOutputTokens, int maxOutputTokens) {
        return computeAllocation(promptTokens, contextWindow, safetyBuffer, minOutputTokens, maxOutputTokens)
                .getNumPredict();
    }

    public TokenAllocation computeAllocation(int promptTokens, int contextWindow, int safetyBuffer,
            int minOutputTokens, int maxOutputTokens) {
        int available = contextWindow - promptTokens - safetyBuffer;

        if (available >= minOutputTokens) {
            int numPredict = Math.min(available, maxOutputTokens);
            log.debug("{} prompt={} available={} num_predict={}", LOG_PREFIX, promptTokens, available, numPredict);
            return TokenAllocation.builder()
                    .promptTokens(promptTokens)
                    .available(available)
                    .numPredict(numPredict)
                    .degraded(false)
                    .build();
        }

        int floor = Math.max(ABSOLUTE_FLOOR, Math.min(minOutputTokens, contextWindow / FLOOR_WINDOW_DIVISOR));
        int numPredict = Math.min(floor, maxOutputTokens);
        log.warn("{} Limited headroom: prompt={} tokens, available={} < min {}, using floor {}",
                LOG_PREFIX, promptTokens, available, minOutputTokens, numPredict);
        return TokenAllocation.builder()
                .promptTokens(promptTokens)
                .available(available)
                .numPredict(numPredict)
                .degraded(true)
                .build();
    }

    static int heuristicCount(String text) {
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }
}
