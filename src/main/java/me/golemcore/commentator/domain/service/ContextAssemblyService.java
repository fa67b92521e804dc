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

import me.golemcore.commentator.domain.exception.ContextAssemblyException;
import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.AssembledPrompt;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.domain.model.TokenAllocation;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Builds the bounded prompt for one commentary cycle.
 *
 * <p>
 * Pipeline per request:
 * <ol>
 * <li>Entity extraction and profile update from the new event lines</li>
 * <li>Concurrent retrieval of history, related memories and entity blurbs,
 * each bounded by the tier timeout</li>
 * <li>Merge in fixed order: owner preamble, history, related memories, player
 * context, non-repetition instruction, delimited new events</li>
 * <li>Generation budget for the merged prompt</li>
 * </ol>
 *
 * <p>
 * A failed or timed-out tier contributes nothing and is reported as
 * {@link TierResult.Status#DEGRADED}. Only a request with no event lines for
 * an owner without history is rejected.
 */
@Service
@Slf4j
public class ContextAssemblyService {

    private static final String LOG_PREFIX = "[Assembler]";

    static final String HISTORY_HEADER = "RECENT RESPONSES CONTEXT (do not repeat this content):";
    static final String MEMORY_HEADER = "RELATED PAST RESPONSES (avoid repeating these):";
    static final String PLAYER_HEADER = "PLAYER CONTEXT (for personalized commentary):";
    static final String INSTRUCTION_WITH_PLAYERS = "Please create fresh commentary that acknowledges player "
            + "personalities while avoiding repetition from the above context.";
    static final String INSTRUCTION = "Please create fresh commentary while avoiding repetition from the "
            + "above context.";
    static final String EVENTS_BEGIN = "=== NEW EVENTS ===";
    static final String EVENTS_END = "=== END EVENTS ===";

    private final EntityProfileService entityProfileService;
    private final ConversationThreadService conversationThreadService;
    private final SemanticMemoryService semanticMemoryService;
    private final TokenBudgetService tokenBudgetService;
    private final SummaryStoreService summaryStoreService;
    private final CommentatorProperties properties;
    private final ExecutorService tierExecutor;

    public ContextAssemblyService(EntityProfileService entityProfileService,
            ConversationThreadService conversationThreadService,
            SemanticMemoryService semanticMemoryService,
            TokenBudgetService tokenBudgetService,
            SummaryStoreService summaryStoreService,
            CommentatorProperties properties,
            @Qualifier("tierExecutor") ExecutorService tierExecutor) {
        this.entityProfileService = entityProfileService;
        this.conversationThreadService = conversationThreadService;
        this.semanticMemoryService = semanticMemoryService;
        this.tokenBudgetService = tokenBudgetService;
        this.summaryStoreService = summaryStoreService;
        this.properties = properties;
        this.tierExecutor = tierExecutor;
    }

    public AssembledPrompt assemble(String ownerKey, List<String> newEventLines) {
        return assemble(ownerKey, newEventLines, properties.getBudget().getPromptTokenBudget());
    }

    /**
     * Assemble the prompt for {@code ownerKey}.
     *
     * @throws ContextAssemblyException
     *             if there are no event lines and the owner has no history
     */
    public AssembledPrompt assemble(String ownerKey, List<String> newEventLines, int totalTokenBudget) {
        List<String> lines = newEventLines != null ? newEventLines : Collections.emptyList();
        if (lines.isEmpty() && !hasHistory(ownerKey)) {
            throw new ContextAssemblyException("No event lines and no history for owner " + ownerKey);
        }

        Set<String> entities = extractAndUpdate(ownerKey, lines);

        int historyBudget = (int) (totalTokenBudget * properties.getHistory().getHistoryShare());
        String query = String.join("\n", lines);
        int blurbChars = properties.getProfiles().getBlurbMaxChars();

        CompletableFuture<TierResult<List<String>>> historyFuture = runTier(AssembledPrompt.TIER_HISTORY,
                () -> conversationThreadService.getContextualHistoryResult(ownerKey, historyBudget),
                Collections.emptyList());
        CompletableFuture<TierResult<List<String>>> semanticFuture = runTier(AssembledPrompt.TIER_SEMANTIC,
                () -> semanticMemoryService.searchResult(query, ownerKey),
                Collections.emptyList());
        CompletableFuture<TierResult<String>> entityFuture = runTier(AssembledPrompt.TIER_ENTITIES,
                () -> entityProfileService.getContextualSummariesResult(entities, ownerKey, blurbChars),
                "");

        TierResult<List<String>> history = historyFuture.join();
        TierResult<List<String>> memories = semanticFuture.join();
        TierResult<String> players = entityFuture.join();

        String prompt = merge(ownerKey, history.getValue(), memories.getValue(), players.getValue(), lines);
        TokenAllocation allocation = tokenBudgetService.allocate(prompt);

        Map<String, TierResult.Status> statuses = new LinkedHashMap<>();
        statuses.put(AssembledPrompt.TIER_HISTORY, history.getStatus());
        statuses.put(AssembledPrompt.TIER_SEMANTIC, memories.getStatus());
        statuses.put(AssembledPrompt.TIER_ENTITIES, players.getStatus());

        log.info("{} {}: {} lines, {} entities, history={} semantic={} entities={}, prompt={} tokens, "
                + "num_predict={}", LOG_PREFIX, ownerKey, lines.size(), entities.size(), history.getStatus(),
                memories.getStatus(), players.getStatus(), allocation.getPromptTokens(),
                allocation.getNumPredict());

        return AssembledPrompt.builder()
                .ownerKey(ownerKey)
                .promptText(prompt)
                .extractedEntities(entities)
                .allocation(allocation)
                .tierStatuses(statuses)
                .build();
    }

    private Set<String> extractAndUpdate(String ownerKey, List<String> lines) {
        if (lines.isEmpty()) {
            return new LinkedHashSet<>();
        }
        try {
            return entityProfileService.processEventLines(ownerKey, lines);
        } catch (RuntimeException e) {
            log.warn("{} Entity processing failed for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return new LinkedHashSet<>();
        }
    }

    private boolean hasHistory(String ownerKey) {
        try {
            return summaryStoreService.hasHistory(ownerKey);
        } catch (StorageException e) {
            log.warn("{} Cannot check history for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return false;
        }
    }

    private <T> CompletableFuture<TierResult<T>> runTier(String tier, Supplier<TierResult<T>> lookup, T fallback) {
        Duration timeout = properties.getAssembly().getTierTimeout();
        return CompletableFuture.supplyAsync(lookup, tierExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("{} Tier {} degraded: {}", LOG_PREFIX, tier, cause.toString());
                    return TierResult.degraded(fallback, cause.toString());
                });
    }

    String merge(String ownerKey, List<String> history, List<String> memories, String players,
            List<String> lines) {
        StringBuilder sb = new StringBuilder();

        CommentatorProperties.OwnerProperties owner = properties.getOwners().get(ownerKey);
        if (owner != null && owner.getPreamble() != null && !owner.getPreamble().isBlank()) {
            sb.append(owner.getPreamble().trim()).append("\n\n");
        }

        if (history != null && !history.isEmpty()) {
            sb.append(HISTORY_HEADER).append('\n');
            for (String text : history) {
                sb.append("- ").append(text).append('\n');
            }
            sb.append('\n');
        }

        if (memories != null && !memories.isEmpty()) {
            sb.append(MEMORY_HEADER).append('\n');
            for (String text : memories) {
                sb.append("- ").append(text).append('\n');
            }
            sb.append('\n');
        }

        boolean hasPlayers = players != null && !players.isBlank();
        if (hasPlayers) {
            sb.append(PLAYER_HEADER).append('\n').append(players).append("\n\n");
        }

        sb.append(hasPlayers ? INSTRUCTION_WITH_PLAYERS : INSTRUCTION).append("\n\n");

        sb.append(EVENTS_BEGIN).append('\n');
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        sb.append(EVENTS_END);
        return sb.toString();
    }
}
