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

import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.ContextStatistics;
import me.golemcore.commentator.domain.model.ConversationThread;
import me.golemcore.commentator.domain.model.SummaryRecord;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Thread-aware retrieval of recent history for an owner.
 *
 * <p>
 * The token budget is split between a conversation portion (the freshest
 * exchange) and a historical portion (long-term context). Both portions are
 * selected greedily newest-first and stop at the first record that does not
 * fit. The result lists the historical portion before the conversation
 * portion, oldest to newest, with exact duplicates removed.
 *
 * <p>
 * Threads group chronological summaries while the pairwise relatedness of
 * consecutive entries stays at or above the configured threshold.
 */
@Service
@Slf4j
public class ConversationThreadService {

    private static final String LOG_PREFIX = "[Threads]";
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");
    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "was", "are", "were", "be", "been", "have", "has", "had", "do", "does", "did");
    private static final int MIN_NAME_LENGTH = 3;

    private final SummaryStoreService summaryStore;
    private final CommentatorProperties.HistoryProperties history;
    private final Clock clock;

    public ConversationThreadService(SummaryStoreService summaryStore, CommentatorProperties properties,
            Clock clock) {
        this.summaryStore = summaryStore;
        this.history = properties.getHistory();
        this.clock = clock;
    }

    /**
     * Historical texts followed by conversation texts, within
     * {@code totalTokenBudget}. A storage failure empties only the affected
     * portion.
     */
    public List<String> getContextualHistory(String ownerKey, int totalTokenBudget) {
        return getContextualHistoryResult(ownerKey, totalTokenBudget).getValue();
    }

    public TierResult<List<String>> getContextualHistoryResult(String ownerKey, int totalTokenBudget) {
        if (totalTokenBudget <= 0) {
            return TierResult.empty(Collections.emptyList());
        }

        int conversationBudget = (int) (totalTokenBudget * history.getConversationWeight());
        int historicalBudget = totalTokenBudget - conversationBudget;
        List<String> failures = new ArrayList<>();

        List<String> conversation;
        try {
            conversation = selectConversation(ownerKey, conversationBudget);
        } catch (StorageException e) {
            log.warn("{} Conversation history unavailable for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            failures.add("conversation: " + e.getMessage());
            conversation = Collections.emptyList();
        }

        List<String> historical;
        try {
            historical = selectHistorical(ownerKey, historicalBudget, new HashSet<>(conversation));
        } catch (StorageException e) {
            log.warn("{} Historical context unavailable for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            failures.add("historical: " + e.getMessage());
            historical = Collections.emptyList();
        }

        List<String> combined = new ArrayList<>(historical.size() + conversation.size());
        combined.addAll(historical);
        combined.addAll(conversation);

        log.debug("{} {}: {} historical + {} conversation entries (budget {} = {} + {})", LOG_PREFIX, ownerKey,
                historical.size(), conversation.size(), totalTokenBudget, historicalBudget, conversationBudget);

        if (!failures.isEmpty()) {
            return TierResult.degraded(combined, String.join("; ", failures));
        }
        return combined.isEmpty() ? TierResult.empty(combined) : TierResult.success(combined);
    }

    private List<String> selectConversation(String ownerKey, int budget) {
        List<SummaryRecord> recent = summaryStore.getRecent(ownerKey, history.getConversationMaxResponses());
        List<String> accepted = new ArrayList<>();
        int used = 0;
        for (SummaryRecord record : recent) {
            if (used + record.getTokenCount() > budget) {
                break;
            }
            used += record.getTokenCount();
            accepted.add(record.getText());
        }
        Collections.reverse(accepted);
        return accepted;
    }

    private List<String> selectHistorical(String ownerKey, int budget, Set<String> alreadyChosen) {
        List<String> texts = new ArrayList<>();
        for (SummaryRecord record : summaryStore.getUpToTokenLimit(ownerKey, budget)) {
            if (!alreadyChosen.contains(record.getText())) {
                texts.add(record.getText());
            }
        }
        return texts;
    }

    /**
     * Relatedness of two summaries in [0, 1]: temporal decay, owner affinity,
     * lexical overlap and shared capitalized names.
     */
    public double relatednessScore(SummaryRecord a, SummaryRecord b) {
        CommentatorProperties.RelatednessProperties weights = history.getRelatedness();
        double score = 0.0;

        score += temporalScore(a.getTimestamp(), b.getTimestamp()) * weights.getTemporalWeight();

        boolean sameOwner = a.getOwnerKey() != null && a.getOwnerKey().equals(b.getOwnerKey());
        score += sameOwner ? weights.getSameOwnerBonus() : weights.getDifferentOwnerBonus();

        score += jaccard(contentWords(a.getText()), contentWords(b.getText())) * weights.getLexicalWeight();

        Set<String> sharedNames = capitalizedNames(a.getText());
        sharedNames.retainAll(capitalizedNames(b.getText()));
        score += sharedNames.size() * weights.getSharedNameBonus();

        return Math.max(0.0, Math.min(1.0, score));
    }

    double temporalScore(Instant a, Instant b) {
        CommentatorProperties.RelatednessProperties weights = history.getRelatedness();
        if (a == null || b == null) {
            return weights.getDecayFloor();
        }
        Duration gap = Duration.between(a, b).abs();
        for (CommentatorProperties.DecayStep step : weights.getDecaySteps()) {
            if (gap.compareTo(step.getWithin()) <= 0) {
                return step.getScore();
            }
        }
        return weights.getDecayFloor();
    }

    /**
     * Group the {@code limit} most recent summaries into threads, oldest first.
     */
    public List<ConversationThread> buildThreads(String ownerKey, int limit) {
        List<SummaryRecord> chronological;
        try {
            chronological = new ArrayList<>(summaryStore.getRecent(ownerKey, limit));
        } catch (StorageException e) {
            log.warn("{} Cannot build threads for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return Collections.emptyList();
        }
        Collections.reverse(chronological);
        return groupIntoThreads(chronological);
    }

    List<ConversationThread> groupIntoThreads(List<SummaryRecord> chronological) {
        double threshold = history.getRelatedness().getThreshold();
        List<ConversationThread> threads = new ArrayList<>();
        ConversationThread current = null;
        SummaryRecord previous = null;
        for (SummaryRecord record : chronological) {
            if (current == null || relatednessScore(previous, record) < threshold) {
                current = new ConversationThread();
                threads.add(current);
            }
            current.getEntries().add(record);
            previous = record;
        }
        log.trace("{} Grouped {} summaries into {} threads", LOG_PREFIX, chronological.size(), threads.size());
        return threads;
    }

    /**
     * History coverage for an owner. Returns zeroed statistics when storage is
     * unavailable.
     */
    public ContextStatistics getStatistics(String ownerKey) {
        List<SummaryRecord> all;
        try {
            all = summaryStore.getAll(ownerKey);
        } catch (StorageException e) {
            log.warn("{} Statistics unavailable for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            all = Collections.emptyList();
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(history.getStatisticsWindowDays()));
        Instant earliest = null;
        Instant latest = null;
        int recent = 0;
        int tokens = 0;
        for (SummaryRecord record : all) {
            tokens += record.getTokenCount();
            Instant ts = record.getTimestamp();
            if (ts == null) {
                continue;
            }
            if (!ts.isBefore(cutoff)) {
                recent++;
            }
            if (earliest == null || ts.isBefore(earliest)) {
                earliest = ts;
            }
            if (latest == null || ts.isAfter(latest)) {
                latest = ts;
            }
        }

        long coverageDays = earliest != null ? Duration.between(earliest, latest).toDays() : 0;
        return ContextStatistics.builder()
                .ownerKey(ownerKey)
                .totalSummaries(all.size())
                .recentSummaries(recent)
                .totalTokens(tokens)
                .earliest(earliest)
                .latest(latest)
                .coverageDays(coverageDays)
                .build();
    }

    private static Set<String> contentWords(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty() && !STOPWORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> capitalizedNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        for (String token : TOKEN_SPLIT.split(text)) {
            if (token.length() >= MIN_NAME_LENGTH
                    && Character.isUpperCase(token.charAt(0))
                    && token.chars().allMatch(Character::isLetter)) {
                names.add(token);
            }
        }
        return names;
    }
}
