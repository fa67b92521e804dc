package me.golemcore.commentator.domain.service;

import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.ContextStatistics;
import me.golemcore.commentator.domain.model.ConversationThread;
import me.golemcore.commentator.domain.model.SummaryRecord;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.TokenizerPort;
import me.golemcore.commentator.testsupport.MutableClock;
import me.golemcore.commentator.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationThreadServiceTest {

    private static final String OWNER = "server-1";
    private static final Instant START = Instant.parse("2026-02-11T10:00:00Z");

    @TempDir
    Path tempDir;

    private CommentatorProperties properties;
    private MutableClock clock;
    private SummaryStoreService store;
    private ConversationThreadService service;

    @BeforeEach
    void setUp() {
        properties = TestObjects.properties(tempDir);
        TokenizerPort tokenizerPort = mock(TokenizerPort.class);
        when(tokenizerPort.countTokens(anyString())).thenReturn(40);
        clock = new MutableClock(START);
        store = new SummaryStoreService(TestObjects.storage(properties), TestObjects.objectMapper(),
                new TokenBudgetService(tokenizerPort, properties), properties, clock);
        service = new ConversationThreadService(store, properties, clock);
    }

    @Test
    void shouldSplitBudgetBetweenHistoricalAndConversation() {
        store.save(OWNER, "s1");
        store.save(OWNER, "s2");
        store.save(OWNER, "s3");

        // 334 * 0.3 = 100 conversation tokens, 234 historical
        TierResult<List<String>> result = service.getContextualHistoryResult(OWNER, 334);

        assertEquals(TierResult.Status.SUCCESS, result.getStatus());
        assertEquals(List.of("s1", "s2", "s3"), result.getValue());
    }

    @Test
    void shouldListHistoricalBeforeConversation() {
        for (int i = 1; i <= 6; i++) {
            store.save(OWNER, "s" + i);
        }

        // 102 conversation tokens fit s5 and s6; 238 historical fit s2..s6, minus duplicates
        List<String> history = service.getContextualHistory(OWNER, 340);

        assertEquals(List.of("s2", "s3", "s4", "s5", "s6"), history);
    }

    @Test
    void shouldNotRepeatEntriesAcrossPortions() {
        store.save(OWNER, "only one");

        List<String> history = service.getContextualHistory(OWNER, 1000);

        assertEquals(List.of("only one"), history);
    }

    @Test
    void shouldReturnEmptyForZeroBudget() {
        store.save(OWNER, "s1");

        TierResult<List<String>> result = service.getContextualHistoryResult(OWNER, 0);

        assertEquals(TierResult.Status.EMPTY, result.getStatus());
        assertTrue(result.getValue().isEmpty());
    }

    @Test
    void shouldDegradeWhenStorageFails() {
        SummaryStoreService failing = mock(SummaryStoreService.class);
        when(failing.getRecent(anyString(), anyInt())).thenThrow(new StorageException("read failed"));
        when(failing.getUpToTokenLimit(anyString(), anyInt())).thenThrow(new StorageException("read failed"));
        ConversationThreadService degraded = new ConversationThreadService(failing, properties, clock);

        TierResult<List<String>> result = degraded.getContextualHistoryResult(OWNER, 500);

        assertTrue(result.isDegraded());
        assertTrue(result.getValue().isEmpty());
    }

    @Test
    void shouldScoreCloseRelatedSummariesHigh() {
        SummaryRecord a = record(OWNER, START, "Sletty tamed a Rex");
        SummaryRecord b = record(OWNER, START.plus(Duration.ofMinutes(2)), "Sletty tamed a Raptor");

        // 0.4 temporal + 0.3 owner + 0.5 * 0.3 lexical + 0.1 shared name
        assertEquals(0.95, service.relatednessScore(a, b), 1e-9);
    }

    @Test
    void shouldScoreDistantUnrelatedSummariesLow() {
        SummaryRecord a = record("alpha", START, "storm incoming");
        SummaryRecord b = record("beta", START.plus(Duration.ofHours(10)), "quiet night");

        assertEquals(0.14, service.relatednessScore(a, b), 1e-9);
    }

    @Test
    void shouldClampScoreToOne() {
        String text = "Alpha Bravo Charlie Delta Echo Foxtrot";
        SummaryRecord a = record(OWNER, START, text);
        SummaryRecord b = record(OWNER, START, text);

        assertEquals(1.0, service.relatednessScore(a, b));
    }

    @Test
    void shouldDecayTemporalScoreWithGap() {
        assertEquals(1.0, service.temporalScore(START, START.plus(Duration.ofMinutes(5))));
        assertEquals(0.8, service.temporalScore(START, START.plus(Duration.ofMinutes(10))));
        assertEquals(0.6, service.temporalScore(START.plus(Duration.ofMinutes(45)), START));
        assertEquals(0.3, service.temporalScore(START, START.plus(Duration.ofHours(3))));
        assertEquals(0.1, service.temporalScore(START, START.plus(Duration.ofDays(1))));
        assertEquals(0.1, service.temporalScore(null, START));
    }

    @Test
    void shouldStartNewThreadBelowThreshold() {
        properties.getHistory().getRelatedness().setThreshold(0.5);
        List<SummaryRecord> records = List.of(
                record(OWNER, START, "Sletty tamed a Rex"),
                record(OWNER, START.plus(Duration.ofMinutes(2)), "Sletty tamed a Raptor"),
                record(OWNER, START.plus(Duration.ofHours(10)), "storm over the island"));

        List<ConversationThread> threads = service.groupIntoThreads(records);

        assertEquals(2, threads.size());
        assertEquals(2, threads.get(0).size());
        assertEquals(START, threads.get(0).getStartedAt());
        assertEquals(START.plus(Duration.ofHours(10)), threads.get(1).getEndedAt());
    }

    @Test
    void shouldBuildThreadsFromStoredSummariesOldestFirst() {
        store.save(OWNER, "Sletty tamed a Rex");
        clock.advance(Duration.ofMinutes(1));
        store.save(OWNER, "Sletty tamed a Raptor");

        List<ConversationThread> threads = service.buildThreads(OWNER, 10);

        assertEquals(1, threads.size());
        assertEquals("Sletty tamed a Rex", threads.get(0).getEntries().get(0).getText());
        assertEquals(80, threads.get(0).getTokenCount());
    }

    @Test
    void shouldComputeStatistics() {
        store.save(OWNER, "old");
        clock.advance(Duration.ofDays(10));
        store.save(OWNER, "newer");
        clock.advance(Duration.ofDays(1));
        store.save(OWNER, "newest");

        ContextStatistics stats = service.getStatistics(OWNER);

        assertEquals(3, stats.getTotalSummaries());
        assertEquals(2, stats.getRecentSummaries());
        assertEquals(120, stats.getTotalTokens());
        assertEquals(START, stats.getEarliest());
        assertEquals(11, stats.getCoverageDays());
    }

    @Test
    void shouldReturnZeroedStatisticsWithoutHistory() {
        ContextStatistics stats = service.getStatistics("nobody");

        assertEquals(0, stats.getTotalSummaries());
        assertEquals(0, stats.getCoverageDays());
    }

    private static SummaryRecord record(String owner, Instant timestamp, String text) {
        return SummaryRecord.builder()
                .id(text)
                .ownerKey(owner)
                .timestamp(timestamp)
                .text(text)
                .tokenCount(10)
                .build();
    }
}
