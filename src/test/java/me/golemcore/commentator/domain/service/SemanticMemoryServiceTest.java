package me.golemcore.commentator.domain.service;

import me.golemcore.commentator.domain.exception.EmbeddingUnavailableException;
import me.golemcore.commentator.domain.model.SemanticMemoryStats;
import me.golemcore.commentator.domain.model.SimilarityExplanation;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.EmbeddingPort;
import me.golemcore.commentator.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SemanticMemoryServiceTest {

    private static final String OWNER = "server-1";
    private static final float[] QUERY = { 1.0f, 0.0f };
    private static final float[] CASTLE = { 0.85f, 0.52678f };
    private static final float[] RAPTOR = { 0.2f, 0.9798f };

    @TempDir
    Path tempDir;

    private CommentatorProperties properties;
    private EmbeddingPort embeddingPort;
    private SemanticMemoryService service;

    @BeforeEach
    void setUp() {
        properties = TestObjects.properties(tempDir);
        properties.getSemantic().setRelevanceThreshold(0.7);
        embeddingPort = mock(EmbeddingPort.class);
        when(embeddingPort.getModel()).thenReturn("test-embedding");
        when(embeddingPort.embed(anyString())).thenAnswer(inv -> {
            String text = inv.getArgument(0);
            if (text.contains("castle")) {
                return CompletableFuture.completedFuture(CASTLE);
            }
            if (text.contains("Raptor")) {
                return CompletableFuture.completedFuture(RAPTOR);
            }
            return CompletableFuture.completedFuture(QUERY);
        });
        service = newService();
    }

    private SemanticMemoryService newService() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneOffset.UTC);
        return new SemanticMemoryService(embeddingPort, TestObjects.storage(properties),
                TestObjects.objectMapper(), properties, clock);
    }

    @Test
    void shouldReturnOnlyMemoriesAboveThreshold() {
        assertTrue(service.store(OWNER, "Player built a stone castle", List.of("placed Stone Wall"), Map.of()));
        assertTrue(service.store(OWNER, "A Raptor attacked", List.of("killed by a Raptor"), Map.of()));

        TierResult<List<String>> result = service.searchResult("constructing a fortress", OWNER);

        assertEquals(TierResult.Status.SUCCESS, result.getStatus());
        assertEquals(List.of("Player built a stone castle"), result.getValue());
    }

    @Test
    void shouldOrderResultsBySimilarityAndLimitToTopK() {
        properties.getSemantic().setRelevanceThreshold(0.1);
        properties.getSemantic().setTopK(1);
        service.store(OWNER, "A Raptor attacked", "killed by a Raptor", Map.of());
        service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of());

        assertEquals(List.of("Player built a stone castle"), service.search("fortress", OWNER));
    }

    @Test
    void shouldIgnoreDuplicateStore() {
        assertTrue(service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of()));
        assertFalse(service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of()));

        SemanticMemoryStats stats = service.getStats();
        assertEquals(1, stats.getTotalMemories());
        assertEquals(1, stats.getOwnerCounts().get(OWNER));
        verify(embeddingPort, times(1)).embed(anyString());
    }

    @Test
    void shouldKeepOwnersIsolated() {
        service.store("other", "Player built a stone castle", "placed Stone Wall", Map.of());

        TierResult<List<String>> result = service.searchResult("fortress", OWNER);

        assertEquals(TierResult.Status.EMPTY, result.getStatus());
    }

    @Test
    void shouldIsolateOwnersSharingFileName() {
        service.store("a b", "Player built a stone castle", "placed Stone Wall", Map.of());

        assertEquals(TierResult.Status.EMPTY, service.searchResult("fortress", "a_b").getStatus());
        assertEquals(List.of("Player built a stone castle"), service.search("fortress", "a b"));
        assertTrue(service.store("a_b", "Player built a stone castle", "placed Stone Wall", Map.of()));

        SemanticMemoryStats stats = service.getStats();
        assertEquals(2, stats.getTotalMemories());
        assertEquals(1, stats.getOwnerCounts().get("a b"));
        assertEquals(1, stats.getOwnerCounts().get("a_b"));
    }

    @Test
    void shouldFixDimensionFromFirstEmbedding() {
        service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of());
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 0.1f, 0.2f, 0.3f }));

        assertEquals(2, service.getDimension());
        assertFalse(service.store(OWNER, "something else", "other lines", Map.of()));
    }

    @Test
    void shouldBehaveAsEmptyStoreWhenDisabled() {
        properties.getSemantic().setEnabled(false);

        assertFalse(service.isEnabled());
        assertFalse(service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of()));
        assertTrue(service.search("fortress", OWNER).isEmpty());
        verify(embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldDisableItselfWhenBackendUnavailable() {
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new EmbeddingUnavailableException("no api key")));

        assertFalse(service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of()));
        assertFalse(service.isEnabled());
        assertFalse(service.store(OWNER, "another response", "lines", Map.of()));
        assertTrue(service.search("fortress", OWNER).isEmpty());
        verify(embeddingPort, times(1)).embed(anyString());
    }

    @Test
    void shouldDegradeSearchOnTransientEmbeddingFailure() {
        service.store(OWNER, "Player built a stone castle", "placed Stone Wall", Map.of());
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        TierResult<List<String>> result = service.searchResult("fortress", OWNER);

        assertTrue(result.isDegraded());
        assertTrue(result.getValue().isEmpty());
        assertTrue(service.isEnabled());
    }

    @Test
    void shouldExplainSimilarity() {
        SimilarityExplanation explanation = service.explainSimilarity("stone castle", "fortress");

        assertNotNull(explanation);
        assertEquals(2, explanation.getDimensions());
        assertEquals(0.85, explanation.getCosineSimilarity(), 1e-4);
        assertEquals("Very high semantic similarity", explanation.getInterpretation());
        assertTrue(explanation.isPassesThreshold());
    }

    @Test
    void shouldInterpretSimilarityBuckets() {
        assertEquals("Nearly identical semantic meaning", SemanticMemoryService.interpret(0.95));
        assertEquals("Moderate semantic similarity", SemanticMemoryService.interpret(0.65));
        assertEquals("Very low or no semantic similarity", SemanticMemoryService.interpret(0.1));
    }

    @Test
    void shouldDeriveStableContentHash() {
        String combined = SemanticMemoryService.combine("r", "s");

        assertEquals("Response: r\n\nContext: s", combined);
        assertEquals(64, SemanticMemoryService.contentHash(OWNER, combined).length());
        assertEquals(SemanticMemoryService.contentHash(OWNER, combined),
                SemanticMemoryService.contentHash(OWNER, combined));
        assertFalse(SemanticMemoryService.contentHash("other", combined)
                .equals(SemanticMemoryService.contentHash(OWNER, combined)));
    }
}
