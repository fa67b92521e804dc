package me.golemcore.commentator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.SummaryRecord;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.StoragePort;
import me.golemcore.commentator.port.outbound.TokenizerPort;
import me.golemcore.commentator.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SummaryStoreServiceTest {

    private static final String OWNER = "server-1";

    @TempDir
    Path tempDir;

    private TokenizerPort tokenizerPort;
    private SummaryStoreService store;

    @BeforeEach
    void setUp() {
        CommentatorProperties properties = TestObjects.properties(tempDir);
        tokenizerPort = mock(TokenizerPort.class);
        when(tokenizerPort.countTokens(anyString())).thenAnswer(inv -> inv.<String>getArgument(0).length());
        TokenBudgetService budget = new TokenBudgetService(tokenizerPort, properties);
        Clock clock = Clock.fixed(Instant.parse("2026-02-11T10:00:00Z"), ZoneOffset.UTC);
        store = new SummaryStoreService(TestObjects.storage(properties), TestObjects.objectMapper(), budget,
                properties, clock);
    }

    @Test
    void shouldSaveSummaryWithTokenCount() {
        SummaryRecord record = store.save(OWNER, "Rex spotted near base");

        assertNotNull(record.getId());
        assertEquals(OWNER, record.getOwnerKey());
        assertEquals(21, record.getTokenCount());
        assertEquals(Instant.parse("2026-02-11T10:00:00Z"), record.getTimestamp());
        assertEquals(1, store.getAll(OWNER).size());
    }

    @Test
    void shouldRejectBlankText() {
        assertThrows(IllegalArgumentException.class, () -> store.save(OWNER, "  "));
    }

    @Test
    void shouldReturnRecentNewestFirst() {
        store.save(OWNER, "first");
        store.save(OWNER, "second");
        store.save(OWNER, "third");

        List<SummaryRecord> recent = store.getRecent(OWNER, 2);

        assertEquals(List.of("third", "second"), recent.stream().map(SummaryRecord::getText).toList());
    }

    @Test
    void shouldSelectNewestWithinTokenLimitInChronologicalOrder() {
        store.save(OWNER, "aaaaaaaaaa");
        store.save(OWNER, "bbbbb");
        store.save(OWNER, "ccccc");

        List<SummaryRecord> selected = store.getUpToTokenLimit(OWNER, 12);

        assertEquals(List.of("bbbbb", "ccccc"), selected.stream().map(SummaryRecord::getText).toList());
    }

    @Test
    void shouldStopAtFirstRecordThatOverflows() {
        store.save(OWNER, "aa");
        store.save(OWNER, "bbbbbbbbbbbbbbbbbbbb");
        store.save(OWNER, "cc");

        List<SummaryRecord> selected = store.getUpToTokenLimit(OWNER, 10);

        assertEquals(List.of("cc"), selected.stream().map(SummaryRecord::getText).toList());
    }

    @Test
    void shouldReportHistoryPerOwner() {
        assertFalse(store.hasHistory(OWNER));

        store.save(OWNER, "something happened");

        assertTrue(store.hasHistory(OWNER));
        assertFalse(store.hasHistory("other"));
    }

    @Test
    void shouldKeepOwnersSeparate() {
        store.save("a/b", "for a");
        store.save("c", "for c");

        assertEquals(1, store.getAll("a/b").size());
        assertEquals("for c", store.getAll("c").get(0).getText());
    }

    @Test
    void shouldNotLeakRecordsBetweenOwnersSharingFileName() {
        store.save("a b", "for a b");
        store.save("a_b", "for a_b");

        List<SummaryRecord> spaced = store.getAll("a b");
        assertEquals(1, spaced.size());
        assertEquals("for a b", spaced.get(0).getText());
        assertEquals(List.of("for a_b"), store.getAll("a_b").stream().map(SummaryRecord::getText).toList());
        assertFalse(store.hasHistory("a:b"));
    }

    @Test
    void shouldSurfaceStorageFailure() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new java.io.IOException("disk gone")));
        CommentatorProperties properties = new CommentatorProperties();
        SummaryStoreService failingStore = new SummaryStoreService(failing, new ObjectMapper(),
                new TokenBudgetService(tokenizerPort, properties), properties, Clock.systemUTC());

        assertThrows(StorageException.class, () -> failingStore.getAll(OWNER));
    }
}
