package me.golemcore.commentator.adapter.outbound.logsource;

import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogFileSourceAdapterTest {

    @TempDir
    Path tempDir;

    private Path logFile;
    private CommentatorProperties.SourceProperties source;
    private LogFileSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        logFile = tempDir.resolve("server.log");
        source = new CommentatorProperties.SourceProperties();
        source.setLogFile(logFile.toString());
        CommentatorProperties properties = new CommentatorProperties();
        properties.getSources().put("island", source);
        adapter = new LogFileSourceAdapter(properties);
    }

    @Test
    void shouldReturnOnlyNewLinesOnEachFetch() throws IOException {
        write("Kira joined\nBob died\n");
        assertEquals(List.of("Kira joined", "Bob died"), adapter.fetchLines("island"));

        append("Kira left\n");
        assertEquals(List.of("Kira left"), adapter.fetchLines("island"));
        assertTrue(adapter.fetchLines("island").isEmpty());
    }

    @Test
    void shouldHoldBackLineStillBeingWritten() throws IOException {
        write("Bob joined\nSletty tam");
        assertEquals(List.of("Bob joined"), adapter.fetchLines("island"));

        append("ed a Rex\n");
        assertEquals(List.of("Sletty tamed a Rex"), adapter.fetchLines("island"));
    }

    @Test
    void shouldNotSplitMultiByteCharacterAcrossFetches() throws IOException {
        byte[] encoded = "Kira built a Caf\u00e9\n".getBytes(StandardCharsets.UTF_8);
        int split = encoded.length - 2;
        Files.write(logFile, Arrays.copyOfRange(encoded, 0, split));
        assertTrue(adapter.fetchLines("island").isEmpty());

        Files.write(logFile, Arrays.copyOfRange(encoded, split, encoded.length), StandardOpenOption.APPEND);
        assertEquals(List.of("Kira built a Caf\u00e9"), adapter.fetchLines("island"));
    }

    @Test
    void shouldReadOnlyBoundedWindowOfLargeFile() throws IOException {
        source.setMaxLines(2);
        source.setMaxLineLength(10);
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            content.append(String.format("line-%02d\n", i));
        }
        write(content.toString());

        assertEquals(88L, LogFileSourceAdapter.readWindow(source));
        assertEquals(List.of("line-18", "line-19"), adapter.fetchLines("island"));

        append("line-20\n");
        assertEquals(List.of("line-20"), adapter.fetchLines("island"));
    }

    @Test
    void shouldRestartFromBeginningWhenFileShrinks() throws IOException {
        write("a long line that will be rotated away\n");
        adapter.fetchLines("island");

        write("fresh\n");

        assertEquals(List.of("fresh"), adapter.fetchLines("island"));
    }

    @Test
    void shouldKeepOnlyLastMaxLines() throws IOException {
        source.setMaxLines(2);
        write("one\ntwo\nthree\n");

        assertEquals(List.of("two", "three"), adapter.fetchLines("island"));
    }

    @Test
    void shouldDropBlankLinesAndControlCharacters() throws IOException {
        write("\n  \nKira\u0007 joined\r\n");

        assertEquals(List.of("Kira joined"), adapter.fetchLines("island"));
    }

    @Test
    void shouldCapLineLength() {
        assertEquals("abc", LogFileSourceAdapter.sanitize("abcdef", 3));
        assertEquals(500, LogFileSourceAdapter.sanitize("x".repeat(600), 0).length());
    }

    @Test
    void shouldReturnEmptyForUnknownSourceOrMissingFile() {
        assertTrue(adapter.fetchLines("unknown").isEmpty());
        assertTrue(adapter.fetchLines("island").isEmpty());
    }

    private void write(String content) throws IOException {
        Files.writeString(logFile, content, StandardCharsets.UTF_8);
    }

    private void append(String content) throws IOException {
        Files.writeString(logFile, content, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }
}
