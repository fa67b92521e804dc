package me.golemcore.commentator.adapter.outbound.logsource;

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
import me.golemcore.commentator.port.outbound.LogSourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Log source that tails a local file per configured source. Each fetch returns
 * the lines appended since the previous fetch, at most
 * {@code commentator.sources.<id>.max-lines} of the newest ones. Only lines
 * terminated by a newline are consumed, and a single read is bounded to a
 * window before the end of the file. A file that shrank is treated as rotated
 * and read from the start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogFileSourceAdapter implements LogSourcePort {

    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
    private static final int DEFAULT_MAX_LINE_LENGTH = 500;
    private static final long MAX_BYTES_PER_CHAR = 4;
    private static final long MAX_READ_BYTES = 64L * 1024 * 1024;

    private final CommentatorProperties properties;

    private final Map<String, Long> offsets = new ConcurrentHashMap<>();

    @Override
    public List<String> fetchLines(String sourceId) {
        CommentatorProperties.SourceProperties source = properties.getSources().get(sourceId);
        if (source == null || source.getLogFile() == null || source.getLogFile().isBlank()) {
            log.warn("[Cycle] No log file configured for source {}", sourceId);
            return Collections.emptyList();
        }

        Path path = Paths.get(source.getLogFile().replace("${user.home}", System.getProperty("user.home")));
        if (!Files.isRegularFile(path)) {
            log.debug("[Cycle] Log file not found for source {}: {}", sourceId, path);
            return Collections.emptyList();
        }

        String chunk;
        try {
            chunk = readFromOffset(sourceId, path, source);
        } catch (IOException e) {
            log.warn("[Cycle] Failed to read log file for source {}: {}", sourceId, e.getMessage());
            return Collections.emptyList();
        }

        List<String> lines = new ArrayList<>();
        for (String raw : chunk.split("\\R")) {
            String clean = sanitize(raw, source.getMaxLineLength());
            if (!clean.isEmpty()) {
                lines.add(clean);
            }
        }

        int maxLines = Math.max(1, source.getMaxLines());
        if (lines.size() > maxLines) {
            lines = new ArrayList<>(lines.subList(lines.size() - maxLines, lines.size()));
        }
        log.debug("[Cycle] Fetched {} new lines from source {}", lines.size(), sourceId);
        return lines;
    }

    private String readFromOffset(String sourceId, Path path, CommentatorProperties.SourceProperties source)
            throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long offset = offsets.getOrDefault(sourceId, 0L);
            if (offset > length) {
                log.info("[Cycle] Log file for source {} was rotated, reading from start", sourceId);
                offset = 0L;
            }
            if (length - offset <= 0) {
                return "";
            }

            long window = readWindow(source);
            long start = offset;
            boolean truncated = false;
            if (length - start > window) {
                start = length - window;
                truncated = true;
            }
            byte[] buffer = new byte[(int) (length - start)];
            file.seek(start);
            file.readFully(buffer);

            // only complete lines are consumed; a trailing partial line waits for its newline
            int end = lastIndexOf(buffer, (byte) '\n') + 1;
            if (end == 0) {
                if (truncated) {
                    log.warn("[Cycle] Line longer than {} bytes in source {} skipped", window, sourceId);
                    offsets.put(sourceId, length);
                }
                return "";
            }
            int begin = truncated ? indexOf(buffer, (byte) '\n') + 1 : 0;
            offsets.put(sourceId, start + end);
            return begin < end ? new String(buffer, begin, end - begin, StandardCharsets.UTF_8) : "";
        }
    }

    /**
     * Upper bound in bytes for one read: enough for {@code max-lines} lines of
     * {@code max-line-length} four-byte characters. Older bytes are skipped.
     */
    static long readWindow(CommentatorProperties.SourceProperties source) {
        long lines = Math.max(1, source.getMaxLines());
        long lineLength = source.getMaxLineLength() > 0 ? source.getMaxLineLength() : DEFAULT_MAX_LINE_LENGTH;
        return Math.min(lines * (lineLength + 1) * MAX_BYTES_PER_CHAR, MAX_READ_BYTES);
    }

    private static int indexOf(byte[] buffer, byte value) {
        for (int i = 0; i < buffer.length; i++) {
            if (buffer[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(byte[] buffer, byte value) {
        for (int i = buffer.length - 1; i >= 0; i--) {
            if (buffer[i] == value) {
                return i;
            }
        }
        return -1;
    }

    static String sanitize(String line, int maxLength) {
        if (line == null) {
            return "";
        }
        String clean = CONTROL_CHARS.matcher(line).replaceAll("").trim();
        int cap = maxLength > 0 ? maxLength : DEFAULT_MAX_LINE_LENGTH;
        return clean.length() > cap ? clean.substring(0, cap) : clean;
    }
}
