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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.SummaryRecord;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only store of generated responses, one JSONL file per owner in the
 * {@code summaries/} directory.
 *
 * <p>
 * Records are appended in event order under a per-owner lock, so file order is
 * chronological and "most recent N" is well defined. Token counts are computed
 * with {@link TokenBudgetService#estimateTokens(String)} at write time.
 *
 * <p>
 * Read and write failures surface as {@link StorageException}; callers decide
 * whether that empties a retrieval tier.
 */
@Service
@Slf4j
public class SummaryStoreService {

    private static final String LOG_PREFIX = "[Storage]";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final TokenBudgetService tokenBudgetService;
    private final Clock clock;
    private final String directory;
    private final Map<String, Object> ownerLocks = new ConcurrentHashMap<>();

    public SummaryStoreService(StoragePort storagePort, ObjectMapper objectMapper,
            TokenBudgetService tokenBudgetService, CommentatorProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.tokenBudgetService = tokenBudgetService;
        this.clock = clock;
        this.directory = properties.getStorage().getSummaries();
    }

    /**
     * Persist a generated response for {@code ownerKey}.
     *
     * @throws IllegalArgumentException
     *             if the text is blank
     */
    public SummaryRecord save(String ownerKey, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Summary text must not be blank");
        }
        synchronized (lockFor(ownerKey)) {
            SummaryRecord record = SummaryRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerKey(ownerKey)
                    .timestamp(clock.instant())
                    .text(text)
                    .tokenCount(Math.max(1, tokenBudgetService.estimateTokens(text)))
                    .build();
            String line;
            try {
                line = objectMapper.writeValueAsString(record) + "\n";
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to serialize summary for " + ownerKey, e);
            }
            StorageKeys.call("Append summary", () -> storagePort.appendText(directory, fileFor(ownerKey), line).join());
            log.debug("{} Saved summary for {} ({} tokens)", LOG_PREFIX, ownerKey, record.getTokenCount());
            return record;
        }
    }

    /**
     * All summaries of an owner in chronological order. Keys that sanitise to
     * the same file name share a file, so records are matched on the stored
     * owner key.
     */
    public List<SummaryRecord> getAll(String ownerKey) {
        String content = StorageKeys.call("Read summaries",
                () -> storagePort.getText(directory, fileFor(ownerKey)).join());
        if (content == null || content.isBlank()) {
            return Collections.emptyList();
        }
        List<SummaryRecord> records = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                SummaryRecord record = objectMapper.readValue(line, SummaryRecord.class);
                if (ownerKey.equals(record.getOwnerKey())) {
                    records.add(record);
                }
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed summary line for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            }
        }
        return records;
    }

    /**
     * The {@code limit} most recent summaries, newest first.
     */
    public List<SummaryRecord> getRecent(String ownerKey, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<SummaryRecord> all = getAll(ownerKey);
        List<SummaryRecord> recent = new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
        Collections.reverse(recent);
        return recent;
    }

    /**
     * Newest summaries whose token counts fit in {@code tokenLimit}, returned in
     * chronological order. Selection walks newest to oldest and stops at the
     * first record that would overflow the limit.
     */
    public List<SummaryRecord> getUpToTokenLimit(String ownerKey, int tokenLimit) {
        if (tokenLimit <= 0) {
            return Collections.emptyList();
        }
        List<SummaryRecord> all = getAll(ownerKey);
        List<SummaryRecord> selected = new ArrayList<>();
        int used = 0;
        for (int i = all.size() - 1; i >= 0; i--) {
            SummaryRecord record = all.get(i);
            if (used + record.getTokenCount() > tokenLimit) {
                break;
            }
            used += record.getTokenCount();
            selected.add(record);
        }
        Collections.reverse(selected);
        return selected;
    }

    public boolean hasHistory(String ownerKey) {
        Boolean exists = StorageKeys.call("Check summaries",
                () -> storagePort.exists(directory, fileFor(ownerKey)).join());
        return Boolean.TRUE.equals(exists) && !getAll(ownerKey).isEmpty();
    }

    private Object lockFor(String ownerKey) {
        return ownerLocks.computeIfAbsent(StorageKeys.fileStem(ownerKey), k -> new Object());
    }

    private static String fileFor(String ownerKey) {
        return StorageKeys.fileStem(ownerKey) + StorageKeys.JSONL_EXTENSION;
    }
}
