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
import me.golemcore.commentator.domain.exception.EmbeddingUnavailableException;
import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.MemoryRecord;
import me.golemcore.commentator.domain.model.SemanticMemoryStats;
import me.golemcore.commentator.domain.model.SimilarityExplanation;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.EmbeddingPort;
import me.golemcore.commentator.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semantic recall of past responses. Each generated response is embedded
 * together with the event lines that prompted it and persisted to
 * {@code semantic/<owner>.jsonl}; later cycles search those records by cosine
 * similarity against the new event text.
 *
 * <p>
 * The service never throws to its callers. When the feature is switched off,
 * or the embedding backend reports {@link EmbeddingUnavailableException}, it
 * behaves as an empty store for the rest of the process lifetime. Transient
 * failures (timeouts, storage errors) degrade only the call in progress.
 *
 * <p>
 * The embedding dimension is fixed per process: taken from the backend
 * configuration when known, otherwise from the first embedding produced.
 * Vectors of any other length are rejected on write and ignored on search.
 */
@Service
@Slf4j
public class SemanticMemoryService {

    private static final String LOG_PREFIX = "[SemanticMemory]";
    private static final int PREVIEW_LENGTH = 100;

    private final EmbeddingPort embeddingPort;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CommentatorProperties.SemanticProperties semantic;
    private final String directory;

    private final AtomicBoolean unavailable = new AtomicBoolean(false);
    private final AtomicInteger dimension = new AtomicInteger(0);
    private final Map<String, Object> ownerLocks = new ConcurrentHashMap<>();

    public SemanticMemoryService(EmbeddingPort embeddingPort, StoragePort storagePort, ObjectMapper objectMapper,
            CommentatorProperties properties, Clock clock) {
        this.embeddingPort = embeddingPort;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.semantic = properties.getSemantic();
        this.directory = properties.getStorage().getSemantic();
        this.dimension.set(Math.max(0, embeddingPort.getDimension()));
    }

    public boolean isEnabled() {
        return semantic.isEnabled() && !unavailable.get();
    }

    public int getDimension() {
        return dimension.get();
    }

    // ==================== STORE ====================

    public boolean store(String ownerKey, String responseText, List<String> sourceLines,
            Map<String, Object> metadata) {
        List<String> lines = sourceLines != null ? sourceLines : Collections.emptyList();
        Map<String, Object> enriched = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        enriched.put("sourceLineCount", lines.size());
        return store(ownerKey, responseText, String.join("\n", lines), enriched);
    }

    /**
     * Embed and persist a response/context pair.
     *
     * @return {@code true} if a new record was written; {@code false} for a
     *         duplicate, when disabled, or when embedding or storage failed
     */
    public boolean store(String ownerKey, String responseText, String sourceText, Map<String, Object> metadata) {
        if (!isEnabled() || responseText == null || responseText.isBlank()) {
            return false;
        }

        String source = sourceText != null ? sourceText : "";
        String combined = combine(responseText, source);
        String id = contentHash(ownerKey, combined);

        synchronized (lockFor(ownerKey)) {
            try {
                if (loadRecords(ownerKey).stream().anyMatch(r -> id.equals(r.getId()))) {
                    log.debug("{} Duplicate memory for {} ignored ({})", LOG_PREFIX, ownerKey, id);
                    return false;
                }
            } catch (StorageException e) {
                log.warn("{} Cannot check duplicates for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
                return false;
            }

            float[] embedding = embedOrNull(combined);
            if (embedding == null) {
                return false;
            }
            if (!acceptDimension(embedding)) {
                log.warn("{} Rejected embedding of dimension {} (expected {})", LOG_PREFIX, embedding.length,
                        dimension.get());
                return false;
            }

            Instant now = clock.instant();
            Map<String, Object> recordMetadata = metadata != null ? new LinkedHashMap<>(metadata)
                    : new LinkedHashMap<>();
            recordMetadata.put("owner", ownerKey);
            recordMetadata.put("timestamp", now.toString());
            recordMetadata.putIfAbsent("sourceLineCount", source.isEmpty() ? 0 : source.split("\n").length);

            MemoryRecord record = MemoryRecord.builder()
                    .id(id)
                    .ownerKey(ownerKey)
                    .responseText(responseText)
                    .sourceText(source)
                    .embedding(embedding)
                    .timestamp(now)
                    .metadata(recordMetadata)
                    .build();

            try {
                String line = objectMapper.writeValueAsString(record) + "\n";
                StorageKeys.call("Append memory",
                        () -> storagePort.appendText(directory, fileFor(ownerKey), line).join());
            } catch (JsonProcessingException | StorageException e) {
                log.warn("{} Failed to persist memory for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
                return false;
            }
            log.debug("{} Stored memory {} for {}", LOG_PREFIX, id, ownerKey);
            return true;
        }
    }

    // ==================== SEARCH ====================

    /**
     * Response texts of the most similar past memories, best first.
     */
    public List<String> search(String queryText, String ownerKey) {
        return searchResult(queryText, ownerKey).getValue();
    }

    public TierResult<List<String>> searchResult(String queryText, String ownerKey) {
        if (!isEnabled()) {
            return TierResult.empty(Collections.emptyList());
        }
        if (queryText == null || queryText.isBlank()) {
            return TierResult.empty(Collections.emptyList());
        }

        List<MemoryRecord> records;
        try {
            records = loadRecords(ownerKey);
        } catch (StorageException e) {
            log.warn("{} Memory records unavailable for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return TierResult.degraded(Collections.emptyList(), e.getMessage());
        }
        if (records.isEmpty()) {
            return TierResult.empty(Collections.emptyList());
        }

        float[] query;
        try {
            query = embed(queryText);
        } catch (EmbeddingUnavailableException e) {
            return TierResult.empty(Collections.emptyList());
        } catch (RuntimeException e) {
            log.warn("{} Query embedding failed for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return TierResult.degraded(Collections.emptyList(), "embedding failed: " + e.getMessage());
        }

        double threshold = semantic.getRelevanceThreshold();
        List<ScoredMemory> scored = new ArrayList<>();
        for (MemoryRecord record : records) {
            float[] vector = record.getEmbedding();
            if (vector == null || vector.length != query.length) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(query, vector);
            if (similarity >= threshold) {
                scored.add(new ScoredMemory(record, similarity));
            }
        }

        List<String> results = scored.stream()
                .sorted(Comparator.comparingDouble(ScoredMemory::similarity).reversed())
                .limit(Math.max(0, semantic.getTopK()))
                .map(s -> s.record().getResponseText())
                .toList();

        log.debug("{} {} of {} memories above {} for {}", LOG_PREFIX, results.size(), records.size(), threshold,
                ownerKey);
        return results.isEmpty() ? TierResult.empty(results) : TierResult.success(results);
    }

    // ==================== DIAGNOSTICS ====================

    public SimilarityExplanation explainSimilarity(String text1, String text2) {
        if (!isEnabled()) {
            return SimilarityExplanation.failure("Semantic memory is disabled");
        }
        float[] a;
        float[] b;
        try {
            a = embed(text1);
            b = embed(text2);
        } catch (RuntimeException e) {
            return SimilarityExplanation.failure("Embedding failed: " + e.getMessage());
        }
        if (a.length != b.length) {
            return SimilarityExplanation.failure("Dimension mismatch: " + a.length + " != " + b.length);
        }

        double cosine = VectorMath.cosineSimilarity(a, b);
        double threshold = semantic.getRelevanceThreshold();
        return SimilarityExplanation.builder()
                .text1Preview(preview(text1))
                .text2Preview(preview(text2))
                .dimensions(a.length)
                .magnitude1(VectorMath.magnitude(a))
                .magnitude2(VectorMath.magnitude(b))
                .dotProduct(VectorMath.dotProduct(a, b))
                .cosineSimilarity(cosine)
                .interpretation(interpret(cosine))
                .passesThreshold(cosine >= threshold)
                .threshold(threshold)
                .build();
    }

    static String interpret(double similarity) {
        if (similarity >= 0.9) {
            return "Nearly identical semantic meaning";
        } else if (similarity >= 0.8) {
            return "Very high semantic similarity";
        } else if (similarity >= 0.7) {
            return "High semantic similarity";
        } else if (similarity >= 0.6) {
            return "Moderate semantic similarity";
        } else if (similarity >= 0.5) {
            return "Some semantic similarity";
        } else if (similarity >= 0.3) {
            return "Low semantic similarity";
        }
        return "Very low or no semantic similarity";
    }

    public SemanticMemoryStats getStats() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int total = 0;
        if (semantic.isEnabled()) {
            try {
                List<String> files = StorageKeys.call("List memories",
                        () -> storagePort.listObjects(directory, "").join());
                for (String file : files) {
                    if (!file.endsWith(StorageKeys.JSONL_EXTENSION)) {
                        continue;
                    }
                    for (MemoryRecord record : readFile(file)) {
                        counts.merge(record.getOwnerKey(), 1, Integer::sum);
                        total++;
                    }
                }
            } catch (StorageException e) {
                log.warn("{} Stats unavailable: {}", LOG_PREFIX, e.getMessage());
            }
        }
        return SemanticMemoryStats.builder()
                .enabled(isEnabled())
                .totalMemories(total)
                .ownerCounts(counts)
                .dimension(dimension.get())
                .embeddingModel(embeddingPort.getModel())
                .build();
    }

    // ==================== INTERNALS ====================

    static String combine(String responseText, String sourceText) {
        return "Response: " + responseText + "\n\nContext: " + sourceText;
    }

    static String contentHash(String ownerKey, String combined) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        byte[] hash = digest.digest((ownerKey + "|" + combined).getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder();
        for (byte value : hash) {
            sb.append(String.format("%02x", value));
        }
        return sb.toString();
    }

    private float[] embedOrNull(String text) {
        try {
            return embed(text);
        } catch (EmbeddingUnavailableException e) {
            return null;
        } catch (RuntimeException e) {
            log.warn("{} Embedding failed: {}", LOG_PREFIX, e.getMessage());
            return null;
        }
    }

    private float[] embed(String text) {
        try {
            return embeddingPort.embed(text)
                    .orTimeout(semantic.getEmbedding().getTimeoutMs(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof EmbeddingUnavailableException unavailableException) {
                markUnavailable(unavailableException);
                throw unavailableException;
            }
            if (cause instanceof TimeoutException) {
                throw new IllegalStateException("Embedding timed out", cause);
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        } catch (EmbeddingUnavailableException e) {
            markUnavailable(e);
            throw e;
        }
    }

    private void markUnavailable(EmbeddingUnavailableException e) {
        if (unavailable.compareAndSet(false, true)) {
            log.warn("{} Embedding backend unavailable, semantic memory disabled: {}", LOG_PREFIX,
                    e.getMessage());
        }
    }

    private boolean acceptDimension(float[] embedding) {
        if (embedding.length == 0) {
            return false;
        }
        if (dimension.compareAndSet(0, embedding.length)) {
            log.info("{} Embedding dimension fixed at {}", LOG_PREFIX, embedding.length);
            return true;
        }
        return dimension.get() == embedding.length;
    }

    private List<MemoryRecord> loadRecords(String ownerKey) {
        return readFile(fileFor(ownerKey)).stream()
                .filter(record -> ownerKey.equals(record.getOwnerKey()))
                .toList();
    }

    private List<MemoryRecord> readFile(String file) {
        String content = StorageKeys.call("Read memories",
                () -> storagePort.getText(directory, file).join());
        if (content == null || content.isBlank()) {
            return Collections.emptyList();
        }
        List<MemoryRecord> records = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, MemoryRecord.class));
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed memory line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return records;
    }

    private Object lockFor(String ownerKey) {
        return ownerLocks.computeIfAbsent(StorageKeys.fileStem(ownerKey), k -> new Object());
    }

    private static String fileFor(String ownerKey) {
        return StorageKeys.fileStem(ownerKey) + StorageKeys.JSONL_EXTENSION;
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    private record ScoredMemory(MemoryRecord record, double similarity) {
    }
}
