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
import me.golemcore.commentator.domain.model.CycleOutcome;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.DeliveryPort;
import me.golemcore.commentator.port.outbound.GenerationPort;
import me.golemcore.commentator.port.outbound.LogSourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One commentary cycle for an owner: assemble the prompt, generate outside of
 * any lock, persist the response to history and semantic memory in event
 * order, then deliver it.
 *
 * <p>
 * A cycle that is already running for an owner causes later requests for the
 * same owner to be skipped. Degraded context still goes to generation.
 */
@Service
@Slf4j
public class CommentaryCycleService {

    private static final String LOG_PREFIX = "[Cycle]";

    private final ContextAssemblyService contextAssemblyService;
    private final SummaryStoreService summaryStoreService;
    private final SemanticMemoryService semanticMemoryService;
    private final GenerationPort generationPort;
    private final LogSourcePort logSourcePort;
    private final DeliveryPort deliveryPort;
    private final CommentatorProperties properties;

    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();
    private final Map<String, Object> persistLocks = new ConcurrentHashMap<>();

    public CommentaryCycleService(ContextAssemblyService contextAssemblyService,
            SummaryStoreService summaryStoreService, SemanticMemoryService semanticMemoryService,
            GenerationPort generationPort, LogSourcePort logSourcePort, DeliveryPort deliveryPort,
            CommentatorProperties properties) {
        this.contextAssemblyService = contextAssemblyService;
        this.summaryStoreService = summaryStoreService;
        this.semanticMemoryService = semanticMemoryService;
        this.generationPort = generationPort;
        this.logSourcePort = logSourcePort;
        this.deliveryPort = deliveryPort;
        this.properties = properties;
    }

    /**
     * New lines from every source of an owner. With more than one source each
     * line is prefixed with {@code [source]}.
     */
    public List<String> collectLines(String ownerKey) {
        CommentatorProperties.OwnerProperties owner = properties.getOwners().get(ownerKey);
        if (owner == null || owner.getSources().isEmpty()) {
            return List.of();
        }
        boolean prefix = owner.getSources().size() > 1;
        List<String> lines = new ArrayList<>();
        for (String source : owner.getSources()) {
            for (String line : logSourcePort.fetchLines(source)) {
                lines.add(prefix ? "[" + source + "] " + line : line);
            }
        }
        return lines;
    }

    public CycleOutcome runCycle(String ownerKey, List<String> lines) {
        AtomicBoolean flag = running.computeIfAbsent(ownerKey, k -> new AtomicBoolean(false));
        if (!flag.compareAndSet(false, true)) {
            log.info("{} Cycle already running for {}, skipping", LOG_PREFIX, ownerKey);
            return CycleOutcome.skipped(ownerKey, "cycle already running");
        }
        try {
            return doRunCycle(ownerKey, lines);
        } finally {
            flag.set(false);
        }
    }

    private CycleOutcome doRunCycle(String ownerKey, List<String> lines) {
        AssembledPrompt prompt;
        try {
            prompt = contextAssemblyService.assemble(ownerKey, lines);
        } catch (ContextAssemblyException e) {
            log.info("{} Nothing to comment on for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return CycleOutcome.skipped(ownerKey, e.getMessage());
        }

        if (prompt.isDegraded()) {
            log.warn("{} Generating for {} with degraded context: {}", LOG_PREFIX, ownerKey,
                    prompt.getTierStatuses());
        }

        String response;
        try {
            response = generationPort.generate(prompt.getPromptText(), prompt.getAllocation().getNumPredict(),
                    ownerKey)
                    .orTimeout(properties.getGeneration().getTimeoutMs(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} Generation failed for {}: {}", LOG_PREFIX, ownerKey, cause.toString());
            return CycleOutcome.failed(ownerKey, prompt, "generation failed: " + cause.getMessage());
        }
        if (response == null || response.isBlank()) {
            log.warn("{} Empty generation for {}", LOG_PREFIX, ownerKey);
            return CycleOutcome.failed(ownerKey, prompt, "empty response");
        }

        persist(ownerKey, response, lines, prompt);
        deliver(ownerKey, response);

        return CycleOutcome.builder()
                .ownerKey(ownerKey)
                .status(CycleOutcome.Status.GENERATED)
                .responseText(response)
                .prompt(prompt)
                .build();
    }

    private void persist(String ownerKey, String response, List<String> lines, AssembledPrompt prompt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entities", new ArrayList<>(prompt.getExtractedEntities()));
        metadata.put("numPredict", prompt.getAllocation().getNumPredict());

        synchronized (persistLocks.computeIfAbsent(ownerKey, k -> new Object())) {
            try {
                summaryStoreService.save(ownerKey, response);
            } catch (StorageException e) {
                log.warn("{} Failed to save summary for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            }
            boolean stored = semanticMemoryService.store(ownerKey, response, lines, metadata);
            log.debug("{} Persisted response for {} (memory stored: {})", LOG_PREFIX, ownerKey, stored);
        }
    }

    private void deliver(String ownerKey, String response) {
        CommentatorProperties.OwnerProperties owner = properties.getOwners().get(ownerKey);
        String header = owner != null ? owner.getHeader() : null;
        try {
            deliveryPort.deliver(ownerKey, header, response);
        } catch (RuntimeException e) {
            log.error("{} Delivery failed for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
        }
    }
}
