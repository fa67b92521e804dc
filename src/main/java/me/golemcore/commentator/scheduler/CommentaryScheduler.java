package me.golemcore.commentator.scheduler;

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

import me.golemcore.commentator.domain.model.CycleOutcome;
import me.golemcore.commentator.domain.service.CommentaryCycleService;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver of commentary cycles for all configured owners.
 *
 * <p>
 * Each tick collects new lines per owner and runs a cycle when more than
 * {@code commentator.schedule.min-lines} arrived. Ticks do not overlap: a tick
 * that fires while the previous one is still running is skipped.
 */
@Component
@Slf4j
public class CommentaryScheduler {

    private final CommentaryCycleService cycleService;
    private final CommentatorProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public CommentaryScheduler(CommentaryCycleService cycleService, CommentatorProperties properties) {
        this.cycleService = cycleService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        CommentatorProperties.ScheduleProperties schedule = properties.getSchedule();
        if (!schedule.isEnabled()) {
            log.info("[Cycle] Scheduled commentary disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "commentary-scheduler");
            t.setDaemon(true);
            return t;
        });

        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                schedule.getInitialDelay().toMillis(),
                schedule.getInterval().toMillis(),
                TimeUnit.MILLISECONDS);

        log.info("[Cycle] Scheduler started for {} owners, interval {}", properties.getOwners().size(),
                schedule.getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Cycle] Scheduler shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Cycle] Previous tick still running, skipping");
            return;
        }
        try {
            for (String ownerKey : properties.getOwners().keySet()) {
                runOwner(ownerKey);
            }
        } finally {
            executing.set(false);
        }
    }

    void runOwner(String ownerKey) {
        try {
            List<String> lines = cycleService.collectLines(ownerKey);
            int minLines = properties.getSchedule().getMinLines();
            if (lines.size() <= minLines) {
                log.debug("[Cycle] {}: {} new lines (need more than {}), skipping", ownerKey, lines.size(),
                        minLines);
                return;
            }
            CycleOutcome outcome = cycleService.runCycle(ownerKey, lines);
            log.info("[Cycle] {}: {}{}", ownerKey, outcome.getStatus(),
                    outcome.getReason() != null ? " (" + outcome.getReason() + ")" : "");
        } catch (RuntimeException e) {
            log.error("[Cycle] Cycle for {} failed", ownerKey, e);
        }
    }
}
