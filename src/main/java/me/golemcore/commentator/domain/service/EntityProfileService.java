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
import me.golemcore.commentator.domain.exception.ExtractionException;
import me.golemcore.commentator.domain.exception.StorageException;
import me.golemcore.commentator.domain.model.ClassifiedEvent;
import me.golemcore.commentator.domain.model.EntityContext;
import me.golemcore.commentator.domain.model.EntityEvent;
import me.golemcore.commentator.domain.model.EntityProfile;
import me.golemcore.commentator.domain.model.EntityTrait;
import me.golemcore.commentator.domain.model.EventCategory;
import me.golemcore.commentator.domain.model.TierResult;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Incremental behavior profiles for entities named in event lines.
 *
 * <p>
 * Each batch is classified line by line; every entity mentioned on a line
 * receives that line's event. Profiles are read-modify-written under a
 * striped per-entity lock: counters and tallies grow, trait values receive fixed
 * increments and are clamped to [0, 1]. The profile is replaced atomically in
 * {@code profiles/<entity>.json}, then the cache is refreshed, then the events
 * are appended to {@code events/<day>.jsonl}.
 *
 * <p>
 * Re-applying a batch increments the counters again; the profile is a bounded
 * approximation, not an exact ledger.
 */
@Service
@Slf4j
public class EntityProfileService {

    private static final String LOG_PREFIX = "[Profiles]";
    private static final double TRAIT_SCALE = 1_000_000.0;
    private static final int LOCK_STRIPES = 64;
    private static final Set<String> PVP_KILLERS = Set.of("player", "tribe");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);

    private final EntityExtractor entityExtractor;
    private final EventClassifier eventClassifier;
    private final ProfileSummaryFormatter formatter;
    private final ProfileCache profileCache;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CommentatorProperties.ProfileProperties profiles;
    private final String profilesDir;
    private final String eventsDir;
    private final Object[] entityLocks = new Object[LOCK_STRIPES];

    public EntityProfileService(EntityExtractor entityExtractor, EventClassifier eventClassifier,
            ProfileSummaryFormatter formatter, ProfileCache profileCache, StoragePort storagePort,
            ObjectMapper objectMapper, CommentatorProperties properties, Clock clock) {
        this.entityExtractor = entityExtractor;
        this.eventClassifier = eventClassifier;
        this.formatter = formatter;
        this.profileCache = profileCache;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.profiles = properties.getProfiles();
        this.profilesDir = properties.getStorage().getProfiles();
        this.eventsDir = properties.getStorage().getEvents();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            entityLocks[i] = new Object();
        }
    }

    // ==================== INGEST ====================

    /**
     * Extract entities from a batch, classify each line and update the profiles
     * of every entity with at least one known event. Entities mentioned only on
     * unclassified lines are returned but get no profile.
     *
     * @return all entity names found, in first-seen order
     */
    public Set<String> processEventLines(String ownerKey, List<String> lines) {
        Map<String, List<ClassifiedEvent>> eventsByEntity = new LinkedHashMap<>();
        if (lines == null) {
            return new LinkedHashSet<>();
        }

        int skipped = 0;
        for (String line : lines) {
            ClassifiedEvent event;
            try {
                event = eventClassifier.classify(line);
            } catch (ExtractionException e) {
                skipped++;
                log.debug("{} Skipping line: {}", LOG_PREFIX, e.getMessage());
                continue;
            }
            for (String entity : entityExtractor.extract(line)) {
                List<ClassifiedEvent> events = eventsByEntity.computeIfAbsent(entity, k -> new ArrayList<>());
                if (event.isKnown()) {
                    events.add(event);
                }
            }
        }

        for (Map.Entry<String, List<ClassifiedEvent>> entry : eventsByEntity.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            try {
                updateProfile(entry.getKey(), ownerKey, entry.getValue());
            } catch (StorageException e) {
                log.warn("{} Failed to update profile for {}: {}", LOG_PREFIX, entry.getKey(), e.getMessage());
            }
        }

        log.debug("{} {}: {} lines, {} entities, {} skipped", LOG_PREFIX, ownerKey, lines.size(),
                eventsByEntity.size(), skipped);
        return new LinkedHashSet<>(eventsByEntity.keySet());
    }

    /**
     * Apply classified events to an entity's profile and persist it.
     *
     * @throws StorageException
     *             if the profile cannot be written
     */
    public EntityProfile updateProfile(String entityName, String ownerKey, List<ClassifiedEvent> batch) {
        List<ClassifiedEvent> events = batch != null ? batch : List.of();
        Instant now = clock.instant();
        EntityProfile profile;
        synchronized (lockFor(entityName)) {
            profile = loadProfile(entityName).orElseGet(() -> EntityProfile.empty(entityName, now));
            profile.setLastSeen(now);
            if (ownerKey != null) {
                profile.getOwnerActivity().merge(ownerKey, events.size(), Integer::sum);
            }
            for (ClassifiedEvent event : events) {
                apply(profile, event);
            }
            clampTraits(profile);

            String json;
            try {
                json = objectMapper.writeValueAsString(profile);
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to serialize profile for " + entityName, e);
            }
            try {
                StorageKeys.call("Write profile",
                        () -> storagePort.putTextAtomic(profilesDir, fileFor(entityName), json, false).join());
            } catch (StorageException e) {
                profileCache.invalidate(entityName);
                throw e;
            }
            profileCache.put(profile);
        }

        appendEvents(entityName, ownerKey, events, now);
        log.trace("{} Updated {} with {} events", LOG_PREFIX, entityName, events.size());
        return profile.copy();
    }

    void apply(EntityProfile profile, ClassifiedEvent event) {
        CommentatorProperties.TraitIncrementProperties increments = profiles.getTraitIncrements();
        EventCategory category = event.getCategory();
        profile.getCounters().merge(category, 1, Integer::sum);

        switch (category) {
        case TAMING -> {
            String creature = event.detail(ClassifiedEvent.CREATURE_TYPE);
            if (creature != null) {
                profile.getFavoriteSubtypes().merge(creature.toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
            String creatureCategory = event.detail(ClassifiedEvent.CREATURE_CATEGORY);
            if (creatureCategory != null) {
                profile.getSubtypeCategories().merge(creatureCategory, 1, Integer::sum);
            }
            addTrait(profile, EntityTrait.TAMER, increments.getTaming());
        }
        case DEATH -> {
            String killer = event.detail(ClassifiedEvent.KILLED_BY);
            if (killer != null && PVP_KILLERS.contains(killer.toLowerCase(Locale.ROOT))) {
                profile.getCounters().merge(EventCategory.PVP, 1, Integer::sum);
                addTrait(profile, EntityTrait.AGGRESSIVE, increments.getPvp());
            }
        }
        case BUILDING -> addTrait(profile, EntityTrait.BUILDER, increments.getBuilding());
        case PVP -> addTrait(profile, EntityTrait.AGGRESSIVE, increments.getPvp());
        case CHAT, TRIBE -> addTrait(profile, EntityTrait.SOCIAL, increments.getSocial());
        default -> {
            // joining and leaving only count
        }
        }
    }

    private static void addTrait(EntityProfile profile, EntityTrait trait, double increment) {
        profile.getTraitVector().merge(trait.getId(), increment, Double::sum);
        clampTrait(profile, trait.getId());
    }

    private static void clampTraits(EntityProfile profile) {
        for (String trait : new ArrayList<>(profile.getTraitVector().keySet())) {
            clampTrait(profile, trait);
        }
    }

    private static void clampTrait(EntityProfile profile, String trait) {
        Double value = profile.getTraitVector().get(trait);
        double v = value != null ? value : 0.0;
        double clamped = Math.max(0.0, Math.min(1.0, v));
        profile.getTraitVector().put(trait, Math.round(clamped * TRAIT_SCALE) / TRAIT_SCALE);
    }

    private void appendEvents(String entityName, String ownerKey, List<ClassifiedEvent> events, Instant now) {
        if (events.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        try {
            for (ClassifiedEvent event : events) {
                EntityEvent entry = EntityEvent.builder()
                        .entityName(entityName)
                        .eventType(event.getCategory())
                        .details(new LinkedHashMap<>(event.getDetails()))
                        .ownerKey(ownerKey)
                        .timestamp(now)
                        .build();
                sb.append(objectMapper.writeValueAsString(entry)).append('\n');
            }
            String day = DAY_FORMAT.format(now) + StorageKeys.JSONL_EXTENSION;
            StorageKeys.call("Append events", () -> storagePort.appendText(eventsDir, day, sb.toString()).join());
        } catch (JsonProcessingException | StorageException e) {
            log.warn("{} Failed to append events for {}: {}", LOG_PREFIX, entityName, e.getMessage());
        }
    }

    // ==================== QUERY ====================

    /**
     * Prompt-ready context for an entity. Unknown entities and storage failures
     * yield the "new or occasional player" context.
     */
    public EntityContext getContext(String entityName, String ownerKey) {
        Optional<EntityProfile> profile;
        try {
            profile = loadProfile(entityName);
        } catch (StorageException e) {
            log.warn("{} Profile for {} unavailable: {}", LOG_PREFIX, entityName, e.getMessage());
            profile = Optional.empty();
        }
        if (profile.isEmpty()) {
            log.trace("{} No profile for {} ({})", LOG_PREFIX, entityName, ownerKey);
            return EntityContext.unknown(entityName);
        }
        return formatter.toContext(profile.get());
    }

    public String getBlurb(String entityName, String ownerKey) {
        return getContext(entityName, ownerKey).getSummary();
    }

    public String getContextualSummaries(Collection<String> entities, int maxChars) {
        return getContextualSummariesResult(entities, null, maxChars).getValue();
    }

    /**
     * Blurbs for up to {@code max-entities} entities, one per line, truncated
     * with {@code ...} at {@code maxChars}.
     */
    public TierResult<String> getContextualSummariesResult(Collection<String> entities, String ownerKey,
            int maxChars) {
        if (entities == null || entities.isEmpty()) {
            return TierResult.empty("");
        }

        List<String> summaries = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String entity : entities.stream().limit(Math.max(0, profiles.getMaxEntities())).toList()) {
            Optional<EntityProfile> profile;
            try {
                profile = loadProfile(entity);
            } catch (StorageException e) {
                failures.add(entity);
                profile = Optional.empty();
            }
            summaries.add(profile.map(p -> formatter.toContext(p).getSummary())
                    .orElse(entity + " (new player)"));
        }

        String text = truncate(String.join("\n", summaries), maxChars);
        if (!failures.isEmpty()) {
            log.warn("{} Profiles unavailable for {}", LOG_PREFIX, failures);
            return TierResult.degraded(text, "profiles unavailable: " + failures);
        }
        return text.isEmpty() ? TierResult.empty(text) : TierResult.success(text);
    }

    /**
     * Most active entities of an owner, by event count then recency.
     */
    public List<EntityContext> getOwnerEntitySummary(String ownerKey, int limit) {
        List<EntityProfile> candidates = new ArrayList<>();
        try {
            List<String> files = StorageKeys.call("List profiles",
                    () -> storagePort.listObjects(profilesDir, "").join());
            for (String file : files) {
                if (!file.endsWith(StorageKeys.JSON_EXTENSION)) {
                    continue;
                }
                readProfile(file).filter(p -> p.getOwnerActivity().containsKey(ownerKey))
                        .ifPresent(candidates::add);
            }
        } catch (StorageException e) {
            log.warn("{} Owner summary unavailable for {}: {}", LOG_PREFIX, ownerKey, e.getMessage());
            return List.of();
        }

        Comparator<EntityProfile> byActivity = Comparator
                .comparingInt((EntityProfile p) -> p.getOwnerActivity().getOrDefault(ownerKey, 0))
                .thenComparing(EntityProfile::getLastSeen, Comparator.nullsFirst(Comparator.naturalOrder()))
                .reversed();
        return candidates.stream()
                .sorted(byActivity)
                .limit(Math.max(0, limit))
                .map(formatter::toContext)
                .toList();
    }

    // ==================== STORAGE ====================

    Optional<EntityProfile> loadProfile(String entityName) {
        Optional<EntityProfile> cached = profileCache.get(entityName);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<EntityProfile> stored = readProfile(fileFor(entityName));
        stored.ifPresent(profileCache::put);
        return stored;
    }

    private Optional<EntityProfile> readProfile(String file) {
        String json = StorageKeys.call("Read profile", () -> storagePort.getText(profilesDir, file).join());
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, EntityProfile.class));
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt profile " + file, e);
        }
    }

    static String truncate(String text, int maxChars) {
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= 3) {
            return text.substring(0, maxChars);
        }
        return text.substring(0, maxChars - 3) + "...";
    }

    private Object lockFor(String entityName) {
        return entityLocks[Math.floorMod(entityName.hashCode(), LOCK_STRIPES)];
    }

    private static String fileFor(String entityName) {
        return StorageKeys.fileStem(entityName) + StorageKeys.JSON_EXTENSION;
    }
}
