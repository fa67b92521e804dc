package me.golemcore.commentator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated behavior of one named entity across all owner streams. The
 * profile is the authoritative cache of the entity event log: counters and
 * tallies only grow, and every trait value stays within [0, 1].
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntityProfile {

    private String entityName;
    private Instant firstSeen;
    private Instant lastSeen;

    @Builder.Default
    private Map<EventCategory, Integer> counters = new EnumMap<>(EventCategory.class);

    @Builder.Default
    private Map<String, Integer> favoriteSubtypes = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> subtypeCategories = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> traitVector = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> ownerActivity = new LinkedHashMap<>();

    public static EntityProfile empty(String entityName, Instant now) {
        Map<String, Double> traits = new LinkedHashMap<>();
        for (EntityTrait trait : EntityTrait.values()) {
            traits.put(trait.getId(), 0.0);
        }
        return EntityProfile.builder()
                .entityName(entityName)
                .firstSeen(now)
                .lastSeen(now)
                .traitVector(traits)
                .build();
    }

    @JsonIgnore
    public int count(EventCategory category) {
        if (counters == null) {
            return 0;
        }
        return counters.getOrDefault(category, 0);
    }

    @JsonIgnore
    public int totalEvents() {
        if (counters == null) {
            return 0;
        }
        return counters.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Deep copy, so cached instances are never mutated by callers.
     */
    public EntityProfile copy() {
        Map<EventCategory, Integer> countersCopy = new EnumMap<>(EventCategory.class);
        if (counters != null) {
            countersCopy.putAll(counters);
        }
        return EntityProfile.builder()
                .entityName(entityName)
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .counters(countersCopy)
                .favoriteSubtypes(copyOf(favoriteSubtypes))
                .subtypeCategories(copyOf(subtypeCategories))
                .traitVector(copyOf(traitVector))
                .ownerActivity(copyOf(ownerActivity))
                .build();
    }

    private static <V> Map<String, V> copyOf(Map<String, V> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }
}
