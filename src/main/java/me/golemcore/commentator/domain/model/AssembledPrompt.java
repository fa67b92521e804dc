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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Result of context assembly: the merged prompt, the entities it mentions and
 * the generation budget left once the prompt is counted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssembledPrompt {

    public static final String TIER_HISTORY = "history";
    public static final String TIER_SEMANTIC = "semantic";
    public static final String TIER_ENTITIES = "entities";

    private String ownerKey;
    private String promptText;

    @Builder.Default
    private Set<String> extractedEntities = new LinkedHashSet<>();

    private TokenAllocation allocation;

    @Builder.Default
    private Map<String, TierResult.Status> tierStatuses = new LinkedHashMap<>();

    public boolean isDegraded() {
        return tierStatuses != null && tierStatuses.containsValue(TierResult.Status.DEGRADED);
    }
}
