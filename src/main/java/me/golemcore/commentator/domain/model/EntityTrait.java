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

import java.util.Optional;

/**
 * Behavioral dimensions tracked in an entity's trait vector, each with the
 * personality label used when it dominates.
 */
public enum EntityTrait {

    TAMER("tamer", "dinosaur enthusiast"),
    BUILDER("builder", "master architect"),
    AGGRESSIVE("aggressive", "PvP warrior"),
    SOCIAL("social", "community leader"),
    EXPLORER("explorer", "adventurous survivor");

    private final String id;
    private final String label;

    EntityTrait(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<EntityTrait> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (EntityTrait trait : values()) {
            if (trait.id.equals(id)) {
                return Optional.of(trait);
            }
        }
        return Optional.empty();
    }
}
