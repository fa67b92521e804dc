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
import java.util.Map;

/**
 * Classification of one event line. Detail keys are best-effort and absent
 * when the line does not carry them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClassifiedEvent {

    public static final String CREATURE_TYPE = "creatureType";
    public static final String CREATURE_CATEGORY = "creatureCategory";
    public static final String LEVEL = "level";
    public static final String KILLED_BY = "killedBy";
    public static final String STRUCTURE_TYPE = "structureType";

    private EventCategory category;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    private String rawLine;

    public boolean isKnown() {
        return category != null && category != EventCategory.UNKNOWN;
    }

    public String detail(String key) {
        if (details == null) {
            return null;
        }
        Object value = details.get(key);
        return value != null ? value.toString() : null;
    }
}
