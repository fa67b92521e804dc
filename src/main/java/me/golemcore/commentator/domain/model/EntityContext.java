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

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt-ready view of an entity profile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntityContext {

    private String entityName;
    private boolean known;
    private String summary;
    private String personalityLabel;

    @Builder.Default
    private List<String> favoriteActivities = new ArrayList<>();

    @Builder.Default
    private List<String> notableStats = new ArrayList<>();

    private EntityProfile profile;

    public static EntityContext unknown(String entityName) {
        return EntityContext.builder()
                .entityName(entityName)
                .known(false)
                .summary(entityName + " is a new or occasional player")
                .build();
    }
}
