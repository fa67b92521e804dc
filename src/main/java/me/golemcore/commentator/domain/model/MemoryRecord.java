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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded response/context pair used for semantic recall. The {@code id} is
 * the content hash of the owner key and combined text, so two writes of the
 * same pair resolve to the same record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryRecord {

    private String id;
    private String ownerKey;
    private String responseText;
    private String sourceText;
    private float[] embedding;
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
