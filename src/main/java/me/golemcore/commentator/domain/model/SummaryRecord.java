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

/**
 * A generated response persisted for one owner stream. Written once after each
 * successful generation and never updated.
 *
 * <p>
 * {@code tokenCount} is always computed by the same estimator used for budget
 * checks, so history selection and prompt allocation agree on sizes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SummaryRecord {

    private String id;
    private String ownerKey;
    private Instant timestamp;
    private String text;
    private int tokenCount;
}
