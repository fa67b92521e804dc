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
import java.util.ArrayList;
import java.util.List;

/**
 * Chronological group of summaries treated as one continuous exchange. Derived
 * at query time, never persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationThread {

    @Builder.Default
    private List<SummaryRecord> entries = new ArrayList<>();

    public Instant getStartedAt() {
        return entries.isEmpty() ? null : entries.get(0).getTimestamp();
    }

    public Instant getEndedAt() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp();
    }

    public int getTokenCount() {
        return entries.stream().mapToInt(SummaryRecord::getTokenCount).sum();
    }

    public int size() {
        return entries.size();
    }
}
