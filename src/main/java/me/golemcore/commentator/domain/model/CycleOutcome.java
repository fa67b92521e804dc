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

/**
 * Result of one commentary cycle for an owner.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CycleOutcome {

    public enum Status {
        GENERATED, SKIPPED, FAILED
    }

    private String ownerKey;
    private Status status;
    private String responseText;
    private AssembledPrompt prompt;
    private String reason;

    public static CycleOutcome skipped(String ownerKey, String reason) {
        return CycleOutcome.builder()
                .ownerKey(ownerKey)
                .status(Status.SKIPPED)
                .reason(reason)
                .build();
    }

    public static CycleOutcome failed(String ownerKey, AssembledPrompt prompt, String reason) {
        return CycleOutcome.builder()
                .ownerKey(ownerKey)
                .status(Status.FAILED)
                .prompt(prompt)
                .reason(reason)
                .build();
    }
}
