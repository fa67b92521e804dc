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
 * Outcome of one context retrieval tier. Lets the assembler tell "nothing
 * relevant" ({@link Status#EMPTY}) apart from "tier failed or timed out"
 * ({@link Status#DEGRADED}); both carry a usable, possibly empty, value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TierResult<T> {

    public enum Status {
        SUCCESS, EMPTY, DEGRADED
    }

    private Status status;
    private T value;
    private String reason;

    public static <T> TierResult<T> success(T value) {
        return TierResult.<T>builder()
                .status(Status.SUCCESS)
                .value(value)
                .build();
    }

    public static <T> TierResult<T> empty(T value) {
        return TierResult.<T>builder()
                .status(Status.EMPTY)
                .value(value)
                .build();
    }

    public static <T> TierResult<T> degraded(T fallback, String reason) {
        return TierResult.<T>builder()
                .status(Status.DEGRADED)
                .value(fallback)
                .reason(reason)
                .build();
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
