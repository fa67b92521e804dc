package me.golemcore.commentator.port.outbound;

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

import java.util.List;

/**
 * Port for acquiring new event lines from a monitored source. Lines are
 * returned sanitized: control characters stripped and length capped.
 */
public interface LogSourcePort {

    /**
     * Fetch lines that appeared since the previous call for this source.
     *
     * @param sourceId
     *            configured source identifier
     * @return ordered lines, empty when nothing new arrived
     */
    List<String> fetchLines(String sourceId);
}
