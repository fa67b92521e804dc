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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the text-generation backend. The prompt arrives fully assembled
 * together with its output token ceiling.
 */
public interface GenerationPort {

    /**
     * Generate a response.
     *
     * @param prompt
     *            assembled prompt text
     * @param numPredict
     *            maximum number of output tokens
     * @param ownerKey
     *            owner stream the response belongs to
     * @return generated text
     */
    CompletableFuture<String> generate(String prompt, int numPredict, String ownerKey);

    boolean isAvailable();
}
