package me.golemcore.commentator.adapter.outbound.tokenizer;

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

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import me.golemcore.commentator.port.outbound.TokenizerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tokenizer adapter backed by jtokkit BPE encodings. The encoding is resolved
 * by name from {@code commentator.budget.tokenizer-encoding} on first use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JtokkitTokenizerAdapter implements TokenizerPort {

    private final CommentatorProperties properties;

    private volatile Encoding encoding;

    private synchronized Encoding resolveEncoding() {
        if (encoding != null) {
            return encoding;
        }
        String name = getEncodingName();
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        encoding = registry.getEncoding(name)
                .orElseThrow(() -> new IllegalStateException("Unknown tokenizer encoding: " + name));
        log.info("[TokenBudget] Tokenizer loaded: {}", name);
        return encoding;
    }

    @Override
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Encoding current = encoding != null ? encoding : resolveEncoding();
        return current.countTokens(text);
    }

    @Override
    public String getEncodingName() {
        String name = properties.getBudget().getTokenizerEncoding();
        return name != null && !name.isBlank() ? name : "cl100k_base";
    }
}
