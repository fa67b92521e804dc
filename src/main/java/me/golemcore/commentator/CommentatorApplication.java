package me.golemcore.commentator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the commentator.
 *
 * <p>
 * Reads event lines from monitored sources, assembles a bounded prompt from
 * conversation history, semantically related past responses and entity
 * behavior profiles, and hands it to a language model for live commentary.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Driver             → CommentaryScheduler
 * Domain Layer       → ContextAssemblyService, retrieval tiers, TokenBudgetService
 * Infrastructure     → Storage/Embedding/Tokenizer/Generation/LogSource adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code commentator.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CommentatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommentatorApplication.class, args);
    }

}
