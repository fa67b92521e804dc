package me.golemcore.commentator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the commentator, bound once from
 * application.properties and injected into every component that needs them.
 *
 * <p>
 * All configuration is organized under the {@code commentator.*} prefix:
 * <ul>
 * <li>{@link BudgetProperties} - context window and generation bounds</li>
 * <li>{@link HistoryProperties} - conversation/historical split and thread
 * relatedness</li>
 * <li>{@link SemanticProperties} - embedding backend and similarity search</li>
 * <li>{@link ProfileProperties} - entity profile cache, traits and
 * blurbs</li>
 * <li>{@link AssemblyProperties} - tier timeouts</li>
 * <li>{@link GenerationProperties}, {@link ScheduleProperties},
 * {@link OwnerProperties}, {@link SourceProperties} - collaborators and the
 * cycle driver</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "commentator")
@Data
public class CommentatorProperties {

    private StorageProperties storage = new StorageProperties();
    private BudgetProperties budget = new BudgetProperties();
    private HistoryProperties history = new HistoryProperties();
    private SemanticProperties semantic = new SemanticProperties();
    private ProfileProperties profiles = new ProfileProperties();
    private AssemblyProperties assembly = new AssemblyProperties();
    private GenerationProperties generation = new GenerationProperties();
    private ScheduleProperties schedule = new ScheduleProperties();
    private Map<String, OwnerProperties> owners = new LinkedHashMap<>();
    private Map<String, SourceProperties> sources = new LinkedHashMap<>();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/commentator";
        private String summaries = "summaries";
        private String semantic = "semantic";
        private String profiles = "profiles";
        private String events = "events";
    }

    @Data
    public static class BudgetProperties {
        private int contextWindow = 4096;
        private int safetyBuffer = 48;
        private int minOutputTokens = 64;
        private int maxOutputTokens = 512;
        private int promptTokenBudget = 3000;
        private String tokenizerEncoding = "cl100k_base";
    }

    @Data
    public static class HistoryProperties {
        private double conversationWeight = 0.3;
        private int conversationMaxResponses = 5;
        private double historyShare = 0.7;
        private int statisticsWindowDays = 7;
        private RelatednessProperties relatedness = new RelatednessProperties();
    }

    // ==================== THREAD RELATEDNESS ====================

    @Data
    public static class RelatednessProperties {
        private double threshold = 0.3;
        private double temporalWeight = 0.4;
        private double sameOwnerBonus = 0.3;
        private double differentOwnerBonus = 0.1;
        private double lexicalWeight = 0.3;
        private double sharedNameBonus = 0.1;
        private List<DecayStep> decaySteps = new ArrayList<>(List.of(
                new DecayStep(Duration.ofMinutes(5), 1.0),
                new DecayStep(Duration.ofMinutes(15), 0.8),
                new DecayStep(Duration.ofMinutes(60), 0.6),
                new DecayStep(Duration.ofMinutes(240), 0.3)));
        private double decayFloor = 0.1;
    }

    @Data
    public static class DecayStep {
        private Duration within;
        private double score;

        public DecayStep() {
        }

        public DecayStep(Duration within, double score) {
            this.within = within;
            this.score = score;
        }
    }

    // ==================== SEMANTIC MEMORY ====================

    @Data
    public static class SemanticProperties {
        private boolean enabled = true;
        private double relevanceThreshold = 0.65;
        private int topK = 3;
        private EmbeddingProperties embedding = new EmbeddingProperties();
    }

    @Data
    public static class EmbeddingProperties {
        private String baseUrl;
        private String apiKey;
        private String model = "text-embedding-3-small";
        private int dimension = 0;
        private long timeoutMs = 30000;
    }

    // ==================== ENTITY PROFILES ====================

    @Data
    public static class ProfileProperties {
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofHours(1);
        private int blurbMaxChars = 800;
        private int maxEntities = 5;
        private TraitIncrementProperties traitIncrements = new TraitIncrementProperties();
        private ThresholdProperties thresholds = new ThresholdProperties();
    }

    @Data
    public static class TraitIncrementProperties {
        private double taming = 0.1;
        private double building = 0.1;
        private double pvp = 0.05;
        private double social = 0.05;
    }

    @Data
    public static class ThresholdProperties {
        private double casualTraitCeiling = 0.3;
        private int favoriteSubtype = 2;
        private int favoriteCategory = 3;
        private int buildingActivity = 10;
        private int pvpActivity = 5;
        private int notableDeaths = 20;
        private int notableTames = 15;
        private int notableStructures = 50;
    }

    @Data
    public static class AssemblyProperties {
        private Duration tierTimeout = Duration.ofSeconds(5);
        private int tierThreads = 6;
    }

    // ==================== COLLABORATORS ====================

    @Data
    public static class GenerationProperties {
        private String baseUrl;
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.8;
        private long timeoutMs = 120000;
    }

    @Data
    public static class ScheduleProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(60);
        private Duration initialDelay = Duration.ofMinutes(1);
        private int minLines = 2;
    }

    @Data
    public static class OwnerProperties {
        private List<String> sources = new ArrayList<>();
        private String preamble;
        private String header;
    }

    @Data
    public static class SourceProperties {
        private String logFile;
        private int maxLines = 1000;
        private int maxLineLength = 500;
    }
}
