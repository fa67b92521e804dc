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

import me.golemcore.commentator.domain.service.NoOpProfileCache;
import me.golemcore.commentator.domain.service.ProfileCache;
import me.golemcore.commentator.domain.service.TtlProfileCache;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans and startup logging.
 *
 * <p>
 * Provides the JSON mapper, the clock, the bounded executor used for
 * concurrent context tiers, and the profile cache selected by
 * {@code commentator.profiles.cache-enabled}.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CommentatorProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tierExecutor() {
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(3, properties.getAssembly().getTierThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "context-tier-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ProfileCache profileCache(Clock clock) {
        CommentatorProperties.ProfileProperties profiles = properties.getProfiles();
        if (!profiles.isCacheEnabled()) {
            log.info("[Profiles] Profile cache disabled");
            return new NoOpProfileCache();
        }
        return new TtlProfileCache(profiles.getCacheTtl(), clock);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Commentator v{} starting...", version);
        log.info("Context window: {} tokens (buffer {}, output {}..{})",
                properties.getBudget().getContextWindow(), properties.getBudget().getSafetyBuffer(),
                properties.getBudget().getMinOutputTokens(), properties.getBudget().getMaxOutputTokens());
        log.info("Semantic memory: {}", properties.getSemantic().isEnabled() ? "enabled" : "disabled");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Owners: {}", properties.getOwners().keySet());
    }
}
