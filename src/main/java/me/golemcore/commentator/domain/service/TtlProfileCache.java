package me.golemcore.commentator.domain.service;

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

import me.golemcore.commentator.domain.model.EntityProfile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Profile cache with a fixed time-to-live, guarded by a single lock. The lock
 * covers only map access; loading from storage happens outside it. Expired
 * entries are dropped on read and swept on every write.
 */
public class TtlProfileCache implements ProfileCache {

    private final Duration ttl;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, CachedProfile> entries = new HashMap<>();

    public TtlProfileCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<EntityProfile> get(String entityName) {
        Instant now = clock.instant();
        synchronized (lock) {
            CachedProfile cached = entries.get(entityName);
            if (cached == null) {
                return Optional.empty();
            }
            if (!now.isBefore(cached.cachedAt().plus(ttl))) {
                entries.remove(entityName);
                return Optional.empty();
            }
            return Optional.of(cached.profile().copy());
        }
    }

    @Override
    public void put(EntityProfile profile) {
        Instant now = clock.instant();
        CachedProfile cached = new CachedProfile(profile.copy(), now);
        synchronized (lock) {
            entries.values().removeIf(entry -> !now.isBefore(entry.cachedAt().plus(ttl)));
            entries.put(profile.getEntityName(), cached);
        }
    }

    @Override
    public void invalidate(String entityName) {
        synchronized (lock) {
            entries.remove(entityName);
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private record CachedProfile(EntityProfile profile, Instant cachedAt) {
    }
}
