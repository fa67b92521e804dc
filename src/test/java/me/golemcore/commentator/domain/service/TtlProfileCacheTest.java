package me.golemcore.commentator.domain.service;

import me.golemcore.commentator.domain.model.EntityProfile;
import me.golemcore.commentator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TtlProfileCacheTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private MutableClock clock;
    private TtlProfileCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = new TtlProfileCache(Duration.ofHours(1), clock);
    }

    @Test
    void shouldReturnCachedProfileWithinTtl() {
        cache.put(EntityProfile.empty("Kira", NOW));
        clock.advance(Duration.ofMinutes(59));

        assertTrue(cache.get("Kira").isPresent());
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        cache.put(EntityProfile.empty("Kira", NOW));
        clock.advance(Duration.ofHours(1));

        assertTrue(cache.get("Kira").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldSweepExpiredEntriesOnWrite() {
        cache.put(EntityProfile.empty("Kira", NOW));
        cache.put(EntityProfile.empty("Sletty", NOW));
        clock.advance(Duration.ofHours(2));

        cache.put(EntityProfile.empty("Bob", clock.instant()));

        assertEquals(1, cache.size());
        assertTrue(cache.get("Bob").isPresent());
    }

    @Test
    void shouldIsolateCachedCopies() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        cache.put(profile);
        profile.getTraitVector().put("tamer", 0.9);

        EntityProfile cached = cache.get("Kira").orElseThrow();
        cached.getTraitVector().put("builder", 0.5);

        assertEquals(0.0, cache.get("Kira").orElseThrow().getTraitVector().get("tamer"));
        assertEquals(0.0, cache.get("Kira").orElseThrow().getTraitVector().get("builder"));
    }

    @Test
    void shouldInvalidateAndClear() {
        cache.put(EntityProfile.empty("Kira", NOW));
        cache.put(EntityProfile.empty("Bob", NOW));

        cache.invalidate("Kira");
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }
}
