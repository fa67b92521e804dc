package me.golemcore.commentator.domain.service;

import me.golemcore.commentator.domain.model.EntityContext;
import me.golemcore.commentator.domain.model.EntityProfile;
import me.golemcore.commentator.domain.model.EventCategory;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileSummaryFormatterTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private final ProfileSummaryFormatter formatter = new ProfileSummaryFormatter(new CommentatorProperties());

    @Test
    void shouldLabelProfileWithoutTraitsAsNewcomer() {
        EntityProfile profile = EntityProfile.builder().entityName("Kira").traitVector(new LinkedHashMap<>()).build();

        assertEquals("newcomer", formatter.personalityLabel(profile));
    }

    @Test
    void shouldLabelWeakTraitsAsCasual() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getTraitVector().put("builder", 0.2);

        assertEquals("casual player", formatter.personalityLabel(profile));
    }

    @Test
    void shouldLabelByDominantTrait() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getTraitVector().put("builder", 0.6);
        profile.getTraitVector().put("social", 0.4);

        assertEquals("master architect", formatter.personalityLabel(profile));
    }

    @Test
    void shouldFallBackForUnknownTrait() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getTraitVector().put("farmer", 0.9);

        assertEquals("active survivor", formatter.personalityLabel(profile));
    }

    @Test
    void shouldListFavoriteActivitiesInOrder() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getFavoriteSubtypes().put("raptor", 3);
        profile.getSubtypeCategories().put("combat", 4);
        profile.getCounters().put(EventCategory.BUILDING, 11);
        profile.getCounters().put(EventCategory.PVP, 6);

        assertEquals(List.of("taming raptors", "combat dinosaurs", "building"), formatter.favoriteActivities(profile));
    }

    @Test
    void shouldRequireCountsAboveThresholds() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getFavoriteSubtypes().put("raptor", 2);
        profile.getSubtypeCategories().put("combat", 3);
        profile.getCounters().put(EventCategory.BUILDING, 10);

        assertTrue(formatter.favoriteActivities(profile).isEmpty());
    }

    @Test
    void shouldListAtMostTwoNotableStats() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getCounters().put(EventCategory.DEATH, 21);
        profile.getCounters().put(EventCategory.TAMING, 16);
        profile.getCounters().put(EventCategory.BUILDING, 51);

        assertEquals(List.of("21 deaths", "16 tames"), formatter.notableStats(profile));
    }

    @Test
    void shouldComposeBlurb() {
        assertEquals("Kira is an active survivor.",
                ProfileSummaryFormatter.blurb("Kira", "active survivor", List.of(), List.of()));
        assertEquals("Kira is a PvP warrior who loves PvP combat (notable: 21 deaths).",
                ProfileSummaryFormatter.blurb("Kira", "PvP warrior", List.of("PvP combat"), List.of("21 deaths")));
    }

    @Test
    void shouldBuildKnownContext() {
        EntityProfile profile = EntityProfile.empty("Kira", NOW);
        profile.getTraitVector().put("tamer", 1.0);

        EntityContext context = formatter.toContext(profile);

        assertTrue(context.isKnown());
        assertEquals("dinosaur enthusiast", context.getPersonalityLabel());
        assertEquals("Kira is a dinosaur enthusiast.", context.getSummary());
    }
}
