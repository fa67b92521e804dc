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

import me.golemcore.commentator.domain.model.EntityContext;
import me.golemcore.commentator.domain.model.EntityProfile;
import me.golemcore.commentator.domain.model.EntityTrait;
import me.golemcore.commentator.domain.model.EventCategory;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an entity profile into prompt-ready text: a personality label, up to
 * three favorite activities, up to two notable statistics and a one-sentence
 * blurb combining them.
 */
@Component
public class ProfileSummaryFormatter {

    static final String NEWCOMER = "newcomer";
    static final String CASUAL = "casual player";
    static final String ACTIVE_SURVIVOR = "active survivor";

    private static final int MAX_ACTIVITIES = 3;
    private static final int MAX_STATS = 2;

    private final CommentatorProperties.ThresholdProperties thresholds;

    public ProfileSummaryFormatter(CommentatorProperties properties) {
        this.thresholds = properties.getProfiles().getThresholds();
    }

    public EntityContext toContext(EntityProfile profile) {
        String label = personalityLabel(profile);
        List<String> activities = favoriteActivities(profile);
        List<String> stats = notableStats(profile);
        return EntityContext.builder()
                .entityName(profile.getEntityName())
                .known(true)
                .personalityLabel(label)
                .favoriteActivities(activities)
                .notableStats(stats)
                .summary(blurb(profile.getEntityName(), label, activities, stats))
                .profile(profile)
                .build();
    }

    /**
     * Label of the dominant trait, {@value #CASUAL} when no trait reaches the
     * casual ceiling, {@value #NEWCOMER} when nothing was recorded.
     */
    public String personalityLabel(EntityProfile profile) {
        Map<String, Double> traits = profile.getTraitVector();
        if (traits == null || traits.isEmpty()) {
            return NEWCOMER;
        }

        String dominant = null;
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : traits.entrySet()) {
            double value = entry.getValue() != null ? entry.getValue() : 0.0;
            if (value > max) {
                max = value;
                dominant = entry.getKey();
            }
        }

        if (max < thresholds.getCasualTraitCeiling()) {
            return CASUAL;
        }
        return EntityTrait.fromId(dominant).map(EntityTrait::getLabel).orElse(ACTIVE_SURVIVOR);
    }

    public List<String> favoriteActivities(EntityProfile profile) {
        List<String> activities = new ArrayList<>();

        Map.Entry<String, Integer> topSubtype = topEntry(profile.getFavoriteSubtypes());
        if (topSubtype != null && topSubtype.getValue() > thresholds.getFavoriteSubtype()) {
            activities.add("taming " + topSubtype.getKey() + "s");
        }

        Map.Entry<String, Integer> topCategory = topEntry(profile.getSubtypeCategories());
        if (topCategory != null && topCategory.getValue() > thresholds.getFavoriteCategory()) {
            activities.add(topCategory.getKey() + " dinosaurs");
        }

        if (profile.count(EventCategory.BUILDING) > thresholds.getBuildingActivity()) {
            activities.add("building");
        }
        if (profile.count(EventCategory.PVP) > thresholds.getPvpActivity()) {
            activities.add("PvP combat");
        }

        return activities.size() > MAX_ACTIVITIES ? activities.subList(0, MAX_ACTIVITIES) : activities;
    }

    public List<String> notableStats(EntityProfile profile) {
        List<String> stats = new ArrayList<>();

        int deaths = profile.count(EventCategory.DEATH);
        if (deaths > thresholds.getNotableDeaths()) {
            stats.add(deaths + " deaths");
        }
        int tames = profile.count(EventCategory.TAMING);
        if (tames > thresholds.getNotableTames()) {
            stats.add(tames + " tames");
        }
        int structures = profile.count(EventCategory.BUILDING);
        if (structures > thresholds.getNotableStructures()) {
            stats.add(structures + " structures built");
        }

        return stats.size() > MAX_STATS ? stats.subList(0, MAX_STATS) : stats;
    }

    static String blurb(String name, String label, List<String> activities, List<String> stats) {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" is ").append(article(label)).append(' ').append(label);
        if (!activities.isEmpty()) {
            sb.append(" who loves ").append(String.join(", ", activities));
        }
        if (!stats.isEmpty()) {
            sb.append(" (notable: ").append(String.join(", ", stats)).append(')');
        }
        return sb.append('.').toString();
    }

    private static String article(String label) {
        char first = Character.toLowerCase(label.charAt(0));
        return "aeiou".indexOf(first) >= 0 ? "an" : "a";
    }

    private static Map.Entry<String, Integer> topEntry(Map<String, Integer> tallies) {
        if (tallies == null || tallies.isEmpty()) {
            return null;
        }
        Map.Entry<String, Integer> top = null;
        for (Map.Entry<String, Integer> entry : tallies.entrySet()) {
            if (top == null || entry.getValue() > top.getValue()) {
                top = entry;
            }
        }
        return top;
    }
}
