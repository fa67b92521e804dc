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

import me.golemcore.commentator.domain.exception.ExtractionException;
import me.golemcore.commentator.domain.model.ClassifiedEvent;
import me.golemcore.commentator.domain.model.EventCategory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single event line against an ordered keyword table. The first
 * category with a keyword contained in the lowercased line wins; lines that
 * match nothing are {@link EventCategory#UNKNOWN}.
 *
 * <p>
 * Detail extraction is best-effort: a detail that cannot be found is left out
 * of the result.
 */
@Component
public class EventClassifier {

    public record ClassificationRule(EventCategory category, List<String> keywords) {
    }

    static final List<ClassificationRule> RULES = List.of(
            new ClassificationRule(EventCategory.TAMING, List.of("tamed", "tame completed", "dinosaur tamed")),
            new ClassificationRule(EventCategory.DEATH, List.of("died", "was killed", "death")),
            new ClassificationRule(EventCategory.BUILDING, List.of("placed", "built", "constructed", "foundation")),
            new ClassificationRule(EventCategory.PVP, List.of("destroyed", "killed", "raided", "attacked")),
            new ClassificationRule(EventCategory.JOINING, List.of("joined", "connected")),
            new ClassificationRule(EventCategory.LEAVING, List.of("left", "disconnected")),
            new ClassificationRule(EventCategory.TRIBE, List.of("tribe", "invited", "promoted", "demoted")),
            new ClassificationRule(EventCategory.CHAT, List.of("said", "chat", "global")));

    /**
     * Creature groups, checked in order; the first group naming a substring of
     * the creature type wins.
     */
    static final Map<String, List<String>> CREATURE_CATEGORIES = createCreatureCategories();

    static final String OTHER_CATEGORY = "other";

    private static final Pattern TAMED_CREATURE = Pattern.compile(
            "(?i:tamed an?\\s+(?:level\\s+\\d+\\s+)?)([A-Za-z]+(?:\\s+(?!(?i:level)\\b)[A-Z][A-Za-z]*)?)");
    private static final Pattern LEVEL = Pattern.compile("level (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern KILLER = Pattern.compile("killed by (?:an?\\s+)?(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRUCTURE = Pattern.compile(
            "(?i:placed\\s+(?:an?\\s+)?)([A-Za-z]+(?:\\s+[A-Z][A-Za-z]*)?)");
    private static final int MAX_LEVEL_DIGITS = 9;

    private static Map<String, List<String>> createCreatureCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("utility", List.of("ankylo", "doedicurus", "beaver", "argentavis", "quetzal"));
        categories.put("combat", List.of("rex", "giga", "spino", "carno", "therizino"));
        categories.put("transport", List.of("argentavis", "quetzal", "wyvern", "griffin", "phoenix"));
        categories.put("gathering", List.of("ankylo", "doedicurus", "mammoth", "therizino"));
        categories.put("tek", List.of("tek parasaur", "tek raptor", "tek rex", "tek stego"));
        categories.put("rare", List.of("wyvern", "griffin", "phoenix", "reaper", "rock drake"));
        return Collections.unmodifiableMap(categories);
    }

    /**
     * Classify one line.
     *
     * @throws ExtractionException
     *             if the line is null or blank
     */
    public ClassifiedEvent classify(String line) {
        if (line == null || line.isBlank()) {
            throw new ExtractionException("Cannot classify an empty event line");
        }
        String lower = line.toLowerCase(Locale.ROOT);

        EventCategory category = EventCategory.UNKNOWN;
        for (ClassificationRule rule : RULES) {
            if (rule.keywords().stream().anyMatch(lower::contains)) {
                category = rule.category();
                break;
            }
        }

        return ClassifiedEvent.builder()
                .category(category)
                .details(extractDetails(line, category))
                .rawLine(line)
                .build();
    }

    Map<String, Object> extractDetails(String line, EventCategory category) {
        Map<String, Object> details = new LinkedHashMap<>();
        switch (category) {
        case TAMING -> {
            Matcher creature = TAMED_CREATURE.matcher(line);
            if (creature.find()) {
                String type = creature.group(1).trim();
                details.put(ClassifiedEvent.CREATURE_TYPE, type);
                details.put(ClassifiedEvent.CREATURE_CATEGORY, categorizeCreature(type));
            }
            Matcher level = LEVEL.matcher(line);
            if (level.find() && level.group(1).length() <= MAX_LEVEL_DIGITS) {
                details.put(ClassifiedEvent.LEVEL, Integer.parseInt(level.group(1)));
            }
        }
        case DEATH -> {
            Matcher killer = KILLER.matcher(line);
            if (killer.find()) {
                details.put(ClassifiedEvent.KILLED_BY, killer.group(1));
            }
        }
        case BUILDING -> {
            Matcher structure = STRUCTURE.matcher(line);
            if (structure.find()) {
                details.put(ClassifiedEvent.STRUCTURE_TYPE, structure.group(1).trim());
            }
        }
        default -> {
            // no details for other categories
        }
        }
        return details;
    }

    static String categorizeCreature(String creatureType) {
        String lower = creatureType.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : CREATURE_CATEGORIES.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return OTHER_CATEGORY;
    }
}
