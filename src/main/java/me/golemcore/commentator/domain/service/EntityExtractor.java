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

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds entity (player or tribe) names in event text using an ordered table of
 * verb-anchored patterns.
 */
@Component
public class EntityExtractor {

    static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(\\w+) tamed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) died", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) was killed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) joined", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) left", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) said", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) placed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\w+) destroyed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Tribe (\\w+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Player (\\w+)", Pattern.CASE_INSENSITIVE));

    static final Set<String> STOPLIST = Set.of("the", "and", "was", "you", "all", "any");

    private static final int MIN_NAME_LENGTH = 3;

    /**
     * @return names in first-seen order, never {@code null}
     */
    public Set<String> extract(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return names;
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group(1);
                if (isName(candidate)) {
                    names.add(candidate);
                }
            }
        }
        return names;
    }

    private static boolean isName(String candidate) {
        return candidate != null
                && candidate.length() >= MIN_NAME_LENGTH
                && !STOPLIST.contains(candidate.toLowerCase(Locale.ROOT));
    }
}
