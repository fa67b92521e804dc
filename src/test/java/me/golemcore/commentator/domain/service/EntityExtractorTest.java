package me.golemcore.commentator.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    void shouldExtractActorsInFirstSeenOrder() {
        Set<String> names = extractor.extract("Sletty tamed a Rex while Bob died nearby");

        assertEquals(List.of("Sletty", "Bob"), List.copyOf(names));
    }

    @Test
    void shouldExtractTribeAndPlayerMentions() {
        Set<String> names = extractor.extract("Tribe Wolves welcomed Player Kira");

        assertTrue(names.contains("Wolves"));
        assertTrue(names.contains("Kira"));
    }

    @Test
    void shouldIgnoreStopwordsAndShortNames() {
        assertTrue(extractor.extract("the tamed beast").isEmpty());
        assertTrue(extractor.extract("Al died").isEmpty());
    }

    @Test
    void shouldDeduplicateNames() {
        Set<String> names = extractor.extract("Kira joined. Kira said hello. Kira left");

        assertEquals(Set.of("Kira"), names);
    }

    @Test
    void shouldReturnEmptySetForBlankText() {
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
