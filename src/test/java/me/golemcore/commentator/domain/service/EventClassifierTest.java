package me.golemcore.commentator.domain.service;

import me.golemcore.commentator.domain.exception.ExtractionException;
import me.golemcore.commentator.domain.model.ClassifiedEvent;
import me.golemcore.commentator.domain.model.EventCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();

    @Test
    void shouldExtractTamingDetails() {
        ClassifiedEvent event = classifier.classify("Sletty tamed a level 150 Tek Parasaur!");

        assertEquals(EventCategory.TAMING, event.getCategory());
        assertEquals("Tek Parasaur", event.detail(ClassifiedEvent.CREATURE_TYPE));
        assertEquals("tek", event.detail(ClassifiedEvent.CREATURE_CATEGORY));
        assertEquals(150, event.getDetails().get(ClassifiedEvent.LEVEL));
    }

    @Test
    void shouldExtractSingleWordCreature() {
        ClassifiedEvent event = classifier.classify("Sletty tamed a Rex");

        assertEquals("Rex", event.detail(ClassifiedEvent.CREATURE_TYPE));
        assertEquals("combat", event.detail(ClassifiedEvent.CREATURE_CATEGORY));
        assertNull(event.detail(ClassifiedEvent.LEVEL));
    }

    @Test
    void shouldExtractKiller() {
        ClassifiedEvent event = classifier.classify("Bob was killed by a Giga");

        assertEquals(EventCategory.DEATH, event.getCategory());
        assertEquals("Giga", event.detail(ClassifiedEvent.KILLED_BY));
    }

    @Test
    void shouldExtractStructure() {
        ClassifiedEvent event = classifier.classify("Bob placed a Stone Foundation");

        assertEquals(EventCategory.BUILDING, event.getCategory());
        assertEquals("Stone Foundation", event.detail(ClassifiedEvent.STRUCTURE_TYPE));
    }

    @Test
    void shouldUseFirstMatchingCategory() {
        assertEquals(EventCategory.JOINING, classifier.classify("Kira joined the tribe").getCategory());
        assertEquals(EventCategory.DEATH, classifier.classify("Kira was killed by a Raptor").getCategory());
        assertEquals(EventCategory.PVP, classifier.classify("Kira destroyed a wall").getCategory());
    }

    @Test
    void shouldClassifyUnmatchedLineAsUnknown() {
        ClassifiedEvent event = classifier.classify("Server restarted");

        assertEquals(EventCategory.UNKNOWN, event.getCategory());
        assertFalse(event.isKnown());
        assertTrue(event.getDetails().isEmpty());
    }

    @Test
    void shouldIgnoreOverlongLevel() {
        ClassifiedEvent event = classifier.classify("Kira tamed a level 99999999999 Dodo");

        assertEquals("Dodo", event.detail(ClassifiedEvent.CREATURE_TYPE));
        assertNull(event.detail(ClassifiedEvent.LEVEL));
    }

    @Test
    void shouldRejectBlankLine() {
        assertThrows(ExtractionException.class, () -> classifier.classify("   "));
        assertThrows(ExtractionException.class, () -> classifier.classify(null));
    }

    @Test
    void shouldCategorizeCreatures() {
        assertEquals("utility", EventClassifier.categorizeCreature("Argentavis"));
        assertEquals("rare", EventClassifier.categorizeCreature("Rock Drake"));
        assertEquals("other", EventClassifier.categorizeCreature("Dodo"));
    }
}
