package com.compound.enrichment.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemTest {

    @Test
    @DisplayName("Should split the label into synonyms on the separator")
    void testQueryNames() {
        WorkItem item = WorkItem.builder()
                .key("17")
                .label("Artemisia annua or Sweet wormwood")
                .build();

        assertEquals(List.of("Artemisia annua", "Sweet wormwood"), item.getQueryNames());
    }

    @Test
    @DisplayName("Should honour a custom synonym separator")
    void testCustomSeparator() {
        WorkItem item = WorkItem.builder()
                .key("17")
                .label("quinine|chinine")
                .synonymSeparator("|")
                .build();

        assertEquals(List.of("quinine", "chinine"), item.getQueryNames());
    }

    @Test
    @DisplayName("Should treat missing hints as empty")
    void testMissingHints() {
        WorkItem item = WorkItem.builder().key("a-1").build();

        assertFalse(item.hasLabel());
        assertFalse(item.hasSecondaryKey());
        assertTrue(item.getQueryNames().isEmpty());
        assertEquals("", item.getSecondaryKey());
    }

    @Test
    @DisplayName("Should reject keys that would break the section marker")
    void testInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> WorkItem.builder().key("a:b").build());
        assertThrows(IllegalArgumentException.class, () -> WorkItem.builder().key("a b").build());
        assertThrows(IllegalArgumentException.class, () -> WorkItem.builder().key("").build());
        assertThrows(IllegalArgumentException.class, () -> WorkItem.builder().build());
    }

    @Test
    @DisplayName("Should keep attributes in insertion order and immutable")
    void testAttributes() {
        WorkItem item = WorkItem.builder()
                .key("c1")
                .attribute("plant_name", "Cinchona")
                .attribute("molecular_weight", "324.4")
                .build();

        assertEquals(List.of("plant_name", "molecular_weight"), List.copyOf(item.getAttributes().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> item.getAttributes().put("x", "y"));
    }
}
