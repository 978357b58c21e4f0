package com.opencm.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EdgeTest {

    @Test
    void causes_defaultsAndSelfLoop() {
        Edge edge = Edge.causes("a", "a", 0.3);

        assertTrue(edge.isSelfLoop());
        assertEquals(1.0, edge.getConfidence());
        assertFalse(edge.isLearned());
        assertEquals(EdgeType.MEDIATES, edge.withType(EdgeType.MEDIATES).getType());
    }

    @Test
    void withTypeValue_keepsUnrecognizedTextAlongsideUnknown() {
        Edge edge = Edge.causes("a", "b", 0.3).withTypeValue("amplifies");

        assertEquals(EdgeType.UNKNOWN, edge.getType());
        assertEquals("amplifies", edge.getTypeValue());
        assertNotEquals(edge, Edge.causes("a", "b", 0.3).withTypeValue("dampens"));
        assertEquals("amplifies", edge.withStrength(0.9).getTypeValue());
    }

    @Test
    void withTypeValue_knownOrBlankTextUsesCanonicalValue() {
        Edge base = Edge.causes("a", "b", 0.3);

        assertEquals(base.withType(EdgeType.INHIBITS), base.withTypeValue("inhibits"));
        assertEquals(base, base.withTypeValue(null));
        assertEquals("causes", base.withTypeValue("").getTypeValue());
        assertEquals("moderates", base.withTypeValue("amplifies").withType(EdgeType.MODERATES).getTypeValue());
    }
}
