package com.identity.resolution.store;

import com.identity.resolution.core.model.EntityMentionLink;
import com.identity.resolution.core.model.ResolvedEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PublicProjection Tests")
class PublicProjectionTest {

    private final PublicProjection projection = PublicProjection.of(StoreFixtures.snapshot("run-1"), 0.5);

    @Test
    @DisplayName("Suppressed and low confidence singletons are hidden")
    void hidesEntities() {
        assertEquals(List.of("e1", "e2"),
                projection.getEntities().stream().map(ResolvedEntity::getEntityId).toList());
        assertTrue(projection.isVisible("e1"));
        assertFalse(projection.isVisible("e3"));
        assertFalse(projection.isVisible("e4"));
        assertEquals("run-1", projection.getRunId());
    }

    @Test
    @DisplayName("Only links of visible entities are exposed")
    void filtersLinks() {
        assertEquals(List.of("m1", "m2", "m3"),
                projection.getLinks().stream().map(EntityMentionLink::mentionId).toList());
    }

    @Test
    @DisplayName("Merged entities stay visible whatever their confidence")
    void mergedAlwaysVisible() {
        ResolvedEntity lowMerged = StoreFixtures.entity("e9", "J. E.", 0.3, "m8", "m9");
        assertTrue(PublicProjection.isVisible(lowMerged, 0.5));
        assertFalse(PublicProjection.isVisible(StoreFixtures.entity("e8", "J.", 0.3, "m7"), 0.5));
        assertTrue(PublicProjection.isVisible(StoreFixtures.entity("e8", "J.", 0.3, "m7"), 0.0));
    }
}
