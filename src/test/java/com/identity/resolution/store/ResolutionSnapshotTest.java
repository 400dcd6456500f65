package com.identity.resolution.store;

import com.identity.resolution.core.model.EntityMentionLink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionSnapshot Tests")
class ResolutionSnapshotTest {

    private final ResolutionSnapshot snapshot = StoreFixtures.snapshot("run-1");

    @Test
    @DisplayName("Should resolve mentions to their entity")
    void findEntityForMention() {
        assertEquals("e1", snapshot.findEntityForMention("m2").orElseThrow().getEntityId());
        assertTrue(snapshot.findEntityForMention("m9").isEmpty());
        assertEquals(0.97, snapshot.findLink("m1").orElseThrow().compositeScore());
    }

    @Test
    @DisplayName("Should list links of an entity")
    void linksForEntity() {
        assertEquals(2, snapshot.linksForEntity("e1").size());
        assertEquals(4, snapshot.entityCount());
        assertEquals(5, snapshot.mentionCount());
    }

    @Test
    @DisplayName("Should reject a mention linked twice")
    void duplicateLink() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionSnapshot("run-1", Instant.now(), null,
                List.of(StoreFixtures.entity("e1", "A B", 0.9, "m1")),
                List.of(new EntityMentionLink("e1", "m1", 1.0), new EntityMentionLink("e2", "m1", 1.0))));
    }

    @Test
    @DisplayName("Store swaps snapshots atomically and returns the previous one")
    void storeCommit() {
        ResolutionStore store = new InMemoryResolutionStore();
        assertTrue(store.current().isEmpty());

        assertNull(store.commit(snapshot));
        ResolutionSnapshot next = StoreFixtures.snapshot("run-2");
        assertSame(snapshot, store.commit(next));
        assertSame(next, store.current().orElseThrow());
    }
}
