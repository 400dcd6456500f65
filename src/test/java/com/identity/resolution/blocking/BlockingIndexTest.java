package com.identity.resolution.blocking;

import com.identity.resolution.core.model.IdentityMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.identity.resolution.MentionFixtures.mention;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BlockingIndex Tests")
class BlockingIndexTest {

    @Test
    @DisplayName("Should place every mention in exactly one block")
    void partitionsMentions() {
        BlockingIndex index = BlockingIndex.build(List.of(
                mention("m3", "John Smyth"),
                mention("m1", "Jon Smith"),
                mention("m2", "Jeffrey Epstein"),
                mention("m4", "?")));

        assertEquals(4, index.mentionCount());
        assertEquals(3, index.blockCount());
        assertEquals(List.of("m1", "m3"), index.block("S530|j").stream().map(IdentityMention::getMentionId).toList());
        assertEquals("E123|j", index.keyOf("m2"));
        assertEquals(1, index.catchAll().size());
        assertEquals(2, index.largestBlockSize());
    }

    @Test
    @DisplayName("Keys iterate in sorted order")
    void sortedKeys() {
        BlockingIndex index = BlockingIndex.build(List.of(
                mention("m1", "Jon Smith"),
                mention("m2", "Jeffrey Epstein"),
                mention("m3", "?")));

        assertEquals(List.of("", "E123|j", "S530|j"), List.copyOf(index.keys()));
    }

    @Test
    @DisplayName("Unknown key yields an empty block")
    void unknownKey() {
        BlockingIndex index = BlockingIndex.build(List.of(mention("m1", "Jon Smith")));
        assertTrue(index.block("X000|x").isEmpty());
        assertNull(index.keyOf("missing"));
    }

    @Test
    @DisplayName("Should reject duplicate mention ids")
    void duplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> BlockingIndex.build(List.of(
                mention("m1", "Jon Smith"),
                mention("m1", "John Smyth"))));
    }

    @Test
    @DisplayName("Index is immutable")
    void immutable() {
        BlockingIndex index = BlockingIndex.build(List.of(mention("m1", "Jon Smith")));
        assertThrows(UnsupportedOperationException.class, () -> index.block("S530|j").clear());
    }
}
