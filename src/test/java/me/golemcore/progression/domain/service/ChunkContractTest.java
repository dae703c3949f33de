package me.golemcore.progression.domain.service;

import me.golemcore.progression.domain.model.PlaceRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkContractTest {

    @Test
    void shouldParseSurfacePlaceRef() {
        PlaceRef ref = ChunkContract.parse("EARTH:SUR:L300-BJ10");

        assertEquals("EARTH", ref.anchor());
        assertEquals("SUR", ref.space());
        assertEquals(300, ref.layer());
        assertEquals("BJ10", ref.cell());
        assertEquals("BJ", ref.col());
        assertEquals(10, ref.row());
        assertEquals(0, ref.z());
        assertEquals("earth-sur-300-bj", ref.chunk2dId());
    }

    @Test
    void shouldParseNegativeZAndKeepItOutOfChunkId() {
        PlaceRef ref = ChunkContract.parse("EARTH:SUB:L340-AA22-Z-3");

        assertEquals(-3, ref.z());
        assertEquals("earth-sub-340-aa", ref.chunk2dId());
    }

    @Test
    void shouldShareChunkAcrossRowsAndDepths() {
        assertEquals(ChunkContract.deriveChunk2dId("EARTH:SUB:L340-AA22-Z-3"),
                ChunkContract.deriveChunk2dId("EARTH:SUB:L340-AA99-Z-8"));
    }

    @Test
    void shouldSupportMultiPartAnchorAndInstanceSuffix() {
        PlaceRef ref = ChunkContract.parse("SOL:MARS:SUR:L200-CC03:instance-7");

        assertEquals("SOL:MARS", ref.anchor());
        assertEquals("SUR", ref.space());
        assertEquals("instance-7", ref.suffix());
        assertEquals("sol-mars-sur-200-cc", ref.chunk2dId());
    }

    @Test
    void shouldNormalizeCase() {
        assertEquals("earth-sur-300-bj", ChunkContract.deriveChunk2dId("earth:sur:l300-bj10"));
    }

    @Test
    void shouldRejectRefWithoutLocId() {
        assertThrows(ChunkContract.PlaceRefParseException.class, () -> ChunkContract.parse("EARTH:SUR:nowhere"));
        assertFalse(ChunkContract.isValid("EARTH:SUR"));
        assertFalse(ChunkContract.isValid(""));
        assertFalse(ChunkContract.isValid(null));
    }

    @Test
    void shouldRejectMissingAnchor() {
        assertFalse(ChunkContract.isValid(":SUR:L300-BJ10"));
        assertTrue(ChunkContract.tryParse("EARTH:SUR:L300-BJ10").isPresent());
    }
}
