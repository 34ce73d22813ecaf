package com.questrail.tilemap.mapping;

import com.questrail.tilemap.api.IdSpace;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ArrayItemIdTranslatorTests
{
    private static ArrayItemIdTranslator standard() {
        ArrayItemIdTranslator.Builder b = ArrayItemIdTranslator.builder();
        b.map(100, 5000);
        b.map(1987, 2854);
        b.map(2148, 3031);
        return b.build();
    }

    @Test
    void translatesInBothDirections() {
        ArrayItemIdTranslator t = standard();

        assertEquals(5000, t.serverToClient(100));
        assertEquals(100, t.clientToServer(5000));
        assertEquals(3031, t.findClientId(2148).getAsInt());
        assertEquals(1987, t.findServerId(2854).getAsInt());
        assertEquals(3, t.size());
        assertTrue(t.hasServerId(100));
        assertTrue(t.hasClientId(3031));
    }

    @Test
    void everyNonAliasServerIdRoundTrips() {
        ArrayItemIdTranslator t = standard();
        for (int serverId : new int[] { 100, 1987, 2148 }) {
            assertEquals(serverId, t.clientToServer(t.serverToClient(serverId)));
        }
    }

    @Test
    void unknownIdsAreEmptyOrThrow() {
        ArrayItemIdTranslator t = standard();

        assertTrue(t.findClientId(101).isEmpty());
        assertTrue(t.findServerId(1).isEmpty());
        assertTrue(t.findClientId(-1).isEmpty());
        assertTrue(t.findServerId(0x10000).isEmpty());

        UnmappedItemIdException e = assertThrows(UnmappedItemIdException.class, () -> t.clientToServer(77));
        assertEquals(77, e.id());
        assertEquals(IdSpace.CLIENT, e.space());
        assertEquals(IdSpace.SERVER,
                assertThrows(UnmappedItemIdException.class, () -> t.serverToClient(78)).space());
    }

    /**
     * A second server id on an already claimed client id still maps forward,
     * but the client id keeps pointing at the first server id.
     */
    @Test
    void laterServerIdOnSameClientIdBecomesAlias() {
        ArrayItemIdTranslator.Builder b = ArrayItemIdTranslator.builder();
        assertTrue(b.map(3000, 3500));
        assertFalse(b.map(3001, 3500));
        ArrayItemIdTranslator t = b.build();

        assertEquals(3500, t.serverToClient(3001));
        assertEquals(3000, t.clientToServer(3500));
        assertEquals(Set.of(3001), t.aliasServerIds());
    }

    @Test
    void duplicateServerIdIsRejected() {
        ArrayItemIdTranslator.Builder b = ArrayItemIdTranslator.builder();
        b.map(100, 5000);
        assertThrows(IllegalArgumentException.class, () -> b.map(100, 5001));
    }

    @Test
    void idsOutsideU16AreRejected() {
        ArrayItemIdTranslator.Builder b = ArrayItemIdTranslator.builder();
        assertThrows(IllegalArgumentException.class, () -> b.map(0x10000, 1));
        assertThrows(IllegalArgumentException.class, () -> b.map(1, -1));
    }

    @Test
    void builtTranslatorIsUnaffectedByLaterBuilderUse() {
        ArrayItemIdTranslator.Builder b = ArrayItemIdTranslator.builder();
        b.map(1, 2);
        ArrayItemIdTranslator first = b.build();
        b.map(3, 4);
        assertTrue(first.findClientId(3).isEmpty());
        assertEquals(1, first.size());
    }
}
