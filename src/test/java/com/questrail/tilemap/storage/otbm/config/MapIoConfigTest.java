package com.questrail.tilemap.storage.otbm.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MapIoConfigTest
{
    @Test
    void defaultsAreUsable() {
        MapIoConfig c = MapIoConfig.defaults();
        assertEquals(UnknownItemPolicy.PLACEHOLDER, c.unknownItemPolicy());
        assertEquals(0, c.placeholderItemId());
        assertFalse(c.allowUnsupportedVersions());
        assertEquals(16_000_000, c.limits().maxTiles());
        assertEquals(256, c.limits().maxNodeDepth());
    }

    @Test
    void builderAppliesEverySetting() {
        ResourceLimits limits = ResourceLimits.builder().withTiles(10, 20).withItems(30, 40).build();
        MapIoConfig c = MapIoConfig.builder()
                .withLimits(limits)
                .withUnknownItemPolicy(UnknownItemPolicy.FAIL)
                .withPlaceholderItemId(100)
                .withAllowUnsupportedVersions(true)
                .withIssueLimitPerCode(5)
                .build();

        assertSame(limits, c.limits());
        assertEquals(UnknownItemPolicy.FAIL, c.unknownItemPolicy());
        assertEquals(100, c.placeholderItemId());
        assertTrue(c.allowUnsupportedVersions());
        assertEquals(5, c.issueLimitPerCode());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MapIoConfig.builder().withPlaceholderItemId(0x10000).build());
        assertThrows(IllegalArgumentException.class, () -> MapIoConfig.builder().withIssueLimitPerCode(0).build());
        assertThrows(NullPointerException.class, () -> MapIoConfig.builder().withLimits(null).build());
    }

    // ---------------------------------------------------------------------
    // ResourceLimits
    // ---------------------------------------------------------------------

    @Test
    void warningThresholdMayNotExceedHardThreshold() {
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().withTiles(11, 10).build());
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().withFileBytes(0, 10).build());
    }

    @Test
    void readerLimitsMustLeaveRoomForAMap() {
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().withMaxNodeDepth(7).build());
        assertThrows(IllegalArgumentException.class, () -> ResourceLimits.builder().withMaxPayloadBytes(0).build());
        assertEquals(8, ResourceLimits.builder().withMaxNodeDepth(8).build().maxNodeDepth());
    }

    @Test
    void unlimitedNeverTriggers() {
        ResourceLimits u = ResourceLimits.unlimited();
        assertEquals(Long.MAX_VALUE, u.maxTiles());
        assertEquals(Long.MAX_VALUE, u.maxFileBytes());
    }
}
