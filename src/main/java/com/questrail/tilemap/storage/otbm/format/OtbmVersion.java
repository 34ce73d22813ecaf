package com.questrail.tilemap.storage.otbm.format;

import com.questrail.tilemap.api.IdSpace;

import java.util.Optional;

/**
 * OtbmVersion
 * -----------------------------------------------------------------------------
 * The structural versions of the map format and what each one may contain.
 *
 * <p>The wire value is the u32 stored first in the root payload. Versions from
 * {@link #V5} on store ClientIDs; earlier ones store ServerIDs.</p>
 */
public enum OtbmVersion
{
    V1(0, IdSpace.SERVER),
    V2(1, IdSpace.SERVER),
    V3(2, IdSpace.SERVER),
    V4(3, IdSpace.SERVER),
    V5(4, IdSpace.CLIENT),
    V6(5, IdSpace.CLIENT),
    V7(6, IdSpace.CLIENT);

    private final int wireValue;
    private final IdSpace idSpace;

    OtbmVersion(int wireValue, IdSpace idSpace) {
        this.wireValue = wireValue;
        this.idSpace = idSpace;
    }

    public int wireValue() {
        return wireValue;
    }

    public IdSpace idSpace() {
        return idSpace;
    }

    public boolean usesClientId() {
        return idSpace == IdSpace.CLIENT;
    }

    /**
     * V1 stores the count or charges of stackable, fluid and splash items as a
     * bare byte right after the item id.
     */
    public boolean hasInlineSubtype() {
        return this == V1;
    }

    public boolean allowsCompactGround() {
        return this != V1;
    }

    public boolean supportsTileZones() {
        return compareTo(V6) >= 0;
    }

    public boolean supportsItemTier() {
        return this == V7;
    }

    public static Optional<OtbmVersion> fromWire(long wireValue) {
        for (OtbmVersion v : values()) {
            if (v.wireValue == wireValue) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    public static OtbmVersion latest() {
        return V7;
    }

    /**
     * Structural version editors write for a client version in the given id space.
     */
    public static OtbmVersion forClient(int clientVersion, IdSpace space) {
        if (space == IdSpace.CLIENT) {
            if (clientVersion < 1300) return V5;
            if (clientVersion < 1330) return V6;
            return V7;
        }
        if (clientVersion < 780) return V1;
        if (clientVersion < 850) return V2;
        if (clientVersion < 870) return V3;
        return V4;
    }
}
