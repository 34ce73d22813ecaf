package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.api.IdSpace;

import java.util.Locale;
import java.util.Optional;

/**
 * Server families a map can be authored for. The family decides the id space
 * of the map files it reads.
 */
public enum ServerEngine
{
    CANARY(IdSpace.CLIENT),
    TFS(IdSpace.SERVER),
    UNKNOWN(null);

    private final IdSpace idSpace;

    ServerEngine(IdSpace idSpace) {
        this.idSpace = idSpace;
    }

    public Optional<IdSpace> idSpace() {
        return Optional.ofNullable(idSpace);
    }

    public static ServerEngine normalize(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "canary":
            case "otservbr":
            case "opentibia-canary":
                return CANARY;
            case "tfs":
            case "forgottenserver":
            case "theforgottenserver":
            case "otx":
                return TFS;
            default:
                return UNKNOWN;
        }
    }
}
