package com.questrail.tilemap.storage.otbm.format;

import java.util.Optional;

/**
 * Node types of a map file.
 *
 * <p>The root is written with type 0; type 1 is accepted as a root as well.
 * Types without a decoder for their parent, listed here or not, are
 * preserved as opaque nodes.</p>
 */
public enum NodeKind
{
    ROOT(0),
    MAP_DATA(2),
    ITEM_DEF(3),
    TILE_AREA(4),
    TILE(5),
    ITEM(6),
    TILE_SQUARE(7),
    TILE_REF(8),
    SPAWNS(9),
    SPAWN_AREA(10),
    MONSTER(11),
    TOWNS(12),
    TOWN(13),
    HOUSETILE(14),
    WAYPOINTS(15),
    WAYPOINT(16),
    TILE_ZONE(19);

    public static final int LEGACY_ROOT_TYPE = 1;

    private static final NodeKind[] BY_TYPE = new NodeKind[256];

    static {
        for (NodeKind kind : values()) {
            BY_TYPE[kind.type] = kind;
        }
    }

    private final int type;

    NodeKind(int type) {
        this.type = type;
    }

    public int type() {
        return type;
    }

    public static Optional<NodeKind> fromType(int type) {
        if (type < 0 || type > 0xFF) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TYPE[type]);
    }

    public static boolean isRootType(int type) {
        return type == ROOT.type || type == LEGACY_ROOT_TYPE;
    }

    /**
     * Name used in node paths of error messages.
     */
    public static String describe(int type) {
        NodeKind kind = type >= 0 && type <= 0xFF ? BY_TYPE[type] : null;
        return kind != null ? kind.name() : String.format("0x%02X", type);
    }
}
