package com.questrail.tilemap.api;

import java.util.Objects;
import java.util.Optional;

/**
 * MapHeader
 * -----------------------------------------------------------------------------
 * Map-wide metadata carried by the root and map-data nodes.
 *
 * <p>{@code otbmVersion} is the structural version number as stored in the
 * file, or {@link #UNVERSIONED} for a map that was never read from one. The
 * items version pair names the item database the map was authored against.
 * The external file names are kept as written; the engine does not
 * open them.</p>
 */
public record MapHeader(
        FileIdentifier identifier,
        long otbmVersion,
        int width,
        int height,
        long itemsMajorVersion,
        long itemsMinorVersion,
        String description,
        String spawnFile,
        String houseFile,
        String npcSpawnFile,
        String zoneFile
) {
    public static final long UNVERSIONED = -1;

    /** Deepest floor a map holds; floor 7 is ground level. */
    public static final int MAX_FLOOR = 15;

    public MapHeader {
        Objects.requireNonNull(identifier, "identifier");
        if (width < 0 || width > 0xFFFF || height < 0 || height > 0xFFFF) {
            throw new IllegalArgumentException("map dimensions out of range: " + width + "x" + height);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withIdentifier(identifier)
                .withOtbmVersion(otbmVersion)
                .withDimensions(width, height)
                .withItemsVersion(itemsMajorVersion, itemsMinorVersion)
                .withDescription(description)
                .withSpawnFile(spawnFile)
                .withHouseFile(houseFile)
                .withNpcSpawnFile(npcSpawnFile)
                .withZoneFile(zoneFile);
    }

    /**
     * True when the position lies inside the declared width and height and on
     * one of floors 0 to {@link #MAX_FLOOR}.
     */
    public boolean contains(Position position) {
        return containsColumn(position) && position.z() <= MAX_FLOOR;
    }

    /**
     * True when the position lies inside the declared width and height,
     * whatever its floor.
     */
    public boolean containsColumn(Position position) {
        return position.x() < width && position.y() < height;
    }

    public Optional<String> descriptionText() {
        return Optional.ofNullable(description);
    }

    public static final class Builder {
        private FileIdentifier identifier = FileIdentifier.OTBM;
        private long otbmVersion = UNVERSIONED;
        private int width = 256;
        private int height = 256;
        private long itemsMajorVersion;
        private long itemsMinorVersion;
        private String description;
        private String spawnFile;
        private String houseFile;
        private String npcSpawnFile;
        private String zoneFile;

        public Builder withIdentifier(FileIdentifier identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder withOtbmVersion(long otbmVersion) {
            this.otbmVersion = otbmVersion;
            return this;
        }

        public Builder withDimensions(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder withItemsVersion(long major, long minor) {
            this.itemsMajorVersion = major;
            this.itemsMinorVersion = minor;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withSpawnFile(String spawnFile) {
            this.spawnFile = spawnFile;
            return this;
        }

        public Builder withHouseFile(String houseFile) {
            this.houseFile = houseFile;
            return this;
        }

        public Builder withNpcSpawnFile(String npcSpawnFile) {
            this.npcSpawnFile = npcSpawnFile;
            return this;
        }

        public Builder withZoneFile(String zoneFile) {
            this.zoneFile = zoneFile;
            return this;
        }

        public MapHeader build() {
            return new MapHeader(identifier, otbmVersion, width, height, itemsMajorVersion,
                    itemsMinorVersion, description, spawnFile, houseFile, npcSpawnFile, zoneFile);
        }
    }
}
