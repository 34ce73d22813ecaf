package com.questrail.tilemap.storage.otbm.version;

import com.questrail.tilemap.api.House;
import com.questrail.tilemap.api.SpawnArea;
import com.questrail.tilemap.database.ItemDatabase;
import com.questrail.tilemap.storage.otbm.format.ItemDatabaseFiles;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * WorkspaceContext
 * -----------------------------------------------------------------------------
 * What the host knows about a map before it is read.
 *
 * <ul>
 *   <li>hints for version resolution (client version, server engine)</li>
 *   <li>where the item database lives, or an already loaded database</li>
 *   <li>side-channel entities the map file does not carry (houses, spawn areas)</li>
 * </ul>
 *
 * <p>Everything is optional; {@link #empty()} makes the engine rely on the
 * map header, the project file and conventional file locations.</p>
 */
public final class WorkspaceContext
{
    private static final WorkspaceContext EMPTY = builder().build();

    private final Path workspaceRoot;
    private final Integer clientVersionHint;
    private final ServerEngine engineHint;
    private final ItemDatabase itemDatabase;
    private final ItemDatabaseFiles databaseFiles;
    private final boolean readProjectMetadata;
    private final List<House> houses;
    private final List<SpawnArea> spawnAreas;

    private WorkspaceContext(Builder b) {
        this.workspaceRoot = b.workspaceRoot;
        this.clientVersionHint = b.clientVersionHint;
        this.engineHint = b.engineHint;
        this.itemDatabase = b.itemDatabase;
        this.databaseFiles = b.databaseFiles;
        this.readProjectMetadata = b.readProjectMetadata;
        this.houses = List.copyOf(b.houses);
        this.spawnAreas = List.copyOf(b.spawnAreas);
    }

    public static WorkspaceContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Path> workspaceRoot() {
        return Optional.ofNullable(workspaceRoot);
    }

    public OptionalInt clientVersionHint() {
        return clientVersionHint == null ? OptionalInt.empty() : OptionalInt.of(clientVersionHint);
    }

    public ServerEngine engineHint() {
        return engineHint;
    }

    public Optional<ItemDatabase> itemDatabase() {
        return Optional.ofNullable(itemDatabase);
    }

    public ItemDatabaseFiles databaseFiles() {
        return databaseFiles;
    }

    public boolean readProjectMetadata() {
        return readProjectMetadata;
    }

    public List<House> houses() {
        return houses;
    }

    public List<SpawnArea> spawnAreas() {
        return spawnAreas;
    }

    public static final class Builder {
        private Path workspaceRoot;
        private Integer clientVersionHint;
        private ServerEngine engineHint = ServerEngine.UNKNOWN;
        private ItemDatabase itemDatabase;
        private ItemDatabaseFiles databaseFiles = ItemDatabaseFiles.NONE;
        private boolean readProjectMetadata = true;
        private final List<House> houses = new ArrayList<>();
        private final List<SpawnArea> spawnAreas = new ArrayList<>();

        public Builder withWorkspaceRoot(Path root) {
            this.workspaceRoot = root;
            return this;
        }

        public Builder withClientVersionHint(int clientVersion) {
            this.clientVersionHint = clientVersion;
            return this;
        }

        public Builder withEngineHint(ServerEngine engine) {
            this.engineHint = Objects.requireNonNull(engine, "engine");
            return this;
        }

        public Builder withItemDatabase(ItemDatabase database) {
            this.itemDatabase = database;
            return this;
        }

        public Builder withDatabaseFiles(ItemDatabaseFiles files) {
            this.databaseFiles = Objects.requireNonNull(files, "files");
            return this;
        }

        public Builder withProjectMetadata(boolean read) {
            this.readProjectMetadata = read;
            return this;
        }

        public Builder withHouses(List<House> houses) {
            this.houses.addAll(houses);
            return this;
        }

        public Builder withSpawnAreas(List<SpawnArea> areas) {
            this.spawnAreas.addAll(areas);
            return this;
        }

        public WorkspaceContext build() {
            return new WorkspaceContext(this);
        }
    }
}
