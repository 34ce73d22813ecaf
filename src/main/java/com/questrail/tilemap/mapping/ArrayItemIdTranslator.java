package com.questrail.tilemap.mapping;

import com.questrail.tilemap.api.IdSpace;

import java.util.Arrays;
import java.util.Collections;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * ArrayItemIdTranslator
 * -----------------------------------------------------------------------------
 * A straightforward, efficient {@link ItemIdTranslator} backed by two dense
 * arrays covering the whole u16 id range:
 *
 * <ul>
 *   <li>server id -> client id</li>
 *   <li>client id -> server id</li>
 * </ul>
 *
 * Both lookups are a single array read, which matters when every item of a
 * multi-million-item map is translated.
 */
public final class ArrayItemIdTranslator implements ItemIdTranslator
{
    private static final int ID_SPACE_SIZE = 0x10000;
    private static final int UNMAPPED = -1;

    private final int[] clientByServer;
    private final int[] serverByClient;
    private final Set<Integer> aliases;
    private final int size;

    private ArrayItemIdTranslator(Builder builder) {
        this.clientByServer = builder.clientByServer.clone();
        this.serverByClient = builder.serverByClient.clone();
        this.aliases = Collections.unmodifiableSet(new TreeSet<>(builder.aliases));
        this.size = builder.size;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int serverToClient(int serverId) {
        OptionalInt client = findClientId(serverId);
        if (client.isEmpty()) {
            throw new UnmappedItemIdException(serverId, IdSpace.SERVER);
        }
        return client.getAsInt();
    }

    @Override
    public int clientToServer(int clientId) {
        OptionalInt server = findServerId(clientId);
        if (server.isEmpty()) {
            throw new UnmappedItemIdException(clientId, IdSpace.CLIENT);
        }
        return server.getAsInt();
    }

    @Override
    public OptionalInt findClientId(int serverId) {
        return lookup(clientByServer, serverId);
    }

    @Override
    public OptionalInt findServerId(int clientId) {
        return lookup(serverByClient, clientId);
    }

    @Override
    public Set<Integer> aliasServerIds() {
        return aliases;
    }

    @Override
    public int size() {
        return size;
    }

    private static OptionalInt lookup(int[] table, int id) {
        if (id < 0 || id >= ID_SPACE_SIZE || table[id] == UNMAPPED) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(table[id]);
    }

    public static final class Builder
    {
        private final int[] clientByServer = new int[ID_SPACE_SIZE];
        private final int[] serverByClient = new int[ID_SPACE_SIZE];
        private final Set<Integer> aliases = new TreeSet<>();
        private int size;

        private Builder() {
            Arrays.fill(clientByServer, UNMAPPED);
            Arrays.fill(serverByClient, UNMAPPED);
        }

        /**
         * Adds a pair. The first server id registered for a client id owns the
         * reverse direction; later ones become aliases.
         *
         * @return true if the pair became the reverse mapping of its client id
         */
        public boolean map(int serverId, int clientId) {
            checkId("serverId", serverId);
            checkId("clientId", clientId);
            if (clientByServer[serverId] != UNMAPPED) {
                throw new IllegalArgumentException("Duplicate server id in translator: " + serverId);
            }
            clientByServer[serverId] = clientId;
            size++;
            if (serverByClient[clientId] == UNMAPPED) {
                serverByClient[clientId] = serverId;
                return true;
            }
            aliases.add(serverId);
            return false;
        }

        public ArrayItemIdTranslator build() {
            return new ArrayItemIdTranslator(this);
        }

        private static void checkId(String name, int id) {
            if (id < 0 || id >= ID_SPACE_SIZE) {
                throw new IllegalArgumentException(name + " out of range: " + id);
            }
        }
    }
}
