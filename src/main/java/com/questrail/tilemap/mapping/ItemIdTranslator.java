package com.questrail.tilemap.mapping;

import java.util.OptionalInt;
import java.util.Set;

/**
 * ItemIdTranslator
 * -----------------------------------------------------------------------------
 * Translates item ids between the ServerID space (the in-memory identity) and
 * the ClientID space (what ClientID-format map files store).
 *
 * <h2>Why this exists</h2>
 * Map files of newer formats name items by their client sprite id, while every
 * consumer of the in-memory map works with server ids. This interface keeps
 * that translation behind one explicit boundary, built once from the item
 * database and shared read-only for the rest of a session.
 *
 * <h2>Bijection</h2>
 * For every server id that is not an alias:
 * {@code clientToServer(serverToClient(s)) == s}. An alias is a server id whose
 * client id was already claimed by an earlier server id; aliases still map
 * server to client, but the client id maps back to the first server id.
 *
 * <p>Implementations are immutable and safe for concurrent use.</p>
 */
public interface ItemIdTranslator
{
    /**
     * @throws UnmappedItemIdException if {@code serverId} has no client id
     */
    int serverToClient(int serverId);

    /**
     * @throws UnmappedItemIdException if {@code clientId} has no server id
     */
    int clientToServer(int clientId);

    OptionalInt findClientId(int serverId);

    OptionalInt findServerId(int clientId);

    /**
     * Server ids that share their client id with an earlier server id.
     */
    Set<Integer> aliasServerIds();

    int size();

    default boolean hasServerId(int serverId) {
        return findClientId(serverId).isPresent();
    }

    default boolean hasClientId(int clientId) {
        return findServerId(clientId).isPresent();
    }
}
