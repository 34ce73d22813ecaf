package com.questrail.tilemap.api;

/**
 * The numbering scheme an item id belongs to.
 *
 * <p>{@link #SERVER} ids are the canonical in-memory identity of an item type.
 * {@link #CLIENT} ids are the sprite-based numbering some map formats store on
 * disk.</p>
 */
public enum IdSpace
{
    SERVER,
    CLIENT
}
