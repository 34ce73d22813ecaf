/**
 * Node-tree codec for OTBM-family files.
 *
 * <p>This package defines the boundary between raw bytes and the logical node
 * tree. A file body is a single root node; every node is written as a
 * node-start marker, a one-byte type, an escaped payload, its child nodes, and
 * a node-end marker. Inside payloads the three marker values are preceded by
 * the escape marker.</p>
 *
 * <p>Readers and writers here know nothing about tiles or items. They stream:
 * neither side holds more than the current node's payload and the stack of
 * open node types, whatever the size of the file.</p>
 *
 * <p>Structural defects are raised as
 * {@link com.questrail.tilemap.storage.otbm.error.StructuralCorruptionException}
 * carrying the byte offset and the path of open nodes.</p>
 */
package com.questrail.tilemap.storage.otbm.codec;
