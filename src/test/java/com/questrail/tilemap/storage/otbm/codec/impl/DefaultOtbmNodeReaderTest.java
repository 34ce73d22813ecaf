package com.questrail.tilemap.storage.otbm.codec.impl;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import com.questrail.tilemap.storage.otbm.error.ResourceLimitExceededException;
import com.questrail.tilemap.storage.otbm.error.StructuralCorruptionException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultOtbmNodeReaderTest
{
    private static DefaultOtbmNodeReader reader(int... bytes) {
        return limitedReader(DefaultOtbmNodeReader.DEFAULT_MAX_PAYLOAD, DefaultOtbmNodeReader.DEFAULT_MAX_DEPTH, bytes);
    }

    private static DefaultOtbmNodeReader limitedReader(int maxPayload, int maxDepth, int... bytes) {
        return new DefaultOtbmNodeReader(new ByteArrayInputStream(toBytes(bytes)), 0, t -> "t" + t,
                maxPayload, maxDepth);
    }

    private static byte[] toBytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    private static List<NodeEvent> drain(DefaultOtbmNodeReader r) throws IOException {
        List<NodeEvent> events = new ArrayList<>();
        Optional<NodeEvent> e;
        while ((e = r.next()).isPresent()) {
            events.add(e.get());
        }
        return events;
    }

    // ---------------------------------------------------------------------
    // Well-formed trees
    // ---------------------------------------------------------------------

    @Test
    void nestedNodesProduceStartAndEndEventsInOrder() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x01, 0xAA, 0xBB, 0xFE, 0x02, 0xCC, 0xFF, 0xFF);

        NodeEvent.Start root = (NodeEvent.Start) r.next().orElseThrow();
        assertEquals(1, root.type());
        assertEquals(1, root.depth());
        assertEquals(0, root.offset());
        assertArrayEquals(toBytes(0xAA, 0xBB), root.payload());
        assertTrue(root.hasChildren());

        NodeEvent.Start child = (NodeEvent.Start) r.next().orElseThrow();
        assertEquals(2, child.type());
        assertEquals(2, child.depth());
        assertEquals(4, child.offset());
        assertArrayEquals(toBytes(0xCC), child.payload());
        assertFalse(child.hasChildren());
        assertEquals("/t1/t2", r.currentPath());

        NodeEvent.End childEnd = (NodeEvent.End) r.next().orElseThrow();
        assertEquals(2, childEnd.type());
        assertEquals(2, childEnd.depth());
        assertEquals(7, childEnd.offset());

        NodeEvent.End rootEnd = (NodeEvent.End) r.next().orElseThrow();
        assertEquals(1, rootEnd.type());
        assertEquals(8, rootEnd.offset());

        assertTrue(r.next().isEmpty());
        r.requireEndOfStream();
        assertEquals("/", r.currentPath());
        assertEquals(9, r.offset());
    }

    @Test
    void offsetsIncludeStartOffset() throws IOException {
        DefaultOtbmNodeReader r = new DefaultOtbmNodeReader(
                new ByteArrayInputStream(toBytes(0xFE, 0x00, 0xFE, 0x02, 0xFF, 0xFF)), 4);
        assertEquals(4, ((NodeEvent.Start) r.next().orElseThrow()).offset());
        assertEquals(6, ((NodeEvent.Start) r.next().orElseThrow()).offset());
    }

    @Test
    void siblingsAreReadAtTheSameDepth() throws IOException {
        List<NodeEvent> events = drain(reader(
                0xFE, 0x00,
                0xFE, 0x04, 0x01, 0xFF,
                0xFE, 0x04, 0x02, 0xFF,
                0xFF));
        assertEquals(6, events.size());
        NodeEvent.Start first = (NodeEvent.Start) events.get(1);
        NodeEvent.Start second = (NodeEvent.Start) events.get(3);
        assertEquals(2, first.depth());
        assertEquals(2, second.depth());
        assertArrayEquals(toBytes(0x02), second.payload());
    }

    @Test
    void escapedPayloadBytesAreUnescaped() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x01, 0xFD, 0xFE, 0xFD, 0xFF, 0xFD, 0xFD, 0x10, 0xFF);
        NodeEvent.Start root = (NodeEvent.Start) r.next().orElseThrow();
        assertArrayEquals(toBytes(0xFE, 0xFF, 0xFD, 0x10), root.payload());
        assertInstanceOf(NodeEvent.End.class, r.next().orElseThrow());
    }

    /**
     * The streaming reader takes any byte after an escape literally.
     */
    @Test
    void escapeBeforeOrdinaryByteIsTakenLiterally() throws IOException {
        NodeEvent.Start root = (NodeEvent.Start) reader(0xFE, 0x01, 0xFD, 0x41, 0xFF).next().orElseThrow();
        assertArrayEquals(toBytes(0x41), root.payload());
    }

    @Test
    void statisticsTrackLargestPayloadAndDeepestNesting() throws IOException {
        DefaultOtbmNodeReader r = reader(
                0xFE, 0x00, 0x01,
                0xFE, 0x02, 0x01, 0x02, 0x03,
                0xFE, 0x03, 0xFF,
                0xFF,
                0xFF);
        drain(r);
        assertEquals(3, r.largestPayload());
        assertEquals(3, r.deepestNesting());
    }

    /**
     * Nesting far beyond what native recursion could handle is read with the
     * explicit frame stack.
     */
    @Test
    void veryDeepNestingIsReadWithoutRecursion() throws IOException {
        final int levels = 50_000;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (int i = 0; i < levels; i++) {
            bytes.write(0xFE);
            bytes.write(0x06);
        }
        for (int i = 0; i < levels; i++) {
            bytes.write(0xFF);
        }
        DefaultOtbmNodeReader r = new DefaultOtbmNodeReader(new ByteArrayInputStream(bytes.toByteArray()), 0,
                t -> "item", 16, levels);
        assertEquals(2 * levels, drain(r).size());
        assertEquals(levels, r.deepestNesting());
        r.requireEndOfStream();
    }

    // ---------------------------------------------------------------------
    // Corruption
    // ---------------------------------------------------------------------

    @Test
    void streamNotStartingWithNodeStartIsCorrupt() {
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class,
                () -> reader(0x00, 0x01).next());
        assertEquals(0, e.offset());
    }

    @Test
    void emptyStreamIsCorrupt() {
        assertThrows(StructuralCorruptionException.class, () -> reader().next());
    }

    @Test
    void markerInPlaceOfNodeTypeIsCorrupt() {
        assertThrows(StructuralCorruptionException.class, () -> reader(0xFE, 0xFF).next());
    }

    @Test
    void streamEndingInsidePayloadIsCorrupt() {
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class,
                () -> reader(0xFE, 0x01, 0xAA).next());
        assertEquals("/t1", e.nodePath());
        assertEquals(3, e.offset());
    }

    @Test
    void danglingEscapeAtEndOfStreamIsCorrupt() {
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class,
                () -> reader(0xFE, 0x01, 0xAA, 0xFD).next());
        assertEquals(3, e.offset());
        assertTrue(e.getMessage().contains("dangling escape"));
    }

    @Test
    void unclosedNodeIsCorrupt() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x01, 0xFE, 0x02, 0xFF);
        r.next();
        r.next();
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class, r::next);
        assertEquals("/t1", e.nodePath());
    }

    /**
     * An unescaped END byte inside a child payload closes the child early; the
     * byte after it is neither a marker nor the end of the stream.
     */
    @Test
    void unescapedEndByteInsidePayloadIsCorrupt() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x00, 0xFE, 0x02, 0xAA, 0xFF, 0xBB, 0xFF, 0xFF);
        r.next();
        r.next();
        StructuralCorruptionException e = assertThrows(StructuralCorruptionException.class, r::next);
        assertEquals(6, e.offset());
    }

    @Test
    void trailingDataAfterRootIsCorrupt() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x01, 0xFF, 0x00);
        drain(r);
        assertThrows(StructuralCorruptionException.class, r::requireEndOfStream);
    }

    @Test
    void requireEndOfStreamBeforeRootClosesIsAnError() throws IOException {
        DefaultOtbmNodeReader r = reader(0xFE, 0x01, 0xFF);
        r.next();
        assertThrows(IllegalStateException.class, r::requireEndOfStream);
    }

    // ---------------------------------------------------------------------
    // Limits
    // ---------------------------------------------------------------------

    @Test
    void nestingBeyondLimitIsRejected() throws IOException {
        DefaultOtbmNodeReader r = limitedReader(1024, 2, 0xFE, 0x00, 0xFE, 0x02, 0xFE, 0x04, 0xFF, 0xFF, 0xFF);
        r.next();
        r.next();
        ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class, r::next);
        assertEquals("node nesting depth", e.limit());
    }

    @Test
    void payloadBeyondLimitIsRejected() {
        DefaultOtbmNodeReader r = limitedReader(4, 8, 0xFE, 0x00, 1, 2, 3, 4, 5, 0xFF);
        assertThrows(ResourceLimitExceededException.class, r::next);
    }

    @Test
    void payloadAtLimitIsAccepted() throws IOException {
        DefaultOtbmNodeReader r = limitedReader(4, 8, 0xFE, 0x00, 1, 2, 3, 4, 0xFF);
        assertEquals(4, ((NodeEvent.Start) r.next().orElseThrow()).payload().length);
    }

    @Test
    void nonPositiveLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultOtbmNodeReader(new ByteArrayInputStream(new byte[0]), 0, t -> "", 0, 8));
    }
}
