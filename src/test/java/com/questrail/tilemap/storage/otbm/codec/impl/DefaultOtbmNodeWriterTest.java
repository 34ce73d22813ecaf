package com.questrail.tilemap.storage.otbm.codec.impl;

import com.questrail.tilemap.storage.otbm.codec.NodeEvent;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultOtbmNodeWriterTest
{
    // ---------------------------------------------------------------------
    // Framing
    // ---------------------------------------------------------------------

    @Test
    void writesStartTypePayloadAndEnd() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(out);

        w.startNode(0x00);
        w.writePayload(new byte[] { 0x01, 0x02 });
        w.startNode(0x02);
        w.endNode();
        w.endNode();

        assertArrayEquals(new byte[] { (byte) 0xFE, 0x00, 0x01, 0x02, (byte) 0xFE, 0x02, (byte) 0xFF, (byte) 0xFF },
                out.toByteArray());
        assertEquals(8, w.bytesWritten());
        assertEquals(0, w.depth());
    }

    @Test
    void markerBytesInPayloadAreEscaped() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(out);

        w.startNode(0x06);
        w.writePayload(new byte[] { (byte) 0xFE, 0x10, (byte) 0xFF, (byte) 0xFD });
        w.endNode();

        byte[] expected = {
                (byte) 0xFE, 0x06,
                (byte) 0xFD, (byte) 0xFE, 0x10, (byte) 0xFD, (byte) 0xFF, (byte) 0xFD, (byte) 0xFD,
                (byte) 0xFF
        };
        assertArrayEquals(expected, out.toByteArray());
        assertEquals(expected.length, w.bytesWritten());
    }

    /**
     * A payload may be written in several pieces while no child has been started.
     */
    @Test
    void payloadMayBeWrittenInPieces() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(out);
        w.startNode(0x04);
        w.writePayload(new byte[] { 0x01 });
        w.writePayload(new byte[] { 0x02 });
        w.endNode();
        assertArrayEquals(new byte[] { (byte) 0xFE, 0x04, 0x01, 0x02, (byte) 0xFF }, out.toByteArray());
    }

    @Test
    void writtenTreeReadsBack() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(out);
        byte[] payload = { (byte) 0xFF, (byte) 0xFE, (byte) 0xFD, 0x00 };

        w.startNode(0x00);
        w.startNode(0x02);
        w.writePayload(payload);
        w.endNode();
        w.endNode();

        DefaultOtbmNodeReader r = new DefaultOtbmNodeReader(new ByteArrayInputStream(out.toByteArray()), 0);
        r.next();
        NodeEvent.Start child = (NodeEvent.Start) r.next().orElseThrow();
        assertEquals(0x02, child.type());
        assertArrayEquals(payload, child.payload());
        r.next();
        r.next();
        r.requireEndOfStream();
    }

    // ---------------------------------------------------------------------
    // Misuse
    // ---------------------------------------------------------------------

    @Test
    void markerValuesAreNotValidNodeTypes() {
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(new ByteArrayOutputStream());
        assertThrows(IllegalArgumentException.class, () -> w.startNode(0xFE));
        assertThrows(IllegalArgumentException.class, () -> w.startNode(0xFD));
        assertThrows(IllegalArgumentException.class, () -> w.startNode(256));
        assertThrows(IllegalArgumentException.class, () -> w.startNode(-1));
    }

    @Test
    void endWithoutOpenNodeFails() {
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(new ByteArrayOutputStream());
        assertThrows(IllegalStateException.class, w::endNode);
    }

    @Test
    void payloadAfterChildFails() throws IOException {
        DefaultOtbmNodeWriter w = new DefaultOtbmNodeWriter(new ByteArrayOutputStream());
        w.startNode(0x00);
        w.startNode(0x02);
        w.endNode();
        assertThrows(IllegalStateException.class, () -> w.writePayload(new byte[] { 0x01 }));
    }
}
