package com.questrail.tilemap.database;

import org.junit.jupiter.api.Test;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ItemsXmlReaderTest
{
    private static Map<Integer, String> read(String xml) throws ItemDatabaseException {
        return new ItemsXmlReader().readNames(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "items.xml");
    }

    @Test
    void singleIdsAndRangesAreNamed() throws ItemDatabaseException {
        Map<Integer, String> names = read("<?xml version=\"1.0\"?>\n"
                + "<items>\n"
                + "  <item id=\"100\" name=\"grass\"/>\n"
                + "  <item fromid=\"101\" toid=\"103\" name=\"dirt\">\n"
                + "    <attribute key=\"weight\" value=\"100\"/>\n"
                + "  </item>\n"
                + "  <item id=\"2148\" article=\"a\" name=\"gold coin\"/>\n"
                + "</items>");

        assertEquals("grass", names.get(100));
        assertEquals("dirt", names.get(101));
        assertEquals("dirt", names.get(103));
        assertEquals("gold coin", names.get(2148));
        assertEquals(5, names.size());
    }

    @Test
    void firstNameForAnIdWins() throws ItemDatabaseException {
        Map<Integer, String> names = read("<items>"
                + "<item fromid=\"1\" toid=\"2\" name=\"first\"/>"
                + "<item id=\"2\" name=\"second\"/>"
                + "</items>");
        assertEquals("first", names.get(2));
    }

    @Test
    void itemsWithoutNameAreIgnored() throws ItemDatabaseException {
        assertTrue(read("<items><item id=\"5\"/></items>").isEmpty());
    }

    @Test
    void malformedXmlIsRejected() {
        assertThrows(ItemDatabaseException.class, () -> read("<items><item id=\"5\" name=\"x\">"));
    }

    @Test
    void nonNumericIdIsRejected() {
        assertThrows(ItemDatabaseException.class, () -> read("<items><item id=\"five\" name=\"x\"/></items>"));
    }

    // ---------------------------------------------------------------------
    // Closing
    // ---------------------------------------------------------------------

    /**
     * A reader whose document is never readable and whose close fails too,
     * if asked to.
     */
    private static XMLStreamReader failingReader(boolean failRead) {
        return (XMLStreamReader) Proxy.newProxyInstance(ItemsXmlReaderTest.class.getClassLoader(),
                new Class<?>[] { XMLStreamReader.class },
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "hasNext":
                            return failRead;
                        case "next":
                            throw new XMLStreamException("unexpected end of document");
                        case "close":
                            throw new XMLStreamException("close failed");
                        default:
                            return null;
                    }
                });
    }

    @Test
    void closeFailureDoesNotHideTheReadFailure() {
        ItemDatabaseException e = assertThrows(ItemDatabaseException.class,
                () -> new ItemsXmlReader().readNames(failingReader(true), "items.xml"));
        assertTrue(e.getMessage().contains("unexpected end of document"), e.getMessage());
        Throwable[] suppressed = e.getCause().getSuppressed();
        assertEquals(1, suppressed.length);
        assertTrue(suppressed[0].getMessage().contains("close failed"));
    }

    @Test
    void closeFailureAloneIsReported() {
        ItemDatabaseException e = assertThrows(ItemDatabaseException.class,
                () -> new ItemsXmlReader().readNames(failingReader(false), "items.xml"));
        assertTrue(e.getMessage().contains("close failed"), e.getMessage());
    }
}
