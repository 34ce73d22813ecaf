package com.questrail.tilemap.database;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads item names from an items.xml file.
 *
 * <p>Each {@code <item>} element names either a single id ({@code id}) or an
 * inclusive range ({@code fromid}/{@code toid}). items.xml is auxiliary: it
 * never defines id mappings, only metadata for ids the binary database
 * already knows.</p>
 */
public final class ItemsXmlReader
{
    private static final int MAX_RANGE = 0xFFFF;

    public Map<Integer, String> readNames(Path path) throws IOException, ItemDatabaseException
    {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return readNames(in, path.toString());
        }
    }

    public Map<Integer, String> readNames(InputStream in, String sourceName) throws ItemDatabaseException
    {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);

        XMLStreamReader xml;
        try {
            xml = factory.createXMLStreamReader(in);
        }
        catch (XMLStreamException e) {
            throw new ItemDatabaseException(sourceName + ": " + e.getMessage(), e);
        }
        return readNames(xml, sourceName);
    }

    /**
     * Reads and closes {@code xml}. A failure to close is suppressed into the
     * failure that ended the read, if there was one.
     */
    Map<Integer, String> readNames(XMLStreamReader xml, String sourceName) throws ItemDatabaseException
    {
        Map<Integer, String> names = new HashMap<>();
        try (ReaderCloser closer = xml::close) {
            while (xml.hasNext()) {
                if (xml.next() == XMLStreamConstants.START_ELEMENT && "item".equals(xml.getLocalName())) {
                    readItem(xml, names);
                }
            }
        }
        catch (XMLStreamException | NumberFormatException e) {
            throw new ItemDatabaseException(sourceName + ": " + e.getMessage(), e);
        }
        return names;
    }

    private static void readItem(XMLStreamReader xml, Map<Integer, String> names)
    {
        String name = xml.getAttributeValue(null, "name");
        if (name == null) {
            return;
        }
        String id = xml.getAttributeValue(null, "id");
        if (id != null) {
            names.putIfAbsent(Integer.parseInt(id.trim()), name);
            return;
        }
        String from = xml.getAttributeValue(null, "fromid");
        String to = xml.getAttributeValue(null, "toid");
        if (from != null && to != null) {
            int first = Integer.parseInt(from.trim());
            int last = Math.min(Integer.parseInt(to.trim()), MAX_RANGE);
            for (int i = first; i <= last; i++) {
                names.putIfAbsent(i, name);
            }
        }
    }

    @FunctionalInterface
    private interface ReaderCloser extends AutoCloseable
    {
        @Override
        void close() throws XMLStreamException;
    }
}
