package com.questrail.tilemap.storage.otbm.internal.decode;

import com.questrail.tilemap.api.AttributeMapEntry;
import com.questrail.tilemap.api.AttributeValueType;
import com.questrail.tilemap.api.Item;
import com.questrail.tilemap.api.Position;
import com.questrail.tilemap.storage.otbm.codec.PayloadReader;
import com.questrail.tilemap.storage.otbm.codec.TruncatedPayloadException;
import com.questrail.tilemap.storage.otbm.format.OtbmAttribute;
import com.questrail.tilemap.storage.otbm.report.IssueCode;
import com.questrail.tilemap.storage.otbm.report.MapIoIssue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ItemAttributeReader
 * -----------------------------------------------------------------------------
 * Reads the tagged attribute list that follows the id in an item payload.
 *
 * <p>Parsing stops at the first tag that is not an item attribute, or at the
 * first attribute whose value is cut short. From that tag on, every remaining
 * byte becomes the item's opaque remainder, which is written back verbatim
 * after the known attributes.</p>
 */
final class ItemAttributeReader
{
    private static final Set<OtbmAttribute> ITEM_ATTRIBUTES = EnumSet.of(
            OtbmAttribute.ACTION_ID, OtbmAttribute.UNIQUE_ID, OtbmAttribute.TEXT, OtbmAttribute.DESC,
            OtbmAttribute.TELE_DEST, OtbmAttribute.DEPOT_ID, OtbmAttribute.RUNE_CHARGES, OtbmAttribute.CHARGES,
            OtbmAttribute.HOUSEDOORID, OtbmAttribute.COUNT, OtbmAttribute.DURATION, OtbmAttribute.DECAYING_STATE,
            OtbmAttribute.WRITTENDATE, OtbmAttribute.WRITTENBY, OtbmAttribute.SLEEPERGUID, OtbmAttribute.SLEEPSTART,
            OtbmAttribute.TIER, OtbmAttribute.ATTRIBUTE_MAP);

    private ItemAttributeReader() {
    }

    static void read(PayloadReader in, Item.Builder item, DecodeContext ctx, Position at)
    {
        while (in.isReadable()) {
            final int start = in.position();
            final int tag = in.readU8();
            Optional<OtbmAttribute> attribute = OtbmAttribute.fromTag(tag);

            if (attribute.isEmpty() || !ITEM_ATTRIBUTES.contains(attribute.get())) {
                item.opaqueRemainder(in.takeRemainderFrom(start));
                ctx.report(MapIoIssue.at(IssueCode.UNKNOWN_ATTRIBUTE,
                        String.format("unknown item attribute 0x%02X; %d bytes kept verbatim",
                                tag, in.position() - start), at));
                return;
            }
            try {
                apply(attribute.get(), in, item);
            }
            catch (TruncatedPayloadException | IllegalArgumentException e) {
                item.opaqueRemainder(in.takeRemainderFrom(start));
                ctx.report(MapIoIssue.at(IssueCode.MALFORMED_ATTRIBUTE,
                        "item attribute " + attribute.get() + " is malformed (" + e.getMessage()
                                + "); remaining bytes kept verbatim", at));
                return;
            }
        }
    }

    private static void apply(OtbmAttribute attribute, PayloadReader in, Item.Builder item)
    {
        switch (attribute) {
            case ACTION_ID:      item.actionId(in.readU16()); break;
            case UNIQUE_ID:      item.uniqueId(in.readU16()); break;
            case TEXT:           item.text(in.readString()); break;
            case DESC:           item.description(in.readString()); break;
            case TELE_DEST:      item.teleportDestination(in.readPosition()); break;
            case DEPOT_ID:       item.depotId(in.readU16()); break;
            case RUNE_CHARGES:   item.charges(in.readU8()); break;
            case CHARGES:        item.charges(in.readU16()); break;
            case HOUSEDOORID:    item.houseDoorId(in.readU8()); break;
            case COUNT:          item.count(in.readU8()); break;
            case DURATION:       item.duration(in.readU32()); break;
            case DECAYING_STATE: item.decayingState(in.readU8()); break;
            case WRITTENDATE:    item.writtenDate(in.readU32()); break;
            case WRITTENBY:      item.writtenBy(in.readString()); break;
            case SLEEPERGUID:    item.sleeperGuid(in.readU32()); break;
            case SLEEPSTART:     item.sleepStart(in.readU32()); break;
            case TIER:           item.tier(in.readU8()); break;
            case ATTRIBUTE_MAP:  readAttributeMap(in).forEach(item::addAttribute); break;
            default:
                throw new IllegalStateException("not an item attribute: " + attribute);
        }
    }

    /**
     * Entries are returned as a whole so a cut-off map adds none of them.
     */
    private static List<AttributeMapEntry> readAttributeMap(PayloadReader in)
    {
        final int entries = in.readU16();
        List<AttributeMapEntry> out = new ArrayList<>(Math.min(entries, 64));
        for (int i = 0; i < entries; i++) {
            String key = in.readString();
            int typeTag = in.readU8();
            AttributeValueType type = AttributeValueType.fromTag(typeTag)
                    .orElseThrow(() -> new IllegalArgumentException("unknown value type " + typeTag));
            byte[] value;
            if (type == AttributeValueType.STRING) {
                long length = in.readU32();
                if (length > in.readableBytes()) {
                    throw new TruncatedPayloadException((int) Math.min(length, Integer.MAX_VALUE), in.readableBytes());
                }
                value = in.readBytes((int) length);
            } else {
                value = in.readBytes(type.fixedSize());
            }
            out.add(new AttributeMapEntry(key, type, value));
        }
        return out;
    }
}
