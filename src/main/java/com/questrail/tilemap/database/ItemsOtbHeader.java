package com.questrail.tilemap.database;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version block of an items.otb root node.
 *
 * @param csd free-form description string, e.g. {@code "OTB 3.65.62-13.10"}
 */
public record ItemsOtbHeader(long majorVersion, long minorVersion, long buildNumber, String csd)
{
    // Major up to four digits, minor up to two; longer runs are not a client version.
    private static final Pattern CLIENT_VERSION = Pattern.compile("-(\\d{1,4})\\.(\\d{1,2})(?!\\d)");

    // Old files carry no client version in their description.
    private static final Map<Long, Integer> LEGACY_CLIENT_VERSIONS = Map.of(
            101L, 740,
            102L, 750
    );

    private static final long MAX_CLIENT_VERSION = 9999_99L;

    public ItemsOtbHeader {
        Objects.requireNonNull(csd, "csd");
    }

    /**
     * The client version the database was built for, as {@code major * 100 + minor}.
     * Zero when neither the description nor the version block yields one.
     */
    public int clientVersion() {
        Matcher m = CLIENT_VERSION.matcher(csd);
        if (m.find()) {
            return Integer.parseInt(m.group(1)) * 100 + Integer.parseInt(m.group(2));
        }
        long otbVersion = majorVersion * 100 + minorVersion;
        Integer legacy = LEGACY_CLIENT_VERSIONS.get(otbVersion);
        if (legacy != null) {
            return legacy;
        }
        return otbVersion > 0 && otbVersion <= MAX_CLIENT_VERSION ? (int) otbVersion : 0;
    }
}
