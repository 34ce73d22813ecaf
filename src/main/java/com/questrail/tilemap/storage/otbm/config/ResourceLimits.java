package com.questrail.tilemap.storage.otbm.config;

/**
 * ResourceLimits
 * -----------------------------------------------------------------------------
 * Bounds applied while loading untrusted map files.
 *
 * <p>Each counted resource has a warning threshold (reported once, load
 * continues) and a hard threshold (load fails with a resource-limit failure).
 * Payload size and nesting depth only have hard thresholds; they bound the
 * reader's working memory.</p>
 */
public record ResourceLimits(
        long warnFileBytes,
        long maxFileBytes,
        int maxPayloadBytes,
        int maxNodeDepth,
        long warnTiles,
        long maxTiles,
        long warnItems,
        long maxItems
) {
    private static final long MB = 1024L * 1024L;

    public ResourceLimits {
        requirePair("file bytes", warnFileBytes, maxFileBytes);
        requirePair("tiles", warnTiles, maxTiles);
        requirePair("items", warnItems, maxItems);
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
        if (maxNodeDepth < 8) {
            throw new IllegalArgumentException("maxNodeDepth must allow at least 8 levels");
        }
    }

    public static ResourceLimits defaults() {
        return builder().build();
    }

    /**
     * Limits that never trigger, for trusted input.
     */
    public static ResourceLimits unlimited() {
        return new ResourceLimits(Long.MAX_VALUE, Long.MAX_VALUE, Integer.MAX_VALUE - 8, 4096,
                Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePair(String what, long warn, long max) {
        if (warn <= 0 || max <= 0) {
            throw new IllegalArgumentException(what + " thresholds must be positive");
        }
        if (warn > max) {
            throw new IllegalArgumentException(what + " warning threshold exceeds hard threshold");
        }
    }

    public static final class Builder {
        private long warnFileBytes = 256 * MB;
        private long maxFileBytes = 1024 * MB;
        private int maxPayloadBytes = (int) (16 * MB);
        private int maxNodeDepth = 256;
        private long warnTiles = 1_000_000;
        private long maxTiles = 16_000_000;
        private long warnItems = 8_000_000;
        private long maxItems = 128_000_000;

        public Builder withFileBytes(long warn, long max) {
            this.warnFileBytes = warn;
            this.maxFileBytes = max;
            return this;
        }

        public Builder withMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        public Builder withMaxNodeDepth(int maxNodeDepth) {
            this.maxNodeDepth = maxNodeDepth;
            return this;
        }

        public Builder withTiles(long warn, long max) {
            this.warnTiles = warn;
            this.maxTiles = max;
            return this;
        }

        public Builder withItems(long warn, long max) {
            this.warnItems = warn;
            this.maxItems = max;
            return this;
        }

        public ResourceLimits build() {
            return new ResourceLimits(warnFileBytes, maxFileBytes, maxPayloadBytes, maxNodeDepth,
                    warnTiles, maxTiles, warnItems, maxItems);
        }
    }
}
