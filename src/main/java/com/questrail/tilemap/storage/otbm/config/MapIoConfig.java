package com.questrail.tilemap.storage.otbm.config;

import java.util.Objects;

/**
 * Aggregated configuration for map loading and saving.
 */
public record MapIoConfig(
    ResourceLimits limits,
    UnknownItemPolicy unknownItemPolicy,
    int placeholderItemId,
    boolean allowUnsupportedVersions,
    int issueLimitPerCode
) {
    public MapIoConfig {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(unknownItemPolicy, "unknownItemPolicy");
        if (placeholderItemId < 0 || placeholderItemId > 0xFFFF) {
            throw new IllegalArgumentException("placeholderItemId out of range: " + placeholderItemId);
        }
        if (issueLimitPerCode <= 0) {
            throw new IllegalArgumentException("issueLimitPerCode must be positive");
        }
    }

    public static MapIoConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ResourceLimits limits = ResourceLimits.defaults();
        private UnknownItemPolicy unknownItemPolicy = UnknownItemPolicy.PLACEHOLDER;
        private int placeholderItemId = 0;
        private boolean allowUnsupportedVersions = false;
        private int issueLimitPerCode = 100;

        public Builder withLimits(ResourceLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder withUnknownItemPolicy(UnknownItemPolicy policy) {
            this.unknownItemPolicy = policy;
            return this;
        }

        public Builder withPlaceholderItemId(int placeholderItemId) {
            this.placeholderItemId = placeholderItemId;
            return this;
        }

        public Builder withAllowUnsupportedVersions(boolean allow) {
            this.allowUnsupportedVersions = allow;
            return this;
        }

        public Builder withIssueLimitPerCode(int limit) {
            this.issueLimitPerCode = limit;
            return this;
        }

        public MapIoConfig build() {
            return new MapIoConfig(limits, unknownItemPolicy, placeholderItemId,
                    allowUnsupportedVersions, issueLimitPerCode);
        }
    }
}
