package com.clusterops.provider;

import java.util.Locale;

/**
 * Allowed cluster sizes. Each tier also answers to the Atlas size code it was originally sold as.
 */
public enum Tier {
    SMALL("M10"),
    MEDIUM("M20"),
    LARGE("M30");

    private final String atlasSize;

    Tier(String atlasSize) {
        this.atlasSize = atlasSize;
    }

    public String getAtlasSize() {
        return atlasSize;
    }

    // returns null for anything that is not an allowed tier
    public static Tier parse(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.name().equals(v) || tier.atlasSize.equals(v)) {
                return tier;
            }
        }
        return null;
    }
}
