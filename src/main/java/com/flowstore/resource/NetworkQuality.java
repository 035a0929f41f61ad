package com.flowstore.resource;

import java.util.Locale;

/**
 * Link quality reported by the embedding application.
 */
public enum NetworkQuality {
    GOOD,
    MODERATE,
    SLOW,
    CONSTRAINED;

    /**
     * Map a Network Information API effective type ("4g", "3g", "2g", "slow-2g")
     * to a quality level. Unknown or missing values are treated as GOOD.
     *
     * @param effectiveType the effective connection type
     * @return the matching quality
     */
    public static NetworkQuality fromEffectiveType(String effectiveType) {
        if (effectiveType == null) {
            return GOOD;
        }
        switch (effectiveType.trim().toLowerCase(Locale.ROOT)) {
            case "slow-2g":
                return CONSTRAINED;
            case "2g":
                return SLOW;
            case "3g":
                return MODERATE;
            default:
                return GOOD;
        }
    }
}
