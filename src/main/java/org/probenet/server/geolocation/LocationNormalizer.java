package org.probenet.server.geolocation;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Display and comparison forms of the free-text values reported by providers.
 * <p>
 * Votes compare normalized forms only, so every provider must build them through this class.
 */
public final class LocationNormalizer {

    private LocationNormalizer() {
    }

    /**
     * Returns the display form: trimmed, inner whitespace collapsed, empty for null.
     */
    public static String displayName(String value) {
        return StringUtils.normalizeSpace(StringUtils.defaultString(value));
    }

    /**
     * Returns the comparison form: display form in lower case.
     */
    public static String normalizedName(String value) {
        return displayName(value).toLowerCase(Locale.ROOT);
    }

    public static String normalizeCountry(String countryCode) {
        return StringUtils.upperCase(StringUtils.trimToEmpty(countryCode), Locale.ROOT);
    }
}
