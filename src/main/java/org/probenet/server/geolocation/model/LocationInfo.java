package org.probenet.server.geolocation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalized location reported by a single provider.
 * <p>
 * Absent values: empty string for city and network fields, zero for ASN, null for state.
 */
@Builder(toBuilder = true)
@Jacksonized
@Value
public class LocationInfo {

    /**
     * Continent code in two-letter format.
     */
    @Builder.Default
    String continent = StringUtils.EMPTY;

    /**
     * Country code in ISO-3166-1-alpha-2 format.
     */
    @Builder.Default
    String country = StringUtils.EMPTY;

    /**
     * ANSI state code, set for US locations only.
     */
    String state;

    @Builder.Default
    String city = StringUtils.EMPTY;

    @Builder.Default
    String normalizedCity = StringUtils.EMPTY;

    double latitude;

    double longitude;

    @Builder.Default
    String network = StringUtils.EMPTY;

    @Builder.Default
    String normalizedNetwork = StringUtils.EMPTY;

    long asn;

    public boolean hasCity() {
        return StringUtils.isNotEmpty(city);
    }

    public boolean hasNetwork() {
        return asn != 0 && StringUtils.isNotEmpty(network);
    }
}
