package org.probenet.server.geolocation.model;

import lombok.Getter;

/**
 * Geo location data providers in descending priority order.
 * <p>
 * The declaration order is the tie-break order of the city vote and the search order of the network fallback.
 */
public enum Provider {

    IP2LOCATION("ip2location", true, true),
    IPMAP("ipmap", false, true),
    MAXMIND("maxmind", false, true),
    IPINFO("ipinfo", false, true),
    FASTLY("fastly", false, false);

    @Getter
    private final String code;

    /**
     * Whether the proxy flag reported by this provider is enforced.
     */
    @Getter
    private final boolean proxyDetector;

    /**
     * Whether this provider alone may establish a city.
     */
    @Getter
    private final boolean standaloneCityAuthority;

    Provider(String code, boolean proxyDetector, boolean standaloneCityAuthority) {
        this.code = code;
        this.proxyDetector = proxyDetector;
        this.standaloneCityAuthority = standaloneCityAuthority;
    }
}
