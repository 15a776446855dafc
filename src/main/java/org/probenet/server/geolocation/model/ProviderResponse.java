package org.probenet.server.geolocation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of a successful provider lookup, cached as is.
 */
@Builder
@Jacksonized
@Value
public class ProviderResponse {

    LocationInfo location;

    /**
     * Proxy/VPN flag. Null for providers that do not detect proxies.
     */
    Boolean proxy;

    public static ProviderResponse of(LocationInfo location) {
        return ProviderResponse.builder().location(location).build();
    }
}
