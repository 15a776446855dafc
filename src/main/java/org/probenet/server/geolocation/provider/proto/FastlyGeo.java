package org.probenet.server.geolocation.provider.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class FastlyGeo {

    String city;

    String countryCode;

    String continentCode;

    /**
     * Subdivision code, e.g. "TX".
     */
    String region;

    Double latitude;

    Double longitude;
}
