package org.probenet.server.geolocation.provider.proto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class Ip2LocationResponse {

    String countryCode;

    /**
     * Full subdivision name, e.g. "Texas".
     */
    String regionName;

    String cityName;

    Double latitude;

    Double longitude;

    /**
     * AS number as a string, "-" when unknown.
     */
    String asn;

    @JsonProperty("as")
    String asName;

    Boolean isProxy;
}
