package org.probenet.server.geolocation.provider.proto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class IpmapLocation {

    @JsonProperty("cityName")
    String cityName;

    @JsonProperty("stateAnsiCode")
    String stateAnsiCode;

    @JsonProperty("countryCodeAlpha2")
    String countryCodeAlpha2;

    String latitude;

    String longitude;
}
