package org.probenet.server.geolocation.provider.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class FastlyResponse {

    FastlyAs as;

    FastlyGeo geo;
}
