package org.probenet.server.geolocation.provider.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class FastlyAs {

    String name;

    Long number;
}
