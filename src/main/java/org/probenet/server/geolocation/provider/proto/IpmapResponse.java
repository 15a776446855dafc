package org.probenet.server.geolocation.provider.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Builder
@Jacksonized
@Value
public class IpmapResponse {

    List<IpmapLocation> locations;
}
