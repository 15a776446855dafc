package org.probenet.server.geolocation.provider.proto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Builder
@Jacksonized
@Value
public class IpinfoResponse {

    String city;

    /**
     * Full subdivision name.
     */
    String region;

    String country;

    /**
     * Coordinates as "latitude,longitude".
     */
    String loc;

    /**
     * Network as "AS&lt;number&gt; &lt;name&gt;".
     */
    String org;
}
