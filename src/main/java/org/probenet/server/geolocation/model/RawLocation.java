package org.probenet.server.geolocation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Location values as extracted from a provider payload, before normalization.
 */
@Builder
@Value
public class RawLocation {

    String continent;

    String country;

    /**
     * State name or code, kept for US locations only.
     */
    String state;

    String city;

    Double latitude;

    Double longitude;

    String network;

    Long asn;
}
