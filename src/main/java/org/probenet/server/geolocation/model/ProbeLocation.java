package org.probenet.server.geolocation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Location attached to a probe: the winning city vote merged with network data and the derived region.
 */
@Builder
@Value
public class ProbeLocation {

    String continent;

    String region;

    String normalizedRegion;

    String country;

    String state;

    String city;

    String normalizedCity;

    long asn;

    double latitude;

    double longitude;

    String network;

    String normalizedNetwork;
}
