package org.probenet.server.geolocation.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class NetworkInfo {

    String network;

    String normalizedNetwork;

    long asn;

    public static NetworkInfo from(LocationInfo location) {
        return of(location.getNetwork(), location.getNormalizedNetwork(), location.getAsn());
    }
}
