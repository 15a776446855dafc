package org.probenet.server.geolocation.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class ProviderLocation {

    Provider provider;

    LocationInfo location;

    public String getNormalizedCity() {
        return location.getNormalizedCity();
    }
}
