package org.probenet.server.geolocation.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class RegionInfo {

    String region;

    String normalizedRegion;
}
