package org.probenet.server.exception;

import lombok.Getter;

/**
 * Thrown when providers do not agree on a trustworthy city or no provider can supply network data for it.
 */
@SuppressWarnings("serial")
public class UnresolvableGeoIpException extends GeoIpException {

    @Getter
    private final String ip;

    public UnresolvableGeoIpException(String ip) {
        super("unresolvable geoip: " + ip);
        this.ip = ip;
    }
}
