package org.probenet.server.exception;

/**
 * Thrown when the proxy-detecting provider flags an address that is not allowlisted.
 */
@SuppressWarnings("serial")
public class VpnDetectedException extends GeoIpException {

    public VpnDetectedException() {
        super("vpn detected");
    }
}
