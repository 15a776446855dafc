package org.probenet.server.exception;

@SuppressWarnings("serial")
public class GeoIpException extends RuntimeException {

    public GeoIpException(String message) {
        super(message);
    }

    public GeoIpException(String message, Throwable cause) {
        super(message, cause);
    }
}
