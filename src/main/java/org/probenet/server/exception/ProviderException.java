package org.probenet.server.exception;

import lombok.Getter;
import org.probenet.server.geolocation.model.Provider;

@SuppressWarnings("serial")
public class ProviderException extends GeoIpException {

    @Getter
    private final Provider provider;

    public ProviderException(Provider provider, String message) {
        super("%s: %s".formatted(provider.getCode(), message));
        this.provider = provider;
    }

    public ProviderException(Provider provider, String message, Throwable cause) {
        super("%s: %s".formatted(provider.getCode(), message), cause);
        this.provider = provider;
    }
}
