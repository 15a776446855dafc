package org.probenet.server.geolocation;

import io.vertx.core.Future;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;

/**
 * Retrieves location and network information for an IP address from a single data provider.
 * <p>
 * Implementations return normalized values (see {@link LocationNormalizer}) and fail the future on transport
 * errors, unexpected status codes or malformed payloads.
 */
public interface GeoLocationProvider {

    Provider provider();

    Future<ProviderResponse> lookup(String ip, Timeout timeout);
}
