package org.probenet.server.geolocation.provider;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import org.probenet.server.exception.ProviderException;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.geolocation.GeoLocationProvider;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.json.DecodeException;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.vertx.httpclient.HttpClient;
import org.probenet.server.vertx.httpclient.model.HttpClientResponse;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Base for providers answering a single HTTP GET with a JSON document.
 */
public abstract class HttpGeoLocationProvider<R> implements GeoLocationProvider {

    private final HttpClient httpClient;
    private final JacksonMapper mapper;
    private final Class<R> responseClass;

    protected final LocationInfoFactory locationInfoFactory;

    protected HttpGeoLocationProvider(HttpClient httpClient,
                                      JacksonMapper mapper,
                                      LocationInfoFactory locationInfoFactory,
                                      Class<R> responseClass) {

        this.httpClient = Objects.requireNonNull(httpClient);
        this.mapper = Objects.requireNonNull(mapper);
        this.locationInfoFactory = Objects.requireNonNull(locationInfoFactory);
        this.responseClass = Objects.requireNonNull(responseClass);
    }

    @Override
    public Future<ProviderResponse> lookup(String ip, Timeout timeout) {
        final long remainingTimeout = timeout.remaining();
        if (remainingTimeout <= 0) {
            return Future.failedFuture(
                    new ProviderException(provider(), "Timeout has been exceeded while executing geo lookup"));
        }

        return httpClient.get(resolveUrl(encode(ip)), headers(), remainingTimeout)
                .recover(error -> Future.failedFuture(
                        new ProviderException(provider(), "Request failed: " + error.getMessage(), error)))
                .map(this::processResponse);
    }

    /**
     * Returns the lookup URL for an already URL-encoded address.
     */
    protected abstract String resolveUrl(String encodedIp);

    protected abstract ProviderResponse toProviderResponse(R response);

    protected MultiMap headers() {
        return null;
    }

    private ProviderResponse processResponse(HttpClientResponse response) {
        final int statusCode = response.getStatusCode();
        if (statusCode != 200) {
            throw new ProviderException(provider(), "Unexpected status code: %d".formatted(statusCode));
        }

        final R body;
        try {
            body = mapper.decodeValue(response.getBody(), responseClass);
        } catch (DecodeException | IllegalArgumentException e) {
            throw new ProviderException(provider(), "Malformed response: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new ProviderException(provider(), "Empty response");
        }

        return toProviderResponse(body);
    }

    private static String encode(String ip) {
        return URLEncoder.encode(ip, StandardCharsets.UTF_8);
    }
}
