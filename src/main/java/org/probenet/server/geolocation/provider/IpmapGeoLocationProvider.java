package org.probenet.server.geolocation.provider;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RawLocation;
import org.probenet.server.geolocation.provider.proto.IpmapLocation;
import org.probenet.server.geolocation.provider.proto.IpmapResponse;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.vertx.httpclient.HttpClient;

import java.util.Objects;

/**
 * Implementation of the {@link org.probenet.server.geolocation.GeoLocationProvider}
 * backed by <a href="https://ipmap.ripe.net/">RIPE IPmap</a>.
 * <p>
 * IPmap locates infrastructure only, so network fields are always absent.
 */
public class IpmapGeoLocationProvider extends HttpGeoLocationProvider<IpmapResponse> {

    private static final IpmapLocation EMPTY_LOCATION = IpmapLocation.builder().build();

    private final String endpoint;

    public IpmapGeoLocationProvider(HttpClient httpClient,
                                    JacksonMapper mapper,
                                    LocationInfoFactory locationInfoFactory,
                                    String endpoint) {

        super(httpClient, mapper, locationInfoFactory, IpmapResponse.class);

        this.endpoint = Objects.requireNonNull(endpoint);
    }

    @Override
    public Provider provider() {
        return Provider.IPMAP;
    }

    @Override
    protected String resolveUrl(String encodedIp) {
        return "%s/%s".formatted(endpoint, encodedIp);
    }

    @Override
    protected ProviderResponse toProviderResponse(IpmapResponse response) {
        final IpmapLocation location = CollectionUtils.isNotEmpty(response.getLocations())
                ? response.getLocations().get(0)
                : EMPTY_LOCATION;

        return ProviderResponse.of(locationInfoFactory.create(RawLocation.builder()
                .country(location.getCountryCodeAlpha2())
                .state(location.getStateAnsiCode())
                .city(location.getCityName())
                .latitude(NumberUtils.toDouble(location.getLatitude(), 0d))
                .longitude(NumberUtils.toDouble(location.getLongitude(), 0d))
                .build()));
    }
}
