package org.probenet.server.geolocation.provider;

import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RawLocation;
import org.probenet.server.geolocation.provider.proto.FastlyAs;
import org.probenet.server.geolocation.provider.proto.FastlyGeo;
import org.probenet.server.geolocation.provider.proto.FastlyResponse;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.vertx.httpclient.HttpClient;

import java.util.Objects;
import java.util.Set;

/**
 * Implementation of the {@link org.probenet.server.geolocation.GeoLocationProvider}
 * backed by the Fastly edge geo location lookup.
 * <p>
 * Fastly answers "reserved" and "private" instead of a city for non-routable addresses. Such cities are
 * dropped while the network data of the same response is kept.
 */
public class FastlyGeoLocationProvider extends HttpGeoLocationProvider<FastlyResponse> {

    private static final Set<String> NON_GEOGRAPHIC_CITIES = Set.of("reserved", "private");

    private static final FastlyGeo EMPTY_GEO = FastlyGeo.builder().build();
    private static final FastlyAs EMPTY_AS = FastlyAs.builder().build();

    private final String endpoint;

    public FastlyGeoLocationProvider(HttpClient httpClient,
                                     JacksonMapper mapper,
                                     LocationInfoFactory locationInfoFactory,
                                     String endpoint) {

        super(httpClient, mapper, locationInfoFactory, FastlyResponse.class);

        this.endpoint = Objects.requireNonNull(endpoint);
    }

    @Override
    public Provider provider() {
        return Provider.FASTLY;
    }

    @Override
    protected String resolveUrl(String encodedIp) {
        return "%s/%s".formatted(endpoint, encodedIp);
    }

    @Override
    protected ProviderResponse toProviderResponse(FastlyResponse response) {
        final FastlyGeo geo = ObjectUtils.defaultIfNull(response.getGeo(), EMPTY_GEO);
        final FastlyAs as = ObjectUtils.defaultIfNull(response.getAs(), EMPTY_AS);

        return ProviderResponse.of(locationInfoFactory.create(RawLocation.builder()
                .continent(geo.getContinentCode())
                .country(geo.getCountryCode())
                .state(geo.getRegion())
                .city(resolveCity(geo.getCity()))
                .latitude(geo.getLatitude())
                .longitude(geo.getLongitude())
                .network(as.getName())
                .asn(as.getNumber())
                .build()));
    }

    private static String resolveCity(String city) {
        return NON_GEOGRAPHIC_CITIES.contains(StringUtils.lowerCase(StringUtils.trim(city)))
                ? StringUtils.EMPTY
                : city;
    }
}
