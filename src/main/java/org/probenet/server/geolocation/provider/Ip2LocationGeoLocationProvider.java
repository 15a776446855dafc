package org.probenet.server.geolocation.provider;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RawLocation;
import org.probenet.server.geolocation.provider.proto.Ip2LocationResponse;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.vertx.httpclient.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Implementation of the {@link org.probenet.server.geolocation.GeoLocationProvider}
 * backed by <a href="https://www.ip2location.io/">IP2Location.io</a> web service.
 * <p>
 * The only provider reporting proxy/VPN usage.
 */
public class Ip2LocationGeoLocationProvider extends HttpGeoLocationProvider<Ip2LocationResponse> {

    private final String endpoint;
    private final String apiKey;

    public Ip2LocationGeoLocationProvider(HttpClient httpClient,
                                          JacksonMapper mapper,
                                          LocationInfoFactory locationInfoFactory,
                                          String endpoint,
                                          String apiKey) {

        super(httpClient, mapper, locationInfoFactory, Ip2LocationResponse.class);

        this.endpoint = Objects.requireNonNull(endpoint);
        this.apiKey = Objects.requireNonNull(apiKey);
    }

    @Override
    public Provider provider() {
        return Provider.IP2LOCATION;
    }

    @Override
    protected String resolveUrl(String encodedIp) {
        return "%s?key=%s&ip=%s".formatted(endpoint, URLEncoder.encode(apiKey, StandardCharsets.UTF_8), encodedIp);
    }

    @Override
    protected ProviderResponse toProviderResponse(Ip2LocationResponse response) {
        final RawLocation rawLocation = RawLocation.builder()
                .country(response.getCountryCode())
                .state(response.getRegionName())
                .city(response.getCityName())
                .latitude(response.getLatitude())
                .longitude(response.getLongitude())
                .network(response.getAsName())
                .asn(NumberUtils.toLong(response.getAsn(), 0L))
                .build();

        return ProviderResponse.builder()
                .location(locationInfoFactory.create(rawLocation))
                .proxy(BooleanUtils.isTrue(response.getIsProxy()))
                .build();
    }
}
