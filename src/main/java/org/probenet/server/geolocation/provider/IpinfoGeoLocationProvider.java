package org.probenet.server.geolocation.provider;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RawLocation;
import org.probenet.server.geolocation.provider.proto.IpinfoResponse;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.vertx.httpclient.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the {@link org.probenet.server.geolocation.GeoLocationProvider}
 * backed by <a href="https://ipinfo.io/">IPinfo</a> web service.
 */
public class IpinfoGeoLocationProvider extends HttpGeoLocationProvider<IpinfoResponse> {

    private static final Pattern ORG_PATTERN = Pattern.compile("^AS(\\d+)\\s+(.+)$");

    private final String endpoint;
    private final String token;

    public IpinfoGeoLocationProvider(HttpClient httpClient,
                                     JacksonMapper mapper,
                                     LocationInfoFactory locationInfoFactory,
                                     String endpoint,
                                     String token) {

        super(httpClient, mapper, locationInfoFactory, IpinfoResponse.class);

        this.endpoint = Objects.requireNonNull(endpoint);
        this.token = Objects.requireNonNull(token);
    }

    @Override
    public Provider provider() {
        return Provider.IPINFO;
    }

    @Override
    protected String resolveUrl(String encodedIp) {
        return "%s/%s?token=%s".formatted(endpoint, encodedIp, URLEncoder.encode(token, StandardCharsets.UTF_8));
    }

    @Override
    protected ProviderResponse toProviderResponse(IpinfoResponse response) {
        final String[] coordinates = StringUtils.split(StringUtils.defaultString(response.getLoc()), ',');
        final Matcher orgMatcher = ORG_PATTERN.matcher(StringUtils.trimToEmpty(response.getOrg()));
        final boolean hasOrg = orgMatcher.matches();

        return ProviderResponse.of(locationInfoFactory.create(RawLocation.builder()
                .country(response.getCountry())
                .state(response.getRegion())
                .city(response.getCity())
                .latitude(coordinates.length == 2 ? NumberUtils.toDouble(coordinates[0].trim(), 0d) : 0d)
                .longitude(coordinates.length == 2 ? NumberUtils.toDouble(coordinates[1].trim(), 0d) : 0d)
                .network(hasOrg ? orgMatcher.group(2) : null)
                .asn(hasOrg ? NumberUtils.toLong(orgMatcher.group(1), 0L) : 0L)
                .build()));
    }
}
