package org.probenet.server.geolocation.provider;

import com.maxmind.geoip2.GeoIp2Provider;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import com.maxmind.geoip2.record.City;
import com.maxmind.geoip2.record.Continent;
import com.maxmind.geoip2.record.Country;
import com.maxmind.geoip2.record.Location;
import com.maxmind.geoip2.record.Subdivision;
import com.maxmind.geoip2.record.Traits;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.exception.ProviderException;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.geolocation.GeoLocationProvider;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RawLocation;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Objects;

/**
 * Implementation of the {@link GeoLocationProvider}
 * backed by <a href="https://dev.maxmind.com/geoip/docs/web-services">MaxMind GeoIP2 web service</a>.
 * <p>
 * The MaxMind client is blocking, so lookups run on the Vert.x worker pool.
 */
public class MaxMindGeoLocationProvider implements GeoLocationProvider {

    private final Vertx vertx;
    private final GeoIp2Provider client;
    private final LocationInfoFactory locationInfoFactory;

    public MaxMindGeoLocationProvider(Vertx vertx, GeoIp2Provider client, LocationInfoFactory locationInfoFactory) {
        this.vertx = Objects.requireNonNull(vertx);
        this.client = Objects.requireNonNull(client);
        this.locationInfoFactory = Objects.requireNonNull(locationInfoFactory);
    }

    @Override
    public Provider provider() {
        return Provider.MAXMIND;
    }

    @Override
    public Future<ProviderResponse> lookup(String ip, Timeout timeout) {
        if (timeout.remaining() <= 0) {
            return Future.failedFuture(
                    new ProviderException(provider(), "Timeout has been exceeded while executing geo lookup"));
        }

        return vertx.executeBlocking(() -> doLookup(ip), false);
    }

    private ProviderResponse doLookup(String ip) {
        final CityResponse cityResponse;
        try {
            cityResponse = client.city(InetAddress.getByName(ip));
        } catch (IOException | GeoIp2Exception e) {
            throw new ProviderException(provider(), "Request failed: " + e.getMessage(), e);
        }

        if (cityResponse == null) {
            throw new ProviderException(provider(), "Empty response");
        }

        final Location location = cityResponse.getLocation();
        final Traits traits = cityResponse.getTraits();

        return ProviderResponse.of(locationInfoFactory.create(RawLocation.builder()
                .continent(resolveContinent(cityResponse.getContinent()))
                .country(resolveCountry(cityResponse.getCountry()))
                .state(resolveState(cityResponse.getMostSpecificSubdivision()))
                .city(resolveCity(cityResponse.getCity()))
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .network(resolveNetwork(traits))
                .asn(traits != null ? traits.getAutonomousSystemNumber() : null)
                .build()));
    }

    private static String resolveContinent(Continent continent) {
        return continent != null ? continent.getCode() : null;
    }

    private static String resolveCountry(Country country) {
        return country != null ? country.getIsoCode() : null;
    }

    private static String resolveState(Subdivision subdivision) {
        return subdivision != null ? subdivision.getIsoCode() : null;
    }

    private static String resolveCity(City city) {
        return city != null ? city.getName() : null;
    }

    private static String resolveNetwork(Traits traits) {
        if (traits == null) {
            return null;
        }

        return StringUtils.firstNonBlank(traits.getIsp(), traits.getAutonomousSystemOrganization());
    }
}
