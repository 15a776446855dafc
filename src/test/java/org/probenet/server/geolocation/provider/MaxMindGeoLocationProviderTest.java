package org.probenet.server.geolocation.provider;

import com.maxmind.geoip2.GeoIp2Provider;
import com.maxmind.geoip2.exception.AddressNotFoundException;
import com.maxmind.geoip2.model.CityResponse;
import com.maxmind.geoip2.record.City;
import com.maxmind.geoip2.record.Continent;
import com.maxmind.geoip2.record.Country;
import com.maxmind.geoip2.record.Location;
import com.maxmind.geoip2.record.Subdivision;
import com.maxmind.geoip2.record.Traits;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.probenet.server.exception.ProviderException;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.execution.timeout.TimeoutFactory;
import org.probenet.server.geolocation.CountryRegionMapper;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.UsStateMapper;
import org.probenet.server.geolocation.model.LocationInfo;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.util.ResourceUtil;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class MaxMindGeoLocationProviderTest {

    @Mock
    private GeoIp2Provider client;

    private Vertx vertx;
    private Clock clock;

    private MaxMindGeoLocationProvider target;

    @BeforeEach
    public void setUp() throws IOException {
        vertx = Vertx.vertx();
        clock = Clock.fixed(Instant.now(), ZoneId.systemDefault());

        final LocationInfoFactory locationInfoFactory = new LocationInfoFactory(
                new CountryRegionMapper(ResourceUtil.readFromClasspath("geolocation/country-regions.csv")),
                new UsStateMapper(ResourceUtil.readFromClasspath("geolocation/us-states.csv")));

        target = new MaxMindGeoLocationProvider(vertx, client, locationInfoFactory);
    }

    @AfterEach
    public void tearDown() {
        vertx.close();
    }

    @Test
    public void lookupShouldMapCityResponse() throws Exception {
        // given
        final CityResponse cityResponse = givenCityResponse();
        given(client.city(InetAddress.getByName("131.255.7.26"))).willReturn(cityResponse);

        // when
        final ProviderResponse result = await(target.lookup("131.255.7.26", timeout()));

        // then
        assertThat(result.getProxy()).isNull();
        assertThat(result.getLocation()).isEqualTo(LocationInfo.builder()
                .continent("NA")
                .country("US")
                .state("TX")
                .city("Dallas")
                .normalizedCity("dallas")
                .latitude(32.7831)
                .longitude(-96.8067)
                .network("InterBS S.R.L.")
                .normalizedNetwork("interbs s.r.l.")
                .asn(61493L)
                .build());
    }

    @Test
    public void lookupShouldWrapClientErrors() throws Exception {
        // given
        given(client.city(any())).willThrow(new AddressNotFoundException("The address is not in the database."));

        // when and then
        assertThatThrownBy(() -> await(target.lookup("10.0.0.1", timeout())))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ProviderException.class)
                .hasMessageContaining("maxmind: Request failed: The address is not in the database.");
    }

    @Test
    public void lookupShouldFailWithoutRequestWhenTimeoutExpired() {
        // given
        final Timeout expiredTimeout = new TimeoutFactory(clock).create(clock.millis() - 2000L, 1000L);

        // when
        final Future<ProviderResponse> result = target.lookup("131.255.7.26", expiredTimeout);

        // then
        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(ProviderException.class);
        verifyNoInteractions(client);
    }

    private Timeout timeout() {
        return new TimeoutFactory(clock).create(clock.millis(), 5000L);
    }

    private static ProviderResponse await(Future<ProviderResponse> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static CityResponse givenCityResponse() {
        final Continent continent = mock(Continent.class);
        given(continent.getCode()).willReturn("NA");
        final Country country = mock(Country.class);
        given(country.getIsoCode()).willReturn("US");
        final Subdivision subdivision = mock(Subdivision.class);
        given(subdivision.getIsoCode()).willReturn("TX");
        final City city = mock(City.class);
        given(city.getName()).willReturn("Dallas");
        final Location location = mock(Location.class);
        given(location.getLatitude()).willReturn(32.7831);
        given(location.getLongitude()).willReturn(-96.8067);
        final Traits traits = mock(Traits.class);
        given(traits.getAutonomousSystemNumber()).willReturn(61493L);
        given(traits.getIsp()).willReturn("InterBS S.R.L.");
        given(traits.getAutonomousSystemOrganization()).willReturn("INTERBS");

        final CityResponse cityResponse = mock(CityResponse.class);
        given(cityResponse.getContinent()).willReturn(continent);
        given(cityResponse.getCountry()).willReturn(country);
        given(cityResponse.getMostSpecificSubdivision()).willReturn(subdivision);
        given(cityResponse.getCity()).willReturn(city);
        given(cityResponse.getLocation()).willReturn(location);
        given(cityResponse.getTraits()).willReturn(traits);
        return cityResponse;
    }
}
