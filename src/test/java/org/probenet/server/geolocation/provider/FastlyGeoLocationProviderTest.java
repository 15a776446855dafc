package org.probenet.server.geolocation.provider;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.probenet.server.VertxTest;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.execution.timeout.TimeoutFactory;
import org.probenet.server.geolocation.CountryRegionMapper;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.UsStateMapper;
import org.probenet.server.geolocation.model.LocationInfo;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.util.ResourceUtil;
import org.probenet.server.vertx.httpclient.HttpClient;
import org.probenet.server.vertx.httpclient.model.HttpClientResponse;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
public class FastlyGeoLocationProviderTest extends VertxTest {

    private static final String ENDPOINT = "https://geoip.fastly.test";

    @Mock
    private HttpClient httpClient;

    private Timeout timeout;

    private FastlyGeoLocationProvider target;

    @BeforeEach
    public void setUp() throws IOException {
        final Clock clock = Clock.fixed(Instant.now(), ZoneId.systemDefault());
        timeout = new TimeoutFactory(clock).create(clock.millis(), 5000L);

        final LocationInfoFactory locationInfoFactory = new LocationInfoFactory(
                new CountryRegionMapper(ResourceUtil.readFromClasspath("geolocation/country-regions.csv")),
                new UsStateMapper(ResourceUtil.readFromClasspath("geolocation/us-states.csv")));

        target = new FastlyGeoLocationProvider(httpClient, jacksonMapper, locationInfoFactory, ENDPOINT);
    }

    @Test
    public void lookupShouldMapGeoAndAsFields() throws IOException {
        // given
        given(httpClient.get(eq(ENDPOINT + "/131.255.7.26"), isNull(), anyLong()))
                .willReturn(Future.succeededFuture(
                        HttpClientResponse.of(200, null, jsonFrom("geolocation/provider/fastly-response.json"))));

        // when
        final Future<ProviderResponse> result = target.lookup("131.255.7.26", timeout);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.result().getLocation()).isEqualTo(LocationInfo.builder()
                .continent("NA")
                .country("US")
                .state("TX")
                .city("dallas")
                .normalizedCity("dallas")
                .latitude(32.78)
                .longitude(-96.8)
                .network("interbs s.r.l.")
                .normalizedNetwork("interbs s.r.l.")
                .asn(61493L)
                .build());
    }

    @Test
    public void lookupShouldDropReservedCityAndKeepNetwork() throws IOException {
        // given
        given(httpClient.get(anyString(), isNull(), anyLong()))
                .willReturn(Future.succeededFuture(HttpClientResponse.of(
                        200, null, jsonFrom("geolocation/provider/fastly-reserved-response.json"))));

        // when
        final Future<ProviderResponse> result = target.lookup("192.168.0.1", timeout);

        // then
        final LocationInfo location = result.result().getLocation();
        assertThat(location.getCity()).isEmpty();
        assertThat(location.getNormalizedCity()).isEmpty();
        assertThat(location.getNetwork()).isEqualTo("private network");
        assertThat(location.getAsn()).isEqualTo(65535L);
    }

    @Test
    public void lookupShouldDropPrivateCityIgnoringCase() {
        // given
        given(httpClient.get(anyString(), isNull(), anyLong()))
                .willReturn(Future.succeededFuture(HttpClientResponse.of(
                        200, null, "{\"geo\":{\"city\":\"PRIVATE\",\"country_code\":\"US\"}}")));

        // when
        final Future<ProviderResponse> result = target.lookup("10.0.0.1", timeout);

        // then
        assertThat(result.result().getLocation().hasCity()).isFalse();
        assertThat(result.result().getLocation().hasNetwork()).isFalse();
    }
}
