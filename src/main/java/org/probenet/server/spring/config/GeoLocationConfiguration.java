package org.probenet.server.spring.config;

import com.maxmind.geoip2.WebServiceClient;
import io.vertx.core.Vertx;
import io.vertx.core.file.FileSystem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.cache.CacheAsideService;
import org.probenet.server.cache.CacheStore;
import org.probenet.server.cache.CaffeineCacheStore;
import org.probenet.server.cache.NullCacheStore;
import org.probenet.server.execution.timeout.TimeoutFactory;
import org.probenet.server.geolocation.CountryRegionMapper;
import org.probenet.server.geolocation.GeoLocationConsensusService;
import org.probenet.server.geolocation.GeoLocationProvider;
import org.probenet.server.geolocation.IpAllowlist;
import org.probenet.server.geolocation.LocationInfoFactory;
import org.probenet.server.geolocation.UsStateMapper;
import org.probenet.server.geolocation.provider.FastlyGeoLocationProvider;
import org.probenet.server.geolocation.provider.Ip2LocationGeoLocationProvider;
import org.probenet.server.geolocation.provider.IpinfoGeoLocationProvider;
import org.probenet.server.geolocation.provider.IpmapGeoLocationProvider;
import org.probenet.server.geolocation.provider.MaxMindGeoLocationProvider;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.log.Logger;
import org.probenet.server.log.LoggerFactory;
import org.probenet.server.metric.Metrics;
import org.probenet.server.util.ResourceUtil;
import org.probenet.server.vertx.httpclient.HttpClient;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class GeoLocationConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(GeoLocationConfiguration.class);

    private static final String COUNTRY_REGIONS_PATH = "geolocation/country-regions.csv";
    private static final String US_STATES_PATH = "geolocation/us-states.csv";

    @Bean
    @ConfigurationProperties(prefix = "geolocation")
    GeoLocationProperties geoLocationProperties() {
        return new GeoLocationProperties();
    }

    @Bean
    CountryRegionMapper countryRegionMapper() throws IOException {
        return new CountryRegionMapper(ResourceUtil.readFromClasspath(COUNTRY_REGIONS_PATH));
    }

    @Bean
    UsStateMapper usStateMapper() throws IOException {
        return new UsStateMapper(ResourceUtil.readFromClasspath(US_STATES_PATH));
    }

    @Bean
    LocationInfoFactory locationInfoFactory(CountryRegionMapper countryRegionMapper, UsStateMapper usStateMapper) {
        return new LocationInfoFactory(countryRegionMapper, usStateMapper);
    }

    @Bean
    IpAllowlist ipAllowlist(Vertx vertx, GeoLocationProperties properties) {
        final String path = properties.getAllowlist().getPath();
        final FileSystem fileSystem = vertx.fileSystem();

        if (StringUtils.isBlank(path) || !fileSystem.existsBlocking(path)) {
            logger.warn("Allowlist file {} not found, VPN detection applies to every address", path);
            return IpAllowlist.empty();
        }

        return IpAllowlist.parse(fileSystem.readFileBlocking(path).toString());
    }

    @Bean
    CacheStore cacheStore(GeoLocationProperties properties) {
        final CacheProperties cache = properties.getCache();
        return cache.isEnabled() ? new CaffeineCacheStore(cache.getSize()) : new NullCacheStore();
    }

    @Bean
    CacheAsideService cacheAsideService(CacheStore cacheStore,
                                        JacksonMapper mapper,
                                        Metrics metrics,
                                        GeoLocationProperties properties) {

        return new CacheAsideService(cacheStore, mapper, metrics, properties.getCache().getTtlSeconds());
    }

    @Bean
    Ip2LocationGeoLocationProvider ip2LocationGeoLocationProvider(HttpClient httpClient,
                                                                  JacksonMapper mapper,
                                                                  LocationInfoFactory locationInfoFactory,
                                                                  GeoLocationProperties properties) {

        final Ip2LocationProperties ip2location = properties.getIp2location();
        return new Ip2LocationGeoLocationProvider(
                httpClient,
                mapper,
                locationInfoFactory,
                ip2location.getEndpoint(),
                ip2location.getApiKey());
    }

    @Bean
    IpmapGeoLocationProvider ipmapGeoLocationProvider(HttpClient httpClient,
                                                      JacksonMapper mapper,
                                                      LocationInfoFactory locationInfoFactory,
                                                      GeoLocationProperties properties) {

        return new IpmapGeoLocationProvider(
                httpClient, mapper, locationInfoFactory, properties.getIpmap().getEndpoint());
    }

    @Bean
    WebServiceClient maxMindWebServiceClient(GeoLocationProperties properties) {
        final MaxMindProperties maxmind = properties.getMaxmind();
        final Duration timeout = Duration.ofMillis(properties.getProviderTimeoutMs());

        return new WebServiceClient.Builder(maxmind.getAccountId(), maxmind.getLicenseKey())
                .host(maxmind.getHost())
                .connectTimeout(timeout)
                .requestTimeout(timeout)
                .build();
    }

    @Bean
    MaxMindGeoLocationProvider maxMindGeoLocationProvider(Vertx vertx,
                                                          WebServiceClient maxMindWebServiceClient,
                                                          LocationInfoFactory locationInfoFactory) {

        return new MaxMindGeoLocationProvider(vertx, maxMindWebServiceClient, locationInfoFactory);
    }

    @Bean
    IpinfoGeoLocationProvider ipinfoGeoLocationProvider(HttpClient httpClient,
                                                        JacksonMapper mapper,
                                                        LocationInfoFactory locationInfoFactory,
                                                        GeoLocationProperties properties) {

        final IpinfoProperties ipinfo = properties.getIpinfo();
        return new IpinfoGeoLocationProvider(
                httpClient, mapper, locationInfoFactory, ipinfo.getEndpoint(), ipinfo.getToken());
    }

    @Bean
    FastlyGeoLocationProvider fastlyGeoLocationProvider(HttpClient httpClient,
                                                        JacksonMapper mapper,
                                                        LocationInfoFactory locationInfoFactory,
                                                        GeoLocationProperties properties) {

        return new FastlyGeoLocationProvider(
                httpClient, mapper, locationInfoFactory, properties.getFastly().getEndpoint());
    }

    @Bean
    GeoLocationConsensusService geoLocationConsensusService(List<GeoLocationProvider> providers,
                                                            CacheAsideService cacheAsideService,
                                                            IpAllowlist ipAllowlist,
                                                            CountryRegionMapper countryRegionMapper,
                                                            TimeoutFactory timeoutFactory,
                                                            Metrics metrics,
                                                            Clock clock,
                                                            GeoLocationProperties properties) {

        return new GeoLocationConsensusService(
                providers,
                cacheAsideService,
                ipAllowlist,
                countryRegionMapper,
                timeoutFactory,
                properties.getProviderTimeoutMs(),
                metrics,
                clock);
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class GeoLocationProperties {

        @Positive
        private long providerTimeoutMs;

        @Valid
        @NotNull
        private CacheProperties cache = new CacheProperties();

        @Valid
        @NotNull
        private AllowlistProperties allowlist = new AllowlistProperties();

        @Valid
        @NotNull
        private Ip2LocationProperties ip2location;

        @Valid
        @NotNull
        private EndpointProperties ipmap;

        @Valid
        @NotNull
        private MaxMindProperties maxmind;

        @Valid
        @NotNull
        private IpinfoProperties ipinfo;

        @Valid
        @NotNull
        private EndpointProperties fastly;
    }

    @NoArgsConstructor
    @Data
    static class CacheProperties {

        private boolean enabled = true;

        @Positive
        private int ttlSeconds;

        @Min(1)
        private int size;
    }

    @NoArgsConstructor
    @Data
    static class AllowlistProperties {

        private String path;
    }

    @NoArgsConstructor
    @Data
    static class EndpointProperties {

        @NotBlank
        private String endpoint;
    }

    @NoArgsConstructor
    @Data
    static class Ip2LocationProperties {

        @NotBlank
        private String endpoint;

        @NotNull
        private String apiKey;
    }

    @NoArgsConstructor
    @Data
    static class IpinfoProperties {

        @NotBlank
        private String endpoint;

        @NotNull
        private String token;
    }

    @NoArgsConstructor
    @Data
    static class MaxMindProperties {

        @Positive
        private int accountId;

        @NotNull
        private String licenseKey;

        @NotBlank
        private String host;
    }
}
