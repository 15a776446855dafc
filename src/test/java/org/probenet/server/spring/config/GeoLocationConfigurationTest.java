package org.probenet.server.spring.config;

import org.junit.jupiter.api.Test;
import org.probenet.server.cache.CacheStore;
import org.probenet.server.cache.CaffeineCacheStore;
import org.probenet.server.cache.NullCacheStore;
import org.probenet.server.geolocation.GeoLocationConsensusService;
import org.probenet.server.geolocation.GeoLocationProvider;
import org.probenet.server.geolocation.IpAllowlist;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class GeoLocationConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class,
                    ValidationAutoConfiguration.class))
            .withUserConfiguration(ApplicationConfiguration.class, GeoLocationConfiguration.class)
            .withPropertyValues(
                    "geolocation.provider-timeout-ms=2000",
                    "geolocation.cache.ttl-seconds=60",
                    "geolocation.cache.size=100",
                    "geolocation.allowlist.path=src/test/resources/org/probenet/server/spring/config/ip-allowlist.txt",
                    "geolocation.ip2location.endpoint=https://api.ip2location.test/",
                    "geolocation.ip2location.api-key=key",
                    "geolocation.ipmap.endpoint=https://ipmap.test/v1/locate",
                    "geolocation.maxmind.account-id=42",
                    "geolocation.maxmind.license-key=license",
                    "geolocation.maxmind.host=geoip.maxmind.test",
                    "geolocation.ipinfo.endpoint=https://ipinfo.test",
                    "geolocation.ipinfo.token=token",
                    "geolocation.fastly.endpoint=https://fastly.test");

    @Test
    public void contextShouldWireConsensusServiceWithAllProviders() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(GeoLocationConsensusService.class);
            assertThat(context.getBeansOfType(GeoLocationProvider.class)).hasSize(5);
            assertThat(context.getBean(CacheStore.class)).isInstanceOf(CaffeineCacheStore.class);
        });
    }

    @Test
    public void contextShouldLoadAllowlistFromFile() {
        contextRunner.run(context -> {
            final IpAllowlist allowlist = context.getBean(IpAllowlist.class);
            assertThat(allowlist.contains("65.49.2.228")).isTrue();
            assertThat(allowlist.contains("95.155.94.10")).isTrue();
            assertThat(allowlist.contains("95.155.95.10")).isFalse();
        });
    }

    @Test
    public void contextShouldUseEmptyAllowlistWhenFileIsMissing() {
        contextRunner
                .withPropertyValues("geolocation.allowlist.path=absent/ip-allowlist.txt")
                .run(context -> assertThat(context.getBean(IpAllowlist.class).contains("65.49.2.228")).isFalse());
    }

    @Test
    public void contextShouldUseNullCacheStoreWhenCacheDisabled() {
        contextRunner
                .withPropertyValues("geolocation.cache.enabled=false")
                .run(context -> assertThat(context.getBean(CacheStore.class)).isInstanceOf(NullCacheStore.class));
    }

    @Test
    public void contextShouldFailOnNonPositiveCacheTtl() {
        contextRunner
                .withPropertyValues("geolocation.cache.ttl-seconds=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
