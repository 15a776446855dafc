package org.probenet.server.geolocation;

import io.vertx.core.Future;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.probenet.server.cache.CacheAsideService;
import org.probenet.server.exception.ConsensusInconsistencyException;
import org.probenet.server.exception.UnresolvableGeoIpException;
import org.probenet.server.exception.VpnDetectedException;
import org.probenet.server.execution.timeout.Timeout;
import org.probenet.server.execution.timeout.TimeoutFactory;
import org.probenet.server.geolocation.model.LocationInfo;
import org.probenet.server.geolocation.model.NetworkInfo;
import org.probenet.server.geolocation.model.ProbeLocation;
import org.probenet.server.geolocation.model.Provider;
import org.probenet.server.geolocation.model.ProviderLocation;
import org.probenet.server.geolocation.model.ProviderResponse;
import org.probenet.server.geolocation.model.RegionInfo;
import org.probenet.server.log.ConditionalLogger;
import org.probenet.server.log.Logger;
import org.probenet.server.log.LoggerFactory;
import org.probenet.server.metric.MetricName;
import org.probenet.server.metric.Metrics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the location of a probe by asking every {@link GeoLocationProvider} and voting on the city.
 * <p>
 * All providers are queried concurrently through the cache. Providers that fail are left out of the vote.
 * The most reported normalized city wins, ties go to the provider declared first in {@link Provider}.
 */
public class GeoLocationConsensusService {

    private static final Logger logger = LoggerFactory.getLogger(GeoLocationConsensusService.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    private static final long LOG_PERIOD_SECONDS = 10L;
    private static final String CACHE_KEY_PREFIX = "geoip";

    private final List<GeoLocationProvider> providers;
    private final CacheAsideService cacheAsideService;
    private final IpAllowlist allowlist;
    private final CountryRegionMapper countryRegionMapper;
    private final TimeoutFactory timeoutFactory;
    private final long providerTimeoutMs;
    private final Metrics metrics;
    private final Clock clock;

    public GeoLocationConsensusService(List<GeoLocationProvider> providers,
                                       CacheAsideService cacheAsideService,
                                       IpAllowlist allowlist,
                                       CountryRegionMapper countryRegionMapper,
                                       TimeoutFactory timeoutFactory,
                                       long providerTimeoutMs,
                                       Metrics metrics,
                                       Clock clock) {

        this.providers = Objects.requireNonNull(providers).stream()
                .sorted(Comparator.comparing(GeoLocationProvider::provider))
                .toList();
        this.cacheAsideService = Objects.requireNonNull(cacheAsideService);
        this.allowlist = Objects.requireNonNull(allowlist);
        this.countryRegionMapper = Objects.requireNonNull(countryRegionMapper);
        this.timeoutFactory = Objects.requireNonNull(timeoutFactory);
        this.providerTimeoutMs = providerTimeoutMs;
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    public Future<ProbeLocation> lookup(String ip) {
        final long startTime = clock.millis();
        final Timeout timeout = timeoutFactory.create(startTime, providerTimeoutMs);

        final List<ProviderCall> calls = providers.stream()
                .map(provider -> new ProviderCall(provider.provider(), lookupCached(provider, ip, timeout)))
                .toList();

        return Future.join(calls.stream().map(ProviderCall::future).toList())
                .otherwiseEmpty()
                .map(ignored -> resolve(ip, isProxyReported(calls), toCandidates(calls)))
                .onComplete(result -> {
                    metrics.updateGeoLocationResultMetric(toResultMetric(result.cause()));
                    metrics.updateGeoLocationRequestTime(clock.millis() - startTime);
                });
    }

    private Future<ProviderResponse> lookupCached(GeoLocationProvider provider, String ip, Timeout timeout) {
        final Provider source = provider.provider();

        return cacheAsideService.get(
                        cacheKey(source, ip),
                        ProviderResponse.class,
                        () -> provider.lookup(ip, timeout))
                .onSuccess(ignored -> metrics.updateProviderMetric(source, true))
                .onFailure(error -> handleProviderError(source, ip, error));
    }

    private void handleProviderError(Provider provider, String ip, Throwable error) {
        metrics.updateProviderMetric(provider, false);
        conditionalLogger.warn(
                provider.getCode(),
                "Geo location lookup failed: " + error.getMessage(),
                LOG_PERIOD_SECONDS,
                TimeUnit.SECONDS);
        logger.debug("Geo location lookup failed for provider %s and ip %s".formatted(provider.getCode(), ip), error);
    }

    private static String cacheKey(Provider provider, String ip) {
        return "%s:%s:%s".formatted(CACHE_KEY_PREFIX, provider.getCode(), ip);
    }

    private static List<ProviderLocation> toCandidates(List<ProviderCall> calls) {
        final List<ProviderLocation> candidates = new ArrayList<>();
        for (ProviderCall call : calls) {
            final Future<ProviderResponse> future = call.future();
            final ProviderResponse response = future.succeeded() ? future.result() : null;
            if (response != null && response.getLocation() != null) {
                candidates.add(ProviderLocation.of(call.provider(), response.getLocation()));
            }
        }
        return candidates;
    }

    /**
     * Reads the proxy flag from every successful response of a proxy detecting provider, with or without location.
     */
    private static boolean isProxyReported(List<ProviderCall> calls) {
        return calls.stream()
                .filter(call -> call.provider().isProxyDetector() && call.future().succeeded())
                .map(call -> call.future().result())
                .anyMatch(response -> response != null && BooleanUtils.isTrue(response.getProxy()));
    }

    private ProbeLocation resolve(String ip, boolean proxyReported, List<ProviderLocation> candidates) {
        if (proxyReported && !allowlist.contains(ip)) {
            throw new VpnDetectedException();
        }

        final List<ProviderLocation> withCity = candidates.stream()
                .filter(candidate -> candidate.getLocation().hasCity())
                .toList();

        if (withCity.isEmpty()
                || (withCity.size() == 1 && !withCity.get(0).getProvider().isStandaloneCityAuthority())) {
            throw new UnresolvableGeoIpException(ip);
        }

        final List<ProviderLocation> ranked = rankByCity(withCity);
        if (ranked.isEmpty()) {
            logger.error("No city vote winner for ip {}, candidates: {}", ip, withCity);
            throw new ConsensusInconsistencyException();
        }

        final ProviderLocation winner = ranked.get(0);
        if (!winner.getProvider().isStandaloneCityAuthority()) {
            throw new UnresolvableGeoIpException(ip);
        }

        final NetworkInfo network = resolveNetwork(winner, ranked);
        if (network == null) {
            throw new UnresolvableGeoIpException(ip);
        }

        return toProbeLocation(winner.getLocation(), network);
    }

    /**
     * Groups candidates by normalized city in first-seen order, then stable-sorts the groups by size descending
     * and flattens them. Candidates arrive in provider priority order, so equal-sized groups keep that order.
     */
    private static List<ProviderLocation> rankByCity(List<ProviderLocation> candidates) {
        final Map<String, List<ProviderLocation>> cityToCandidates = new LinkedHashMap<>();
        for (ProviderLocation candidate : candidates) {
            final String city = candidate.getNormalizedCity();
            if (StringUtils.isNotEmpty(city)) {
                cityToCandidates.computeIfAbsent(city, key -> new ArrayList<>()).add(candidate);
            }
        }

        final List<List<ProviderLocation>> groups = new ArrayList<>(cityToCandidates.values());
        groups.sort(Comparator.comparingInt((List<ProviderLocation> group) -> group.size()).reversed());

        return groups.stream()
                .flatMap(List::stream)
                .toList();
    }

    private static NetworkInfo resolveNetwork(ProviderLocation winner, List<ProviderLocation> ranked) {
        if (winner.getLocation().hasNetwork()) {
            return NetworkInfo.from(winner.getLocation());
        }

        return ranked.stream()
                .filter(candidate -> candidate.getNormalizedCity().equals(winner.getNormalizedCity()))
                .map(ProviderLocation::getLocation)
                .filter(LocationInfo::hasNetwork)
                .findFirst()
                .map(NetworkInfo::from)
                .orElse(null);
    }

    private ProbeLocation toProbeLocation(LocationInfo location, NetworkInfo network) {
        final RegionInfo region = countryRegionMapper.regionFor(location.getCountry());

        return ProbeLocation.builder()
                .continent(location.getContinent())
                .region(region.getRegion())
                .normalizedRegion(region.getNormalizedRegion())
                .country(location.getCountry())
                .state(location.getState())
                .city(location.getCity())
                .normalizedCity(location.getNormalizedCity())
                .asn(network.getAsn())
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .network(network.getNetwork())
                .normalizedNetwork(network.getNormalizedNetwork())
                .build();
    }

    private static MetricName toResultMetric(Throwable error) {
        if (error == null) {
            return MetricName.ok;
        } else if (error instanceof VpnDetectedException) {
            return MetricName.vpn_detected;
        } else if (error instanceof UnresolvableGeoIpException) {
            return MetricName.unresolvable;
        }
        return MetricName.err;
    }

    private record ProviderCall(Provider provider, Future<ProviderResponse> future) {
    }
}
