package org.probenet.server.metric;

public enum MetricName {

    // geo location consensus
    geolocation_requests("geolocation.requests"),
    geolocation_request_time("geolocation.request_time"),

    // providers
    geolocation_provider_requests("geolocation.provider.requests"),

    // cache
    geolocation_cache_read("geolocation.cache.read"),
    geolocation_cache_write("geolocation.cache.write"),

    // statuses
    ok,
    err,
    hit,
    miss,
    vpn_detected,
    unresolvable;

    private final String name;

    MetricName(String name) {
        this.name = name;
    }

    MetricName() {
        this.name = name();
    }

    @Override
    public String toString() {
        return name;
    }
}
