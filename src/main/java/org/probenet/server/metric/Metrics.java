package org.probenet.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import org.probenet.server.geolocation.model.Provider;

import java.util.Objects;

/**
 * Defines interface for submitting geo location metrics.
 */
public class Metrics {

    private static final String PROVIDER_TAG = "provider";
    private static final String RESULT_TAG = "result";

    private final MeterRegistry meterRegistry;

    public Metrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    public Metric newMetric(MetricName metricName) {
        return new Metric(metricName, meterRegistry);
    }

    public void updateGeoLocationResultMetric(MetricName result) {
        newMetric(MetricName.geolocation_requests)
                .withTag(RESULT_TAG, result.toString())
                .incCounter();
    }

    public void updateGeoLocationRequestTime(long millis) {
        newMetric(MetricName.geolocation_request_time).updateTimer(millis);
    }

    public void updateProviderMetric(Provider provider, boolean successful) {
        newMetric(MetricName.geolocation_provider_requests)
                .withTag(PROVIDER_TAG, provider.getCode())
                .withTag(RESULT_TAG, successful ? MetricName.ok.toString() : MetricName.err.toString())
                .incCounter();
    }

    public void updateCacheReadMetric(MetricName result) {
        newMetric(MetricName.geolocation_cache_read)
                .withTag(RESULT_TAG, result.toString())
                .incCounter();
    }

    public void updateCacheWriteMetric(boolean successful) {
        newMetric(MetricName.geolocation_cache_write)
                .withTag(RESULT_TAG, successful ? MetricName.ok.toString() : MetricName.err.toString())
                .incCounter();
    }
}
