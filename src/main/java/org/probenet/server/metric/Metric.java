package org.probenet.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Single meter addressed by name and tags, created lazily in the underlying registry.
 */
public class Metric {

    private final MeterRegistry meterRegistry;

    private final String metricName;
    private final List<Tag> metricTags;

    public Metric(MetricName metricName, MeterRegistry meterRegistry) {
        this.metricName = metricName.toString();
        this.metricTags = new ArrayList<>();
        this.meterRegistry = meterRegistry;
    }

    public Metric withTag(String key, String value) {
        metricTags.add(Tag.of(key, value));
        return this;
    }

    public void incCounter() {
        meterRegistry.counter(metricName, metricTags).increment();
    }

    public void updateTimer(long millis) {
        meterRegistry.timer(metricName, metricTags).record(millis, TimeUnit.MILLISECONDS);
    }
}
