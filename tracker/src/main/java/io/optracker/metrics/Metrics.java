package io.optracker.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;

public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) { this(registry, ""); }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
    }

    public MetricRegistry registry() { return registry; }

    public String qualify(String name) { return prefix + name; }

    public Counter counter(String name) { return registry.counter(qualify(name)); }
}
