package io.optracker.inject;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.optracker.budget.HierarchicalMemoryBudget;
import io.optracker.budget.MemoryBudget;
import io.optracker.config.TrackerConfig;
import io.optracker.tracker.OperationTracker;

public class TrackerModule extends AbstractModule {
    private final TrackerConfig config;

    public TrackerModule(TrackerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(TrackerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton MemoryBudget rootBudget() { return HierarchicalMemoryBudget.root("root", config.rootMemoryLimit()); }

    @Provides @Singleton OperationTracker operationTracker(MetricRegistry registry, MemoryBudget root) {
        OperationTracker tracker = new OperationTracker();
        tracker.startInstrumentation(registry, "partition." + config.partitionId());
        tracker.startMemoryTracking(root, config.operationMemoryLimit());
        return tracker;
    }
}
