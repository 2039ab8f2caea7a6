package io.optracker.metrics;

import com.codahale.metrics.Counter;
import io.optracker.core.OperationType;

import java.util.EnumMap;
import java.util.Map;

/**
 * In-flight gauges for the tracker: one aggregate, one per operation type, plus the rejection counter.
 */
public class OperationMetrics {
    public static final String ALL_INFLIGHT = "operations.inflight.all";
    public static final String REJECTIONS = "operations.memory_pressure_rejections";

    private final Counter allInflight;
    private final Map<OperationType, Counter> inflightByType = new EnumMap<>(OperationType.class);
    private final Counter rejections;

    public OperationMetrics(Metrics metrics) {
        this.allInflight = metrics.counter(ALL_INFLIGHT);
        this.rejections = metrics.counter(REJECTIONS);
        inflightByType.put(OperationType.WRITE, metrics.counter(inflightName(OperationType.WRITE)));
        inflightByType.put(OperationType.ALTER_SCHEMA, metrics.counter(inflightName(OperationType.ALTER_SCHEMA)));
        inflightByType.put(OperationType.UPDATE_TRANSACTION, metrics.counter(inflightName(OperationType.UPDATE_TRANSACTION)));
        inflightByType.put(OperationType.SNAPSHOT, metrics.counter(inflightName(OperationType.SNAPSHOT)));
        inflightByType.put(OperationType.TRUNCATE, metrics.counter(inflightName(OperationType.TRUNCATE)));
        if (inflightByType.size() != OperationType.values().length) {
            throw new IllegalStateException("in-flight gauges wired for " + inflightByType.size()
                    + " operation types but " + OperationType.values().length + " exist");
        }
    }

    public static String inflightName(OperationType type) {
        return "operations.inflight." + type.metricName();
    }

    public void increment(OperationType type) {
        allInflight.inc();
        inflightByType.get(type).inc();
    }

    public void decrement(OperationType type) {
        assert allInflight.getCount() > 0 : "all operations in-flight gauge would go negative";
        allInflight.dec();
        Counter byType = inflightByType.get(type);
        assert byType.getCount() > 0 : type + " in-flight gauge would go negative";
        byType.dec();
    }

    public void markRejected() { rejections.inc(); }

    public long inflight() { return allInflight.getCount(); }

    public long inflight(OperationType type) { return inflightByType.get(type).getCount(); }

    public long rejections() { return rejections.getCount(); }
}
