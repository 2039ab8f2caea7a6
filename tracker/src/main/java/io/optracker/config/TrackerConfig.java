package io.optracker.config;

import io.optracker.budget.MemoryLimit;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

public record TrackerConfig(
        String partitionId,
        MemoryLimit operationMemoryLimit,
        MemoryLimit rootMemoryLimit,
        int adminPort,
        Duration drainTimeout
) {
    public static TrackerConfig fromEnv() {
        return from(System.getProperties(), System.getenv());
    }

    public TrackerConfig withPartitionId(String id) {
        return new TrackerConfig(id, operationMemoryLimit, rootMemoryLimit, adminPort, drainTimeout);
    }

    public TrackerConfig withOperationMemoryLimit(MemoryLimit limit) {
        return new TrackerConfig(partitionId, limit, rootMemoryLimit, adminPort, drainTimeout);
    }

    public TrackerConfig withAdminPort(int port) {
        return new TrackerConfig(partitionId, operationMemoryLimit, rootMemoryLimit, port, drainTimeout);
    }

    public TrackerConfig withDrainTimeout(Duration timeout) {
        return new TrackerConfig(partitionId, operationMemoryLimit, rootMemoryLimit, adminPort, timeout);
    }

    static TrackerConfig from(Properties props, Map<String, String> env) {
        String partition = lookup(props, env, "optracker.partition", "OPTRACKER_PARTITION", "partition-0");
        MemoryLimit opLimit = parseLimit("optracker.memory.limit.mb",
                lookup(props, env, "optracker.memory.limit.mb", "OPTRACKER_MEMORY_LIMIT_MB", "1024"));
        MemoryLimit rootLimit = parseLimit("optracker.root.memory.limit.mb",
                lookup(props, env, "optracker.root.memory.limit.mb", "OPTRACKER_ROOT_MEMORY_LIMIT_MB", "-1"));
        int port = parsePort("optracker.port", lookup(props, env, "optracker.port", "OPTRACKER_PORT", "8080"));
        long drainMs = parseLong("optracker.drain.timeout.ms",
                lookup(props, env, "optracker.drain.timeout.ms", "OPTRACKER_DRAIN_TIMEOUT_MS", "30000"));
        return new TrackerConfig(partition, opLimit, rootLimit, port, Duration.ofMillis(drainMs));
    }

    private static String lookup(Properties props, Map<String, String> env, String key, String envKey, String def) {
        return props.getProperty(key, env.getOrDefault(envKey, def));
    }

    private static MemoryLimit parseLimit(String key, String value) {
        try {
            return MemoryLimit.parseMegabytes(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + value, e);
        }
    }

    private static int parsePort(String key, String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + value, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("invalid " + key + ": " + value + " is not a TCP port");
        }
        return port;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + value, e);
        }
    }
}
