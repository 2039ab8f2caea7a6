package io.optracker.loadgen;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.optracker.admin.AdminServer;
import io.optracker.budget.MemoryLimit;
import io.optracker.config.TrackerConfig;
import io.optracker.inject.TrackerModule;
import io.optracker.tracker.OperationTracker;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI that drives an operation tracker with synthetic concurrent load and prints a JSON report.
 * Tracker settings come from {@link TrackerConfig#fromEnv()}; flags given on the command line win.
 */
@CommandLine.Command(name = "optracker-load", mixinStandardHelpOptions = true, description = "Drive an operation tracker with synthetic load")
public final class LoadGeneratorMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-t", "--threads"}, description = "Producer threads", defaultValue = "4")
    int threads;

    @CommandLine.Option(names = {"-n", "--ops-per-thread"}, description = "Operations each producer submits", defaultValue = "1000")
    int opsPerThread;

    @CommandLine.Option(names = {"-f", "--footprint-bytes"}, description = "Memory footprint of each operation", defaultValue = "65536")
    long footprintBytes;

    @CommandLine.Option(names = {"-l", "--limit-mb"}, description = "Tracker memory limit in MB; -1 disables the limit (default: optracker.memory.limit.mb)")
    String limitMb;

    @CommandLine.Option(names = {"--hold-millis"}, description = "How long each admitted operation stays in flight", defaultValue = "5")
    long holdMillis;

    @CommandLine.Option(names = {"--drain-timeout-ms"}, description = "How long to wait for in-flight operations (default: optracker.drain.timeout.ms)")
    Long drainTimeoutMs;

    @CommandLine.Option(names = {"-p", "--partition"}, description = "Partition identifier (default: optracker.partition)")
    String partition;

    @CommandLine.Option(names = {"--admin"}, description = "Serve the admin endpoint on optracker.port while running")
    boolean admin;

    @CommandLine.Option(names = {"--admin-port"}, description = "Serve the admin endpoint on this port while running")
    Integer adminPort;

    public static void main(String[] args) {
        int code = new CommandLine(new LoadGeneratorMain()).execute(args);
        System.exit(code);
    }

    /** Applies the command-line flags on top of {@code base}. */
    TrackerConfig resolveConfig(TrackerConfig base) {
        TrackerConfig cfg = base;
        if (limitMb != null) cfg = cfg.withOperationMemoryLimit(MemoryLimit.parseMegabytes(limitMb));
        if (partition != null) cfg = cfg.withPartitionId(partition);
        if (drainTimeoutMs != null) cfg = cfg.withDrainTimeout(Duration.ofMillis(drainTimeoutMs));
        if (adminPort != null) cfg = cfg.withAdminPort(adminPort);
        return cfg;
    }

    @Override
    public Integer call() throws Exception {
        TrackerConfig cfg;
        try {
            cfg = resolveConfig(TrackerConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new TrackerModule(cfg));
        OperationTracker tracker = injector.getInstance(OperationTracker.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        boolean serveAdmin = admin || adminPort != null;
        AdminServer server = serveAdmin ? new AdminServer(cfg.adminPort(), cfg.partitionId(), tracker, registry) : null;
        try {
            if (server != null) server.start();
            LoadReport report = new LoadRunner(tracker, cfg.partitionId(), threads, opsPerThread, footprintBytes, holdMillis)
                    .run(cfg.drainTimeout());
            System.out.println(report.toJson());
            if (!report.drained() || report.releaseFailures() > 0) return 1;
            tracker.close();
            return 0;
        } finally {
            if (server != null) server.close();
        }
    }
}
