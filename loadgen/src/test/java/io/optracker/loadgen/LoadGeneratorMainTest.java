package io.optracker.loadgen;

import io.optracker.budget.MemoryLimit;
import io.optracker.config.TrackerConfig;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class LoadGeneratorMainTest {
    private static final TrackerConfig BASE = new TrackerConfig("partition-env", MemoryLimit.ofMegabytes(64),
            MemoryLimit.unlimited(), 9000, Duration.ofSeconds(5));

    @Test
    void runs_small_load_to_completion() {
        int code = new CommandLine(new LoadGeneratorMain()).execute("-t", "2", "-n", "5", "-f", "128", "-l", "-1", "--hold-millis", "1");
        assertEquals(0, code);
    }

    @Test
    void rejects_invalid_limit() {
        int code = new CommandLine(new LoadGeneratorMain()).execute("-l", "-7");
        assertEquals(2, code);
    }

    @Test
    void config_values_apply_when_no_flags_are_given() {
        LoadGeneratorMain main = new LoadGeneratorMain();
        new CommandLine(main).parseArgs("-t", "1");

        assertEquals(BASE, main.resolveConfig(BASE));
    }

    @Test
    void flags_override_config_values() {
        LoadGeneratorMain main = new LoadGeneratorMain();
        new CommandLine(main).parseArgs("-l", "-1", "-p", "cli-partition", "--drain-timeout-ms", "250", "--admin-port", "0");

        TrackerConfig cfg = main.resolveConfig(BASE);

        assertTrue(cfg.operationMemoryLimit().isUnlimited());
        assertEquals("cli-partition", cfg.partitionId());
        assertEquals(Duration.ofMillis(250), cfg.drainTimeout());
        assertEquals(0, cfg.adminPort());
        assertEquals(BASE.rootMemoryLimit(), cfg.rootMemoryLimit());
    }

    @Test
    void serves_admin_endpoint_while_running() {
        int code = new CommandLine(new LoadGeneratorMain()).execute("-t", "1", "-n", "3", "-l", "-1", "--hold-millis", "1", "--admin-port", "0");
        assertEquals(0, code);
    }
}
