package io.optracker.error;

import java.time.Duration;

/**
 * Operations were still pending when a drain gave up waiting.
 */
public class DrainTimeoutException extends Exception {
    private final int pending;
    private final Duration waited;

    public DrainTimeoutException(int pending, Duration waited) {
        super(String.format("Timed out waiting for all operations to finish. %d operations pending. Waited for %d ms",
                pending, waited.toMillis()));
        this.pending = pending;
        this.waited = waited;
    }

    public int pending() { return pending; }

    public Duration waited() { return waited; }
}
