package io.optracker.loadgen;

import java.time.Duration;

public record LoadReport(
        long admitted,
        long rejected,
        long rejectionCounter,
        boolean drained,
        int pendingAfterDrain,
        long releaseFailures,
        Duration elapsed
) {
    public String toJson() {
        return String.format("{\"admitted\":%d,\"rejected\":%d,\"rejectionCounter\":%d,\"drained\":%s,\"pendingAfterDrain\":%d,\"releaseFailures\":%d,\"elapsedMs\":%d}",
                admitted, rejected, rejectionCounter, drained, pendingAfterDrain, releaseFailures, elapsed.toMillis());
    }
}
