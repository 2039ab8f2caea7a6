package io.optracker.retry;

import com.google.common.base.Preconditions;

/**
 * Grows the delay by numerator/denominator on every step, never above maxMicros.
 */
public class MultiplicativeBackoffPolicy implements BackoffPolicy {
    private final long initialMicros;
    private final long numerator;
    private final long denominator;
    private final long maxMicros;

    public MultiplicativeBackoffPolicy(long initialMicros, long numerator, long denominator, long maxMicros) {
        Preconditions.checkArgument(denominator > 0, "denominator must be positive");
        Preconditions.checkArgument(numerator >= denominator, "backoff must not shrink: %s/%s", numerator, denominator);
        this.initialMicros = Math.max(1, initialMicros);
        this.numerator = numerator;
        this.denominator = denominator;
        this.maxMicros = Math.max(this.initialMicros, maxMicros);
    }

    /** 250us growing by 5/4 per step up to one second. */
    public static MultiplicativeBackoffPolicy drainDefault() {
        return new MultiplicativeBackoffPolicy(250, 5, 4, 1_000_000);
    }

    @Override
    public long initialDelayMicros() { return initialMicros; }

    @Override
    public long nextDelayMicros(long currentMicros) {
        if (currentMicros >= maxMicros) return maxMicros;
        long next = currentMicros * numerator / denominator;
        if (next <= currentMicros) next = currentMicros + 1;
        return Math.min(next, maxMicros);
    }
}
