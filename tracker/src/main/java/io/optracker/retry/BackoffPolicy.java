package io.optracker.retry;

public interface BackoffPolicy {
    long initialDelayMicros();
    long nextDelayMicros(long currentMicros);
}
