package io.optracker.tracker;

import io.optracker.core.OperationDriver;

/**
 * Registry value. The footprint is sampled once at admission; the request behind the driver may be gone by release.
 */
public record TrackedEntry(OperationDriver driver, long memoryFootprint) {
}
