package io.optracker.error;

/**
 * The tracker's bookkeeping no longer matches what callers did: a double admission, a release of an
 * operation it never admitted, or teardown with operations still registered. Memory accounting can no
 * longer be trusted once this is thrown, so callers must not catch it.
 */
public class TrackerInvariantError extends Error {
    public TrackerInvariantError(String message) {
        super(message);
    }
}
