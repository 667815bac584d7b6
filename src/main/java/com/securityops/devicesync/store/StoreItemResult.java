package com.securityops.devicesync.store;

/**
 * Result of one item inside a store batch request.
 */
public record StoreItemResult(
    String key,
    Outcome outcome,
    double cost,
    String error
) {

    public enum Outcome {
        SUCCEEDED,
        /** The store is over capacity; the same request may succeed later. */
        THROTTLED,
        /** Rejected for good, e.g. a malformed payload. */
        FAILED
    }

    public static StoreItemResult succeeded(String key, double cost) {
        return new StoreItemResult(key, Outcome.SUCCEEDED, cost, null);
    }

    public static StoreItemResult throttled(String key, String error) {
        return new StoreItemResult(key, Outcome.THROTTLED, 0.0, error);
    }

    public static StoreItemResult failed(String key, String error) {
        return new StoreItemResult(key, Outcome.FAILED, 0.0, error);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    public boolean isThrottled() {
        return outcome == Outcome.THROTTLED;
    }
}
