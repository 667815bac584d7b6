package com.securityops.devicesync.model.dto;

public record ClearResult(
    int deletedCount,
    int failureCount,
    double cost
) {
    public static ClearResult empty(double listingCost) {
        return new ClearResult(0, 0, listingCost);
    }
}
