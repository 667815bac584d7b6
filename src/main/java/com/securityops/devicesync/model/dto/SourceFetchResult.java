package com.securityops.devicesync.model.dto;

import java.util.List;

/**
 * Full device set read from one source catalog, with the cost of reading it.
 */
public record SourceFetchResult<T>(
    List<T> devices,
    double cost
) {
    public int count() {
        return devices.size();
    }
}
