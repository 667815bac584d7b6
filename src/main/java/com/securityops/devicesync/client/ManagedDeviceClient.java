package com.securityops.devicesync.client;

import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.SourceFetchResult;

/**
 * Reads the Intune managed-device catalog.
 * Allows swapping between mock and production implementations.
 */
public interface ManagedDeviceClient {

    /**
     * Fetches every managed device, following pagination until the catalog is exhausted.
     *
     * @return all devices and the number of page requests it took
     */
    SourceFetchResult<ManagedDevice> fetchAllDevices();
}
