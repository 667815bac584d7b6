package com.securityops.devicesync.client;

import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.SourceFetchResult;

/**
 * Reads the Defender for Endpoint machine catalog.
 */
public interface DefenderDeviceClient {

    SourceFetchResult<DefenderDevice> fetchAllDevices();
}
