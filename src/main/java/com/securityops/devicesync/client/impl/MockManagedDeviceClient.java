package com.securityops.devicesync.client.impl;

import com.securityops.devicesync.client.ManagedDeviceClient;
import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.SourceFetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@Profile("test | mock")
public class MockManagedDeviceClient implements ManagedDeviceClient {

    @Override
    public SourceFetchResult<ManagedDevice> fetchAllDevices() {
        log.info("MOCK INTUNE API - Fetching all managed devices");

        List<ManagedDevice> devices = new ArrayList<>();
        devices.add(device("intune-001", MockDeviceKeys.SHARED_LAPTOP, "LAPTOP-FIN-001", "j.doe@contoso.com", "Windows"));
        devices.add(device("intune-002", MockDeviceKeys.SHARED_DESKTOP, "DESKTOP-OPS-002", "a.smith@contoso.com", "Windows"));
        devices.add(device("intune-003", MockDeviceKeys.INTUNE_ONLY_PHONE, "IPHONE-SALES-003", "m.lee@contoso.com", "iOS"));
        devices.add(device("intune-004", "", "KIOSK-LOBBY-004", null, "Windows"));

        log.info("MOCK INTUNE API - Returning {} devices", devices.size());
        return new SourceFetchResult<>(devices, 1);
    }

    private static ManagedDevice device(String id, String key, String name, String user, String os) {
        return new ManagedDevice(id, key, name, user, os, "10.0.22631", "compliant", "mdm",
                "Contoso", "Model-" + id.substring(id.length() - 3), "SN-" + id, "2024-01-15T09:00:00Z",
                "2024-06-01T08:30:00Z");
    }
}
