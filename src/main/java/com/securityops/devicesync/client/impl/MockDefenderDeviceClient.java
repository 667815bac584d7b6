package com.securityops.devicesync.client.impl;

import com.securityops.devicesync.client.DefenderDeviceClient;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.SourceFetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@Profile("test | mock")
public class MockDefenderDeviceClient implements DefenderDeviceClient {

    @Override
    public SourceFetchResult<DefenderDevice> fetchAllDevices() {
        log.info("MOCK DEFENDER API - Fetching all machines");

        List<DefenderDevice> devices = new ArrayList<>();
        devices.add(machine("def-a1", MockDeviceKeys.SHARED_LAPTOP, "laptop-fin-001.contoso.com", "Low"));
        devices.add(machine("def-b2", MockDeviceKeys.SHARED_DESKTOP, "desktop-ops-002.contoso.com", "Medium"));
        devices.add(machine("def-c3", MockDeviceKeys.DEFENDER_ONLY_SERVER, "srv-build-003.contoso.com", "High"));
        devices.add(machine("def-d4", null, "linux-lab-004.contoso.com", "None"));

        log.info("MOCK DEFENDER API - Returning {} machines", devices.size());
        return new SourceFetchResult<>(devices, 1);
    }

    private static DefenderDevice machine(String id, String key, String dnsName, String riskScore) {
        return new DefenderDevice(id, key, dnsName, "Windows11", "10.0.22631", "Active", riskScore,
                riskScore, "Onboarded", "10.1.0.15", "2024-01-10T12:00:00Z", "2024-06-01T09:00:00Z",
                List.of("contoso"));
    }
}
