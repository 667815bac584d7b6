package com.securityops.devicesync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A machine known to Defender for Endpoint.
 * {@code aadDeviceId} is null for machines that are not Entra ID joined.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DefenderDevice(
    String id,
    String aadDeviceId,
    String computerDnsName,
    String osPlatform,
    String osVersion,
    String healthStatus,
    String riskScore,
    String exposureLevel,
    String onboardingStatus,
    String lastIpAddress,
    String firstSeen,
    String lastSeen,
    List<String> machineTags
) {

    public boolean hasIdentityKey() {
        return aadDeviceId != null && !aadDeviceId.isBlank();
    }
}
