package com.securityops.devicesync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An Intune managed device as returned by Microsoft Graph.
 *
 * The join key towards Defender is {@code azureADDeviceId}; Graph reports it as an
 * all-zero GUID or omits it for devices that never registered with Entra ID.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManagedDevice(
    String id,
    @JsonProperty("azureADDeviceId") String azureADDeviceId,
    String deviceName,
    String userPrincipalName,
    String operatingSystem,
    String osVersion,
    String complianceState,
    String managementAgent,
    String manufacturer,
    String model,
    String serialNumber,
    String enrolledDateTime,
    String lastSyncDateTime
) {

    /**
     * @return true when the device carries a usable Entra ID device id
     */
    public boolean hasIdentityKey() {
        return azureADDeviceId != null && !azureADDeviceId.isBlank();
    }
}
