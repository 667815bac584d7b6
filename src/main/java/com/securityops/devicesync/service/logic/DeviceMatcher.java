package com.securityops.devicesync.service.logic;

import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.MatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Joins Intune and Defender device sets on the Entra ID device id.
 *
 * Matching rules:
 * - Intune device with a key present in Defender: matched
 * - Intune device without a key, or with a key unknown to Defender: only_intune
 *   (keyless devices are keyed by their Intune id)
 * - Defender device with a key no Intune device claimed: only_defender, keyed by the key
 * - Defender device without a key: only_defender, keyed by a fresh UUID
 *
 * When two Defender devices share a key the later one wins and the earlier one is dropped.
 * When two Intune devices share a key, each of them is matched against the same Defender device.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceMatcher {

    private final Clock clock;

    public MatchOutcome match(List<ManagedDevice> intuneDevices, List<DefenderDevice> defenderDevices) {
        String syncTimestamp = Instant.now(clock).toString();
        List<SyncRecord> records = new ArrayList<>(intuneDevices.size() + defenderDevices.size());

        Map<String, DefenderDevice> defenderByKey = new LinkedHashMap<>();
        List<DefenderDevice> defenderWithoutKey = new ArrayList<>();
        for (DefenderDevice defender : defenderDevices) {
            if (!defender.hasIdentityKey()) {
                defenderWithoutKey.add(defender);
                continue;
            }
            DefenderDevice previous = defenderByKey.put(defender.aadDeviceId(), defender);
            if (previous != null) {
                log.warn("Duplicate aadDeviceId {} in Defender data: device {} replaces {}",
                        defender.aadDeviceId(), defender.id(), previous.id());
            }
        }
        log.info("Built Defender lookup: {} keyed, {} without aadDeviceId",
                defenderByKey.size(), defenderWithoutKey.size());

        Set<String> consumedKeys = new HashSet<>();
        for (ManagedDevice intune : intuneDevices) {
            if (!intune.hasIdentityKey()) {
                log.warn("Intune device {} ({}) has no azureADDeviceId, recording as only_intune",
                        intune.id(), intune.deviceName());
                records.add(SyncRecord.onlyIntune(intune.id(), syncTimestamp, intune));
                continue;
            }

            String key = intune.azureADDeviceId();
            DefenderDevice defender = defenderByKey.get(key);
            if (defender != null) {
                records.add(SyncRecord.matched(key, syncTimestamp, intune, defender));
                consumedKeys.add(key);
                log.debug("Matched {}: intune={} defender={}", key, intune.id(), defender.id());
            } else {
                records.add(SyncRecord.onlyIntune(key, syncTimestamp, intune));
            }
        }

        defenderByKey.forEach((key, defender) -> {
            if (!consumedKeys.contains(key)) {
                records.add(SyncRecord.onlyDefender(key, syncTimestamp, defender));
            }
        });

        for (DefenderDevice defender : defenderWithoutKey) {
            records.add(SyncRecord.onlyDefender(UUID.randomUUID().toString(), syncTimestamp, defender));
            log.debug("Defender device {} ({}) has no aadDeviceId", defender.id(), defender.computerDnsName());
        }

        MatchOutcome outcome = new MatchOutcome(syncTimestamp, records);
        log.info("Cross-matching produced {} records: matched={}, only_intune={}, only_defender={}",
                records.size(),
                outcome.count(SyncState.MATCHED),
                outcome.count(SyncState.ONLY_INTUNE),
                outcome.count(SyncState.ONLY_DEFENDER));
        return outcome;
    }
}
