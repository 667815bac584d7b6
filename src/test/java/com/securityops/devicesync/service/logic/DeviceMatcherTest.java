package com.securityops.devicesync.service.logic;

import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.MatchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.securityops.devicesync.helper.TestDevices.defender;
import static com.securityops.devicesync.helper.TestDevices.intune;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("DeviceMatcher Tests")
class DeviceMatcherTest {

    private static final Instant NOW = Instant.parse("2024-06-01T06:00:00Z");

    private DeviceMatcher deviceMatcher;

    @BeforeEach
    void setUp() {
        deviceMatcher = new DeviceMatcher(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Basic scenarios")
    class BasicScenarios {

        @Test
        @DisplayName("Should match devices sharing an identity key")
        void shouldMatchDevicesSharingKey() {
            // Given
            List<ManagedDevice> intuneDevices = List.of(intune("a1", "K1"));
            List<DefenderDevice> defenderDevices = List.of(defender("b1", "K1"));

            // When
            MatchOutcome outcome = deviceMatcher.match(intuneDevices, defenderDevices);

            // Then
            assertThat(outcome.records()).hasSize(1);
            SyncRecord record = outcome.records().get(0);
            assertThat(record.syncKey()).isEqualTo("K1");
            assertThat(record.syncState()).isEqualTo(SyncState.MATCHED);
            assertThat(record.intune().id()).isEqualTo("a1");
            assertThat(record.defender().id()).isEqualTo("b1");
        }

        @Test
        @DisplayName("Should record an Intune device without Defender counterpart as only_intune")
        void shouldRecordOnlyIntune() {
            MatchOutcome outcome = deviceMatcher.match(List.of(intune("a1", "K1")), List.of());

            assertThat(outcome.records()).hasSize(1);
            SyncRecord record = outcome.records().get(0);
            assertThat(record.syncKey()).isEqualTo("K1");
            assertThat(record.syncState()).isEqualTo(SyncState.ONLY_INTUNE);
            assertThat(record.defender()).isNull();
        }

        @Test
        @DisplayName("Should key an unkeyed Defender device with a fresh UUID")
        void shouldKeyUnkeyedDefenderWithUuid() {
            MatchOutcome outcome = deviceMatcher.match(List.of(), List.of(defender("b1", null)));

            assertThat(outcome.records()).hasSize(1);
            SyncRecord record = outcome.records().get(0);
            assertThat(record.syncState()).isEqualTo(SyncState.ONLY_DEFENDER);
            assertThat(record.syncKey()).isNotNull().isNotEqualTo("b1");
            assertThatCode(() -> UUID.fromString(record.syncKey())).doesNotThrowAnyException();
            assertThat(record.intune()).isNull();
        }

        @Test
        @DisplayName("Should key an Intune device without azureADDeviceId by its own id")
        void shouldKeyUnkeyedIntuneById() {
            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", null), intune("a2", "  ")),
                    List.of(defender("b1", "")));

            assertThat(outcome.records())
                    .filteredOn(r -> r.syncState() == SyncState.ONLY_INTUNE)
                    .extracting(SyncRecord::syncKey)
                    .containsExactly("a1", "a2");
            assertThat(outcome.count(SyncState.MATCHED)).isZero();
        }

        @Test
        @DisplayName("Should join devices on the all-zero GUID like any other key")
        void shouldMatchOnAllZeroGuid() {
            String zeroGuid = "00000000-0000-0000-0000-000000000000";

            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", zeroGuid)),
                    List.of(defender("b1", zeroGuid)));

            assertThat(outcome.records()).hasSize(1);
            SyncRecord record = outcome.records().get(0);
            assertThat(record.syncState()).isEqualTo(SyncState.MATCHED);
            assertThat(record.syncKey()).isEqualTo(zeroGuid);
            assertThat(record.intune().id()).isEqualTo("a1");
            assertThat(record.defender().id()).isEqualTo("b1");
        }

        @Test
        @DisplayName("Should stamp every record of a run with the same timestamp")
        void shouldStampRecordsWithRunTimestamp() {
            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", "K1"), intune("a2", "K2")),
                    List.of(defender("b1", "K1"), defender("b3", "K3"), defender("b4", null)));

            assertThat(outcome.syncTimestamp()).isEqualTo("2024-06-01T06:00:00Z");
            assertThat(outcome.records())
                    .extracting(SyncRecord::syncTimestamp)
                    .containsOnly("2024-06-01T06:00:00Z");
        }

        @Test
        @DisplayName("Should produce no records for empty inputs")
        void shouldHandleEmptyInputs() {
            assertThat(deviceMatcher.match(List.of(), List.of()).records()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Partition properties")
    class PartitionProperties {

        @Test
        @DisplayName("Disjoint keys should yield only singly-sourced records")
        void disjointKeysYieldNoMatches() {
            List<ManagedDevice> intuneDevices = intuneWithKeys("I", 7);
            List<DefenderDevice> defenderDevices = defenderWithKeys("D", 5);

            MatchOutcome outcome = deviceMatcher.match(intuneDevices, defenderDevices);

            assertThat(outcome.records()).hasSize(12);
            assertThat(outcome.count(SyncState.MATCHED)).isZero();
            assertThat(outcome.count(SyncState.ONLY_INTUNE)).isEqualTo(7);
            assertThat(outcome.count(SyncState.ONLY_DEFENDER)).isEqualTo(5);
        }

        @Test
        @DisplayName("A key bijection should yield only matched records")
        void bijectionYieldsOnlyMatches() {
            List<ManagedDevice> intuneDevices = intuneWithKeys("K", 10);
            List<DefenderDevice> defenderDevices = new ArrayList<>(defenderWithKeys("K", 10));
            Collections.reverse(defenderDevices);

            MatchOutcome outcome = deviceMatcher.match(intuneDevices, defenderDevices);

            assertThat(outcome.records()).hasSize(10);
            assertThat(outcome.records()).allMatch(r -> r.syncState() == SyncState.MATCHED);
            assertThat(outcome.records()).allMatch(r -> r.intune().azureADDeviceId().equals(r.defender().aadDeviceId()));
        }

        @Test
        @DisplayName("Every device should be accounted for exactly once with unique keys")
        void partitionIsTotal() {
            List<ManagedDevice> intuneDevices = new ArrayList<>(intuneWithKeys("K", 6));
            intuneDevices.add(intune("loose-1", null));
            List<DefenderDevice> defenderDevices = new ArrayList<>(defenderWithKeys("K", 4));
            defenderDevices.addAll(defenderWithKeys("X", 3));
            defenderDevices.add(defender("loose-2", null));

            MatchOutcome outcome = deviceMatcher.match(intuneDevices, defenderDevices);

            long matched = outcome.count(SyncState.MATCHED);
            long onlyIntune = outcome.count(SyncState.ONLY_INTUNE);
            long onlyDefender = outcome.count(SyncState.ONLY_DEFENDER);
            assertThat(matched * 2 + onlyIntune + onlyDefender)
                    .isEqualTo(intuneDevices.size() + defenderDevices.size());
            assertThat(matched).isEqualTo(4);
            assertThat(onlyIntune).isEqualTo(3);
            assertThat(onlyDefender).isEqualTo(4);
        }

        @Test
        @DisplayName("Matching twice should give the same key and state pairs")
        void matchingIsIdempotent() {
            List<ManagedDevice> intuneDevices = List.of(intune("a1", "K1"), intune("a2", "K2"), intune("a3", null));
            List<DefenderDevice> defenderDevices = List.of(defender("b1", "K1"), defender("b3", "K3"));

            MatchOutcome first = deviceMatcher.match(intuneDevices, defenderDevices);
            MatchOutcome second = deviceMatcher.match(intuneDevices, defenderDevices);

            assertThat(keyStatePairs(second)).isEqualTo(keyStatePairs(first));
            assertThat(second.records()).extracting(SyncRecord::id)
                    .doesNotContainAnyElementsOf(first.records().stream().map(SyncRecord::id).toList());
        }

        @Test
        @DisplayName("Unkeyed Defender devices should never be matched")
        void unkeyedDefenderNeverMatches() {
            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", null), intune("a2", "K2")),
                    List.of(defender("b1", null), defender("b2", "  ")));

            assertThat(outcome.count(SyncState.MATCHED)).isZero();
            assertThat(outcome.records())
                    .filteredOn(r -> r.defender() != null)
                    .allMatch(r -> r.syncState() == SyncState.ONLY_DEFENDER)
                    .hasSize(2);
        }
    }

    @Nested
    @DisplayName("Duplicate keys")
    class DuplicateKeys {

        @Test
        @DisplayName("The later Defender device should win a duplicate key")
        void laterDefenderDeviceWins() {
            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", "K1")),
                    List.of(defender("b-old", "K1"), defender("b-new", "K1")));

            assertThat(outcome.records()).hasSize(1);
            assertThat(outcome.records().get(0).defender().id()).isEqualTo("b-new");
        }

        @Test
        @DisplayName("Each Intune device sharing a key should be matched against the same Defender device")
        void duplicateIntuneKeysAllMatch() {
            MatchOutcome outcome = deviceMatcher.match(
                    List.of(intune("a1", "K1"), intune("a2", "K1")),
                    List.of(defender("b1", "K1")));

            assertThat(outcome.records()).hasSize(2);
            assertThat(outcome.records()).allMatch(r -> r.syncState() == SyncState.MATCHED);
            assertThat(outcome.records()).extracting(r -> r.intune().id()).containsExactly("a1", "a2");
            assertThat(outcome.records()).extracting(r -> r.defender().id()).containsOnly("b1");
            assertThat(outcome.count(SyncState.ONLY_INTUNE)).isZero();
            assertThat(outcome.count(SyncState.ONLY_DEFENDER)).isZero();
        }
    }

    private static List<ManagedDevice> intuneWithKeys(String prefix, int count) {
        List<ManagedDevice> devices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            devices.add(intune("intune-" + prefix + i, prefix + "-" + i));
        }
        return devices;
    }

    private static List<DefenderDevice> defenderWithKeys(String prefix, int count) {
        List<DefenderDevice> devices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            devices.add(defender("defender-" + prefix + i, prefix + "-" + i));
        }
        return devices;
    }

    private static Map<String, Long> keyStatePairs(MatchOutcome outcome) {
        return outcome.records().stream()
                .collect(Collectors.groupingBy(r -> r.syncKey() + "|" + r.syncState().getValue(), Collectors.counting()));
    }
}
