package com.fastalert.model;

import com.fastalert.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertGroupTest {

    private final GroupKey key = GroupKey.of("{alertname=\"A\"}");

    @Test
    void shouldBeResolvedOnlyWhenEveryAlertIsResolved() {
        AlertGroup mixed = AlertGroup.of(key, List.of(TestAlerts.firing("alertname", "A"), TestAlerts.resolved("alertname", "A", "pod", "x")), TestAlerts.NOW);
        AlertGroup resolved = AlertGroup.of(key, List.of(TestAlerts.resolved("alertname", "A")), TestAlerts.NOW);

        assertThat(mixed.isResolved()).isFalse();
        assertThat(mixed.firingCount()).isEqualTo(1);
        assertThat(mixed.resolvedCount()).isEqualTo(1);
        assertThat(resolved.isResolved()).isTrue();
    }

    @Test
    void shouldTreatFutureEndsAtAsFiring() {
        Alert alert = TestAlerts.firing("alertname", "A").toBuilder().endsAt(TestAlerts.NOW.plusSeconds(60)).build();
        assertThat(alert.isResolved(TestAlerts.NOW)).isFalse();
    }

    @Test
    void shouldRejectEmptyGroup() {
        assertThatThrownBy(() -> AlertGroup.of(key, List.of(), TestAlerts.NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one alert");
    }

    @Test
    void shouldComputeStableFingerprint() {
        Alert a = TestAlerts.firing("alertname", "A", "pod", "x");
        Alert b = TestAlerts.firing("pod", "x", "alertname", "A");
        assertThat(a.fingerprint()).hasSize(16).isEqualTo(b.fingerprint());
    }
}
