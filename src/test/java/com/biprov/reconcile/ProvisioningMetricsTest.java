package com.biprov.reconcile;

import com.biprov.domain.ResourceAction;
import com.biprov.domain.ResourceKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProvisioningMetrics Tests")
class ProvisioningMetricsTest {

    private MeterRegistry meterRegistry;
    private ProvisioningMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ProvisioningMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Should register every outcome counter at startup")
    void shouldRegisterCounters() {
        assertThat(meterRegistry.find("biprov.provision.completed").counter()).isNotNull();
        assertThat(meterRegistry.find("biprov.provision.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("biprov.provision.validation_failed").counter()).isNotNull();
        assertThat(meterRegistry.find("biprov.resources.created").counters()).hasSize(ResourceKind.values().length);
        assertThat(meterRegistry.find("biprov.resources.reused").counters()).hasSize(ResourceKind.values().length);
    }

    @Test
    @DisplayName("Should count run outcomes")
    void shouldCountOutcomes() {
        metrics.recordCompleted();
        metrics.recordCompleted();
        metrics.recordFailed();
        metrics.recordValidationFailed();

        assertThat(meterRegistry.get("biprov.provision.completed").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("biprov.provision.failed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("biprov.provision.validation_failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count resources by kind and action")
    void shouldCountResources() {
        metrics.recordResource(ResourceKind.DASHBOARD, ResourceAction.CREATED);
        metrics.recordResource(ResourceKind.DASHBOARD, ResourceAction.CREATED);
        metrics.recordResource(ResourceKind.ACCESS_MAPPING, ResourceAction.REUSED);

        assertThat(meterRegistry.get("biprov.resources.created").tag("kind", "dashboard").counter().count())
            .isEqualTo(2.0);
        assertThat(meterRegistry.get("biprov.resources.reused").tag("kind", "access_mapping").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("biprov.resources.reused").tag("kind", "dashboard").counter().count())
            .isZero();
    }

    @Test
    @DisplayName("Should record run latency from a sample")
    void shouldRecordLatency() {
        Timer.Sample sample = metrics.startTimer();

        metrics.recordLatency(sample);

        assertThat(meterRegistry.get("biprov.provision.latency").timer().count()).isEqualTo(1L);
    }
}
