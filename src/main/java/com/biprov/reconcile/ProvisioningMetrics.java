package com.biprov.reconcile;

import com.biprov.domain.ResourceAction;
import com.biprov.domain.ResourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for provisioning runs.
 *
 * Tracks:
 * - Run outcomes (completed, failed, rejected payloads)
 * - Resources created and reused, per kind
 * - End-to-end run latency
 *
 * Exposed via Micrometer through the actuator endpoints.
 */
@Component
public class ProvisioningMetrics {

    private final MeterRegistry registry;
    private final Counter completed;
    private final Counter failed;
    private final Counter validationFailed;
    private final Map<ResourceKind, Counter> created = new EnumMap<>(ResourceKind.class);
    private final Map<ResourceKind, Counter> reused = new EnumMap<>(ResourceKind.class);
    private final Timer latency;

    public ProvisioningMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.completed = Counter.builder("biprov.provision.completed")
            .description("Number of provisioning runs that reached the desired state")
            .register(registry);

        this.failed = Counter.builder("biprov.provision.failed")
            .description("Number of provisioning runs that failed on the platform")
            .register(registry);

        this.validationFailed = Counter.builder("biprov.provision.validation_failed")
            .description("Number of provisioning requests rejected as invalid")
            .register(registry);

        for (ResourceKind kind : ResourceKind.values()) {
            String tag = kind.name().toLowerCase();
            created.put(kind, Counter.builder("biprov.resources.created")
                .description("Platform resources created by provisioning")
                .tag("kind", tag)
                .register(registry));
            reused.put(kind, Counter.builder("biprov.resources.reused")
                .description("Existing platform resources reused by provisioning")
                .tag("kind", tag)
                .register(registry));
        }

        this.latency = Timer.builder("biprov.provision.latency")
            .description("End-to-end provisioning latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordCompleted() {
        completed.increment();
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordValidationFailed() {
        validationFailed.increment();
    }

    public void recordResource(ResourceKind kind, ResourceAction action) {
        (action == ResourceAction.CREATED ? created : reused).get(kind).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordLatency(Timer.Sample sample) {
        sample.stop(latency);
    }
}
