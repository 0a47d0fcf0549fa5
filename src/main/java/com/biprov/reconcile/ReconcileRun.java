package com.biprov.reconcile;

import com.biprov.domain.ProvisionRequest;
import com.biprov.domain.ProvisionResult;
import com.biprov.domain.ProvisionedResource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State of a single provisioning invocation.
 *
 * Created per call and confined to the calling thread; the reconciler itself stays stateless.
 */
public class ReconcileRun {

    private final ProvisionRequest request;
    private final String correlationId;
    private final Clock clock;
    private final Instant deadline;

    private RunState state = RunState.RUNNING;
    private ReconcileStage stage;
    private Long groupId;
    private Long folderId;
    private final List<Long> dashboardIds = new ArrayList<>();
    private final List<ProvisionedResource> resources = new ArrayList<>();

    public ReconcileRun(ProvisionRequest request, String correlationId, Clock clock, Duration timeout) {
        this.request = Objects.requireNonNull(request, "request");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.clock = clock;
        this.deadline = timeout != null && !timeout.isZero() && !timeout.isNegative()
            ? clock.instant().plus(timeout)
            : null;
    }

    public ProvisionRequest getRequest() {
        return request;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public RunState getState() {
        return state;
    }

    public ReconcileStage getStage() {
        return stage;
    }

    public Long getGroupId() {
        return groupId;
    }

    public Long getFolderId() {
        return folderId;
    }

    public List<ProvisionedResource> getResources() {
        return List.copyOf(resources);
    }

    void enter(ReconcileStage next) {
        requireRunning();
        this.stage = next;
    }

    /**
     * @throws ProvisioningError when the invocation deadline has passed
     */
    void checkDeadline(String operation) {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new ProvisioningError(stage, operation,
                "deadline exceeded before " + operation + " (stage " + stage.getValue() + ")", null);
        }
    }

    void groupResolved(ProvisionedResource resource) {
        this.groupId = resource.getId();
        resources.add(resource);
    }

    void accessMapped(ProvisionedResource resource) {
        resources.add(resource);
    }

    void folderResolved(ProvisionedResource resource) {
        this.folderId = resource.getId();
        resources.add(resource);
    }

    void dashboardResolved(ProvisionedResource resource) {
        dashboardIds.add(resource.getId());
        resources.add(resource);
    }

    ProvisionResult complete() {
        requireRunning();
        this.state = RunState.COMPLETED;
        return new ProvisionResult(
            request.getProjectId(),
            request.getGroupEmail(),
            groupId,
            folderId,
            dashboardIds,
            correlationId,
            resources);
    }

    void fail() {
        if (state == RunState.RUNNING) {
            this.state = RunState.FAILED;
        }
    }

    private void requireRunning() {
        if (state.isTerminal()) {
            throw new IllegalStateException("run " + correlationId + " is already " + state);
        }
    }
}
