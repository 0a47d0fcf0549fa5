package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a completed provisioning run.
 *
 * Built once by the reconciler at the end of a successful run and never mutated.
 * {@link #getDashboardIds()} is index-aligned with the request's template dashboard ids.
 * {@code groupId} and {@code folderId} are null only for runs restricted to stages that do
 * not touch them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "projectId", "groupEmail", "groupId", "folderId", "dashboardIds",
    "correlationId", "resources"})
public final class ProvisionResult {

    private final String projectId;
    private final String groupEmail;
    private final Long groupId;
    private final Long folderId;
    private final List<Long> dashboardIds;
    private final String correlationId;
    private final List<ProvisionedResource> resources;

    public ProvisionResult(
        String projectId,
        String groupEmail,
        Long groupId,
        Long folderId,
        List<Long> dashboardIds,
        String correlationId,
        List<ProvisionedResource> resources
    ) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.groupEmail = Objects.requireNonNull(groupEmail, "groupEmail");
        this.groupId = groupId;
        this.folderId = folderId;
        this.dashboardIds = List.copyOf(dashboardIds);
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.resources = resources == null ? List.of() : List.copyOf(resources);
    }

    @JsonProperty("status")
    public ProvisionStatus getStatus() {
        return ProvisionStatus.OK;
    }

    @JsonProperty("projectId")
    public String getProjectId() {
        return projectId;
    }

    @JsonProperty("groupEmail")
    public String getGroupEmail() {
        return groupEmail;
    }

    @JsonProperty("groupId")
    public Long getGroupId() {
        return groupId;
    }

    @JsonProperty("folderId")
    public Long getFolderId() {
        return folderId;
    }

    @JsonProperty("dashboardIds")
    public List<Long> getDashboardIds() {
        return dashboardIds;
    }

    @JsonProperty("correlationId")
    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Per-entity report of what this run created and what it reused.
     */
    @JsonProperty("resources")
    public List<ProvisionedResource> getResources() {
        return resources;
    }

    public long createdCount() {
        return resources.stream().filter(ProvisionedResource::isCreated).count();
    }

    @Override
    public String toString() {
        return "ProvisionResult{projectId='" + projectId + "', groupId=" + groupId + ", folderId=" + folderId
            + ", dashboardIds=" + dashboardIds + ", correlationId='" + correlationId + "'}";
    }
}
