package com.biprov.decommission;

import com.biprov.domain.ProvisionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * What a decommission run did. {@code folderId} is absent when the project had no folder.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "projectId", "folderId", "archivedFolder", "deletedDashboards", "deletedSchedules",
    "correlationId"})
public class DecommissionResult {

    private final String projectId;
    private final Long folderId;
    private final boolean archivedFolder;
    private final int deletedDashboards;
    private final int deletedSchedules;
    private final String correlationId;

    public DecommissionResult(String projectId, Long folderId, boolean archivedFolder, int deletedDashboards,
                              String correlationId) {
        this(projectId, folderId, archivedFolder, deletedDashboards, 0, correlationId);
    }

    public DecommissionResult(String projectId, Long folderId, boolean archivedFolder, int deletedDashboards,
                              int deletedSchedules, String correlationId) {
        this.projectId = projectId;
        this.folderId = folderId;
        this.archivedFolder = archivedFolder;
        this.deletedDashboards = deletedDashboards;
        this.deletedSchedules = deletedSchedules;
        this.correlationId = correlationId;
    }

    public static DecommissionResult nothingToDo(String projectId, String correlationId) {
        return new DecommissionResult(projectId, null, false, 0, 0, correlationId);
    }

    @JsonProperty("status")
    public ProvisionStatus getStatus() {
        return ProvisionStatus.OK;
    }

    public String getProjectId() {
        return projectId;
    }

    public Long getFolderId() {
        return folderId;
    }

    public boolean isArchivedFolder() {
        return archivedFolder;
    }

    public int getDeletedDashboards() {
        return deletedDashboards;
    }

    public int getDeletedSchedules() {
        return deletedSchedules;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "DecommissionResult{projectId='" + projectId + "', folderId=" + folderId + ", archivedFolder="
            + archivedFolder + ", deletedDashboards=" + deletedDashboards + ", deletedSchedules=" + deletedSchedules + "}";
    }
}
