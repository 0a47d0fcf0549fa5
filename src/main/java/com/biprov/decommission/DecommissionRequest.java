package com.biprov.decommission;

import com.biprov.validation.ProvisionPayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request to retire a project's BI resources.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DecommissionRequest {

    @NotBlank(message = "is required")
    @Pattern(regexp = ProvisionPayload.PROJECT_ID_PATTERN, message = "must be a valid project id")
    private String projectId;

    private boolean archiveFolder = true;

    private boolean deleteDashboards;

    private boolean deleteSchedules;

    public DecommissionRequest() {
    }

    public DecommissionRequest(String projectId, boolean archiveFolder, boolean deleteDashboards) {
        this(projectId, archiveFolder, deleteDashboards, false);
    }

    public DecommissionRequest(String projectId, boolean archiveFolder, boolean deleteDashboards,
                               boolean deleteSchedules) {
        this.projectId = projectId;
        this.archiveFolder = archiveFolder;
        this.deleteDashboards = deleteDashboards;
        this.deleteSchedules = deleteSchedules;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public boolean isArchiveFolder() {
        return archiveFolder;
    }

    public void setArchiveFolder(boolean archiveFolder) {
        this.archiveFolder = archiveFolder;
    }

    public boolean isDeleteDashboards() {
        return deleteDashboards;
    }

    public void setDeleteDashboards(boolean deleteDashboards) {
        this.deleteDashboards = deleteDashboards;
    }

    public boolean isDeleteSchedules() {
        return deleteSchedules;
    }

    public void setDeleteSchedules(boolean deleteSchedules) {
        this.deleteSchedules = deleteSchedules;
    }

    @Override
    public String toString() {
        return "DecommissionRequest{projectId='" + projectId + "', archiveFolder=" + archiveFolder
            + ", deleteDashboards=" + deleteDashboards + ", deleteSchedules=" + deleteSchedules + "}";
    }
}
