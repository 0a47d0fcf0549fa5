package com.biprov.ingestion;

import com.biprov.domain.ProvisionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Error body returned for a failed invocation. Optional fields are omitted when unknown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "error", "projectId", "groupEmail", "correlationId"})
public class ErrorReport {

    @JsonProperty("status")
    private final ProvisionStatus status;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("projectId")
    private final String projectId;

    @JsonProperty("groupEmail")
    private final String groupEmail;

    @JsonProperty("correlationId")
    private final String correlationId;

    public ErrorReport(ProvisionStatus status, String error, String projectId, String groupEmail, String correlationId) {
        this.status = status;
        this.error = error;
        this.projectId = projectId;
        this.groupEmail = groupEmail;
        this.correlationId = correlationId;
    }

    public ProvisionStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getGroupEmail() {
        return groupEmail;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return "ErrorReport{status=" + status + ", error='" + error + "', projectId='" + projectId
            + "', correlationId='" + correlationId + "'}";
    }
}
