package com.biprov.ingestion;

import com.biprov.domain.ProvisionResult;
import com.biprov.domain.ProvisionStatus;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Result of one invocation as reported to the caller: either a {@link ProvisionResult} or an
 * {@link ErrorReport}. Serializes as whichever of the two it holds.
 */
public final class ProvisionOutcome {

    private final ProvisionResult result;
    private final ErrorReport error;

    private ProvisionOutcome(ProvisionResult result, ErrorReport error) {
        this.result = result;
        this.error = error;
    }

    public static ProvisionOutcome ok(ProvisionResult result) {
        return new ProvisionOutcome(result, null);
    }

    public static ProvisionOutcome validationError(String message, String projectId, String groupEmail,
                                                   String correlationId) {
        return new ProvisionOutcome(null,
            new ErrorReport(ProvisionStatus.VALIDATION_ERROR, message, projectId, groupEmail, correlationId));
    }

    public static ProvisionOutcome error(String message, String projectId, String groupEmail, String correlationId) {
        return new ProvisionOutcome(null,
            new ErrorReport(ProvisionStatus.ERROR, message, projectId, groupEmail, correlationId));
    }

    public ProvisionStatus getStatus() {
        return result != null ? result.getStatus() : error.getStatus();
    }

    public boolean isOk() {
        return result != null;
    }

    public ProvisionResult getResult() {
        return result;
    }

    public ErrorReport getError() {
        return error;
    }

    public String getCorrelationId() {
        return result != null ? result.getCorrelationId() : error.getCorrelationId();
    }

    public String getProjectId() {
        return result != null ? result.getProjectId() : error.getProjectId();
    }

    @JsonValue
    public Object body() {
        return result != null ? result : error;
    }

    /**
     * 200 for success, 400 for a rejected payload, 502 for a platform-side failure.
     */
    public HttpStatus httpStatus() {
        switch (getStatus()) {
            case OK:
                return HttpStatus.OK;
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    @Override
    public String toString() {
        return "ProvisionOutcome{" + body() + "}";
    }
}
