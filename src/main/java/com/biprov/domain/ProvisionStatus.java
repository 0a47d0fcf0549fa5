package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status reported in the outbound JSON object of a provisioning invocation.
 */
public enum ProvisionStatus {

    /**
     * All four stages completed; ids are present.
     */
    OK("ok"),

    /**
     * The payload was rejected before any remote call was made. Never retried.
     */
    VALIDATION_ERROR("validation_error"),

    /**
     * A remote call failed or a data-integrity condition was found. Remote entities created
     * before the failure stay in place and are reused by the next run.
     */
    ERROR("error");

    private final String value;

    ProvisionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ProvisionStatus fromValue(String value) {
        for (ProvisionStatus status : ProvisionStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown provision status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
