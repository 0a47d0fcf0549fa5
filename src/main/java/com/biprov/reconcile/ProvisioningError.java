package com.biprov.reconcile;

import com.biprov.platform.PlatformException;

/**
 * A provisioning run could not reach its desired state: a platform call failed, the platform
 * holds conflicting data, or the run ran out of time.
 *
 * Partial remote state created before the failure is left in place and reused by the next run.
 */
public class ProvisioningError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ReconcileStage stage;
    private final String operation;

    public ProvisioningError(ReconcileStage stage, String message) {
        this(stage, null, message, null);
    }

    public ProvisioningError(ReconcileStage stage, String operation, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.operation = operation;
    }

    /**
     * Wraps a platform failure as {@code "<operation> failed: <cause>"}.
     */
    public static ProvisioningError platformFailure(ReconcileStage stage, String operation, PlatformException cause) {
        return new ProvisioningError(stage, operation, operation + " failed: " + cause.getMessage(), cause);
    }

    /**
     * Stage that failed; null for failures outside a provisioning run, such as decommissioning.
     */
    public ReconcileStage getStage() {
        return stage;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status reported by the platform, if the failure was a platform response.
     */
    public Integer getPlatformStatus() {
        return getCause() instanceof PlatformException
            ? ((PlatformException) getCause()).getHttpStatus()
            : null;
    }
}
