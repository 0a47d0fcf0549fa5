package com.biprov.reconcile;

/**
 * What to do when more than one platform group matches the requested group name.
 */
public enum GroupMatchPolicy {
    /**
     * Use the first match and log a warning.
     */
    LENIENT,

    /**
     * Fail the run with a {@link ProvisioningError}.
     */
    STRICT
}
