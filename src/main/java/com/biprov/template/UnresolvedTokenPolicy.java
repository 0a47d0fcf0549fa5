package com.biprov.template;

/**
 * What token substitution does with a {@code {{KEY}}} placeholder whose key is not in the
 * context.
 */
public enum UnresolvedTokenPolicy {

    /**
     * Leave the placeholder verbatim so template mismatches stay visible in the cloned
     * dashboard. The default.
     */
    LEAVE,

    /**
     * Reject the substitution with a {@link com.biprov.validation.ValidationError} naming the
     * unresolved keys. Project-level opt-in.
     */
    FAIL
}
