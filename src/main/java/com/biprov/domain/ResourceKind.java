package com.biprov.domain;

/**
 * Kinds of remote entity the provisioner ensures.
 */
public enum ResourceKind {
    GROUP,
    ACCESS_MAPPING,
    FOLDER,
    DASHBOARD
}
