package com.biprov.reconcile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Provisioning stages, in execution order.
 */
public enum ReconcileStage {
    ENSURE_GROUP("ensure_group"),
    ENSURE_ACCESS_MAPPING("ensure_access_mapping"),
    ENSURE_FOLDER("ensure_folder"),
    CLONE_DASHBOARDS("clone_dashboards");

    private final String value;

    ReconcileStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Set<ReconcileStage> all() {
        return EnumSet.allOf(ReconcileStage.class);
    }

    /**
     * Stages behind a single-purpose entry point: {@code group}, {@code folder} or
     * {@code dashboards}.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static Set<ReconcileStage> forEntryPoint(String name) {
        if (name == null) {
            throw new IllegalArgumentException("stage must not be null");
        }
        switch (name.toLowerCase()) {
            case "group":
                return EnumSet.of(ENSURE_GROUP, ENSURE_ACCESS_MAPPING);
            case "folder":
                return EnumSet.of(ENSURE_FOLDER);
            case "dashboards":
                return EnumSet.of(ENSURE_FOLDER, CLONE_DASHBOARDS);
            default:
                throw new IllegalArgumentException("unknown stage '" + name + "', expected group, folder or dashboards");
        }
    }
}
