package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a stage did to its remote entity.
 */
public enum ResourceAction {

    CREATED("created"),

    REUSED("reused");

    private final String value;

    ResourceAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
