package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of a group on the BI platform. Owned by the platform and never cached between
 * invocations.
 */
public final class RemoteGroup {

    @JsonProperty("id")
    private final long id;

    @JsonProperty("name")
    private final String name;

    @JsonCreator
    public RemoteGroup(@JsonProperty("id") long id, @JsonProperty("name") String name) {
        this.id = id;
        this.name = name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RemoteGroup)) {
            return false;
        }
        RemoteGroup that = (RemoteGroup) o;
        return id == that.id && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "RemoteGroup{id=" + id + ", name='" + name + "'}";
    }
}
