package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A folder on the BI platform. {@code parentId} is null for folders directly under the
 * platform root.
 */
public final class RemoteFolder {

    @JsonProperty("id")
    private final long id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("parent_id")
    private final Long parentId;

    @JsonCreator
    public RemoteFolder(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("parent_id") Long parentId
    ) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Long getParentId() {
        return parentId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RemoteFolder)) {
            return false;
        }
        RemoteFolder that = (RemoteFolder) o;
        return id == that.id && Objects.equals(name, that.name) && Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, parentId);
    }

    @Override
    public String toString() {
        return "RemoteFolder{id=" + id + ", name='" + name + "', parentId=" + parentId + "}";
    }
}
