package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One binding in the platform's access configuration: an identity-provider group name mapped
 * onto a platform group.
 *
 * Any further attributes the platform stores on a binding (role ids, urls) are kept in
 * {@link #getAttributes()} and written back unchanged, so a merge never strips them. Equality
 * only considers the binding itself ({@code name} and {@code groupId}).
 */
public final class AccessMapping {

    private final String name;
    private final long groupId;
    private final String groupName;
    private final Map<String, Object> attributes;

    public AccessMapping(String name, long groupId, String groupName) {
        this(name, groupId, groupName, Collections.emptyMap());
    }

    public AccessMapping(String name, long groupId, String groupName, Map<String, Object> attributes) {
        this.name = name;
        this.groupId = groupId;
        this.groupName = groupName;
        this.attributes = attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Mapping that binds the identity-provider group of the same name onto {@code group}.
     */
    public static AccessMapping forGroup(RemoteGroup group) {
        return new AccessMapping(group.getName(), group.getId(), group.getName());
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("looker_group_id")
    public long getGroupId() {
        return groupId;
    }

    @JsonProperty("looker_group_name")
    public String getGroupName() {
        return groupName;
    }

    @JsonIgnore
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnyGetter
    Map<String, Object> anyAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessMapping)) {
            return false;
        }
        AccessMapping that = (AccessMapping) o;
        return groupId == that.groupId && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, groupId);
    }

    @Override
    public String toString() {
        return "AccessMapping{name='" + name + "', groupId=" + groupId + "}";
    }
}
