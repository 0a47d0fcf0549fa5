package com.biprov.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the platform's global group-to-access mapping (the SAML group bindings on
 * Looker).
 *
 * From the provisioner's point of view this is an append-only set keyed by platform group id:
 * {@link #merge(AccessMapping)} never removes or rewrites an existing entry. Snapshots are
 * immutable; merging returns a new snapshot.
 */
public final class AccessConfig {

    private final List<AccessMapping> mappings;

    public AccessConfig(List<AccessMapping> mappings) {
        this.mappings = mappings == null ? Collections.emptyList() : List.copyOf(mappings);
    }

    public static AccessConfig empty() {
        return new AccessConfig(Collections.emptyList());
    }

    public List<AccessMapping> getMappings() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }

    public boolean containsGroup(long groupId) {
        return mappings.stream().anyMatch(m -> m.getGroupId() == groupId);
    }

    /**
     * Returns a snapshot holding every existing mapping in its original order followed by
     * {@code mapping}, or this snapshot when the group is already bound.
     */
    public AccessConfig merge(AccessMapping mapping) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        if (containsGroup(mapping.getGroupId())) {
            return this;
        }
        List<AccessMapping> merged = new ArrayList<>(mappings.size() + 1);
        merged.addAll(mappings);
        merged.add(mapping);
        return new AccessConfig(merged);
    }

    /**
     * True when every mapping of {@code other} is still present here. Used to detect writes
     * that dropped entries.
     */
    public boolean containsAll(AccessConfig other) {
        return mappings.containsAll(other.mappings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessConfig)) {
            return false;
        }
        return mappings.equals(((AccessConfig) o).mappings);
    }

    @Override
    public int hashCode() {
        return mappings.hashCode();
    }

    @Override
    public String toString() {
        return "AccessConfig{mappings=" + mappings + "}";
    }
}
