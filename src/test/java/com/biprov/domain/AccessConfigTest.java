package com.biprov.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessConfig Tests")
class AccessConfigTest {

    private static AccessConfig existing() {
        return new AccessConfig(List.of(
            new AccessMapping("admins@example.com", 1L, "admins@example.com", Map.of("role_ids", List.of("2"))),
            new AccessMapping("viewers@example.com", 2L, "viewers@example.com")));
    }

    @Test
    @DisplayName("Should grow from N to N+1 entries and keep existing ones in order")
    void shouldAppendNewMapping() {
        // Given
        AccessConfig config = existing();
        RemoteGroup group = new RemoteGroup(9L, "team@example.com");

        // When
        AccessConfig merged = config.merge(AccessMapping.forGroup(group));

        // Then
        assertThat(merged.size()).isEqualTo(config.size() + 1);
        assertThat(merged.getMappings().subList(0, 2)).isEqualTo(config.getMappings());
        assertThat(merged.getMappings().get(2).getGroupId()).isEqualTo(9L);
        assertThat(merged.containsAll(config)).isTrue();
        assertThat(config.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should treat merging an already bound group as a no-op")
    void shouldNotDuplicateMapping() {
        AccessConfig config = existing();

        AccessConfig merged = config.merge(new AccessMapping("other-name", 2L, "other-name"));

        assertThat(merged).isSameAs(config);
        assertThat(merged.containsGroup(2L)).isTrue();
    }

    @Test
    @DisplayName("Should keep opaque attributes of existing mappings")
    void shouldKeepAttributes() {
        AccessConfig merged = existing().merge(new AccessMapping("x@example.com", 3L, "x@example.com"));

        assertThat(merged.getMappings().get(0).getAttributes()).containsEntry("role_ids", List.of("2"));
    }

    @Test
    @DisplayName("Should detect a snapshot that lost entries")
    void shouldDetectLostEntries() {
        AccessConfig config = existing();
        AccessConfig truncated = new AccessConfig(List.of(config.getMappings().get(1)));

        assertThat(truncated.containsAll(config)).isFalse();
        assertThat(AccessConfig.empty().containsGroup(1L)).isFalse();
    }
}
