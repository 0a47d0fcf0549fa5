package com.biprov.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A dashboard copied from a template into a project folder.
 *
 * Clone titles follow {@code <template title> (project: <projectId>)}; at most one clone per
 * (template, project) pair is expected to exist in the project folder.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DashboardClone {

    @JsonProperty("id")
    private final long id;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("folder_id")
    private final long folderId;

    @JsonProperty("description")
    private final String description;

    public DashboardClone(long id, String title, long folderId, String description) {
        this.id = id;
        this.title = title;
        this.folderId = folderId;
        this.description = description;
    }

    public DashboardClone(long id, String title, long folderId) {
        this(id, title, folderId, null);
    }

    /**
     * Title given to the clone of {@code templateTitle} for {@code projectId}.
     */
    public static String cloneTitle(String templateTitle, String projectId) {
        return templateTitle + " (project: " + projectId + ")";
    }

    public long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public long getFolderId() {
        return folderId;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DashboardClone)) {
            return false;
        }
        DashboardClone that = (DashboardClone) o;
        return id == that.id && folderId == that.folderId
            && Objects.equals(title, that.title)
            && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, folderId, description);
    }

    @Override
    public String toString() {
        return "DashboardClone{id=" + id + ", title='" + title + "', folderId=" + folderId + "}";
    }
}
