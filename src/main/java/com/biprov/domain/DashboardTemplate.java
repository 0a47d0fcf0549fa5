package com.biprov.domain;

/**
 * Read-only view of a template dashboard, as fetched before cloning.
 */
public final class DashboardTemplate {

    private final long id;
    private final String title;
    private final String description;

    public DashboardTemplate(long id, String title, String description) {
        this.id = id;
        this.title = title;
        this.description = description;
    }

    public long getId() {
        return id;
    }

    /**
     * Title of the template, falling back to {@code dashboard-<id>} when the platform returns
     * none.
     */
    public String getTitle() {
        return title == null || title.isBlank() ? "dashboard-" + id : title;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "DashboardTemplate{id=" + id + ", title='" + title + "'}";
    }
}
