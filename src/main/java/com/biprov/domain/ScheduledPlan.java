package com.biprov.domain;

import java.util.Objects;

/**
 * A scheduled delivery of a dashboard.
 */
public final class ScheduledPlan {

    private final long id;
    private final String name;
    private final long dashboardId;

    public ScheduledPlan(long id, String name, long dashboardId) {
        this.id = id;
        this.name = name;
        this.dashboardId = dashboardId;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getDashboardId() {
        return dashboardId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScheduledPlan)) {
            return false;
        }
        ScheduledPlan that = (ScheduledPlan) o;
        return id == that.id && dashboardId == that.dashboardId && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, dashboardId);
    }

    @Override
    public String toString() {
        return "ScheduledPlan{id=" + id + ", name='" + name + "', dashboardId=" + dashboardId + "}";
    }
}
