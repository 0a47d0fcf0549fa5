package com.biprov.platform;

import com.biprov.domain.AccessConfig;
import com.biprov.domain.DashboardClone;
import com.biprov.domain.DashboardTemplate;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.RemoteGroup;
import com.biprov.domain.ScheduledPlan;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability surface of the BI platform that provisioning needs.
 *
 * Implementations talk to the platform directly and hold no state about provisioned entities;
 * every call reflects the platform's current state. Every method may throw
 * {@link PlatformException}. No method retries.
 *
 * @see com.biprov.platform.looker.LookerApiClient
 * @see com.biprov.platform.memory.InMemoryBiPlatformClient
 */
public interface BiPlatformClient {

    /**
     * Groups whose name equals {@code name} exactly, in the order the platform returns them.
     * The platform allows duplicate names, so more than one match is possible.
     */
    List<RemoteGroup> findGroupByName(String name);

    RemoteGroup createGroup(String name);

    AccessConfig getAccessConfig();

    boolean groupIsMappedInAccessConfig(AccessConfig config, long groupId);

    /**
     * Adds a binding for {@code group} to the access configuration. This is a read-merge-write:
     * every mapping of {@code config} is written back along with the new one.
     *
     * @return the configuration as stored after the write
     * @throws PlatformException if the write fails or the stored configuration lost any of the
     *         entries of {@code config}
     */
    AccessConfig appendGroupToAccessConfig(AccessConfig config, RemoteGroup group);

    /**
     * Folders named {@code name} directly under {@code parentId}; a null parent means the
     * platform root.
     */
    List<RemoteFolder> findFolderByName(String name, Long parentId);

    RemoteFolder createFolder(String name, Long parentId);

    DashboardTemplate getDashboardTemplate(long templateId);

    /**
     * The dashboard in {@code folderId} whose title matches {@code title} according to
     * {@link TitleMatcher}, if any.
     */
    Optional<DashboardClone> findDashboardByTitle(String title, long folderId);

    DashboardClone cloneDashboard(long templateId, long folderId, String title);

    /**
     * Overwrites the given text fields ({@code title}, {@code description}) of a dashboard.
     */
    void updateDashboardText(long dashboardId, Map<String, String> resolvedFields);

    List<DashboardClone> findDashboardsInFolder(long folderId);

    RemoteFolder renameFolder(long folderId, String newName);

    void deleteDashboard(long dashboardId);

    List<ScheduledPlan> findScheduledPlansForDashboard(long dashboardId);

    void deleteScheduledPlan(long planId);
}
