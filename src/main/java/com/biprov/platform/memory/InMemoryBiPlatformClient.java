package com.biprov.platform.memory;

import com.biprov.domain.AccessConfig;
import com.biprov.domain.AccessMapping;
import com.biprov.domain.DashboardClone;
import com.biprov.domain.DashboardTemplate;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.RemoteGroup;
import com.biprov.domain.ScheduledPlan;
import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.PlatformException;
import com.biprov.platform.TitleMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-process BI platform used for local runs ({@code provisioner.platform=in-memory}) and tests.
 *
 * Behaves like the real platform where provisioning depends on it: duplicate group and folder
 * names are allowed, dashboards are copied from seeded templates, and the access configuration
 * is replaced wholesale by a write. Operations can be made to fail to exercise error paths.
 */
public class InMemoryBiPlatformClient implements BiPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBiPlatformClient.class);

    private final AtomicLong groupIds = new AtomicLong(1);
    private final AtomicLong folderIds = new AtomicLong(100);
    private final AtomicLong dashboardIds = new AtomicLong(1000);
    private final AtomicLong planIds = new AtomicLong(5000);

    private final List<RemoteGroup> groups = new ArrayList<>();
    private final List<RemoteFolder> folders = new ArrayList<>();
    private final Map<Long, DashboardTemplate> templates = new LinkedHashMap<>();
    private final List<DashboardClone> dashboards = new ArrayList<>();
    private final List<ScheduledPlan> scheduledPlans = new ArrayList<>();
    private AccessConfig accessConfig = AccessConfig.empty();

    private final Set<String> failingOperations = new HashSet<>();
    private final AtomicInteger createCalls = new AtomicInteger();

    // Seeding

    public synchronized DashboardTemplate addTemplate(long id, String title, String description) {
        DashboardTemplate template = new DashboardTemplate(id, title, description);
        templates.put(id, template);
        return template;
    }

    public synchronized RemoteGroup addGroup(String name) {
        RemoteGroup group = new RemoteGroup(groupIds.getAndIncrement(), name);
        groups.add(group);
        return group;
    }

    public synchronized RemoteFolder addFolder(String name, Long parentId) {
        RemoteFolder folder = new RemoteFolder(folderIds.getAndIncrement(), name, parentId);
        folders.add(folder);
        return folder;
    }

    public synchronized DashboardClone addDashboard(String title, long folderId, String description) {
        DashboardClone dashboard = new DashboardClone(dashboardIds.getAndIncrement(), title, folderId, description);
        dashboards.add(dashboard);
        return dashboard;
    }

    public synchronized ScheduledPlan addScheduledPlan(String name, long dashboardId) {
        ScheduledPlan plan = new ScheduledPlan(planIds.getAndIncrement(), name, dashboardId);
        scheduledPlans.add(plan);
        return plan;
    }

    public synchronized void setAccessConfig(AccessConfig config) {
        this.accessConfig = Objects.requireNonNull(config);
    }

    /**
     * Make every subsequent call of {@code operation} (a method name of
     * {@link BiPlatformClient}) throw a {@link PlatformException} with HTTP 503.
     */
    public synchronized void failOn(String operation) {
        failingOperations.add(operation);
    }

    public synchronized void recover(String operation) {
        failingOperations.remove(operation);
    }

    // Inspection

    public synchronized List<RemoteGroup> getGroups() {
        return List.copyOf(groups);
    }

    public synchronized List<RemoteFolder> getFolders() {
        return List.copyOf(folders);
    }

    public synchronized List<DashboardClone> getDashboards() {
        return List.copyOf(dashboards);
    }

    public synchronized List<ScheduledPlan> getScheduledPlans() {
        return List.copyOf(scheduledPlans);
    }

    public synchronized AccessConfig currentAccessConfig() {
        return accessConfig;
    }

    public synchronized Optional<DashboardClone> dashboard(long id) {
        return dashboards.stream().filter(d -> d.getId() == id).findFirst();
    }

    /**
     * Number of entity-creating calls (groups, folders, clones, access writes) served so far.
     */
    public int getCreateCalls() {
        return createCalls.get();
    }

    // BiPlatformClient

    @Override
    public synchronized List<RemoteGroup> findGroupByName(String name) {
        check("findGroupByName");
        return groups.stream()
            .filter(g -> name.equals(g.getName()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized RemoteGroup createGroup(String name) {
        check("createGroup");
        createCalls.incrementAndGet();
        RemoteGroup group = addGroup(name);
        log.debug("Created group {}", group);
        return group;
    }

    @Override
    public synchronized AccessConfig getAccessConfig() {
        check("getAccessConfig");
        return accessConfig;
    }

    @Override
    public boolean groupIsMappedInAccessConfig(AccessConfig config, long groupId) {
        return config.containsGroup(groupId);
    }

    @Override
    public synchronized AccessConfig appendGroupToAccessConfig(AccessConfig config, RemoteGroup group) {
        check("appendGroupToAccessConfig");
        createCalls.incrementAndGet();
        AccessConfig merged = config.merge(AccessMapping.forGroup(group));
        accessConfig = merged;
        if (!accessConfig.containsAll(config)) {
            throw new PlatformException("appendGroupToAccessConfig", "access configuration lost existing entries");
        }
        return accessConfig;
    }

    @Override
    public synchronized List<RemoteFolder> findFolderByName(String name, Long parentId) {
        check("findFolderByName");
        return folders.stream()
            .filter(f -> name.equals(f.getName()) && Objects.equals(f.getParentId(), parentId))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized RemoteFolder createFolder(String name, Long parentId) {
        check("createFolder");
        createCalls.incrementAndGet();
        return addFolder(name, parentId);
    }

    @Override
    public synchronized DashboardTemplate getDashboardTemplate(long templateId) {
        check("getDashboardTemplate");
        DashboardTemplate template = templates.get(templateId);
        if (template == null) {
            throw new PlatformException("getDashboardTemplate", "dashboard " + templateId + " not found", 404, null);
        }
        return template;
    }

    @Override
    public synchronized Optional<DashboardClone> findDashboardByTitle(String title, long folderId) {
        check("findDashboardByTitle");
        return dashboards.stream()
            .filter(d -> d.getFolderId() == folderId && TitleMatcher.matches(d.getTitle(), title))
            .findFirst();
    }

    @Override
    public synchronized DashboardClone cloneDashboard(long templateId, long folderId, String title) {
        check("cloneDashboard");
        DashboardTemplate template = getDashboardTemplate(templateId);
        if (folders.stream().noneMatch(f -> f.getId() == folderId)) {
            throw new PlatformException("cloneDashboard", "folder " + folderId + " not found", 404, null);
        }
        createCalls.incrementAndGet();
        return addDashboard(title, folderId, template.getDescription());
    }

    @Override
    public synchronized void updateDashboardText(long dashboardId, Map<String, String> resolvedFields) {
        check("updateDashboardText");
        DashboardClone existing = dashboard(dashboardId)
            .orElseThrow(() -> new PlatformException("updateDashboardText",
                "dashboard " + dashboardId + " not found", 404, null));
        DashboardClone updated = new DashboardClone(
            existing.getId(),
            resolvedFields.getOrDefault("title", existing.getTitle()),
            existing.getFolderId(),
            resolvedFields.getOrDefault("description", existing.getDescription()));
        dashboards.set(dashboards.indexOf(existing), updated);
    }

    @Override
    public synchronized List<DashboardClone> findDashboardsInFolder(long folderId) {
        check("findDashboardsInFolder");
        return dashboards.stream()
            .filter(d -> d.getFolderId() == folderId)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized RemoteFolder renameFolder(long folderId, String newName) {
        check("renameFolder");
        for (int i = 0; i < folders.size(); i++) {
            RemoteFolder folder = folders.get(i);
            if (folder.getId() == folderId) {
                RemoteFolder renamed = new RemoteFolder(folder.getId(), newName, folder.getParentId());
                folders.set(i, renamed);
                return renamed;
            }
        }
        throw new PlatformException("renameFolder", "folder " + folderId + " not found", 404, null);
    }

    @Override
    public synchronized void deleteDashboard(long dashboardId) {
        check("deleteDashboard");
        boolean removed = dashboards.removeIf(d -> d.getId() == dashboardId);
        if (!removed) {
            throw new PlatformException("deleteDashboard", "dashboard " + dashboardId + " not found", 404, null);
        }
    }

    @Override
    public synchronized List<ScheduledPlan> findScheduledPlansForDashboard(long dashboardId) {
        check("findScheduledPlansForDashboard");
        return scheduledPlans.stream()
            .filter(p -> p.getDashboardId() == dashboardId)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteScheduledPlan(long planId) {
        check("deleteScheduledPlan");
        boolean removed = scheduledPlans.removeIf(p -> p.getId() == planId);
        if (!removed) {
            throw new PlatformException("deleteScheduledPlan", "scheduled plan " + planId + " not found", 404, null);
        }
    }

    private void check(String operation) {
        if (failingOperations.contains(operation)) {
            throw new PlatformException(operation, "simulated platform outage", 503, null);
        }
    }
}
