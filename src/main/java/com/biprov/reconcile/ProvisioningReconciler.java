package com.biprov.reconcile;

import com.biprov.config.ProvisionerProperties;
import com.biprov.domain.AccessConfig;
import com.biprov.domain.DashboardClone;
import com.biprov.domain.DashboardTemplate;
import com.biprov.domain.ProvisionRequest;
import com.biprov.domain.ProvisionResult;
import com.biprov.domain.ProvisionedResource;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.RemoteGroup;
import com.biprov.domain.ResourceAction;
import com.biprov.domain.ResourceKind;
import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.PlatformException;
import com.biprov.template.TokenContext;
import com.biprov.template.TokenSubstitutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Drives the BI platform towards the desired state for one project.
 *
 * Stages run strictly in order: group, access mapping, folder, dashboard clones. Each stage
 * looks the entity up before creating it, so a re-run with the same request creates nothing
 * and returns the same ids. Nothing is cached between runs.
 *
 * Failures are never retried. A failed platform call ends the run with a
 * {@link ProvisioningError}; entities created before it stay on the platform and are picked up
 * by the next run.
 */
@Service
public class ProvisioningReconciler {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningReconciler.class);

    private final BiPlatformClient platform;
    private final TokenSubstitutionEngine substitutionEngine;
    private final ProvisioningEventLog eventLog;
    private final ProvisioningMetrics metrics;
    private final Clock clock;

    private final GroupMatchPolicy groupMatchPolicy;
    private final String groupAliasPrefix;
    private final Long parentFolderId;
    private final Duration invocationTimeout;

    @Autowired
    public ProvisioningReconciler(
        BiPlatformClient platform,
        TokenSubstitutionEngine substitutionEngine,
        ProvisionerProperties properties,
        ProvisioningEventLog eventLog,
        ProvisioningMetrics metrics
    ) {
        this(platform, substitutionEngine, properties, eventLog, metrics, Clock.systemUTC());
    }

    public ProvisioningReconciler(
        BiPlatformClient platform,
        TokenSubstitutionEngine substitutionEngine,
        ProvisionerProperties properties,
        ProvisioningEventLog eventLog,
        ProvisioningMetrics metrics,
        Clock clock
    ) {
        this.platform = platform;
        this.substitutionEngine = substitutionEngine;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.clock = clock;
        this.groupMatchPolicy = properties.getGroupMatchPolicy();
        this.groupAliasPrefix = properties.getGroupAliasPrefix();
        this.parentFolderId = properties.getParentFolderId();
        this.invocationTimeout = properties.getInvocationTimeout();
    }

    /**
     * Runs every stage.
     */
    public ProvisionResult reconcile(ProvisionRequest request, String correlationId) {
        return reconcile(request, correlationId, ReconcileStage.all());
    }

    /**
     * Runs the given subset of stages, still in their natural order.
     *
     * @throws ProvisioningError if any platform call fails, the platform holds conflicting
     *         entities, or the invocation deadline passes
     * @throws com.biprov.validation.ValidationError if template text references an unknown
     *         token under the {@code FAIL} policy
     */
    public ProvisionResult reconcile(ProvisionRequest request, String correlationId, Set<ReconcileStage> stages) {
        Objects.requireNonNull(request, "request must not be null");
        ReconcileRun run = new ReconcileRun(request, correlationId, clock, invocationTimeout);

        try {
            if (stages.contains(ReconcileStage.ENSURE_GROUP) || stages.contains(ReconcileStage.ENSURE_ACCESS_MAPPING)) {
                RemoteGroup group = ensureGroup(run);
                if (stages.contains(ReconcileStage.ENSURE_ACCESS_MAPPING)) {
                    ensureAccessMapping(run, group);
                }
            }
            if (stages.contains(ReconcileStage.ENSURE_FOLDER) || stages.contains(ReconcileStage.CLONE_DASHBOARDS)) {
                RemoteFolder folder = ensureFolder(run);
                if (stages.contains(ReconcileStage.CLONE_DASHBOARDS)) {
                    cloneDashboards(run, folder);
                }
            }
            ProvisionResult result = run.complete();
            log.debug("Run {} completed: {}", correlationId, result.getResources());
            return result;
        } catch (RuntimeException e) {
            run.fail();
            throw e;
        }
    }

    // Stage 1

    RemoteGroup ensureGroup(ReconcileRun run) {
        enter(run, ReconcileStage.ENSURE_GROUP);
        String email = run.getRequest().getGroupEmail();

        List<RemoteGroup> matches = remote(run, "findGroupByName", () -> platform.findGroupByName(email));
        if (matches.isEmpty() && groupAliasPrefix != null && !groupAliasPrefix.isEmpty()) {
            String alias = groupAliasPrefix + email;
            matches = remote(run, "findGroupByName", () -> platform.findGroupByName(alias));
            if (!matches.isEmpty()) {
                log.debug("Group {} found under alias {}", email, alias);
            }
        }

        RemoteGroup group;
        ResourceAction action;
        if (matches.isEmpty()) {
            group = remote(run, "createGroup", () -> platform.createGroup(email));
            action = ResourceAction.CREATED;
            eventLog.event("group.create", "groupId={} name={}", group.getId(), group.getName());
        } else {
            if (matches.size() > 1) {
                List<Long> ids = matches.stream().map(RemoteGroup::getId).collect(Collectors.toList());
                if (groupMatchPolicy == GroupMatchPolicy.STRICT) {
                    throw new ProvisioningError(ReconcileStage.ENSURE_GROUP,
                        "ambiguous group '" + email + "': " + matches.size() + " groups match " + ids);
                }
                eventLog.warn("group.ambiguous", "name={} candidates={} using={}", email, ids, ids.get(0));
            }
            group = matches.get(0);
            action = ResourceAction.REUSED;
            eventLog.event("group.reuse", "groupId={} name={}", group.getId(), group.getName());
        }

        run.groupResolved(resource(ResourceKind.GROUP, group.getId(), action, null));
        return group;
    }

    // Stage 2

    void ensureAccessMapping(ReconcileRun run, RemoteGroup group) {
        enter(run, ReconcileStage.ENSURE_ACCESS_MAPPING);

        AccessConfig config = remote(run, "getAccessConfig", platform::getAccessConfig);
        ResourceAction action;
        if (platform.groupIsMappedInAccessConfig(config, group.getId())) {
            action = ResourceAction.REUSED;
            eventLog.event("access.reuse", "groupId={} mappings={}", group.getId(), config.size());
        } else {
            AccessConfig updated = remote(run, "appendGroupToAccessConfig",
                () -> platform.appendGroupToAccessConfig(config, group));
            action = ResourceAction.CREATED;
            eventLog.event("access.create", "groupId={} mappings={}->{}", group.getId(), config.size(), updated.size());
        }
        run.accessMapped(resource(ResourceKind.ACCESS_MAPPING, group.getId(), action, null));
    }

    // Stage 3

    RemoteFolder ensureFolder(ReconcileRun run) {
        enter(run, ReconcileStage.ENSURE_FOLDER);
        String name = run.getRequest().folderName();

        List<RemoteFolder> matches = remote(run, "findFolderByName", () -> platform.findFolderByName(name, parentFolderId));
        RemoteFolder folder;
        ResourceAction action;
        if (matches.isEmpty()) {
            folder = remote(run, "createFolder", () -> platform.createFolder(name, parentFolderId));
            action = ResourceAction.CREATED;
            eventLog.event("folder.create", "folderId={} name={}", folder.getId(), name);
        } else if (matches.size() == 1) {
            folder = matches.get(0);
            action = ResourceAction.REUSED;
            eventLog.event("folder.reuse", "folderId={} name={}", folder.getId(), name);
        } else {
            List<Long> ids = matches.stream().map(RemoteFolder::getId).collect(Collectors.toList());
            throw new ProvisioningError(ReconcileStage.ENSURE_FOLDER,
                "ambiguous folder '" + name + "': " + matches.size() + " folders match " + ids);
        }

        run.folderResolved(resource(ResourceKind.FOLDER, folder.getId(), action, null));
        return folder;
    }

    // Stage 4

    /**
     * Clones each template into the project folder, in request order.
     *
     * A clone starts out under the template's own title and only gets its final title when its
     * text is written. A dashboard still carrying the template title is therefore a clone whose
     * text write never happened (or failed), and is adopted instead of copied again. The final
     * title is resolved before the lookup so that a re-run finds the clone under the title it was
     * given. Finished clones keep their current text.
     */
    void cloneDashboards(ReconcileRun run, RemoteFolder folder) {
        enter(run, ReconcileStage.CLONE_DASHBOARDS);
        ProvisionRequest request = run.getRequest();
        TokenContext context = TokenContext.of(request);

        for (Long templateId : request.getTemplateDashboardIds()) {
            DashboardTemplate template = remote(run, "getDashboardTemplate",
                () -> platform.getDashboardTemplate(templateId));

            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(TokenSubstitutionEngine.FIELD_TITLE,
                DashboardClone.cloneTitle(template.getTitle(), request.getProjectId()));
            if (template.getDescription() != null) {
                fields.put(TokenSubstitutionEngine.FIELD_DESCRIPTION, template.getDescription());
            }
            Map<String, String> resolved = substitutionEngine.applyToDashboard(fields, context);
            String title = resolved.get(TokenSubstitutionEngine.FIELD_TITLE);

            Optional<DashboardClone> existing = remote(run, "findDashboardByTitle",
                () -> platform.findDashboardByTitle(title, folder.getId()));
            if (existing.isPresent()) {
                DashboardClone clone = existing.get();
                eventLog.event("dashboard.reuse", "templateId={} dashboardId={} title={}",
                    templateId, clone.getId(), title);
                run.dashboardResolved(resource(ResourceKind.DASHBOARD, clone.getId(), ResourceAction.REUSED,
                    templateId, false));
                continue;
            }

            Optional<DashboardClone> unfinished = remote(run, "findDashboardByTitle",
                () -> platform.findDashboardByTitle(template.getTitle(), folder.getId()));
            DashboardClone clone;
            ResourceAction action;
            if (unfinished.isPresent()) {
                clone = unfinished.get();
                action = ResourceAction.REUSED;
                eventLog.event("dashboard.adopt", "templateId={} dashboardId={} title={}",
                    templateId, clone.getId(), clone.getTitle());
            } else {
                clone = remote(run, "cloneDashboard",
                    () -> platform.cloneDashboard(templateId, folder.getId(), template.getTitle()));
                action = ResourceAction.CREATED;
                eventLog.event("dashboard.clone", "templateId={} dashboardId={} title={}",
                    templateId, clone.getId(), title);
            }

            boolean textPending = !writeText(run, templateId, clone, changedText(clone, resolved));
            run.dashboardResolved(resource(ResourceKind.DASHBOARD, clone.getId(), action, templateId, textPending));
        }
    }

    /**
     * Writes the resolved text of a clone. A failed write is not fatal: the clone keeps the
     * template title, the next run adopts it and writes again.
     *
     * @return whether the clone now carries its final text
     * @throws ProvisioningError when the invocation deadline has passed
     */
    private boolean writeText(ReconcileRun run, long templateId, DashboardClone clone, Map<String, String> changed) {
        if (changed.isEmpty()) {
            return true;
        }
        run.checkDeadline("updateDashboardText");
        try {
            platform.updateDashboardText(clone.getId(), changed);
            return true;
        } catch (PlatformException e) {
            eventLog.warn("dashboard.template_failed", "templateId={} dashboardId={} error={}",
                templateId, clone.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Resolved fields that differ from what the fresh clone carries.
     */
    private static Map<String, String> changedText(DashboardClone clone, Map<String, String> resolved) {
        Map<String, String> changed = new LinkedHashMap<>();
        String title = resolved.get(TokenSubstitutionEngine.FIELD_TITLE);
        if (title != null && !title.equals(clone.getTitle())) {
            changed.put(TokenSubstitutionEngine.FIELD_TITLE, title);
        }
        String description = resolved.get(TokenSubstitutionEngine.FIELD_DESCRIPTION);
        if (description != null && !description.equals(clone.getDescription())) {
            changed.put(TokenSubstitutionEngine.FIELD_DESCRIPTION, description);
        }
        return changed;
    }

    private void enter(ReconcileRun run, ReconcileStage stage) {
        run.enter(stage);
        eventLog.stage(stage);
        eventLog.event("stage.start", "stage={}", stage.getValue());
    }

    /**
     * One platform call: deadline check, then the call, with platform failures wrapped.
     */
    private <T> T remote(ReconcileRun run, String operation, Supplier<T> call) {
        run.checkDeadline(operation);
        try {
            return call.get();
        } catch (PlatformException e) {
            throw ProvisioningError.platformFailure(run.getStage(), operation, e);
        }
    }

    private ProvisionedResource resource(ResourceKind kind, long id, ResourceAction action, Long templateId) {
        return resource(kind, id, action, templateId, false);
    }

    private ProvisionedResource resource(ResourceKind kind, long id, ResourceAction action, Long templateId,
                                         boolean textPending) {
        metrics.recordResource(kind, action);
        return new ProvisionedResource(kind, id, action, templateId, textPending);
    }
}
