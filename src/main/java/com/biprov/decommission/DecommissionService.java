package com.biprov.decommission;

import com.biprov.config.ProvisionerProperties;
import com.biprov.domain.DashboardClone;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.ScheduledPlan;
import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.PlatformException;
import com.biprov.reconcile.ProvisioningError;
import com.biprov.reconcile.ProvisioningEventLog;
import com.biprov.validation.PayloadValidator;
import com.biprov.validation.ValidationError;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Retires the BI resources of a project.
 *
 * The project folder is renamed to {@code Archived: Project: <projectId>} and, on request, the
 * scheduled deliveries of its dashboards and then the dashboards themselves are deleted first. The group and its access mapping are left alone because other
 * projects may share them. A second run finds no {@code Project: ...} folder and does nothing.
 */
@Service
public class DecommissionService {

    private static final Logger log = LoggerFactory.getLogger(DecommissionService.class);

    static final String ARCHIVED_PREFIX = "Archived: ";

    private final BiPlatformClient platform;
    private final ProvisioningEventLog eventLog;
    private final Validator validator;
    private final Long parentFolderId;

    public DecommissionService(
        BiPlatformClient platform,
        ProvisioningEventLog eventLog,
        Validator validator,
        ProvisionerProperties properties
    ) {
        this.platform = platform;
        this.eventLog = eventLog;
        this.validator = validator;
        this.parentFolderId = properties.getParentFolderId();
    }

    /**
     * @throws ValidationError if the request is malformed
     * @throws ProvisioningError if a platform call fails or several project folders exist
     */
    public DecommissionResult decommission(DecommissionRequest request) {
        validate(request);
        String correlationId = UUID.randomUUID().toString();
        String projectId = request.getProjectId();
        String folderName = "Project: " + projectId;

        try (ProvisioningEventLog.Scope scope = eventLog.open(projectId, correlationId)) {
            eventLog.event("decommission.start", "archiveFolder={} deleteDashboards={} deleteSchedules={}",
                request.isArchiveFolder(), request.isDeleteDashboards(), request.isDeleteSchedules());

            List<RemoteFolder> folders = remote("findFolderByName",
                () -> platform.findFolderByName(folderName, parentFolderId));
            if (folders.isEmpty()) {
                eventLog.event("decommission.complete", "no folder named '{}'", folderName);
                return DecommissionResult.nothingToDo(projectId, correlationId);
            }
            if (folders.size() > 1) {
                List<Long> ids = folders.stream().map(RemoteFolder::getId).collect(Collectors.toList());
                throw new ProvisioningError(null, "findFolderByName",
                    "ambiguous folder '" + folderName + "': " + folders.size() + " folders match " + ids, null);
            }
            RemoteFolder folder = folders.get(0);

            List<DashboardClone> dashboards = List.of();
            if (request.isDeleteDashboards() || request.isDeleteSchedules()) {
                dashboards = remote("findDashboardsInFolder", () -> platform.findDashboardsInFolder(folder.getId()));
            }

            // Plans go first: they are looked up through their dashboard.
            int deletedSchedules = 0;
            if (request.isDeleteSchedules()) {
                for (DashboardClone dashboard : dashboards) {
                    List<ScheduledPlan> plans = remote("findScheduledPlansForDashboard",
                        () -> platform.findScheduledPlansForDashboard(dashboard.getId()));
                    for (ScheduledPlan plan : plans) {
                        remote("deleteScheduledPlan", () -> {
                            platform.deleteScheduledPlan(plan.getId());
                            return null;
                        });
                        deletedSchedules++;
                        log.debug("Deleted scheduled plan {} of dashboard {}", plan.getId(), dashboard.getId());
                    }
                }
            }

            int deleted = 0;
            if (request.isDeleteDashboards()) {
                for (DashboardClone dashboard : dashboards) {
                    remote("deleteDashboard", () -> {
                        platform.deleteDashboard(dashboard.getId());
                        return null;
                    });
                    deleted++;
                    log.debug("Deleted dashboard {} '{}'", dashboard.getId(), dashboard.getTitle());
                }
            }

            boolean archived = false;
            if (request.isArchiveFolder()) {
                remote("renameFolder", () -> platform.renameFolder(folder.getId(), ARCHIVED_PREFIX + folderName));
                archived = true;
            }

            eventLog.event("decommission.complete", "folderId={} archived={} deletedDashboards={} deletedSchedules={}",
                folder.getId(), archived, deleted, deletedSchedules);
            return new DecommissionResult(projectId, folder.getId(), archived, deleted, deletedSchedules, correlationId);
        }
    }

    private void validate(DecommissionRequest request) {
        if (request == null) {
            throw new ValidationError("payload must not be empty");
        }
        Set<ConstraintViolation<DecommissionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ValidationError(violations.stream()
                .map(v -> PayloadValidator.fieldName(v.getPropertyPath()) + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.toList()));
        }
    }

    private <T> T remote(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (PlatformException e) {
            throw ProvisioningError.platformFailure(null, operation, e);
        }
    }
}
