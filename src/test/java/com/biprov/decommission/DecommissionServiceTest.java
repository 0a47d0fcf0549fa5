package com.biprov.decommission;

import com.biprov.config.ProvisionerProperties;
import com.biprov.domain.RemoteFolder;
import com.biprov.domain.ScheduledPlan;
import com.biprov.platform.memory.InMemoryBiPlatformClient;
import com.biprov.reconcile.ProvisioningError;
import com.biprov.reconcile.ProvisioningEventLog;
import com.biprov.validation.ValidationError;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DecommissionService Tests")
class DecommissionServiceTest {

    private ValidatorFactory validatorFactory;
    private InMemoryBiPlatformClient platform;
    private DecommissionService service;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        platform = new InMemoryBiPlatformClient();
        service = new DecommissionService(platform, new ProvisioningEventLog(), validatorFactory.getValidator(),
            new ProvisionerProperties());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("Should archive the project folder and keep its dashboards by default")
    void shouldArchiveFolder() {
        // Given
        RemoteFolder folder = platform.addFolder("Project: demo-proj", null);
        platform.addDashboard("Costs (project: demo-proj)", folder.getId(), null);

        // When
        DecommissionResult result = service.decommission(new DecommissionRequest("demo-proj", true, false));

        // Then
        assertThat(result.getFolderId()).isEqualTo(folder.getId());
        assertThat(result.isArchivedFolder()).isTrue();
        assertThat(result.getDeletedDashboards()).isZero();
        assertThat(platform.getFolders()).extracting(RemoteFolder::getName)
            .containsExactly("Archived: Project: demo-proj");
        assertThat(platform.getDashboards()).hasSize(1);
    }

    @Test
    @DisplayName("Should delete every dashboard in the folder when asked")
    void shouldDeleteDashboards() {
        RemoteFolder folder = platform.addFolder("Project: demo-proj", null);
        RemoteFolder other = platform.addFolder("Project: other-proj", null);
        platform.addDashboard("A", folder.getId(), null);
        platform.addDashboard("B", folder.getId(), null);
        platform.addDashboard("C", other.getId(), null);

        DecommissionResult result = service.decommission(new DecommissionRequest("demo-proj", false, true));

        assertThat(result.getDeletedDashboards()).isEqualTo(2);
        assertThat(result.isArchivedFolder()).isFalse();
        assertThat(platform.getDashboards()).hasSize(1);
        assertThat(platform.findFolderByName("Project: demo-proj", null)).hasSize(1);
    }

    @Test
    @DisplayName("Should delete the scheduled plans of the folder's dashboards before the dashboards")
    void shouldDeleteSchedules() {
        // Given
        RemoteFolder folder = platform.addFolder("Project: demo-proj", null);
        RemoteFolder other = platform.addFolder("Project: other-proj", null);
        long costs = platform.addDashboard("Costs (project: demo-proj)", folder.getId(), null).getId();
        long usage = platform.addDashboard("Usage (project: demo-proj)", folder.getId(), null).getId();
        long foreign = platform.addDashboard("Costs (project: other-proj)", other.getId(), null).getId();
        platform.addScheduledPlan("daily costs", costs);
        platform.addScheduledPlan("weekly costs", costs);
        platform.addScheduledPlan("daily usage", usage);
        ScheduledPlan kept = platform.addScheduledPlan("daily costs", foreign);

        // When
        DecommissionResult result = service.decommission(new DecommissionRequest("demo-proj", true, true, true));

        // Then
        assertThat(result.getDeletedSchedules()).isEqualTo(3);
        assertThat(result.getDeletedDashboards()).isEqualTo(2);
        assertThat(platform.getScheduledPlans()).containsExactly(kept);
    }

    @Test
    @DisplayName("Should keep the dashboards when only the schedules are to go")
    void shouldDeleteSchedulesOnly() {
        RemoteFolder folder = platform.addFolder("Project: demo-proj", null);
        long costs = platform.addDashboard("Costs (project: demo-proj)", folder.getId(), null).getId();
        platform.addScheduledPlan("daily costs", costs);

        DecommissionResult result = service.decommission(new DecommissionRequest("demo-proj", false, false, true));

        assertThat(result.getDeletedSchedules()).isEqualTo(1);
        assertThat(result.getDeletedDashboards()).isZero();
        assertThat(platform.getScheduledPlans()).isEmpty();
        assertThat(platform.getDashboards()).hasSize(1);
    }

    @Test
    @DisplayName("Should do nothing when the project has no folder, so a second run is harmless")
    void shouldBeIdempotent() {
        platform.addFolder("Project: demo-proj", null);
        service.decommission(new DecommissionRequest("demo-proj", true, true));

        DecommissionResult second = service.decommission(new DecommissionRequest("demo-proj", true, true));

        assertThat(second.getFolderId()).isNull();
        assertThat(second.isArchivedFolder()).isFalse();
        assertThat(second.getDeletedDashboards()).isZero();
    }

    @Test
    @DisplayName("Should refuse to pick between duplicate project folders")
    void shouldFailOnAmbiguousFolder() {
        platform.addFolder("Project: demo-proj", null);
        platform.addFolder("Project: demo-proj", null);

        assertThatThrownBy(() -> service.decommission(new DecommissionRequest("demo-proj", true, false)))
            .isInstanceOf(ProvisioningError.class)
            .hasMessageContaining("ambiguous folder");
    }

    @Test
    @DisplayName("Should wrap platform failures with the failed operation")
    void shouldWrapPlatformFailures() {
        platform.addFolder("Project: demo-proj", null);
        platform.failOn("renameFolder");

        assertThatThrownBy(() -> service.decommission(new DecommissionRequest("demo-proj", true, false)))
            .isInstanceOf(ProvisioningError.class)
            .hasMessageStartingWith("renameFolder failed: ");
    }

    @Test
    @DisplayName("Should reject an invalid project id")
    void shouldValidateRequest() {
        assertThatThrownBy(() -> service.decommission(new DecommissionRequest("AB", true, false)))
            .isInstanceOf(ValidationError.class)
            .hasMessageStartingWith("projectId: ");
        assertThatThrownBy(() -> service.decommission(null))
            .isInstanceOf(ValidationError.class);
    }
}
