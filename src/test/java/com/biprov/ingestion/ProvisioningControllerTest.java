package com.biprov.ingestion;

import com.biprov.decommission.DecommissionRequest;
import com.biprov.decommission.DecommissionResult;
import com.biprov.decommission.DecommissionService;
import com.biprov.domain.ProvisionResult;
import com.biprov.reconcile.ProvisioningError;
import com.biprov.reconcile.ReconcileStage;
import com.biprov.validation.ValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumSet;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProvisioningController.class)
@DisplayName("ProvisioningController Tests")
class ProvisioningControllerTest {

    private static final String PAYLOAD = "{\"projectId\":\"demo-proj\",\"groupEmail\":\"team@example.com\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProvisioningEventHandler eventHandler;

    @MockBean
    private DecommissionService decommissionService;

    private static ProvisionOutcome okOutcome() {
        return ProvisionOutcome.ok(new ProvisionResult(
            "demo-proj", "team@example.com", 1L, 100L, List.of(1000L), "corr-1", List.of()));
    }

    @Test
    @DisplayName("Should return 200 with the result body on success")
    void shouldReturnOk() throws Exception {
        when(eventHandler.handle(any(byte[].class))).thenReturn(okOutcome());

        mockMvc.perform(post("/api/provision").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.groupId").value(1))
            .andExpect(jsonPath("$.folderId").value(100))
            .andExpect(jsonPath("$.dashboardIds[0]").value(1000))
            .andExpect(jsonPath("$.correlationId").value("corr-1"));
    }

    @Test
    @DisplayName("Should return 400 for a validation error")
    void shouldReturnBadRequest() throws Exception {
        when(eventHandler.handle(any(byte[].class)))
            .thenReturn(ProvisionOutcome.validationError("projectId: is required", null, null, "corr-2"));

        mockMvc.perform(post("/api/provision").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("validation_error"))
            .andExpect(jsonPath("$.error").value("projectId: is required"))
            .andExpect(jsonPath("$.projectId").doesNotExist());
    }

    @Test
    @DisplayName("Should return 502 for a platform failure")
    void shouldReturnBadGateway() throws Exception {
        when(eventHandler.handle(any(byte[].class)))
            .thenReturn(ProvisionOutcome.error("createGroup failed: boom", "demo-proj", "team@example.com", "c"));

        mockMvc.perform(post("/api/provision").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.projectId").value("demo-proj"));
    }

    @Test
    @DisplayName("Should map the stage path onto the matching stage subset")
    void shouldRunStageSubset() throws Exception {
        when(eventHandler.handle(any(byte[].class), any())).thenReturn(okOutcome());

        mockMvc.perform(post("/api/provision/stages/dashboards").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
            .andExpect(status().isOk());

        verify(eventHandler).handle(any(byte[].class),
            eq(EnumSet.of(ReconcileStage.ENSURE_FOLDER, ReconcileStage.CLONE_DASHBOARDS)));
    }

    @Test
    @DisplayName("Should reject an unknown stage name with 400")
    void shouldRejectUnknownStage() throws Exception {
        mockMvc.perform(post("/api/provision/stages/everything").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("validation_error"));
    }

    @Test
    @DisplayName("Should return the decommission result")
    void shouldDecommission() throws Exception {
        when(decommissionService.decommission(any(DecommissionRequest.class)))
            .thenReturn(new DecommissionResult("demo-proj", 100L, true, 2, "corr-3"));

        mockMvc.perform(post("/api/decommission").contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectId\":\"demo-proj\",\"deleteDashboards\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.archivedFolder").value(true))
            .andExpect(jsonPath("$.deletedDashboards").value(2));
    }

    @Test
    @DisplayName("Should map decommission exceptions to 400 and 502")
    void shouldMapDecommissionErrors() throws Exception {
        when(decommissionService.decommission(any(DecommissionRequest.class)))
            .thenThrow(new ValidationError("projectId: is required"))
            .thenThrow(new ProvisioningError(null, "renameFolder", "renameFolder failed: down", null));

        mockMvc.perform(post("/api/decommission").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("projectId: is required"));

        mockMvc.perform(post("/api/decommission").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("renameFolder failed: down"));
    }
}
