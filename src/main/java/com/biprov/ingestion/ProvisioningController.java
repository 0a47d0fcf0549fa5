package com.biprov.ingestion;

import com.biprov.decommission.DecommissionRequest;
import com.biprov.decommission.DecommissionResult;
import com.biprov.decommission.DecommissionService;
import com.biprov.reconcile.ReconcileStage;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * HTTP transport for provisioning events.
 *
 * The body is passed through as raw bytes so that envelope decoding and validation behave
 * exactly as they do for Kafka records. Authentication is expected upstream.
 */
@RestController
@RequestMapping("/api")
public class ProvisioningController {

    private final ProvisioningEventHandler eventHandler;
    private final DecommissionService decommissionService;

    public ProvisioningController(ProvisioningEventHandler eventHandler, DecommissionService decommissionService) {
        this.eventHandler = eventHandler;
        this.decommissionService = decommissionService;
    }

    @PostMapping(value = "/provision", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProvisionOutcome> provision(@RequestBody(required = false) byte[] body) {
        ProvisionOutcome outcome = eventHandler.handle(body);
        return ResponseEntity.status(outcome.httpStatus()).body(outcome);
    }

    /**
     * Runs a single-purpose subset: {@code group} (group and access mapping), {@code folder}, or
     * {@code dashboards} (folder and clones).
     */
    @PostMapping(value = "/provision/stages/{stage}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProvisionOutcome> provisionStage(
        @PathVariable String stage,
        @RequestBody(required = false) byte[] body
    ) {
        Set<ReconcileStage> stages = ReconcileStage.forEntryPoint(stage);
        ProvisionOutcome outcome = eventHandler.handle(body, stages);
        return ResponseEntity.status(outcome.httpStatus()).body(outcome);
    }

    @PostMapping(value = "/decommission", produces = MediaType.APPLICATION_JSON_VALUE)
    public DecommissionResult decommission(@RequestBody DecommissionRequest request) {
        return decommissionService.decommission(request);
    }
}
