package com.biprov.ingestion;

import com.biprov.config.ProvisionerProperties;
import com.biprov.domain.ProvisionRequest;
import com.biprov.domain.ProvisionResult;
import com.biprov.reconcile.ProvisioningError;
import com.biprov.reconcile.ProvisioningEventLog;
import com.biprov.reconcile.ProvisioningMetrics;
import com.biprov.reconcile.ProvisioningReconciler;
import com.biprov.reconcile.ReconcileStage;
import com.biprov.validation.PayloadValidator;
import com.biprov.validation.ValidationError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point shared by every transport.
 *
 * Decodes the event body (raw JSON or a Pub/Sub style envelope whose {@code data} field holds
 * base64 JSON), validates it, runs the reconciler and turns whatever happened into a
 * {@link ProvisionOutcome}. Never throws.
 */
@Component
public class ProvisioningEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEventHandler.class);

    private static final String ENVELOPE_DATA = "data";
    private static final String ENVELOPE_MESSAGE = "message";

    private final PayloadValidator validator;
    private final ProvisioningReconciler reconciler;
    private final ProvisioningEventLog eventLog;
    private final ProvisioningMetrics metrics;
    private final ObjectMapper objectMapper;
    private final ProvisionerProperties properties;

    public ProvisioningEventHandler(
        PayloadValidator validator,
        ProvisioningReconciler reconciler,
        ProvisioningEventLog eventLog,
        ProvisioningMetrics metrics,
        ObjectMapper objectMapper,
        ProvisionerProperties properties
    ) {
        this.validator = validator;
        this.reconciler = reconciler;
        this.eventLog = eventLog;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ProvisionOutcome handle(byte[] body) {
        return handle(body, ReconcileStage.all());
    }

    /**
     * Handles one event, running only {@code stages}.
     */
    public ProvisionOutcome handle(byte[] body, Set<ReconcileStage> stages) {
        String correlationId = UUID.randomUUID().toString();
        Timer.Sample sample = metrics.startTimer();
        JsonNode payload = null;
        ProvisionRequest request = null;

        try (ProvisioningEventLog.Scope scope = eventLog.open(null, correlationId)) {
            try {
                payload = decode(body);
                request = withDefaults(validator.validate(payload));
                eventLog.project(request.getProjectId());
                eventLog.event("provision.start", "groupEmail={} templates={} stages={}",
                    request.getGroupEmail(), request.getTemplateDashboardIds(), stages);

                ProvisionResult result = reconciler.reconcile(request, correlationId, stages);

                metrics.recordCompleted();
                eventLog.event("provision.complete", "groupId={} folderId={} dashboardIds={} created={}",
                    result.getGroupId(), result.getFolderId(), result.getDashboardIds(), result.createdCount());
                return ProvisionOutcome.ok(result);
            } catch (ValidationError e) {
                metrics.recordValidationFailed();
                eventLog.warn("provision.rejected", "error={}", e.getMessage());
                return ProvisionOutcome.validationError(e.getMessage(), text(payload, "projectId"),
                    text(payload, "groupEmail"), correlationId);
            } catch (ProvisioningError e) {
                metrics.recordFailed();
                eventLog.error("provision.failed", "stage={} error={}",
                    e.getStage() != null ? e.getStage().getValue() : null, e.getMessage());
                log.debug("Provisioning failure detail", e);
                return ProvisionOutcome.error(e.getMessage(), projectId(request), groupEmail(request), correlationId);
            } catch (RuntimeException e) {
                metrics.recordFailed();
                eventLog.error("provision.failed", "unexpected error: {}", e.getMessage(), e);
                return ProvisionOutcome.error("unexpected error: " + e.getMessage(), projectId(request),
                    groupEmail(request), correlationId);
            }
        } finally {
            metrics.recordLatency(sample);
        }
    }

    /**
     * Unwraps {@code {"data": "<base64>"}} and {@code {"message": {"data": "<base64>"}}}
     * envelopes. Anything else is taken to be the payload itself.
     */
    JsonNode decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new ValidationError("payload must not be empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ValidationError("payload is not valid JSON: " + originalMessage(e), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ValidationError("payload must not be empty");
        }

        JsonNode data = null;
        if (root.isObject() && root.path(ENVELOPE_MESSAGE).isObject()) {
            data = root.path(ENVELOPE_MESSAGE).get(ENVELOPE_DATA);
        } else if (root.isObject() && root.size() == 1 && root.has(ENVELOPE_DATA)) {
            data = root.get(ENVELOPE_DATA);
        }
        if (data == null) {
            return root;
        }
        if (!data.isTextual()) {
            throw new ValidationError("envelope data must be a base64 string");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(data.asText());
        } catch (IllegalArgumentException e) {
            throw new ValidationError("envelope data is not valid base64", e);
        }
        if (decoded.length == 0) {
            throw new ValidationError("payload must not be empty");
        }
        try {
            return objectMapper.readTree(decoded);
        } catch (IOException e) {
            throw new ValidationError("payload is not valid JSON: " + originalMessage(e), e);
        }
    }

    private ProvisionRequest withDefaults(ProvisionRequest request) {
        ProvisionRequest.Builder builder = request.toBuilder();
        if (request.getTemplateDashboardIds().isEmpty() && !properties.getDefaultTemplateDashboardIds().isEmpty()) {
            builder.templateDashboardIds(properties.getDefaultTemplateDashboardIds());
        }
        if (request.getTemplateFolderId() == null && properties.getDefaultTemplateFolderId() != null) {
            builder.templateFolderId(properties.getDefaultTemplateFolderId());
        }
        return builder.build();
    }

    /**
     * A top-level string field of the raw payload, so rejected requests can still be attributed.
     */
    private static String text(JsonNode payload, String field) {
        if (payload == null || !payload.path(field).isTextual()) {
            return null;
        }
        return payload.get(field).asText();
    }

    private static String originalMessage(IOException e) {
        return e instanceof JsonProcessingException
            ? ((JsonProcessingException) e).getOriginalMessage()
            : e.getMessage();
    }

    private static String projectId(ProvisionRequest request) {
        return request != null ? request.getProjectId() : null;
    }

    private static String groupEmail(ProvisionRequest request) {
        return request != null ? request.getGroupEmail() : null;
    }
}
