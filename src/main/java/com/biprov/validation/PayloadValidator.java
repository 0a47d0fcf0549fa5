package com.biprov.validation;

import com.biprov.domain.ProvisionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses and validates the inbound provisioning payload.
 *
 * Validation policy: every field violation is collected and reported together, each as
 * {@code field: message}, sorted so that the same bytes always yield the same error text.
 * Structural problems (malformed JSON, a non-object root, a field of the wrong JSON type) stop
 * at the first problem because field validation cannot run without a parsed object.
 *
 * The validator has no side effects.
 */
@Component
public class PayloadValidator {

    private static final Logger log = LoggerFactory.getLogger(PayloadValidator.class);

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public PayloadValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = strict(objectMapper);
        this.validator = validator;
    }

    /**
     * Validate raw JSON bytes and produce an immutable request.
     *
     * @param json the decoded event body
     * @return the validated request; {@code templateDashboardIds} is empty when the payload
     *         omitted it
     * @throws ValidationError if the payload cannot be parsed or violates a constraint
     */
    public ProvisionRequest validate(byte[] json) {
        if (json == null || json.length == 0) {
            throw new ValidationError("payload must not be empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ValidationError("payload is not valid JSON: " + originalMessage(e), e);
        }
        return validate(root);
    }

    /**
     * Validate an already-parsed JSON tree.
     */
    public ProvisionRequest validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationError("payload must be a JSON object");
        }

        ProvisionPayload payload;
        try {
            payload = objectMapper.treeToValue(root, ProvisionPayload.class);
        } catch (JsonProcessingException e) {
            throw new ValidationError("payload has an invalid field: " + originalMessage(e), e);
        }

        Set<ConstraintViolation<ProvisionPayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                .map(v -> fieldName(v.getPropertyPath()) + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .distinct()
                .collect(Collectors.toList());
            log.debug("Payload rejected with {} violation(s): {}", messages.size(), messages);
            throw new ValidationError(messages);
        }

        return ProvisionRequest.builder()
            .projectId(payload.getProjectId())
            .groupEmail(payload.getGroupEmail())
            .ancestryPath(payload.getAncestryPath())
            .templateDashboardIds(payload.getTemplateDashboardIds())
            .templateFolderId(payload.getTemplateFolderId())
            .tokens(payload.getTokens())
            .build();
    }

    /**
     * Renders a property path as {@code field}, {@code field[index]} or {@code field[key]},
     * dropping the container-element nodes Hibernate Validator adds.
     */
    public static String fieldName(Path path) {
        StringBuilder sb = new StringBuilder();
        for (Path.Node node : path) {
            String name = node.getName();
            if (name != null && !name.startsWith("<")) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(name);
            }
            if (node.getIndex() != null) {
                sb.append('[').append(node.getIndex()).append(']');
            } else if (node.getKey() != null) {
                sb.append('[').append(node.getKey()).append(']');
            }
        }
        return sb.toString();
    }

    private static String originalMessage(Exception e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }

    /**
     * Copy of the application mapper that refuses silent coercions: no float-to-int truncation
     * and no numeric strings for id fields.
     */
    private static ObjectMapper strict(ObjectMapper source) {
        ObjectMapper mapper = source.copy();
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.coercionConfigFor(LogicalType.Integer)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        return mapper;
    }
}
