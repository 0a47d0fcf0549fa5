package com.biprov.ingestion.kafka;

import com.biprov.config.ProvisionerProperties;
import com.biprov.ingestion.ProvisionOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes provisioning outcomes to {@code provisioner.kafka.result-topic} as JSON, keyed by
 * project id. Does nothing when no result topic is configured.
 */
@Component
@ConditionalOnProperty(prefix = "provisioner.kafka", name = "enabled", havingValue = "true")
public class ProvisioningResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningResultPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String resultTopic;

    public ProvisioningResultPublisher(
        KafkaTemplate<String, String> outcomeKafkaTemplate,
        ObjectMapper objectMapper,
        ProvisionerProperties properties
    ) {
        this.kafkaTemplate = outcomeKafkaTemplate;
        this.objectMapper = objectMapper;
        this.resultTopic = properties.getKafka().getResultTopic();
    }

    public boolean isEnabled() {
        return resultTopic != null && !resultTopic.isBlank();
    }

    /**
     * @return the pending send, or a completed future holding null when publishing is off
     */
    public CompletableFuture<SendResult<String, String>> publish(ProvisionOutcome outcome) {
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize outcome " + outcome.getCorrelationId(), e);
        }

        String key = outcome.getProjectId() != null ? outcome.getProjectId() : outcome.getCorrelationId();
        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(resultTopic, key, json);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish outcome {} to {}: {}", outcome.getCorrelationId(), resultTopic,
                    ex.getMessage(), ex);
            } else {
                log.debug("Published outcome {} to {} partition {} offset {}",
                    outcome.getCorrelationId(),
                    resultTopic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            }
        });
        return future;
    }
}
