package com.biprov.ingestion.kafka;

import com.biprov.ingestion.ProvisionOutcome;
import com.biprov.ingestion.ProvisioningEventHandler;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Consumes provisioning events from Kafka.
 *
 * Each record value is one payload or envelope. Records are processed one at a time and an
 * outcome is produced for every record, failed or not, so nothing is redelivered.
 */
@Component
@ConditionalOnProperty(prefix = "provisioner.kafka", name = "enabled", havingValue = "true")
public class ProvisioningEventListener {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEventListener.class);

    private final ProvisioningEventHandler eventHandler;
    private final ProvisioningResultPublisher resultPublisher;

    public ProvisioningEventListener(ProvisioningEventHandler eventHandler, ProvisioningResultPublisher resultPublisher) {
        this.eventHandler = eventHandler;
        this.resultPublisher = resultPublisher;
    }

    @KafkaListener(
        topics = "${provisioner.kafka.topic:bi-provisioning-requests}",
        groupId = "${provisioner.kafka.consumer-group:bi-provisioner}"
    )
    public void onEvent(ConsumerRecord<String, String> record) {
        log.debug("Processing provisioning event from partition {} offset {}", record.partition(), record.offset());

        byte[] body = record.value() != null ? record.value().getBytes(StandardCharsets.UTF_8) : null;
        ProvisionOutcome outcome = eventHandler.handle(body);

        log.info("Provisioning event at offset {} finished with status {} (correlationId={})",
            record.offset(), outcome.getStatus(), outcome.getCorrelationId());
        resultPublisher.publish(outcome);
    }
}
