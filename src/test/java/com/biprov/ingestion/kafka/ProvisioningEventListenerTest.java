package com.biprov.ingestion.kafka;

import com.biprov.ingestion.ProvisionOutcome;
import com.biprov.ingestion.ProvisioningEventHandler;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProvisioningEventListener Tests")
class ProvisioningEventListenerTest {

    @Mock
    private ProvisioningEventHandler eventHandler;

    @Mock
    private ProvisioningResultPublisher resultPublisher;

    @InjectMocks
    private ProvisioningEventListener listener;

    @Test
    @DisplayName("Should hand the record value to the handler and publish the outcome")
    void shouldHandleRecord() {
        // Given
        String payload = "{\"projectId\":\"demo-proj\",\"groupEmail\":\"team@example.com\"}";
        ProvisionOutcome outcome = ProvisionOutcome.error("createGroup failed: down", "demo-proj", null, "corr");
        when(eventHandler.handle(any(byte[].class))).thenReturn(outcome);

        // When
        listener.onEvent(new ConsumerRecord<>("bi-provisioning-requests", 0, 42L, "demo-proj", payload));

        // Then
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(eventHandler).handle(body.capture());
        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo(payload);
        verify(resultPublisher).publish(outcome);
    }

    @Test
    @DisplayName("Should pass a tombstone record on as an empty body")
    void shouldHandleNullValue() {
        when(eventHandler.handle(any())).thenReturn(
            ProvisionOutcome.validationError("payload must not be empty", null, null, "corr"));

        listener.onEvent(new ConsumerRecord<>("bi-provisioning-requests", 0, 43L, null, null));

        verify(eventHandler).handle((byte[]) null);
    }
}
