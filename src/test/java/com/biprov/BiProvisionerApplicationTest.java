package com.biprov;

import com.biprov.ingestion.ProvisionOutcome;
import com.biprov.ingestion.ProvisioningEventHandler;
import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.memory.InMemoryBiPlatformClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Application context Tests")
class BiProvisionerApplicationTest {

    @Autowired
    private BiPlatformClient platform;

    @Autowired
    private ProvisioningEventHandler eventHandler;

    @Test
    @DisplayName("Should wire the in-memory platform and provision through the handler")
    void shouldProvisionAgainstInMemoryPlatform() {
        assertThat(platform).isInstanceOf(InMemoryBiPlatformClient.class);

        ProvisionOutcome outcome = eventHandler.handle(
            "{\"projectId\":\"context-proj\",\"groupEmail\":\"ctx@example.com\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getResult().getGroupId()).isNotNull();
        assertThat(outcome.getResult().getDashboardIds()).isEmpty();
    }
}
