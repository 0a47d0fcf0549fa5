package com.biprov.config;

import com.biprov.platform.BiPlatformClient;
import com.biprov.platform.looker.LookerApiClient;
import com.biprov.platform.looker.LookerAuthenticator;
import com.biprov.platform.memory.InMemoryBiPlatformClient;
import com.biprov.template.TokenSubstitutionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the BI platform adapter selected by {@code provisioner.platform}.
 */
@Configuration
public class BiPlatformConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BiPlatformConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "provisioner", name = "platform", havingValue = "looker", matchIfMissing = true)
    public BiPlatformClient lookerPlatformClient(
        ProvisionerProperties properties,
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper
    ) {
        ProvisionerProperties.Looker looker = properties.getLooker();
        if (looker.getBaseUrl() == null || looker.getBaseUrl().isBlank()) {
            throw new IllegalStateException("provisioner.looker.base-url must be set when provisioner.platform=looker");
        }

        WebClient webClient = webClientBuilder.clone()
            .baseUrl(looker.apiUrl())
            .build();
        LookerAuthenticator authenticator = new LookerAuthenticator(
            webClient,
            looker.getClientId(),
            looker.getClientSecret(),
            looker.getRequestTimeout(),
            Clock.systemUTC());

        log.info("Using Looker platform at {}", looker.apiUrl());
        return new LookerApiClient(webClient, authenticator, objectMapper, looker.getRequestTimeout(),
            looker.getRootFolderId());
    }

    @Bean
    @ConditionalOnProperty(prefix = "provisioner", name = "platform", havingValue = "in-memory")
    public BiPlatformClient inMemoryPlatformClient() {
        log.warn("Using the in-memory BI platform; nothing is provisioned remotely");
        return new InMemoryBiPlatformClient();
    }

    @Bean
    public TokenSubstitutionEngine tokenSubstitutionEngine(ProvisionerProperties properties) {
        return new TokenSubstitutionEngine(properties.getUnresolvedTokenPolicy());
    }
}
