package com.biprov;

import com.biprov.config.ProvisionerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the BI provisioner.
 *
 * Onboards a cloud project into the BI platform: a group bound through SAML, a project folder
 * and per-project copies of the template dashboards. Provisioning requests arrive over HTTP
 * or, when enabled, from a Kafka topic, and every run is safe to repeat.
 */
@SpringBootApplication
@EnableConfigurationProperties(ProvisionerProperties.class)
public class BiProvisionerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiProvisionerApplication.class, args);
    }
}
