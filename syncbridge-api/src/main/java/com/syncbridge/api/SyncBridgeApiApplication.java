package com.syncbridge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SyncBridge sync engine.
 * Runs the scheduler, executor and token-refresh loops next to the webhook and connect endpoints.
 */
@SpringBootApplication(scanBasePackages = "com.syncbridge")
@EntityScan(basePackages = "com.syncbridge.core.domain")
@EnableJpaRepositories(basePackages = "com.syncbridge.core.repository")
@ConfigurationPropertiesScan(basePackages = "com.syncbridge.api.config")
@EnableScheduling
public class SyncBridgeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncBridgeApiApplication.class, args);
    }
}
