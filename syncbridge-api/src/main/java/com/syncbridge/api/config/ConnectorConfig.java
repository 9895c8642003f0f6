package com.syncbridge.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.ProviderConfig;
import com.syncbridge.connector.bridge.DefaultProviderBridge;
import com.syncbridge.connector.bridge.ProviderBridge;
import com.syncbridge.connector.provider.ExampleConnector;
import com.syncbridge.connector.provider.GitHubConnector;
import com.syncbridge.connector.provider.GmailConnector;
import com.syncbridge.connector.provider.GoogleCalendarConnector;
import com.syncbridge.connector.provider.GoogleDriveConnector;
import com.syncbridge.connector.provider.JiraConnector;
import com.syncbridge.connector.provider.ZohoCliqConnector;
import com.syncbridge.connector.provider.ZohoMailConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

/**
 * Wires the provider connectors into an immutable registry at startup.
 */
@Configuration
public class ConnectorConfig {

    private static final Logger log = LoggerFactory.getLogger(ConnectorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator syncRandom() {
        return new Random();
    }

    @Bean
    public ProviderBridge providerBridge() {
        return new DefaultProviderBridge();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService connectorExecutor(SyncBridgeProperties properties) {
        int threads = Math.max(2, properties.getExecutor().getConcurrency());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("connector-io-"));
    }

    @Bean
    public ConnectorRegistry connectorRegistry(SyncBridgeProperties properties, ProviderBridge bridge,
                                               ObjectMapper objectMapper, ExecutorService connectorExecutor) {
        List<Connector> connectors = List.of(
                new GitHubConnector(providerConfig(properties, GitHubConnector.NAME), bridge, objectMapper, connectorExecutor),
                new JiraConnector(providerConfig(properties, JiraConnector.NAME), bridge, objectMapper, connectorExecutor),
                new GmailConnector(providerConfig(properties, GmailConnector.NAME), bridge, objectMapper, connectorExecutor),
                new GoogleCalendarConnector(providerConfig(properties, GoogleCalendarConnector.NAME), bridge, objectMapper, connectorExecutor),
                new GoogleDriveConnector(providerConfig(properties, GoogleDriveConnector.NAME), bridge, objectMapper, connectorExecutor),
                new ZohoCliqConnector(),
                new ZohoMailConnector(providerConfig(properties, ZohoMailConnector.NAME), bridge, objectMapper, connectorExecutor),
                new ExampleConnector());
        ConnectorRegistry registry = new ConnectorRegistry(connectors);
        log.info("Registered {} connectors: {}", connectors.size(), registry.names());
        return registry;
    }

    static ProviderConfig providerConfig(SyncBridgeProperties properties, String provider) {
        SyncBridgeProperties.Provider settings = properties.getProviders().get(provider);
        if (settings == null) {
            return ProviderConfig.empty();
        }
        return new ProviderConfig(
                settings.getClientId(),
                settings.getClientSecret(),
                settings.getAuthBaseUrl(),
                settings.getApiBaseUrl(),
                settings.getOptions());
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
