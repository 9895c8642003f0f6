package com.syncbridge.connector;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable map of provider name to connector, built once at startup.
 */
public final class ConnectorRegistry {

    private final Map<String, Connector> connectors;
    private final List<ProviderMetadata> sortedMetadata;

    public ConnectorRegistry(Collection<? extends Connector> connectors) {
        Map<String, Connector> byName = new TreeMap<>();
        for (Connector connector : connectors) {
            String name = connector.name();
            if (!name.equals(connector.metadata().name())) {
                throw new IllegalArgumentException(
                        "Connector name " + name + " does not match metadata name " + connector.metadata().name());
            }
            if (byName.putIfAbsent(name, connector) != null) {
                throw new IllegalArgumentException("Duplicate connector registration: " + name);
            }
        }
        this.connectors = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        this.sortedMetadata = byName.values().stream()
                .map(Connector::metadata)
                .sorted(Comparator.comparing(ProviderMetadata::name))
                .toList();
    }

    /**
     * @throws ProviderNotFoundException if no connector is registered under {@code name}
     */
    public Connector get(String name) {
        Connector connector = name != null ? connectors.get(name) : null;
        if (connector == null) {
            throw new ProviderNotFoundException(name);
        }
        return connector;
    }

    public ProviderMetadata metadata(String name) {
        return get(name).metadata();
    }

    public boolean contains(String name) {
        return name != null && connectors.containsKey(name);
    }

    /**
     * All provider metadata, sorted by name.
     */
    public List<ProviderMetadata> listMetadata() {
        return sortedMetadata;
    }

    public Set<String> names() {
        return connectors.keySet();
    }

    public static class ProviderNotFoundException extends RuntimeException {
        private final String provider;

        public ProviderNotFoundException(String provider) {
            super("Provider not found: " + provider);
            this.provider = provider;
        }

        public String getProvider() { return provider; }
    }
}
