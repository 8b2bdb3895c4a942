package com.gridcast.core.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide mapping from capability name to descriptor.
 * <p>
 * Populated once from every {@link CapabilityProvider} bean and read-only afterwards.
 */
@Service
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityDescriptor> capabilities;

    @Autowired
    public CapabilityRegistry(List<CapabilityProvider> providers) {
        this(providers.stream().flatMap(p -> p.capabilities().stream()).toList());
    }

    private CapabilityRegistry(Collection<CapabilityDescriptor> descriptors) {
        var map = new LinkedHashMap<String, CapabilityDescriptor>();
        for (var descriptor : descriptors) {
            if (map.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalStateException("Capability registered twice: " + descriptor.name());
            }
        }
        this.capabilities = Collections.unmodifiableMap(map);
        log.info("Capability registry initialized with {} capabilities: {}", map.size(), map.keySet());
    }

    public static CapabilityRegistry of(CapabilityDescriptor... descriptors) {
        return new CapabilityRegistry(Arrays.asList(descriptors));
    }

    public Optional<CapabilityDescriptor> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(capabilities.get(name));
    }

    public boolean contains(String name) {
        return name != null && capabilities.containsKey(name);
    }

    public Collection<CapabilityDescriptor> all() {
        return capabilities.values();
    }

    public int size() {
        return capabilities.size();
    }

    /**
     * Contracts of all capabilities, in registration order.
     */
    public List<Map<String, Object>> contracts() {
        return capabilities.values().stream().map(CapabilityDescriptor::contract).toList();
    }
}
