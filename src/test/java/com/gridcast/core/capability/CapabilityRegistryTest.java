package com.gridcast.core.capability;

import com.gridcast.core.model.ResultEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private static CapabilityDescriptor capability(String name) {
        return new CapabilityDescriptor(name, "does " + name, List.of(
                ParameterSpec.optional("days_back", ParameterType.INTEGER, "days")),
                "map", null, (args, ctx) -> ResultEnvelope.ok(name, "ok"));
    }

    @Test
    @DisplayName("collects capabilities from every provider")
    void collectsFromProviders() {
        CapabilityProvider first = () -> List.of(capability("query_demand"), capability("summary"));
        CapabilityProvider second = () -> List.of(capability("produce_forecast"));

        var registry = new CapabilityRegistry(List.of(first, second));

        assertEquals(3, registry.size());
        assertTrue(registry.contains("produce_forecast"));
        assertFalse(registry.contains("forecast_anything"));
        assertFalse(registry.contains(null));
        assertTrue(registry.find("summary").isPresent());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    @DisplayName("duplicate capability names are rejected")
    void rejectsDuplicates() {
        assertThrows(IllegalStateException.class,
                () -> CapabilityRegistry.of(capability("summary"), capability("summary")));
    }

    @Test
    @DisplayName("contracts list name, description, parameters and result shape in registration order")
    void contracts() {
        var registry = CapabilityRegistry.of(capability("b"), capability("a"));
        var contracts = registry.contracts();
        assertEquals("b", contracts.get(0).get("name"));
        assertEquals("a", contracts.get(1).get("name"));
        assertEquals("does a", contracts.get(1).get("description"));
        assertEquals("map", contracts.get(1).get("result"));
        assertNotNull(contracts.get(1).get("parameters"));
    }

    @Test
    @DisplayName("a descriptor cannot declare the same parameter twice")
    void duplicateParameter() {
        assertThrows(IllegalArgumentException.class, () -> new CapabilityDescriptor("x", "x", List.of(
                ParameterSpec.optional("a", ParameterType.STRING, ""),
                ParameterSpec.optional("a", ParameterType.INTEGER, "")),
                "", null, (args, ctx) -> ResultEnvelope.ok("x", "ok")));
    }
}
