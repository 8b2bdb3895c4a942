package com.gridcast.core.capability;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name, contract and executor of one invocable capability.
 *
 * @param name        unique capability name
 * @param description what the capability does, shown to the reasoning oracle
 * @param parameters  parameter schema
 * @param resultShape description of the data payload on success
 * @param timeout     execution bound, or {@code null} to use the dispatcher default
 * @param executor    implementation
 */
public record CapabilityDescriptor(
    String name,
    String description,
    List<ParameterSpec> parameters,
    String resultShape,
    Duration timeout,
    CapabilityExecutor executor
) {

    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(executor, "executor");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        long distinct = parameters.stream().map(ParameterSpec::name).distinct().count();
        if (distinct != parameters.size()) {
            throw new IllegalArgumentException("Capability '" + name + "' declares a parameter twice");
        }
    }

    public Optional<ParameterSpec> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    /**
     * Contract view handed to the reasoning oracle.
     */
    public Map<String, Object> contract() {
        var contract = new LinkedHashMap<String, Object>();
        contract.put("name", name);
        contract.put("description", description);
        contract.put("parameters", parameters);
        contract.put("result", resultShape);
        return contract;
    }
}
