package com.gridcast.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A capability call proposed by the reasoning oracle.
 * <p>
 * String argument values of the form {@code $ref:<invocationId>} or
 * {@code $ref:<invocationId>.<path>} are replaced with (part of) another
 * invocation's result data before execution.
 *
 * @param id         plan-local identifier; assigned by the orchestrator when absent
 * @param capability capability name
 * @param arguments  named arguments
 * @param dependsOn  ids of invocations that must complete first
 */
public record PlannedInvocation(
    String id,
    @JsonProperty("capability_name") @JsonAlias("capability") String capability,
    Map<String, Object> arguments,
    @JsonProperty("depends_on") List<String> dependsOn
) {

    public static final String REFERENCE_PREFIX = "$ref:";

    public PlannedInvocation {
        arguments = arguments == null ? Map.of() : arguments;
        dependsOn = dependsOn == null ? List.of() : dependsOn;
    }

    public PlannedInvocation withId(String newId) {
        return new PlannedInvocation(newId, capability, arguments, dependsOn);
    }
}
