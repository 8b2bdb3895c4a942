package com.gridcast.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record of one capability call made by the dispatcher.
 *
 * @param invocationId   plan-local id of the invocation
 * @param capabilityName name of the capability that was requested
 * @param arguments      arguments as executed (after reference resolution)
 * @param result         normalized outcome
 * @param duration       wall-clock time spent
 * @param outcome        ok, error or timeout
 */
public record CapabilityInvocation(
    String invocationId,
    String capabilityName,
    Map<String, Object> arguments,
    ResultEnvelope result,
    Duration duration,
    InvocationOutcome outcome
) implements Serializable {

    public CapabilityInvocation {
        Objects.requireNonNull(result, "result");
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        duration = duration == null ? Duration.ZERO : duration;
    }

    public boolean succeeded() {
        return result.success();
    }
}
