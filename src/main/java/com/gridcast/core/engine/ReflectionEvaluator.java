package com.gridcast.core.engine;

import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ForecastResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides where a session goes after ACT.
 * <p>
 * DONE when every invocation succeeded and a forecast was produced. FAILED when no data exists at
 * all, when the whole model chain failed, or when a capability fails internally for the second
 * time in the session. ADAPT otherwise, including the case where everything succeeded but the
 * goal still needs the oracle to answer from the results.
 */
@Component
public class ReflectionEvaluator {

    /**
     * @param next      phase to move to
     * @param errorKind terminal error, or the most significant recoverable one; {@code null} when clean
     * @param rationale explanation recorded in the decision log
     */
    public record Reflection(AgentPhase next, ErrorKind errorKind, String rationale) {}

    public Reflection evaluate(AgentSession session, List<CapabilityInvocation> invocations) {
        var failures = invocations.stream().filter(i -> !i.succeeded()).toList();
        boolean forecastProduced = invocations.stream()
                .anyMatch(i -> i.succeeded() && i.result().data() instanceof ForecastResult);

        if (failures.isEmpty()) {
            if (forecastProduced) {
                return new Reflection(AgentPhase.DONE, null,
                        "All " + invocations.size() + " invocation(s) succeeded and a forecast was produced");
            }
            return new Reflection(AgentPhase.ADAPT, null,
                    "All " + invocations.size() + " invocation(s) succeeded; results returned to the oracle");
        }

        for (CapabilityInvocation failure : failures) {
            ErrorKind kind = failure.result().errorKind();
            if (kind == ErrorKind.NO_DATA) {
                return new Reflection(AgentPhase.FAILED, kind,
                        "No demand data is available: " + failure.result().message());
            }
            if (kind == ErrorKind.NO_MODEL_AVAILABLE) {
                return new Reflection(AgentPhase.FAILED, kind,
                        "Every model kind failed to train: " + failure.result().message());
            }
            if (kind == ErrorKind.ABORTED) {
                return new Reflection(AgentPhase.FAILED, kind, "Session aborted during " + failure.capabilityName());
            }
        }

        var recoverable = new ArrayList<String>();
        for (CapabilityInvocation failure : failures) {
            ErrorKind kind = failure.result().errorKind();
            if (kind == ErrorKind.INTERNAL_CAPABILITY_ERROR
                    && session.recordInternalError(failure.capabilityName()) >= 2) {
                return new Reflection(AgentPhase.FAILED, kind,
                        "Capability " + failure.capabilityName() + " failed internally twice: "
                                + failure.result().message());
            }
            recoverable.add(failure.capabilityName() + " (" + kind + ")");
        }
        return new Reflection(AgentPhase.ADAPT, failures.get(0).result().errorKind(),
                failures.size() + " of " + invocations.size() + " invocation(s) failed, recoverable: "
                        + String.join(", ", recoverable));
    }
}
