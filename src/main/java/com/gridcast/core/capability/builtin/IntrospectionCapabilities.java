package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.capability.CapabilityDescriptor;
import com.gridcast.core.capability.CapabilityProvider;
import com.gridcast.core.capability.InvocationContext;
import com.gridcast.core.capability.ParameterSpec;
import com.gridcast.core.capability.ParameterType;
import com.gridcast.core.decisionlog.DecisionLedger;
import com.gridcast.core.forecast.ForecastModelManager;
import com.gridcast.core.model.ResultEnvelope;
import com.gridcast.core.model.SessionSummary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the cross-session ledger and the model registry.
 */
@Component
public class IntrospectionCapabilities implements CapabilityProvider {

    public static final String GET_PERFORMANCE_HISTORY = "get_performance_history";

    private final DecisionLedger ledger;
    private final ForecastModelManager modelManager;

    public IntrospectionCapabilities(DecisionLedger ledger, ForecastModelManager modelManager) {
        this.ledger = ledger;
        this.modelManager = modelManager;
    }

    @Override
    public List<CapabilityDescriptor> capabilities() {
        return List.of(new CapabilityDescriptor(GET_PERFORMANCE_HISTORY,
                "Outcomes of recent sessions and the latest metrics of each trained model.",
                List.of(ParameterSpec.optional("limit", ParameterType.INTEGER, "Sessions to return (default 10)")
                        .range(1, 100)),
                "sessions (newest first), models (latest metrics per target and kind)",
                null, this::performanceHistory));
    }

    ResultEnvelope performanceHistory(CapabilityArguments args, InvocationContext ctx) {
        int limit = args.integer("limit", 10);
        List<SessionSummary> outcomes = ledger.recentOutcomes(limit);

        var sessions = outcomes.stream().map(IntrospectionCapabilities::describe).toList();
        var models = new LinkedHashMap<String, Object>();
        for (String target : modelManager.store().targets()) {
            models.put(target, modelManager.latestMetrics(target));
        }

        var data = new LinkedHashMap<String, Object>();
        data.put("sessions", sessions);
        data.put("models", models);
        long succeeded = outcomes.stream().filter(SessionSummary::succeeded).count();
        return ResultEnvelope.ok(data, outcomes.size() + " recent session(s), " + succeeded + " succeeded; "
                + models.size() + " target(s) with trained models");
    }

    private static Map<String, Object> describe(SessionSummary summary) {
        var map = new LinkedHashMap<String, Object>();
        map.put("session_id", summary.sessionId());
        map.put("goal", summary.goal());
        map.put("status", summary.status().name());
        map.put("iterations", summary.iterations());
        map.put("reason", summary.reason());
        if (summary.errorKind() != null) {
            map.put("error_kind", summary.errorKind().name());
        }
        if (summary.forecast() != null) {
            map.put("forecast_candidate", summary.forecast().candidateId());
            map.put("forecast_horizon", summary.forecast().horizon());
        }
        map.put("finished_at", summary.finishedAt() != null ? summary.finishedAt().toString() : null);
        return map;
    }
}
