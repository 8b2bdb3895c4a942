package com.gridcast.core.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcast.core.llm.LlmEmptyResponseException;
import com.gridcast.core.llm.LlmParseException;
import com.gridcast.core.llm.LlmProperties;
import com.gridcast.core.llm.LlmService;
import com.gridcast.core.model.OracleDecision;
import com.gridcast.core.model.SituationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningOracle} backed by a chat model through {@link LlmService}.
 */
@Service
public class LlmReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(LlmReasoningOracle.class);

    static final String SYSTEM_PROMPT = """
            You are the reasoning component of Gridcast, an agent that answers operator questions
            about Ontario electricity demand. You never fetch data or compute forecasts yourself:
            you choose capabilities for the agent to invoke, then read their results.

            Each turn you receive a JSON situation with:
            - goal: the operator's question
            - facts: data freshness, recent model metrics and prior session outcomes
            - history: notes from earlier iterations, including rejected plans and failures
            - last_results: results of the capabilities invoked in the previous iteration
            - available_capabilities: the only capabilities you may use, with their parameters
            - iteration / max_iterations: how many planning rounds remain

            Respond with exactly one of:
            1. A plan: {"done": false, "rationale": "...", "invocations": [
                   {"id": "inv-1", "capability_name": "...", "arguments": {...}, "depends_on": []}]}
            2. A final answer: {"done": true, "summary": "..."} once last_results contain what the
               goal needs. The summary is shown to the operator; quote the numbers you were given.

            RULES:
            1. Use only capability names and argument names listed in available_capabilities.
               Unknown arguments are rejected. Dates are YYYY-MM-DD.
            2. Provide every required argument, and keep numbers inside the declared ranges.
            3. To pass an earlier result of the same plan, use "$ref:<id>" or "$ref:<id>.<field>"
               as the argument value and list that id in depends_on.
            4. For forecasting questions, invoke produce_forecast; it already falls back between
               model kinds, so do not train models first unless the goal asks for it.
            5. When a result reports STALE_DATA or an error, read its message and adapt the next
               plan instead of repeating the same call.
            6. Do not answer from memory. If the results cannot answer the goal, say so in the summary.

            Respond with valid JSON matching the schema provided.
            """;

    static final String STRICT_REMINDER = """

            IMPORTANT: your previous answer could not be used. Return ONLY a JSON object with the
            fields done, summary, rationale and invocations. No prose, no markdown fences.
            When done is true, summary must be non-empty. When done is false, invocations must be
            a non-empty list.
            """;

    private final LlmService llmService;
    private final ObjectMapper objectMapper;
    private final LlmProperties properties;

    public LlmReasoningOracle(LlmService llmService, ObjectMapper objectMapper, LlmProperties properties) {
        this.llmService = llmService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public OracleDecision decide(SituationContext context, boolean strict) {
        String systemPrompt = strict ? SYSTEM_PROMPT + STRICT_REMINDER : SYSTEM_PROMPT;
        String userPrompt = buildUserPrompt(context);

        OracleDecision decision;
        try {
            decision = llmService.structuredCall(systemPrompt, userPrompt, OracleDecision.class);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            throw new OracleException("Malformed oracle response: " + e.getMessage(), e);
        }
        if (decision == null || decision.done() == null) {
            throw new OracleException("Oracle response does not say whether the goal is done");
        }
        if (decision.isDone() && (decision.summary() == null || decision.summary().isBlank())) {
            throw new OracleException("Oracle finished without a summary");
        }
        log.info("Oracle decision: done={}, invocations={}", decision.isDone(),
                decision.invocations() == null ? 0 : decision.invocations().size());
        return decision;
    }

    String buildUserPrompt(SituationContext context) {
        var view = new LinkedHashMap<String, Object>();
        view.put("goal", context.goal());
        view.put("iteration", context.iteration());
        view.put("max_iterations", context.maxIterations());
        view.put("facts", context.facts());
        view.put("history", context.history());
        view.put("last_results", truncateResults(context.lastResults()));
        view.put("available_capabilities", context.availableCapabilities());
        try {
            return "Situation:\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new OracleException("Could not serialize situation context: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> truncateResults(List<Map<String, Object>> results) {
        int limit = properties.getMaxResultChars();
        var truncated = new ArrayList<Map<String, Object>>(results.size());
        for (Map<String, Object> result : results) {
            var copy = new LinkedHashMap<>(result);
            Object data = copy.get("data");
            if (data != null) {
                String json;
                try {
                    json = objectMapper.writeValueAsString(data);
                } catch (JsonProcessingException e) {
                    json = String.valueOf(data);
                }
                if (json.length() > limit) {
                    copy.put("data", json.substring(0, limit) + "... [truncated " + (json.length() - limit) + " chars]");
                }
            }
            truncated.add(copy);
        }
        return truncated;
    }
}
