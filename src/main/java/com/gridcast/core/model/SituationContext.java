package com.gridcast.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything the reasoning oracle is shown when asked for the next decision.
 *
 * @param goal                    the operator's request
 * @param facts                   situation facts gathered during PERCEIVE
 * @param history                 notes accumulated across iterations (rejections, failures, adaptations)
 * @param lastResults             outcomes of the most recent ACT phase
 * @param availableCapabilities   registry contracts the oracle may plan with
 * @param iteration               current iteration
 * @param maxIterations           iteration cap
 */
public record SituationContext(
    String goal,
    Map<String, Object> facts,
    List<String> history,
    @JsonProperty("last_results") List<Map<String, Object>> lastResults,
    @JsonProperty("available_capabilities") List<Map<String, Object>> availableCapabilities,
    int iteration,
    @JsonProperty("max_iterations") int maxIterations
) {

    public SituationContext {
        facts = facts == null ? Map.of() : Map.copyOf(facts);
        history = history == null ? List.of() : List.copyOf(history);
        lastResults = lastResults == null ? List.of() : List.copyOf(lastResults);
        availableCapabilities = availableCapabilities == null ? List.of() : List.copyOf(availableCapabilities);
    }
}
