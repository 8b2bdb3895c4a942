package com.gridcast.core.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gridcast.core.llm.LlmParseException;
import com.gridcast.core.llm.LlmProperties;
import com.gridcast.core.llm.LlmService;
import com.gridcast.core.model.OracleDecision;
import com.gridcast.core.model.PlannedInvocation;
import com.gridcast.core.model.SituationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LlmReasoningOracleTest {

    private LlmService llmService;
    private LlmProperties properties;
    private LlmReasoningOracle oracle;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new LlmProperties();
        oracle = new LlmReasoningOracle(llmService, new ObjectMapper().registerModule(new JavaTimeModule()),
                properties);
    }

    private static SituationContext context(List<Map<String, Object>> lastResults) {
        return new SituationContext("Forecast the next 24 hours",
                Map.of("data_freshness", Map.of("verdict", "FRESH")),
                List.of("Plan rejected (ValidationFailed): inv-1: horizon is required"),
                lastResults,
                List.of(Map.of("name", "produce_forecast", "description", "forecast")),
                2, 6);
    }

    @Test
    @DisplayName("a well-formed plan is returned as is")
    void returnsPlan() {
        var plan = OracleDecision.plan("forecast", List.of(
                new PlannedInvocation("inv-1", "produce_forecast", Map.of("horizon", 24), List.of())));
        when(llmService.structuredCall(anyString(), anyString(), eq(OracleDecision.class))).thenReturn(plan);

        assertSame(plan, oracle.decide(context(List.of()), false));
    }

    @Test
    @DisplayName("the user prompt carries the goal, history and capability contracts")
    void userPrompt() {
        when(llmService.structuredCall(anyString(), anyString(), eq(OracleDecision.class)))
                .thenReturn(OracleDecision.finish("done"));

        oracle.decide(context(List.of()), false);

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(llmService).structuredCall(system.capture(), user.capture(), eq(OracleDecision.class));
        assertEquals(LlmReasoningOracle.SYSTEM_PROMPT, system.getValue());
        assertTrue(user.getValue().contains("Forecast the next 24 hours"));
        assertTrue(user.getValue().contains("horizon is required"));
        assertTrue(user.getValue().contains("\"available_capabilities\""));
        assertTrue(user.getValue().contains("\"max_iterations\" : 6"));
    }

    @Test
    @DisplayName("strict mode restates the output contract")
    void strictMode() {
        when(llmService.structuredCall(anyString(), anyString(), eq(OracleDecision.class)))
                .thenReturn(OracleDecision.finish("done"));

        oracle.decide(context(List.of()), true);

        verify(llmService).structuredCall(
                eq(LlmReasoningOracle.SYSTEM_PROMPT + LlmReasoningOracle.STRICT_REMINDER), anyString(),
                eq(OracleDecision.class));
    }

    @Test
    @DisplayName("large result payloads are truncated in the prompt")
    void truncatesResults() {
        properties.setMaxResultChars(50);
        when(llmService.structuredCall(anyString(), anyString(), eq(OracleDecision.class)))
                .thenReturn(OracleDecision.finish("done"));
        var result = Map.<String, Object>of("capability", "query_demand_data", "data", "x".repeat(500));

        String prompt = oracle.buildUserPrompt(context(List.of(result)));

        assertTrue(prompt.contains("[truncated"));
        assertFalse(prompt.contains("x".repeat(100)));
    }

    @Test
    @DisplayName("unparseable or incomplete answers become OracleException")
    void malformedAnswers() {
        when(llmService.structuredCall(anyString(), anyString(), eq(OracleDecision.class)))
                .thenThrow(new LlmParseException("bad json"))
                .thenReturn(new OracleDecision(null, null, "no verdict", List.of()))
                .thenReturn(new OracleDecision(true, " ", null, List.of()));

        assertThrows(OracleException.class, () -> oracle.decide(context(List.of()), false));
        assertThrows(OracleException.class, () -> oracle.decide(context(List.of()), false));
        assertThrows(OracleException.class, () -> oracle.decide(context(List.of()), false));
    }
}
