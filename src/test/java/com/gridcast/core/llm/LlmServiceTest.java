package com.gridcast.core.llm;

import com.gridcast.core.model.OracleDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}. The whole {@link ChatClient} chain is mocked.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://localhost:11434");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and appends format instructions to the user prompt")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"done": true, "summary": "Data is fresh"}
                """);

        llmService.structuredCall("System prompt", "User prompt", OracleDecision.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
    }

    @Test
    @DisplayName("structuredCall deserializes a plan with snake_case invocation fields")
    void deserializesPlan() {
        when(mockCallResponse.content()).thenReturn("""
                {"done": false, "rationale": "forecast directly",
                 "invocations": [{"id": "inv-1", "capability_name": "produce_forecast",
                                  "arguments": {"horizon": 24}, "depends_on": []}]}
                """);

        OracleDecision decision = llmService.structuredCall("sys", "usr", OracleDecision.class);

        assertFalse(decision.isDone());
        assertEquals(1, decision.invocations().size());
        var invocation = decision.invocations().get(0);
        assertEquals("produce_forecast", invocation.capability());
        assertEquals(Map.of("horizon", 24), invocation.arguments());
    }

    @Test
    @DisplayName("markdown fences around the JSON are tolerated")
    void fencedJson() {
        when(mockCallResponse.content()).thenReturn("```json\n{\"done\": true, \"summary\": \"ok\"}\n```");

        OracleDecision decision = llmService.structuredCall("sys", "usr", OracleDecision.class);

        assertTrue(decision.isDone());
        assertEquals("ok", decision.summary());
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", OracleDecision.class));
    }

    @Test
    @DisplayName("prose instead of JSON raises LlmParseException")
    void unparseable() {
        when(mockCallResponse.content()).thenReturn("I think you should forecast tomorrow.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", OracleDecision.class));
    }
}
