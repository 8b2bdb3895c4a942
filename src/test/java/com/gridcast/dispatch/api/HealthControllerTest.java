package com.gridcast.dispatch.api;

import com.gridcast.core.health.HealthCheckService;
import com.gridcast.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    private static HealthStatus up(String component) {
        return new HealthStatus(component, HealthStatus.Status.UP, component + " ok", Map.of());
    }

    @Test
    @DisplayName("GET /health returns 200 UP when every component is UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(up("capabilities"), up("database")));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.database.status").value("UP"));
    }

    @Test
    @DisplayName("GET /health returns 200 DEGRADED with metadata for stale data")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                up("capabilities"),
                new HealthStatus("demand-data", HealthStatus.Status.DEGRADED, "Data is stale (3.0h old)",
                        Map.of("hoursOld", "3.0"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components['demand-data'].metadata.hoursOld").value("3.0"));
    }

    @Test
    @DisplayName("GET /health returns 503 when any component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                up("capabilities"),
                new HealthStatus("database", HealthStatus.Status.DOWN, "No DataSource configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    @DisplayName("GET /health/{component} returns one component or 404")
    void singleComponent() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(up("capabilities")));

        mockMvc.perform(get("/api/v1/health/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detail").value("capabilities ok"));
        mockMvc.perform(get("/api/v1/health/warp-drive"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("overall status prefers DOWN over DEGRADED")
    void overall() {
        var degraded = new HealthStatus("demand-data", HealthStatus.Status.DEGRADED, "stale", Map.of());
        var down = new HealthStatus("database", HealthStatus.Status.DOWN, "down", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(List.of(up("a"))));
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.overall(List.of(up("a"), degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(List.of(degraded, down)));
    }
}
