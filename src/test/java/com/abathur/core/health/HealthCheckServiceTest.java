package com.abathur.core.health;

import com.abathur.core.model.QueueStats;
import com.abathur.core.model.SwarmStatus;
import com.abathur.core.store.TaskStore;
import com.abathur.core.swarm.SwarmOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private final TaskStore store = mock(TaskStore.class);
    private final SwarmOrchestrator orchestrator = mock(SwarmOrchestrator.class);

    private static SwarmStatus idle() {
        return new SwarmStatus(false, 0, 10, 4, 4, 0, null, 10, List.of(), new QueueStats(0, Map.of(), 0.0, 0, null, null));
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(r -> r.component().equals(component)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reports store, orchestrator and agent as UP when everything is configured")
    void allUp() {
        when(store.isAvailable()).thenReturn(true);
        when(orchestrator.status()).thenReturn(idle());
        var service = new HealthCheckService(store, orchestrator, List.of("agent", "--run"));

        List<HealthStatus> results = service.checkAll();

        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(r -> r.status() == HealthStatus.Status.UP));
        assertEquals("agent --run", find(results, "agent").metadata().get("command"));
        assertEquals("Swarm idle", find(results, "orchestrator").detail());
        assertEquals("4", find(results, "orchestrator").metadata().get("completed"));
        assertEquals("10", find(results, "orchestrator").metadata().get("availableSlots"));
        assertEquals("0", find(results, "orchestrator").metadata().get("failures"));
    }

    @Test
    @DisplayName("an unreachable store is DOWN")
    void storeUnreachable() {
        when(store.isAvailable()).thenReturn(false);
        when(orchestrator.status()).thenReturn(idle());
        var service = new HealthCheckService(store, orchestrator, List.of("agent"));

        assertEquals(HealthStatus.Status.DOWN, find(service.checkAll(), "store").status());
    }

    @Test
    @DisplayName("a store that throws is DOWN with the error in the detail")
    void storeThrows() {
        when(store.isAvailable()).thenThrow(new IllegalStateException("connection refused"));
        when(orchestrator.status()).thenReturn(idle());
        var service = new HealthCheckService(store, orchestrator, List.of("agent"));

        HealthStatus status = find(service.checkAll(), "store");
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("missing components are DOWN and a missing agent command is DEGRADED")
    void missingComponents() {
        var service = new HealthCheckService(null, null, (List<String>) null);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "store").status());
        assertEquals(HealthStatus.Status.DOWN, find(results, "orchestrator").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "agent").status());
    }

    @Test
    @DisplayName("an orchestrator whose status fails is DEGRADED")
    void orchestratorThrows() {
        when(store.isAvailable()).thenReturn(true);
        when(orchestrator.status()).thenThrow(new IllegalStateException("store offline"));
        var service = new HealthCheckService(store, orchestrator, List.of("agent"));

        assertEquals(HealthStatus.Status.DEGRADED, find(service.checkAll(), "orchestrator").status());
    }
}
