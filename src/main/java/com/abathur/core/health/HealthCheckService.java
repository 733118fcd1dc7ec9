package com.abathur.core.health;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.model.SwarmStatus;
import com.abathur.core.store.TaskStore;
import com.abathur.core.swarm.SwarmOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore taskStore;
    private final SwarmOrchestrator orchestrator;
    private final List<String> agentCommand;

    @Autowired
    public HealthCheckService(
            @Autowired(required = false) TaskStore taskStore,
            @Autowired(required = false) SwarmOrchestrator orchestrator,
            AbathurProperties properties) {
        this(taskStore, orchestrator, properties.getAgent().getCommand());
    }

    HealthCheckService(TaskStore taskStore, SwarmOrchestrator orchestrator, List<String> agentCommand) {
        this.taskStore = taskStore;
        this.orchestrator = orchestrator;
        this.agentCommand = agentCommand == null ? List.of() : agentCommand;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkOrchestrator());
        results.add(checkAgent());
        return results;
    }

    private HealthStatus checkStore() {
        if (taskStore == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN, "No task store configured", Map.of());
        }
        String type = taskStore.getClass().getSimpleName();
        try {
            if (taskStore.isAvailable()) {
                return new HealthStatus("store", HealthStatus.Status.UP, "Task store reachable", Map.of("type", type));
            }
            return new HealthStatus("store", HealthStatus.Status.DOWN, "Task store unreachable", Map.of("type", type));
        } catch (Exception e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Task store error: " + e.getMessage(), Map.of("type", type));
        }
    }

    private HealthStatus checkOrchestrator() {
        if (orchestrator == null) {
            return new HealthStatus("orchestrator", HealthStatus.Status.DOWN, "Orchestrator not available", Map.of());
        }
        try {
            SwarmStatus status = orchestrator.status();
            var metadata = Map.of(
                    "running", String.valueOf(status.running()),
                    "active", String.valueOf(status.activeCount()),
                    "availableSlots", String.valueOf(status.availableSlots()),
                    "completed", String.valueOf(status.completedCount()),
                    "failures", String.valueOf(status.failureCount()),
                    "maxConcurrentAgents", String.valueOf(status.maxConcurrentAgents()));
            return new HealthStatus("orchestrator", HealthStatus.Status.UP,
                    status.running() ? "Swarm running" : "Swarm idle", metadata);
        } catch (Exception e) {
            log.warn("Orchestrator health check failed: {}", e.getMessage());
            return new HealthStatus("orchestrator", HealthStatus.Status.DEGRADED,
                    "Status unavailable: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAgent() {
        if (agentCommand.isEmpty()) {
            return new HealthStatus("agent", HealthStatus.Status.DEGRADED,
                    "No agent command configured; tasks cannot be executed", Map.of());
        }
        return new HealthStatus("agent", HealthStatus.Status.UP,
                "Agent command configured", Map.of("command", String.join(" ", agentCommand)));
    }
}
