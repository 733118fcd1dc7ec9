package com.abathur.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "abathur")
public class AbathurProperties {

    private Swarm swarm = new Swarm();
    private Priority priority = new Priority();
    private Dependency dependency = new Dependency();
    private Store store = new Store();
    private Agent agent = new Agent();

    public Swarm getSwarm() { return swarm; }
    public void setSwarm(Swarm swarm) { this.swarm = swarm; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public Dependency getDependency() { return dependency; }
    public void setDependency(Dependency dependency) { this.dependency = dependency; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }

    public static class Swarm {
        private int maxConcurrentAgents = 10;
        private Duration pollInterval = Duration.ofSeconds(1);
        /** Null waits for in-flight executions without bound. */
        private Duration shutdownTimeout;
        private Duration staleCheckInterval = Duration.ofSeconds(60);
        private Duration staleTaskBuffer = Duration.ofSeconds(60);

        public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
        public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
        public Duration getStaleCheckInterval() { return staleCheckInterval; }
        public void setStaleCheckInterval(Duration staleCheckInterval) { this.staleCheckInterval = staleCheckInterval; }
        public Duration getStaleTaskBuffer() { return staleTaskBuffer; }
        public void setStaleTaskBuffer(Duration staleTaskBuffer) { this.staleTaskBuffer = staleTaskBuffer; }
    }

    public static class Priority {
        private double baseWeight = 0.30;
        private double depthWeight = 0.25;
        private double urgencyWeight = 0.25;
        private double blockingWeight = 0.15;
        private double sourceWeight = 0.05;

        public double getBaseWeight() { return baseWeight; }
        public void setBaseWeight(double baseWeight) { this.baseWeight = baseWeight; }
        public double getDepthWeight() { return depthWeight; }
        public void setDepthWeight(double depthWeight) { this.depthWeight = depthWeight; }
        public double getUrgencyWeight() { return urgencyWeight; }
        public void setUrgencyWeight(double urgencyWeight) { this.urgencyWeight = urgencyWeight; }
        public double getBlockingWeight() { return blockingWeight; }
        public void setBlockingWeight(double blockingWeight) { this.blockingWeight = blockingWeight; }
        public double getSourceWeight() { return sourceWeight; }
        public void setSourceWeight(double sourceWeight) { this.sourceWeight = sourceWeight; }
    }

    public static class Dependency {
        private Duration cacheTtl = Duration.ofSeconds(60);

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
    }

    public static class Store {
        /** "jdbc" or "memory". */
        private String type = "jdbc";
        private int maxWriteAttempts = 5;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public int getMaxWriteAttempts() { return maxWriteAttempts; }
        public void setMaxWriteAttempts(int maxWriteAttempts) { this.maxWriteAttempts = maxWriteAttempts; }
    }

    public static class Agent {
        /** Command line launched per task; empty disables execution. */
        private List<String> command = new ArrayList<>();
        private String workingDirectory;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    }
}
