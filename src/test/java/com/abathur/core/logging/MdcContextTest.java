package com.abathur.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSwarmRun puts swarmRunId in MDC")
    void setSwarmRun() {
        MdcContext.setSwarmRun("a1b2c3d4");
        assertEquals("a1b2c3d4", MDC.get("swarmRunId"));
    }

    @Test
    @DisplayName("setTask puts swarmRunId, taskId, and agentType in MDC")
    void setTask() {
        MdcContext.setTask("a1b2c3d4", "task-1", "coder");
        assertEquals("a1b2c3d4", MDC.get("swarmRunId"));
        assertEquals("task-1", MDC.get("taskId"));
        assertEquals("coder", MDC.get("agentType"));
    }

    @Test
    @DisplayName("clearTask keeps the swarm run id")
    void clearTask() {
        MdcContext.setTask("a1b2c3d4", "task-1", "coder");
        MdcContext.clearTask();
        assertEquals("a1b2c3d4", MDC.get("swarmRunId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentType"));
    }

    @Test
    @DisplayName("clear removes all abathur MDC keys")
    void clear() {
        MdcContext.setTask("a1b2c3d4", "task-1", "coder");
        MdcContext.clear();
        assertNull(MDC.get("swarmRunId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentType"));
    }
}
