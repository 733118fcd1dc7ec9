package com.abathur.core.logging;

import org.slf4j.MDC;

/**
 * Abathur MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SWARM_RUN_ID = "swarmRunId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_TYPE = "agentType";

    private MdcContext() {}

    public static void setSwarmRun(String swarmRunId) {
        MDC.put(SWARM_RUN_ID, swarmRunId);
    }

    public static void setTask(String swarmRunId, String taskId, String agentType) {
        if (swarmRunId != null) {
            MDC.put(SWARM_RUN_ID, swarmRunId);
        }
        MDC.put(TASK_ID, taskId);
        if (agentType != null) {
            MDC.put(AGENT_TYPE, agentType);
        }
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_TYPE);
    }

    public static void clear() {
        MDC.remove(SWARM_RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_TYPE);
    }
}
