package com.abathur.core.model;

/**
 * Who asked for a task. Human requests outrank agent-generated follow-ups.
 */
public enum TaskSource {
    HUMAN,
    AGENT_REQUIREMENTS,
    AGENT_PLANNER,
    AGENT_IMPLEMENTATION
}
