package com.abathur.core.swarm;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.model.ExecutionFailureException;
import com.abathur.core.model.ExecutionResult;
import com.abathur.core.model.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs each task as an external process.
 * <p>
 * The configured command is started once per task with the task serialized as JSON on
 * stdin and {@code ABATHUR_TASK_ID} / {@code ABATHUR_AGENT_TYPE} in the environment.
 * Exit code 0 is success; combined stdout and stderr becomes the output or the error.
 * The process is destroyed when the task's execution timeout passes or on cancellation.
 */
@Service
public class CommandAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandAgentExecutor.class);

    static final int MAX_CAPTURED_CHARS = 64 * 1024;

    private final List<String> command;
    private final Path workingDirectory;
    private final ObjectMapper objectMapper;

    private final Map<String, Process> running = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    @Autowired
    public CommandAgentExecutor(AbathurProperties properties, ObjectMapper objectMapper) {
        this(properties.getAgent().getCommand(),
                properties.getAgent().getWorkingDirectory() == null ? null
                        : Path.of(properties.getAgent().getWorkingDirectory()),
                objectMapper);
    }

    public CommandAgentExecutor(List<String> command, Path workingDirectory, ObjectMapper objectMapper) {
        this.command = command == null ? List.of() : List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExecutionResult execute(Task task) {
        if (command.isEmpty()) {
            throw new ExecutionFailureException(task.id(), "No agent command configured (abathur.agent.command)");
        }
        byte[] input;
        try {
            input = objectMapper.writeValueAsBytes(task);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailureException(task.id(), "Could not serialize task", e);
        }
        long startMs = System.currentTimeMillis();
        Process process;
        try {
            var builder = new ProcessBuilder(command).redirectErrorStream(true);
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            builder.environment().put("ABATHUR_TASK_ID", task.id());
            if (task.agentType() != null) {
                builder.environment().put("ABATHUR_AGENT_TYPE", task.agentType());
            }
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutionFailureException(task.id(), "Could not start agent command: " + e.getMessage(), e);
        }
        running.put(task.id(), process);

        try {
            var output = new StringBuilder();
            Thread reader = startReader(task.id(), process, output);
            startWriter(task.id(), process, input);

            boolean exited = process.waitFor(task.maxExecutionTimeoutSeconds(), TimeUnit.SECONDS);
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (!exited) {
                process.destroyForcibly();
                return ExecutionResult.failure(task.id(),
                        "Agent timed out after " + task.maxExecutionTimeoutSeconds() + "s", elapsedMs);
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));

            String captured;
            synchronized (output) {
                captured = output.toString();
            }
            if (cancelled.contains(task.id())) {
                return ExecutionResult.cancelled(task.id(), elapsedMs);
            }
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return ExecutionResult.success(task.id(), captured, elapsedMs);
            }
            log.warn("Agent for task {} exited with code {}", task.id(), exitCode);
            return ExecutionResult.failure(task.id(), "Agent exited with code " + exitCode + ": " + captured, elapsedMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ExecutionResult.cancelled(task.id(), System.currentTimeMillis() - startMs);
        } finally {
            running.remove(task.id());
            cancelled.remove(task.id());
        }
    }

    @Override
    public void cancel(String taskId) {
        Process process = running.get(taskId);
        if (process != null) {
            cancelled.add(taskId);
            log.info("Destroying agent process for cancelled task {}", taskId);
            process.destroy();
        }
    }

    // Writes on its own thread so an agent that never drains stdin still hits the timeout.
    private void startWriter(String taskId, Process process, byte[] input) {
        Thread writer = new Thread(() -> {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
            } catch (IOException e) {
                // The agent may exit without reading its input.
                log.debug("Agent for task {} closed stdin early: {}", taskId, e.getMessage());
            }
        }, "agent-input-" + taskId);
        writer.setDaemon(true);
        writer.start();
    }

    private Thread startReader(String taskId, Process process, StringBuilder output) {
        Thread reader = new Thread(() -> {
            try (var in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    log.debug("agent[{}]: {}", taskId, line);
                    synchronized (output) {
                        if (output.length() < MAX_CAPTURED_CHARS) {
                            output.append(line).append('\n');
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream for task {} closed: {}", taskId, e.getMessage());
            }
        }, "agent-output-" + taskId);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }
}
