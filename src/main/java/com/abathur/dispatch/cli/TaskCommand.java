package com.abathur.dispatch.cli;

import com.abathur.core.model.CancellationReport;
import com.abathur.core.model.ExecutionBatch;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskQueueException;
import com.abathur.core.model.TaskSource;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.TaskSubmission;
import com.abathur.core.queue.TaskQueueService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * CLI command group: abathur task &lt;submit|list|show|cancel|retry|depend|plan&gt;
 */
@Command(name = "task", mixinStandardHelpOptions = true, description = "Submit and manage tasks")
@Component
public class TaskCommand implements Runnable {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final TaskQueueService queue;
    private final ObjectMapper objectMapper;

    public TaskCommand(TaskQueueService queue, ObjectMapper objectMapper) {
        this.queue = queue;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "submit", mixinStandardHelpOptions = true, description = "Enqueue a new task")
    int submit(
            @Parameters(index = "0", paramLabel = "DESCRIPTION", description = "What the agent should do")
            String description,
            @Option(names = {"--priority", "-p"}, defaultValue = "5", description = "Base priority 0-10 (default: ${DEFAULT-VALUE})")
            int priority,
            @Option(names = {"--depends-on", "-d"}, split = ",", description = "Prerequisite task ids")
            List<String> dependsOn,
            @Option(names = "--parallel", paramLabel = "N", description = "Ready once N prerequisites are completed")
            Integer parallel,
            @Option(names = "--source", defaultValue = "HUMAN", description = "Origin: ${COMPLETION-CANDIDATES}")
            TaskSource source,
            @Option(names = "--agent", description = "Agent type")
            String agentType,
            @Option(names = "--deadline", description = "ISO-8601 instant, e.g. 2026-01-31T12:00:00Z")
            Instant deadline,
            @Option(names = "--estimate", description = "Expected duration, e.g. PT30M")
            Duration estimate,
            @Option(names = "--max-retries", description = "Retries after failure")
            Integer maxRetries,
            @Option(names = "--id", description = "Explicit task id")
            String id) {
        return guarded(() -> {
            TaskSubmission submission = TaskSubmission.of(description, priority, dependsOn)
                    .withSource(source)
                    .withDeadline(deadline, estimate == null ? null : estimate.getSeconds());
            if (id != null) {
                submission = submission.withId(id);
            }
            if (agentType != null) {
                submission = submission.withAgentType(agentType);
            }
            if (parallel != null) {
                submission = submission.withParallel(parallel);
            }
            if (maxRetries != null) {
                submission = submission.withMaxRetries(maxRetries);
            }
            Task task = queue.enqueue(submission);
            ConsoleOutput.success("Enqueued " + task.id() + " as " + task.status()
                    + String.format(" (priority %.2f, depth %d)", task.calculatedPriority(), task.dependencyDepth()));
            return 0;
        });
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List tasks by dispatch order")
    int list(
            @Option(names = {"--status", "-s"}, split = ",", description = "Filter by status")
            Set<TaskStatus> statuses,
            @Option(names = {"--limit", "-n"}, defaultValue = "50", description = "Number of results")
            int limit,
            @Option(names = "--json", description = "Print JSON")
            boolean json) {
        return guarded(() -> {
            List<Task> tasks = queue.listTasks(statuses == null ? Set.of() : statuses, limit);
            if (json) {
                return printJson(tasks);
            }
            if (tasks.isEmpty()) {
                ConsoleOutput.info("No tasks found.");
                return 0;
            }
            ConsoleOutput.taskHeader();
            tasks.forEach(ConsoleOutput::taskRow);
            return 0;
        });
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show one task")
    int show(
            @Parameters(index = "0", paramLabel = "TASK_ID") String taskId,
            @Option(names = "--json", description = "Print JSON") boolean json) {
        return guarded(() -> {
            Task task = queue.getTask(taskId);
            if (json) {
                return printJson(task);
            }
            System.out.println("TASK " + task.id());
            System.out.println("Summary: " + task.summary());
            ConsoleOutput.status(task.status());
            System.out.printf("Priority: %.2f (base %d, source %s)%n",
                    task.calculatedPriority(), task.basePriority(), task.source());
            System.out.println("Depth: " + task.dependencyDepth());
            if (!task.dependencies().isEmpty()) {
                System.out.println("Depends on (" + task.dependencyType() + "): "
                        + String.join(", ", task.dependencies()));
            }
            if (task.deadline() != null) {
                System.out.println("Deadline: " + task.deadline());
            }
            System.out.println("Retries: " + task.retryCount() + "/" + task.maxRetries());
            if (task.errorMessage() != null) {
                ConsoleOutput.error("Error: " + task.errorMessage());
            }
            return 0;
        });
    }

    @Command(name = "cancel", mixinStandardHelpOptions = true,
            description = "Cancel a task and everything that depends on it")
    int cancel(@Parameters(index = "0", paramLabel = "TASK_ID") String taskId) {
        return guarded(() -> {
            CancellationReport report = queue.cancelTask(taskId);
            if (report.cancelled().isEmpty()) {
                ConsoleOutput.info("Task " + taskId + " was already cancelled.");
                return 0;
            }
            ConsoleOutput.success("Cancelled " + report.cancelled().size() + " task(s): "
                    + String.join(", ", report.cancelled()));
            report.unreachable().forEach((id, reason) -> ConsoleOutput.error("Not cancelled " + id + ": " + reason));
            return report.isComplete() ? 0 : 1;
        });
    }

    @Command(name = "retry", mixinStandardHelpOptions = true, description = "Retry a failed task")
    int retry(@Parameters(index = "0", paramLabel = "TASK_ID") String taskId) {
        return guarded(() -> {
            Task task = queue.retryTask(taskId);
            ConsoleOutput.success("Retry " + task.retryCount() + "/" + task.maxRetries()
                    + " for " + task.id() + ", now " + task.status());
            return 0;
        });
    }

    @Command(name = "depend", mixinStandardHelpOptions = true,
            description = "Make TASK_ID wait for PREREQUISITE_ID")
    int depend(
            @Parameters(index = "0", paramLabel = "TASK_ID") String taskId,
            @Parameters(index = "1", paramLabel = "PREREQUISITE_ID") String prerequisiteId) {
        return guarded(() -> {
            Task task = queue.addDependency(taskId, prerequisiteId);
            ConsoleOutput.success(task.id() + " now depends on " + prerequisiteId + " (" + task.status() + ")");
            return 0;
        });
    }

    @Command(name = "plan", mixinStandardHelpOptions = true,
            description = "Show parallel execution batches in dependency order")
    int plan(@Parameters(paramLabel = "TASK_ID", arity = "0..*", description = "Defaults to every open task")
             List<String> taskIds) {
        return guarded(() -> {
            List<ExecutionBatch> batches = queue.executionPlan(taskIds == null ? List.of() : taskIds);
            if (batches.isEmpty()) {
                ConsoleOutput.info("Nothing to plan.");
                return 0;
            }
            for (ExecutionBatch batch : batches) {
                System.out.println("  Level " + batch.level() + ": " + String.join(", ", batch.taskIds()));
            }
            return 0;
        });
    }

    private int printJson(Object value) throws JsonProcessingException {
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        return 0;
    }

    static int guarded(CommandAction action) {
        try {
            return action.run();
        } catch (TaskQueueException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render JSON: " + e.getOriginalMessage());
            return 1;
        }
    }

    @FunctionalInterface
    interface CommandAction {
        int run() throws JsonProcessingException;
    }
}
