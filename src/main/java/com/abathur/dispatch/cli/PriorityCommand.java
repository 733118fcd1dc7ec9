package com.abathur.dispatch.cli;

import com.abathur.core.model.Task;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.priority.PriorityCalculator;
import com.abathur.core.queue.TaskQueueService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * CLI command group: abathur priority recalc [TASK_ID...]
 */
@Command(name = "priority", mixinStandardHelpOptions = true, description = "Priority maintenance")
@Component
public class PriorityCommand implements Runnable {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final PriorityCalculator calculator;
    private final TaskQueueService queue;

    public PriorityCommand(PriorityCalculator calculator, TaskQueueService queue) {
        this.calculator = calculator;
        this.queue = queue;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "recalc", mixinStandardHelpOptions = true,
            description = "Recalculate priorities of pending, blocked and ready tasks")
    int recalc(@Parameters(paramLabel = "TASK_ID", arity = "0..*", description = "Defaults to every waiting task")
               List<String> taskIds) {
        return TaskCommand.guarded(() -> {
            List<String> ids = taskIds;
            if (ids == null || ids.isEmpty()) {
                ids = queue.listTasks(EnumSet.of(TaskStatus.PENDING, TaskStatus.BLOCKED, TaskStatus.READY),
                                Integer.MAX_VALUE).stream()
                        .map(Task::id)
                        .toList();
            }
            Map<String, Double> updated = calculator.recalculatePriorities(ids);
            updated.forEach((id, priority) -> System.out.printf("  %-38s %8.2f%n", id, priority));
            ConsoleOutput.success("Recalculated " + updated.size() + " of " + ids.size() + " task(s)");
            return 0;
        });
    }
}
