package com.abathur.dispatch.cli;

import com.abathur.core.model.QueueStats;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.queue.TaskQueueService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command group: abathur queue status
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Inspect the task queue")
@Component
public class QueueCommand implements Runnable {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final TaskQueueService queue;
    private final ObjectMapper objectMapper;

    public QueueCommand(TaskQueueService queue, ObjectMapper objectMapper) {
        this.queue = queue;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "status", mixinStandardHelpOptions = true, description = "Show queue statistics")
    int status(@Option(names = "--json", description = "Print JSON") boolean json) {
        return TaskCommand.guarded(() -> {
            QueueStats stats = queue.queueStats();
            if (json) {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(stats));
                return 0;
            }
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Tasks: " + stats.total());
            for (TaskStatus status : TaskStatus.values()) {
                int count = stats.count(status);
                if (count > 0) {
                    System.out.printf("  %-22s %d%n", status, count);
                }
            }
            System.out.printf("  Average priority: %.2f%n", stats.averagePriority());
            System.out.println("  Max dependency depth: " + stats.maxDependencyDepth());
            if (stats.oldestWaiting() != null) {
                System.out.println("  Oldest waiting since: " + stats.oldestWaiting());
            }
            if (stats.newestSubmission() != null) {
                System.out.println("  Newest submission: " + stats.newestSubmission());
            }
            return 0;
        });
    }
}
