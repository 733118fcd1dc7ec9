package com.abathur.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Abathur.
 * Routes to subcommands: task, queue, priority, swarm, health.
 */
@Command(
        name = "abathur",
        mixinStandardHelpOptions = true,
        version = "Abathur 0.1.0",
        description = "Priority task queue and agent swarm orchestrator",
        subcommands = {
                TaskCommand.class,
                QueueCommand.class,
                PriorityCommand.class,
                SwarmCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AbathurCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
