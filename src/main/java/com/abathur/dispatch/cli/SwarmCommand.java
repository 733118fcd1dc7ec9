package com.abathur.dispatch.cli;

import com.abathur.core.model.ExecutionResult;
import com.abathur.core.model.SwarmStatus;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.swarm.SwarmOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.List;

/**
 * CLI command group: abathur swarm run
 * <p>
 * Runs the dispatch loop in the foreground. Without {@code --watch} the run ends once the
 * queue has nothing ready and nothing executing; with it, the run continues until the
 * completion limit or Ctrl-C.
 */
@Command(name = "swarm", mixinStandardHelpOptions = true, description = "Run the agent swarm")
@Component
public class SwarmCommand implements Runnable {

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final SwarmOrchestrator orchestrator;

    public SwarmCommand(SwarmOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "run", mixinStandardHelpOptions = true, description = "Dispatch ready tasks to agents")
    int runSwarm(
            @Option(names = {"--limit", "-l"}, description = "Stop after this many completed executions")
            Integer limit,
            @Option(names = {"--max-agents", "-a"}, description = "Concurrent agent limit for this run")
            Integer maxAgents,
            @Option(names = {"--watch", "-w"}, description = "Keep waiting for new tasks when the queue drains")
            boolean watch) {
        SwarmOrchestrator swarm;
        try {
            swarm = maxAgents == null ? orchestrator : orchestrator.withMaxConcurrentAgents(maxAgents);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        Thread shutdownHook = new Thread(swarm::stop, "abathur-swarm-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        ConsoleOutput.printBanner();
        SwarmStatus before = swarm.status();
        ConsoleOutput.info("Starting swarm with " + before.maxConcurrentAgents() + " agent slot(s), "
                + before.queueStats().count(TaskStatus.READY) + " task(s) ready"
                + (limit != null ? ", limit " + limit : ""));

        List<ExecutionResult> results;
        try {
            results = swarm.startSwarm(limit, !watch);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            removeHook(shutdownHook);
        }

        results.forEach(ConsoleOutput::executionResult);
        long succeeded = results.stream().filter(ExecutionResult::success).count();
        long cancelled = results.stream().filter(ExecutionResult::cancelled).count();
        long failed = results.size() - succeeded - cancelled;
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info("Executions: " + results.size() + " (" + succeeded + " succeeded, "
                + failed + " failed, " + cancelled + " cancelled)");
        return failed > 0 ? 1 : 0;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down
        }
    }
}
