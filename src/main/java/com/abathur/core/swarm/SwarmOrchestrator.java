package com.abathur.core.swarm;

import com.abathur.core.config.AbathurProperties;
import com.abathur.core.events.EventBus;
import com.abathur.core.events.SwarmEvent;
import com.abathur.core.logging.MdcContext;
import com.abathur.core.metrics.AbathurMetrics;
import com.abathur.core.model.CancellationReport;
import com.abathur.core.model.ExecutionResult;
import com.abathur.core.model.FailureOutcome;
import com.abathur.core.model.SwarmStatus;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.TaskSubmission;
import com.abathur.core.queue.TaskQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dispatch loop that keeps up to {@code maxConcurrentAgents} tasks executing at once.
 * <p>
 * The loop runs on the thread that calls {@link #startSwarm}; executions run on a fixed
 * worker pool bounded by a semaphore. Every execution funnels through
 * {@link #finishExecution}, which runs exactly once per dispatched task whatever the
 * outcome and is the only place {@code completedCount} is incremented.
 * <p>
 * A bounded run admits new work only while {@code completedCount + inFlight < limit}.
 * {@code inFlight} is incremented before an execution is handed to the pool and
 * decremented after {@code completedCount} has been incremented, so the sum never drops
 * below the number of tasks already spawned.
 */
@Service
public class SwarmOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SwarmOrchestrator.class);

    private final TaskQueueService queue;
    private final AgentExecutor executor;
    private final Clock clock;
    private final int maxConcurrentAgents;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;
    private final Duration staleCheckInterval;
    private final Duration staleTaskBuffer;
    private final EventBus eventBus;
    private final AbathurMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean shutdownRequested;
    private volatile Integer completionLimit;
    private volatile String swarmRunId;
    private CountDownLatch finished = new CountDownLatch(0);

    private final Map<String, ActiveExecution> activeExecutions = new ConcurrentHashMap<>();
    private final List<ExecutionResult> results = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger completedCount = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile Semaphore capacity;
    private volatile ExecutorService workers;

    private final ReentrantLock wakeLock = new ReentrantLock();
    private final Condition wakeCondition = wakeLock.newCondition();
    private boolean wakePending;

    /**
     * One dispatched task. {@code done} is set under the instance lock before the
     * completion handler runs, after which the worker thread is never interrupted for it.
     */
    private static final class ActiveExecution {
        private final Task task;
        private Thread worker;
        private boolean done;
        private volatile boolean cancelRequested;
        private volatile boolean stoppedByShutdown;

        private ActiveExecution(Task task) {
            this.task = task;
        }
    }

    @Autowired
    public SwarmOrchestrator(TaskQueueService queue, AgentExecutor executor, AbathurProperties properties,
                             Clock clock, @Autowired(required = false) EventBus eventBus,
                             @Autowired(required = false) AbathurMetrics metrics) {
        this(queue, executor, clock, properties.getSwarm().getMaxConcurrentAgents(),
                properties.getSwarm().getPollInterval(), properties.getSwarm().getShutdownTimeout(),
                properties.getSwarm().getStaleCheckInterval(), properties.getSwarm().getStaleTaskBuffer(),
                eventBus, metrics);
    }

    SwarmOrchestrator(TaskQueueService queue, AgentExecutor executor, Clock clock,
                      int maxConcurrentAgents, Duration pollInterval, EventBus eventBus) {
        this(queue, executor, clock, maxConcurrentAgents, pollInterval, null,
                Duration.ofSeconds(60), Duration.ofSeconds(60), eventBus, null);
    }

    public SwarmOrchestrator(TaskQueueService queue, AgentExecutor executor, Clock clock,
                             int maxConcurrentAgents, Duration pollInterval, Duration shutdownTimeout,
                             Duration staleCheckInterval, Duration staleTaskBuffer,
                             EventBus eventBus, AbathurMetrics metrics) {
        if (maxConcurrentAgents < 1) {
            throw new IllegalArgumentException("maxConcurrentAgents must be at least 1, got " + maxConcurrentAgents);
        }
        this.queue = queue;
        this.executor = executor;
        this.clock = clock;
        this.maxConcurrentAgents = maxConcurrentAgents;
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;
        this.staleCheckInterval = staleCheckInterval;
        this.staleTaskBuffer = staleTaskBuffer;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Same collaborators and timings with a different agent limit.
     */
    public SwarmOrchestrator withMaxConcurrentAgents(int agents) {
        return new SwarmOrchestrator(queue, executor, clock, agents, pollInterval, shutdownTimeout,
                staleCheckInterval, staleTaskBuffer, eventBus, metrics);
    }

    // ── Control surface ───────────────────────────────────────────────────

    /**
     * Runs the dispatch loop on the calling thread until {@link #stop()} is called or
     * {@code completionLimit} executions have finished, then waits for in-flight executions.
     *
     * @param completionLimit stop once this many executions have finished since the last
     *                        {@link #reset()}; null for no limit
     * @return results recorded during this run, in completion order
     */
    public List<ExecutionResult> startSwarm(Integer completionLimit) {
        return startSwarm(completionLimit, false);
    }

    /**
     * @param stopWhenIdle also return once no task is ready and nothing is executing
     */
    public List<ExecutionResult> startSwarm(Integer completionLimit, boolean stopWhenIdle) {
        if (completionLimit != null && completionLimit < 0) {
            throw new IllegalArgumentException("completionLimit must not be negative");
        }
        CountDownLatch done = new CountDownLatch(1);
        synchronized (this) {
            if (running.get()) {
                throw new IllegalStateException("Swarm is already running");
            }
            finished = done;
            running.set(true);
        }
        shutdownRequested = false;
        this.completionLimit = completionLimit;
        swarmRunId = UUID.randomUUID().toString().substring(0, 8);
        int resultsBefore = results.size();
        capacity = new Semaphore(maxConcurrentAgents);
        workers = Executors.newFixedThreadPool(maxConcurrentAgents, workerThreadFactory(swarmRunId));
        EventBus.Subscription subscription = eventBus != null ? eventBus.subscribeAll(this::onEvent) : null;

        MdcContext.setSwarmRun(swarmRunId);
        log.info("Swarm {} started (max agents {}, completion limit {})",
                swarmRunId, maxConcurrentAgents, completionLimit == null ? "none" : completionLimit);
        publish(SwarmEvent.SWARM_STARTED, Map.of("maxConcurrentAgents", maxConcurrentAgents));
        try {
            dispatchLoop(stopWhenIdle);
            awaitInFlight();
            synchronized (results) {
                return List.copyOf(results.subList(resultsBefore, results.size()));
            }
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            workers.shutdown();
            running.set(false);
            log.info("Swarm {} stopped after {} completed execution(s)", swarmRunId, completedCount.get());
            publish(SwarmEvent.SWARM_STOPPED, Map.of("completedCount", completedCount.get()));
            MdcContext.clear();
            done.countDown();
        }
    }

    /**
     * Stops admitting work and waits for in-flight executions, bounded by
     * {@code abathur.swarm.shutdown-timeout} when configured.
     */
    public void stop() {
        stop(shutdownTimeout);
    }

    /**
     * Stops admitting work and waits for in-flight executions. When {@code hardTimeout}
     * passes first, every active execution is cancelled and the wait is repeated once. Tasks
     * interrupted this way stay {@code RUNNING} for stale recovery and their dependents keep waiting.
     *
     * @param hardTimeout null waits without bound
     */
    public void stop(Duration hardTimeout) {
        CountDownLatch done;
        synchronized (this) {
            if (!running.get()) {
                return;
            }
            done = finished;
        }
        log.info("Stop requested for swarm {}", swarmRunId);
        shutdownRequested = true;
        signal();
        try {
            if (hardTimeout == null) {
                done.await();
                return;
            }
            if (done.await(hardTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
            log.warn("Swarm {} still has {} execution(s) after {}; cancelling them",
                    swarmRunId, activeExecutions.size(), hardTimeout);
            activeExecutions.values().forEach(execution -> {
                execution.stoppedByShutdown = true;
                requestCancel(execution);
            });
            if (!done.await(hardTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Swarm {} did not stop; {} execution(s) ignored cancellation",
                        swarmRunId, activeExecutions.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Cancels a task and its transitive dependents, signalling any that are executing.
     */
    public CancellationReport cancelTask(String taskId) {
        CancellationReport report = queue.cancelTask(taskId);
        for (String id : report.cancelled()) {
            ActiveExecution execution = activeExecutions.get(id);
            if (execution != null) {
                requestCancel(execution);
            }
        }
        return report;
    }

    /**
     * Enqueues every submission, then runs until that many further executions have finished
     * or nothing is left to dispatch. Other ready tasks in the queue may be picked up too.
     *
     * @return results recorded during the run
     */
    public List<ExecutionResult> executeBatch(List<TaskSubmission> submissions) {
        log.info("Executing batch of {} task(s)", submissions.size());
        for (TaskSubmission submission : submissions) {
            queue.enqueue(submission);
        }
        return startSwarm(completedCount.get() + submissions.size(), true);
    }

    public SwarmStatus status() {
        int active = activeExecutions.size();
        int successes = 0;
        int failures = 0;
        synchronized (results) {
            for (ExecutionResult result : results) {
                if (result.success()) {
                    successes++;
                } else {
                    failures++;
                }
            }
        }
        return new SwarmStatus(running.get(), active, Math.max(0, maxConcurrentAgents - active),
                completedCount.get(), successes, failures, completionLimit, maxConcurrentAgents,
                List.copyOf(activeExecutions.keySet()), queue.queueStats());
    }

    /**
     * Clears active executions, recorded results and the completion counter between runs.
     *
     * @throws IllegalStateException while a run is active
     */
    public void reset() {
        if (running.get()) {
            throw new IllegalStateException("Cannot reset a running swarm");
        }
        activeExecutions.clear();
        results.clear();
        completedCount.set(0);
        inFlight.set(0);
        completionLimit = null;
        log.debug("Swarm state reset");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getCompletedCount() {
        return completedCount.get();
    }

    public List<String> getActiveTaskIds() {
        return List.copyOf(activeExecutions.keySet());
    }

    public List<ExecutionResult> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    // ── Dispatch loop ─────────────────────────────────────────────────────

    private void dispatchLoop(boolean stopWhenIdle) {
        Instant nextStaleCheck = clock.instant();
        while (!shutdownRequested) {
            Integer limit = completionLimit;
            if (limit != null && completedCount.get() >= limit) {
                log.info("Completion limit {} reached", limit);
                break;
            }
            if (!clock.instant().isBefore(nextStaleCheck)) {
                recoverStaleTasks();
                nextStaleCheck = clock.instant().plus(staleCheckInterval);
            }

            boolean admissionOpen = limit == null || completedCount.get() + inFlight.get() < limit;
            if (admissionOpen && capacity.tryAcquire()) {
                int inFlightBefore = inFlight.get();
                Optional<Task> next = Optional.empty();
                try {
                    next = queue.dequeueNextTask();
                } catch (RuntimeException e) {
                    log.error("Failed to fetch next ready task", e);
                }
                if (next.isPresent()) {
                    launch(next.get());
                    continue;
                }
                capacity.release();
                if (stopWhenIdle && inFlightBefore == 0) {
                    log.info("No ready tasks and nothing executing; swarm {} is idle", swarmRunId);
                    break;
                }
            }

            if (!awaitWake(pollInterval)) {
                shutdownRequested = true;
            }
        }
    }

    private void launch(Task task) {
        ActiveExecution execution = new ActiveExecution(task);
        activeExecutions.put(task.id(), execution);
        inFlight.incrementAndGet();
        log.info("Dispatching task {} [{}] (priority {})", task.id(),
                task.agentType() == null ? "default" : task.agentType(),
                String.format("%.2f", task.calculatedPriority()));
        try {
            workers.execute(() -> runExecution(execution));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected task {}", task.id(), e);
            finishExecution(execution, ExecutionResult.failure(task.id(), "Worker pool rejected execution", 0));
        }
    }

    private void runExecution(ActiveExecution execution) {
        Task task = execution.task;
        synchronized (execution) {
            execution.worker = Thread.currentThread();
        }
        MdcContext.setTask(swarmRunId, task.id(), task.agentType());
        long startMs = System.currentTimeMillis();
        ExecutionResult result = null;
        try {
            if (execution.cancelRequested) {
                result = ExecutionResult.cancelled(task.id(), 0);
            } else {
                result = executor.execute(task);
                if (result == null) {
                    result = ExecutionResult.failure(task.id(), "Agent returned no result",
                            System.currentTimeMillis() - startMs);
                } else if (execution.cancelRequested && !result.success()) {
                    result = ExecutionResult.cancelled(task.id(), result.elapsedMs());
                }
            }
        } catch (Throwable t) {
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (execution.cancelRequested) {
                result = ExecutionResult.cancelled(task.id(), elapsedMs);
            } else {
                log.error("Execution of task {} threw", task.id(), t);
                String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
                result = ExecutionResult.failure(task.id(), message, elapsedMs);
            }
        } finally {
            synchronized (execution) {
                execution.done = true;
            }
            if (result == null) {
                result = ExecutionResult.failure(task.id(), "Execution ended without a result",
                        System.currentTimeMillis() - startMs);
            }
            finishExecution(execution, result);
            Thread.interrupted();
            MdcContext.clearTask();
        }
    }

    /**
     * Completion handler. Runs once per launched execution.
     */
    private void finishExecution(ActiveExecution execution, ExecutionResult result) {
        String taskId = execution.task.id();
        try {
            activeExecutions.remove(taskId);
            results.add(result);
            recordOutcome(execution, result);
        } catch (RuntimeException e) {
            log.error("Could not record outcome of task {}", taskId, e);
        } finally {
            completedCount.incrementAndGet();
            inFlight.decrementAndGet();
            capacity.release();
            if (metrics != null) {
                metrics.recordTaskExecution(execution.task.agentType(), result.elapsedMs());
                metrics.recordExecutionOutcome(result.outcome());
            }
            log.info("Task {} finished: {} in {}ms (completed {})",
                    taskId, result.outcome(), result.elapsedMs(), completedCount.get());
            signal();
        }
    }

    private void recordOutcome(ActiveExecution execution, ExecutionResult result) {
        Task task = execution.task;
        Task current = queue.getTask(task.id());
        if (current.status() != TaskStatus.RUNNING) {
            log.info("Task {} is {} after execution; result not applied", task.id(), current.status());
            return;
        }
        if (result.cancelled() && execution.stoppedByShutdown) {
            // Left RUNNING; stale recovery fails and retries it once its timeout has passed.
            log.warn("Task {} was interrupted by shutdown and left running for stale recovery", task.id());
            return;
        }
        if (result.success()) {
            queue.completeTask(task.id());
        } else if (result.cancelled()) {
            queue.cancelTask(task.id());
        } else {
            FailureOutcome outcome = queue.failTask(task.id(), result.error());
            if (outcome.retryable()) {
                queue.retryTask(task.id());
            }
        }
    }

    private void recoverStaleTasks() {
        try {
            queue.recoverStaleTasks(activeExecutions.keySet(), staleTaskBuffer);
        } catch (RuntimeException e) {
            log.warn("Stale task recovery failed: {}", e.getMessage());
        }
    }

    private void awaitInFlight() {
        boolean interrupted = Thread.interrupted();
        wakeLock.lock();
        try {
            while (inFlight.get() > 0) {
                try {
                    wakeCondition.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            wakeLock.unlock();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Signalling ────────────────────────────────────────────────────────

    private void onEvent(SwarmEvent event) {
        switch (event.eventType()) {
            case SwarmEvent.TASK_ENQUEUED, SwarmEvent.TASK_READY -> signal();
            case SwarmEvent.TASK_CANCELLED -> {
                ActiveExecution execution = activeExecutions.get(event.taskId());
                if (execution != null) {
                    requestCancel(execution);
                }
            }
            default -> {
            }
        }
    }

    private void requestCancel(ActiveExecution execution) {
        execution.cancelRequested = true;
        try {
            executor.cancel(execution.task.id());
        } catch (RuntimeException e) {
            log.warn("Agent executor failed to cancel task {}: {}", execution.task.id(), e.getMessage());
        }
        synchronized (execution) {
            if (!execution.done && execution.worker != null) {
                execution.worker.interrupt();
            }
        }
    }

    private void signal() {
        wakeLock.lock();
        try {
            wakePending = true;
            wakeCondition.signalAll();
        } finally {
            wakeLock.unlock();
        }
    }

    /**
     * @return false when the loop thread was interrupted
     */
    private boolean awaitWake(Duration timeout) {
        wakeLock.lock();
        try {
            if (!wakePending) {
                wakeCondition.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            wakePending = false;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            wakeLock.unlock();
        }
    }

    private void publish(String eventType, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new SwarmEvent(eventType, null, payload, clock.instant()));
        }
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "swarm-" + runId + "-agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
