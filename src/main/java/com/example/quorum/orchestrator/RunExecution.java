package com.example.quorum.orchestrator;

import com.example.quorum.agent.Agent;
import com.example.quorum.agent.AgentSelector;
import com.example.quorum.agent.AgentTimeoutException;
import com.example.quorum.agent.AgentUnavailableException;
import com.example.quorum.config.RunConfig;
import com.example.quorum.consensus.ConsensusPolicy;
import com.example.quorum.consensus.ConsensusRound;
import com.example.quorum.graph.Task;
import com.example.quorum.graph.TaskGraph;
import com.example.quorum.logging.PerformanceTracker;
import com.example.quorum.logging.PerformanceTracker.Operation;
import com.example.quorum.logging.PerformanceTracker.OperationTimer;
import com.example.quorum.logging.StructuredLogger;
import com.example.quorum.logging.StructuredLogger.AgentCallOutcome;
import com.example.quorum.logging.StructuredLogger.RunLifecycleEvent;
import com.example.quorum.model.AgentAnswer;
import com.example.quorum.model.FailureReason;
import com.example.quorum.model.RunReport;
import com.example.quorum.model.TaskReport;
import com.example.quorum.model.TaskResult;
import com.example.quorum.model.TaskSpec;
import com.example.quorum.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Scheduling state machine for a single run.
 *
 * <p>All status transitions happen on the thread executing {@link #run()}. Agent calls, consensus
 * rounds and backoff timers run elsewhere and report back as events on a queue.
 */
class RunExecution implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RunExecution.class);

    static final String CANCELLED_DETAIL = "Run cancelled";

    private final TaskGraph graph;
    private final RunContext context;
    private final RunConfig config;
    private final ConsensusPolicy policy;
    private final AgentSelector selector;
    private final WorkerPool pool;
    private final StructuredLogger structuredLogger;
    private final PerformanceTracker performanceTracker;
    private final CompletableFuture<RunReport> completion = new CompletableFuture<>();
    private final BlockingQueue<RunEvent> events = new LinkedBlockingQueue<>();
    private final Runnable wakeUp = () -> events.offer(RunEvent.wakeUp());

    // Owned by the scheduling thread.
    private final Map<String, Integer> slotHolders = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> backoffTimers = new HashMap<>();
    private final Map<String, Integer> attempts = new HashMap<>();
    private final Map<String, Instant> dispatchedAt = new HashMap<>();
    private final Map<String, Instant> finishedAt = new HashMap<>();
    private final Map<String, OperationTimer> taskTimers = new HashMap<>();
    private final List<CompletableFuture<Void>> deliveries = new ArrayList<>();
    private Instant startedAt;
    private boolean cancelling;
    private boolean interrupted;

    RunExecution(TaskGraph graph, RunContext context) {
        this.graph = graph;
        this.context = context;
        this.config = context.getConfig();
        this.policy = config.getConsensusPolicy();
        this.selector = new AgentSelector(context.getAgents(), config.getAgentSelection());
        this.pool = new WorkerPool("quorum-" + shortId(context.getRunId()), config.getConcurrency());
        this.structuredLogger = new StructuredLogger(RunExecution.class, context.getRunId());
        this.performanceTracker = new PerformanceTracker(structuredLogger);
    }

    CompletableFuture<RunReport> getCompletion() {
        return completion;
    }

    @Override
    public void run() {
        startedAt = Instant.now();
        resetMdc(null, "schedule");
        context.getCancellationToken().onCancel(wakeUp);
        boolean aborted = false;
        try {
            structuredLogger.logRunLifecycle(RunLifecycleEvent.STARTED, Map.of(
                "tasks", graph.size(),
                "concurrency", pool.getSlots(),
                "agents", context.getAgents().size()));
            notifyListener(listener -> listener.onRunStarted(context.getRunId()));

            schedule();
            if (cancelling) {
                failRemainingAsCancelled();
            }
            CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();

            RunReport report = buildReport();
            structuredLogger.logRunLifecycle(RunLifecycleEvent.COMPLETED, Map.of(
                "succeeded", report.getSucceededCount(),
                "failed", report.getFailedCount(),
                "retries", report.getTotalRetries(),
                "cancelled", report.isCancelled(),
                "elapsedMs", report.getElapsedMs(),
                "metrics", performanceTracker.summary()));
            notifyListener(listener -> listener.onRunFinished(report));
            completion.complete(report);
        } catch (RuntimeException e) {
            aborted = true;
            structuredLogger.logError("run", "Run aborted: " + e.getMessage(), e, 0, 0, Map.of());
            structuredLogger.logRunLifecycle(RunLifecycleEvent.ABORTED,
                Map.of("error", String.valueOf(e.getMessage())));
            completion.completeExceptionally(e);
        } finally {
            context.getCancellationToken().removeCallback(wakeUp);
            backoffTimers.values().forEach(timer -> timer.cancel(false));
            pool.shutdown(aborted);
            structuredLogger.clearMDCContext();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void schedule() {
        while (!graph.isComplete()) {
            if (!cancelling && context.getCancellationToken().isCancelled()) {
                beginCancellation();
            }
            if (!cancelling) {
                dispatchReady();
            }
            if (slotHolders.isEmpty()) {
                if (cancelling || graph.isComplete()) {
                    return;
                }
                throw new IllegalStateException("No task can make progress: " + graph.statusSnapshot());
            }
            RunEvent event = nextEvent();
            if (event != null) {
                apply(event);
            }
            resetMdc(null, "schedule");
        }
    }

    private RunEvent nextEvent() {
        try {
            return events.take();
        } catch (InterruptedException e) {
            interrupted = true;
            logger.warn("Scheduling thread interrupted; cancelling run {}", context.getRunId());
            context.getCancellationToken().cancel();
            return null;
        }
    }

    private void apply(RunEvent event) {
        switch (event.kind) {
            case ATTEMPT_FINISHED:
                onAttemptFinished(event.result);
                break;
            case RETRY_DUE:
                onRetryDue(event.taskId);
                break;
            case WAKE_UP:
            default:
                break;
        }
    }

    private void beginCancellation() {
        cancelling = true;
        structuredLogger.logRunLifecycle(RunLifecycleEvent.CANCELLING, Map.of(
            "inFlight", slotHolders.size() - backoffTimers.size(),
            "abandonedRetries", backoffTimers.size()));
        Iterator<Map.Entry<String, ScheduledFuture<?>>> pending = backoffTimers.entrySet().iterator();
        while (pending.hasNext()) {
            Map.Entry<String, ScheduledFuture<?>> entry = pending.next();
            entry.getValue().cancel(false);
            releaseSlot(entry.getKey());
            pending.remove();
        }
    }

    private void dispatchReady() {
        for (Task task : graph.readyTasks()) {
            if (task.getStatus() != TaskStatus.READY) {
                continue;
            }
            if (!pool.tryAcquireSlot()) {
                break;
            }
            String taskId = task.getId();
            resetMdc(taskId, "dispatch");
            graph.markRunning(taskId);
            statusChanged(taskId, TaskStatus.READY, TaskStatus.RUNNING, "dispatched");
            dispatchedAt.put(taskId, Instant.now());
            taskTimers.put(taskId, performanceTracker.start(taskId, Operation.TASK));
            startAttempt(task, 1);
        }
    }

    private void startAttempt(Task task, int attempt) {
        String taskId = task.getId();
        slotHolders.put(taskId, attempt);
        attempts.put(taskId, attempt);
        notifyListener(listener -> listener.onAttemptStarted(taskId, attempt));

        TaskSpec spec = specWithContext(task);
        OptionalInt faultTolerance = policy.faultToleranceFor(taskId);
        CompletableFuture<AttemptResult> outcome;
        if (faultTolerance.isPresent()) {
            graph.markAwaitingConsensus(taskId);
            statusChanged(taskId, TaskStatus.RUNNING, TaskStatus.AWAITING_CONSENSUS,
                "fan-out to " + ConsensusRound.requiredAnswers(faultTolerance.getAsInt()) + " agents");
            outcome = resolveByConsensus(taskId, spec, attempt, faultTolerance.getAsInt());
        } else {
            Agent agent = selector.select(taskId, spec, attempt, 1).get(0);
            outcome = callAgent(agent, taskId, spec, attempt)
                .handle((answer, error) -> singleAgentResult(taskId, attempt, agent, answer, error));
        }
        outcome.whenComplete((result, error) -> events.offer(RunEvent.attemptFinished(
            error == null ? result : AttemptResult.failed(taskId, attempt,
                faultTolerance.isPresent() ? FailureReason.CONSENSUS_FAILURE : FailureReason.AGENT_FAILURE,
                describe(error)))));
    }

    private CompletableFuture<AttemptResult> resolveByConsensus(String taskId, TaskSpec spec, int attempt,
                                                                int faultTolerance) {
        int calls = ConsensusRound.requiredAnswers(faultTolerance);
        List<CompletableFuture<AgentAnswer>> answers = selector.select(taskId, spec, attempt, calls).stream()
            .map(agent -> callAgent(agent, taskId, spec, attempt))
            .collect(Collectors.toList());
        OperationTimer timer = performanceTracker.start(taskId + "#" + attempt, Operation.CONSENSUS_ROUND);

        return context.getConsensusEngine()
            .resolve(taskId, attempt, answers, faultTolerance, config.getConsensusTimeout())
            .thenApply(round -> {
                structuredLogger.logConsensusRound(taskId, attempt, round.getOutcome().name(), faultTolerance,
                    round.getAnswersReceived(), round.getAnswersExpected(), round.getTally());
                performanceTracker.record(timer, round.isAccepted(), round.getAnswersReceived(),
                    Map.of("outcome", round.getOutcome().name(), "faultTolerance", faultTolerance));
                if (round.isAccepted()) {
                    return AttemptResult.succeeded(taskId, attempt, round.toTaskResult());
                }
                return AttemptResult.failed(taskId, attempt, FailureReason.CONSENSUS_FAILURE, round.describe());
            });
    }

    private CompletableFuture<AgentAnswer> callAgent(Agent agent, String taskId, TaskSpec spec, int attempt) {
        OperationTimer timer = performanceTracker.start(
            taskId + "#" + attempt + "@" + agent.getId(), Operation.AGENT_CALL);
        Duration timeout = config.getAgentTimeout();
        return pool.submit(() -> propose(agent, taskId, spec), timeout,
                           () -> new AgentTimeoutException(agent.getId(), timeout))
            .whenComplete((answer, error) -> recordAgentCall(agent, taskId, attempt, timer, answer, error));
    }

    private AgentAnswer propose(Agent agent, String taskId, TaskSpec spec) {
        structuredLogger.setMDCContext(taskId, "agent_call");
        try {
            return agent.propose(taskId, spec);
        } finally {
            structuredLogger.clearMDCContext();
        }
    }

    private void recordAgentCall(Agent agent, String taskId, int attempt, OperationTimer timer,
                                 AgentAnswer answer, Throwable error) {
        Throwable cause = unwrap(error);
        AgentCallOutcome outcome;
        if (cause instanceof AgentTimeoutException) {
            outcome = AgentCallOutcome.TIMED_OUT;
        } else if (cause instanceof AgentUnavailableException) {
            outcome = AgentCallOutcome.UNAVAILABLE;
        } else if (cause != null) {
            outcome = AgentCallOutcome.ERROR;
        } else if (answer == null || answer.isEmpty()) {
            outcome = AgentCallOutcome.EMPTY;
        } else {
            outcome = AgentCallOutcome.ANSWERED;
        }
        Map<String, Object> details = cause != null ? Map.of("error", describe(cause)) : Map.of();
        structuredLogger.logAgentCall(taskId, agent.getId(), attempt, outcome, timer.elapsedMs(), details);
        performanceTracker.record(timer, outcome == AgentCallOutcome.ANSWERED, 1,
            Map.of("agentId", agent.getId(), "outcome", outcome.name()));
    }

    private AttemptResult singleAgentResult(String taskId, int attempt, Agent agent, AgentAnswer answer,
                                            Throwable error) {
        if (error != null) {
            return AttemptResult.failed(taskId, attempt, FailureReason.AGENT_FAILURE, describe(error));
        }
        if (answer == null || answer.isEmpty()) {
            return AttemptResult.failed(taskId, attempt, FailureReason.AGENT_FAILURE,
                "Agent " + agent.getId() + " returned an empty answer");
        }
        return AttemptResult.succeeded(taskId, attempt, TaskResult.fromAnswer(answer, attempt));
    }

    private void onAttemptFinished(AttemptResult result) {
        String taskId = result.getTaskId();
        Integer current = slotHolders.get(taskId);
        if (current == null || current != result.getAttempt() || backoffTimers.containsKey(taskId)) {
            logger.debug("Ignoring stale result of attempt {} for task {}", result.getAttempt(), taskId);
            return;
        }
        resetMdc(taskId, "complete");
        notifyListener(listener -> listener.onAttemptFinished(result));
        Task task = graph.get(taskId);

        if (result.isSucceeded()) {
            TaskStatus from = task.getStatus();
            List<String> unlocked = graph.markSucceeded(taskId, result.getResult());
            statusChanged(taskId, from, TaskStatus.SUCCEEDED, "attempt " + result.getAttempt() + " succeeded");
            for (String dependentId : unlocked) {
                statusChanged(dependentId, TaskStatus.PENDING, TaskStatus.READY, "dependencies succeeded");
            }
            finish(taskId, true);
            deliver(taskId, result.getResult());
            return;
        }

        if (cancelling) {
            logger.info("Attempt {} of task {} failed during cancellation: {}",
                        result.getAttempt(), taskId, result.getDetail());
            releaseSlot(taskId);
            return;
        }

        int maxRetries = task.effectiveMaxRetries(config.getMaxRetries());
        if (task.getRetryCount() < maxRetries) {
            TaskStatus from = task.getStatus();
            int retry = graph.recordRetry(taskId);
            if (from != TaskStatus.RUNNING) {
                statusChanged(taskId, from, TaskStatus.RUNNING, "retry " + retry + " of " + maxRetries);
            }
            Duration delay = config.getRetryBackoff().delayFor(retry);
            structuredLogger.logError("attempt", result.getDetail(), null, retry, maxRetries, Map.of(
                "taskId", taskId,
                "reason", result.getFailureReason().name(),
                "backoffMs", delay.toMillis()));
            backoffTimers.put(taskId, pool.schedule(() -> events.offer(RunEvent.retryDue(taskId)), delay));
            return;
        }

        Map<String, TaskStatus> before = graph.statusSnapshot();
        List<String> propagated = graph.markFailed(taskId, result.getFailureReason(), result.getDetail());
        statusChanged(taskId, before.get(taskId), TaskStatus.FAILED, result.getFailureReason().name());
        structuredLogger.logError("task", result.getDetail(), null, task.getRetryCount(), maxRetries, Map.of(
            "taskId", taskId,
            "reason", result.getFailureReason().name(),
            "attempts", result.getAttempt(),
            "propagatedTo", propagated));
        finish(taskId, false);
        for (String dependentId : propagated) {
            statusChanged(dependentId, before.get(dependentId), TaskStatus.FAILED,
                FailureReason.UPSTREAM_FAILURE.name());
            finishedAt.put(dependentId, Instant.now());
        }
    }

    private void onRetryDue(String taskId) {
        if (backoffTimers.remove(taskId) == null || cancelling) {
            return;
        }
        resetMdc(taskId, "retry");
        Task task = graph.get(taskId);
        startAttempt(task, task.getRetryCount() + 1);
    }

    private void failRemainingAsCancelled() {
        Map<String, TaskStatus> before = graph.statusSnapshot();
        List<String> failed = graph.failRemaining(FailureReason.CANCELLED, CANCELLED_DETAIL);
        for (String taskId : failed) {
            statusChanged(taskId, before.get(taskId), TaskStatus.FAILED, FailureReason.CANCELLED.name());
            finish(taskId, false);
        }
        if (!failed.isEmpty()) {
            logger.info("Run {} cancelled; {} tasks did not finish", context.getRunId(), failed.size());
        }
    }

    private void finish(String taskId, boolean success) {
        releaseSlot(taskId);
        finishedAt.put(taskId, Instant.now());
        OperationTimer timer = taskTimers.remove(taskId);
        if (timer != null) {
            performanceTracker.record(timer, success, attempts.getOrDefault(taskId, 0),
                Map.of("taskId", taskId));
        }
    }

    private void releaseSlot(String taskId) {
        if (slotHolders.remove(taskId) != null) {
            pool.releaseSlot();
        }
    }

    private void deliver(String taskId, TaskResult result) {
        deliveries.add(pool.execute(() -> {
            try {
                context.getSink().accept(taskId, result);
            } catch (RuntimeException e) {
                logger.warn("Result sink rejected result of task {}", taskId, e);
            }
        }));
    }

    private TaskSpec specWithContext(Task task) {
        List<String> completed = new ArrayList<>();
        for (String dependencyId : task.getDependencies()) {
            TaskResult dependencyResult = graph.get(dependencyId).getResult();
            if (dependencyResult != null) {
                completed.add(dependencyResult.asText());
            }
        }
        return completed.isEmpty() ? task.getSpec() : task.getSpec().withContext(completed);
    }

    private RunReport buildReport() {
        Map<String, TaskReport> reports = new LinkedHashMap<>();
        for (Task task : graph.tasks()) {
            String taskId = task.getId();
            Instant start = dispatchedAt.get(taskId);
            Instant end = finishedAt.get(taskId);
            long elapsedMs = start != null && end != null ? Duration.between(start, end).toMillis() : 0L;
            reports.put(taskId, new TaskReport(
                taskId,
                task.getStatus(),
                task.getFailureReason(),
                task.getFailureDetail(),
                attempts.getOrDefault(taskId, 0),
                task.getRetryCount(),
                elapsedMs,
                task.getResult()));
        }
        return new RunReport(context.getRunId(), startedAt, Instant.now(), cancelling, reports);
    }

    private void statusChanged(String taskId, TaskStatus from, TaskStatus to, String reason) {
        structuredLogger.logStateTransition(taskId, String.valueOf(from), to.name(), reason, null);
        notifyListener(listener -> listener.onStatusChange(taskId, from, to));
    }

    private void notifyListener(Consumer<RunListener> event) {
        try {
            event.accept(context.getListener());
        } catch (RuntimeException e) {
            logger.warn("Run listener failed", e);
        }
    }

    private void resetMdc(String taskId, String operation) {
        structuredLogger.clearMDCContext();
        structuredLogger.setMDCContext(taskId, operation);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private static String shortId(String runId) {
        return runId.length() > 8 ? runId.substring(0, 8) : runId;
    }

    private static final class RunEvent {

        private enum Kind {
            ATTEMPT_FINISHED,
            RETRY_DUE,
            WAKE_UP
        }

        private final Kind kind;
        private final AttemptResult result;
        private final String taskId;

        private RunEvent(Kind kind, AttemptResult result, String taskId) {
            this.kind = kind;
            this.result = result;
            this.taskId = taskId;
        }

        static RunEvent attemptFinished(AttemptResult result) {
            return new RunEvent(Kind.ATTEMPT_FINISHED, result, result.getTaskId());
        }

        static RunEvent retryDue(String taskId) {
            return new RunEvent(Kind.RETRY_DUE, null, taskId);
        }

        static RunEvent wakeUp() {
            return new RunEvent(Kind.WAKE_UP, null, null);
        }
    }
}
