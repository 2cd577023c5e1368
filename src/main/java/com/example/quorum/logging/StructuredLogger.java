package com.example.quorum.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Map;

/**
 * Structured JSON logging for orchestrator runs.
 * Every event carries the run id so interleaved runs in one process stay separable.
 */
public class StructuredLogger {

    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_OPERATION = "operation";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule());

    private final Logger logger;
    private final String runId;

    public StructuredLogger(Class<?> clazz, String runId) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.runId = runId;
    }

    /**
     * Logs a task status transition.
     */
    public void logStateTransition(String taskId, String fromState, String toState, String reason,
                                   Map<String, Object> context) {
        ObjectNode entry = baseEntry("state_transition");
        entry.put("taskId", taskId);
        entry.put("fromState", fromState);
        entry.put("toState", toState);
        entry.put("reason", reason);
        info(entry, context, "context");
    }

    /**
     * Logs the outcome of one agent invocation.
     */
    public void logAgentCall(String taskId, String agentId, int attempt, AgentCallOutcome outcome,
                             long durationMs, Map<String, Object> context) {
        ObjectNode entry = baseEntry("agent_call");
        entry.put("taskId", taskId);
        entry.put("agentId", agentId);
        entry.put("attempt", attempt);
        entry.put("outcome", outcome.name());
        entry.put("durationMs", durationMs);
        info(entry, context, "context");
    }

    /**
     * Logs a finished consensus round with its tally.
     */
    public void logConsensusRound(String taskId, int round, String outcome, int faultTolerance,
                                  int answersReceived, int answersExpected, Map<String, Integer> tally) {
        ObjectNode entry = baseEntry("consensus_round");
        entry.put("taskId", taskId);
        entry.put("round", round);
        entry.put("outcome", outcome);
        entry.put("faultTolerance", faultTolerance);
        entry.put("answersReceived", answersReceived);
        entry.put("answersExpected", answersExpected);
        if (tally != null && !tally.isEmpty()) {
            entry.set("tally", objectMapper.valueToTree(tally));
        }
        write(entry, false);
    }

    /**
     * Logs one timed operation with its running aggregate.
     */
    public void logPerformanceMetrics(String operation, long durationMs, int units,
                                      Map<String, Object> metrics) {
        ObjectNode entry = baseEntry("performance_metrics");
        entry.put("operation", operation);
        entry.put("durationMs", durationMs);
        entry.put("units", units);
        info(entry, metrics, "metrics");
    }

    /**
     * Logs error events with context and retry information.
     */
    public void logError(String operation, String errorMessage, Throwable throwable,
                         int retryAttempt, int maxRetries, Map<String, Object> context) {
        ObjectNode entry = baseEntry("error");
        entry.put("operation", operation);
        entry.put("errorMessage", errorMessage);
        entry.put("retryAttempt", retryAttempt);
        entry.put("maxRetries", maxRetries);
        if (throwable != null) {
            entry.put("exceptionType", throwable.getClass().getSimpleName());
            entry.put("stackTrace", getStackTraceString(throwable));
        }
        if (context != null && !context.isEmpty()) {
            entry.set("context", objectMapper.valueToTree(context));
        }
        write(entry, true);
    }

    /**
     * Logs run lifecycle events (start, cancellation, completion).
     */
    public void logRunLifecycle(RunLifecycleEvent event, Map<String, Object> context) {
        ObjectNode entry = baseEntry("run_lifecycle");
        entry.put("lifecycleEvent", event.name());
        info(entry, context, "context");
    }

    /**
     * Sets MDC context for the current thread.
     */
    public void setMDCContext(String taskId, String operation) {
        MDC.put(MDC_RUN_ID, runId);
        if (taskId != null) {
            MDC.put(MDC_TASK_ID, taskId);
        }
        if (operation != null) {
            MDC.put(MDC_OPERATION, operation);
        }
    }

    /**
     * Clears the MDC keys this logger sets, leaving unrelated keys alone.
     */
    public void clearMDCContext() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_OPERATION);
    }

    public String getRunId() {
        return runId;
    }

    private ObjectNode baseEntry(String eventType) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", Instant.now().toString());
        entry.put("runId", runId);
        entry.put("eventType", eventType);
        return entry;
    }

    private void info(ObjectNode entry, Map<String, Object> extra, String fieldName) {
        if (extra != null && !extra.isEmpty()) {
            entry.set(fieldName, objectMapper.valueToTree(extra));
        }
        write(entry, false);
    }

    private void write(ObjectNode entry, boolean error) {
        try {
            String json = objectMapper.writeValueAsString(entry);
            if (error) {
                logger.error(json);
            } else {
                logger.info(json);
            }
        } catch (Exception e) {
            logger.error("Failed to log {} event", entry.path("eventType").asText(), e);
        }
    }

    private String getStackTraceString(Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Outcome of a single agent invocation.
     */
    public enum AgentCallOutcome {
        ANSWERED,
        EMPTY,
        UNAVAILABLE,
        TIMED_OUT,
        ERROR
    }

    /**
     * Run lifecycle events.
     */
    public enum RunLifecycleEvent {
        STARTED,
        CANCELLING,
        COMPLETED,
        ABORTED
    }
}
