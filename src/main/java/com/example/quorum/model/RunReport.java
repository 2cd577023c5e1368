package com.example.quorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregate outcome of an orchestrator run: one {@link TaskReport} per task plus run totals.
 */
public class RunReport {

    private final String runId;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final boolean cancelled;
    private final Map<String, TaskReport> tasks;

    @JsonCreator
    public RunReport(
            @JsonProperty("runId") String runId,
            @JsonProperty("startedAt") Instant startedAt,
            @JsonProperty("finishedAt") Instant finishedAt,
            @JsonProperty("cancelled") boolean cancelled,
            @JsonProperty("tasks") Map<String, TaskReport> tasks) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.cancelled = cancelled;
        this.tasks = tasks != null ? Collections.unmodifiableMap(new TreeMap<>(tasks)) : Map.of();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Per-task reports keyed and ordered by task id.
     */
    public Map<String, TaskReport> getTasks() {
        return tasks;
    }

    @JsonIgnore
    public TaskReport getTask(String taskId) {
        return tasks.get(taskId);
    }

    @JsonIgnore
    public long getElapsedMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    @JsonIgnore
    public long getSucceededCount() {
        return countWithStatus(TaskStatus.SUCCEEDED);
    }

    @JsonIgnore
    public long getFailedCount() {
        return countWithStatus(TaskStatus.FAILED);
    }

    @JsonIgnore
    public int getTotalRetries() {
        return tasks.values().stream().mapToInt(TaskReport::getRetryCount).sum();
    }

    /**
     * True when every task succeeded.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return !tasks.isEmpty() && getSucceededCount() == tasks.size();
    }

    /**
     * Ids of tasks that failed with the given reason, in id order.
     */
    public List<String> failedWith(FailureReason reason) {
        return tasks.values().stream()
            .filter(report -> report.getFailureReason() == reason)
            .map(TaskReport::getTaskId)
            .collect(Collectors.toList());
    }

    private long countWithStatus(TaskStatus status) {
        return tasks.values().stream().filter(report -> report.getStatus() == status).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunReport runReport = (RunReport) o;
        return cancelled == runReport.cancelled &&
               Objects.equals(runId, runReport.runId) &&
               Objects.equals(startedAt, runReport.startedAt) &&
               Objects.equals(finishedAt, runReport.finishedAt) &&
               Objects.equals(tasks, runReport.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, startedAt, finishedAt, cancelled, tasks);
    }

    @Override
    public String toString() {
        return "RunReport{" +
               "runId='" + runId + '\'' +
               ", tasks=" + tasks.size() +
               ", succeeded=" + getSucceededCount() +
               ", failed=" + getFailedCount() +
               ", cancelled=" + cancelled +
               ", elapsedMs=" + getElapsedMs() +
               '}';
    }
}
