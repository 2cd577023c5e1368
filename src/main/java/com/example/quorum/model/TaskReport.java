package com.example.quorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Terminal outcome of one task in a run.
 */
public class TaskReport {

    private final String taskId;
    private final TaskStatus status;
    private final FailureReason failureReason;
    private final String failureDetail;
    private final int attempts;
    private final int retryCount;
    private final long elapsedMs;
    private final TaskResult result;

    @JsonCreator
    public TaskReport(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("status") TaskStatus status,
            @JsonProperty("failureReason") FailureReason failureReason,
            @JsonProperty("failureDetail") String failureDetail,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("retryCount") int retryCount,
            @JsonProperty("elapsedMs") long elapsedMs,
            @JsonProperty("result") TaskResult result) {
        this.taskId = taskId;
        this.status = status;
        this.failureReason = failureReason;
        this.failureDetail = failureDetail;
        this.attempts = attempts;
        this.retryCount = retryCount;
        this.elapsedMs = elapsedMs;
        this.result = result;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getFailureDetail() {
        return failureDetail;
    }

    /**
     * Number of agent attempts made; zero for tasks that never ran.
     */
    public int getAttempts() {
        return attempts;
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Time from first dispatch to terminal state; zero for tasks that never ran.
     */
    public long getElapsedMs() {
        return elapsedMs;
    }

    public TaskResult getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskReport that = (TaskReport) o;
        return attempts == that.attempts &&
               retryCount == that.retryCount &&
               elapsedMs == that.elapsedMs &&
               Objects.equals(taskId, that.taskId) &&
               status == that.status &&
               failureReason == that.failureReason &&
               Objects.equals(failureDetail, that.failureDetail) &&
               Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, status, failureReason, failureDetail, attempts, retryCount, elapsedMs, result);
    }

    @Override
    public String toString() {
        return "TaskReport{" +
               "taskId='" + taskId + '\'' +
               ", status=" + status +
               ", failureReason=" + failureReason +
               ", failureDetail='" + failureDetail + '\'' +
               ", attempts=" + attempts +
               ", retryCount=" + retryCount +
               ", elapsedMs=" + elapsedMs +
               '}';
    }
}
