package com.example.quorum.orchestrator;

import com.example.quorum.model.FailureReason;
import com.example.quorum.model.TaskResult;

/**
 * Outcome of one attempt of a task, as consumed by the scheduling loop.
 */
public final class AttemptResult {

    private final String taskId;
    private final int attempt;
    private final TaskResult result;
    private final FailureReason failureReason;
    private final String detail;

    private AttemptResult(String taskId, int attempt, TaskResult result, FailureReason failureReason, String detail) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.result = result;
        this.failureReason = failureReason;
        this.detail = detail;
    }

    public static AttemptResult succeeded(String taskId, int attempt, TaskResult result) {
        return new AttemptResult(taskId, attempt, result, null, null);
    }

    public static AttemptResult failed(String taskId, int attempt, FailureReason reason, String detail) {
        return new AttemptResult(taskId, attempt, null, reason, detail);
    }

    public boolean isSucceeded() {
        return result != null;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getAttempt() {
        return attempt;
    }

    /**
     * The accepted result, or null for a failed attempt.
     */
    public TaskResult getResult() {
        return result;
    }

    /**
     * Reason the task fails with if no retry remains, or null for a successful attempt.
     */
    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isSucceeded()
            ? "AttemptResult{taskId='" + taskId + "', attempt=" + attempt + ", succeeded}"
            : "AttemptResult{taskId='" + taskId + "', attempt=" + attempt + ", failed=" + failureReason
                + ", detail='" + detail + "'}";
    }
}
