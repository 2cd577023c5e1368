package com.example.quorum.graph;

import com.example.quorum.model.FailureReason;
import com.example.quorum.model.TaskResult;
import com.example.quorum.model.TaskSpec;
import com.example.quorum.model.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the task graph. Identity, priority and spec are fixed at construction;
 * status fields are mutated only through the owning {@link TaskGraph}.
 */
public class Task {

    private final String id;
    private final int priority;
    private final TaskSpec spec;
    private final Integer maxRetries;

    private volatile Set<String> dependencies = Set.of();
    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile TaskResult result;
    private volatile FailureReason failureReason;
    private volatile String failureDetail;
    private volatile int retryCount;

    public Task(String id, int priority, TaskSpec spec) {
        this(id, priority, spec, null);
    }

    /**
     * @param maxRetries per-task retry limit, or null to use the run configuration
     */
    public Task(String id, int priority, TaskSpec spec, Integer maxRetries) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for task " + id);
        }
        this.id = id;
        this.priority = priority;
        this.spec = spec != null ? spec : TaskSpec.of("");
        this.maxRetries = maxRetries;
    }

    public static Task of(String id, int priority, String description) {
        return new Task(id, priority, TaskSpec.of(description));
    }

    public String getId() {
        return id;
    }

    public int getPriority() {
        return priority;
    }

    public TaskSpec getSpec() {
        return spec;
    }

    /**
     * Per-task retry limit, or null when the run configuration decides.
     */
    public Integer getMaxRetries() {
        return maxRetries;
    }

    public int effectiveMaxRetries(int defaultMaxRetries) {
        return maxRetries != null ? maxRetries : defaultMaxRetries;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public TaskResult getResult() {
        return result;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getFailureDetail() {
        return failureDetail;
    }

    public int getRetryCount() {
        return retryCount;
    }

    void setDependencies(Set<String> dependencies) {
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    void setStatus(TaskStatus status) {
        this.status = status;
    }

    void setResult(TaskResult result) {
        this.result = result;
    }

    void setFailure(FailureReason reason, String detail) {
        this.failureReason = reason;
        this.failureDetail = detail;
    }

    void incrementRetryCount() {
        this.retryCount++;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Task) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{" +
               "id='" + id + '\'' +
               ", priority=" + priority +
               ", dependencies=" + dependencies +
               ", status=" + status +
               ", retryCount=" + retryCount +
               (failureReason != null ? ", failureReason=" + failureReason : "") +
               '}';
    }
}
