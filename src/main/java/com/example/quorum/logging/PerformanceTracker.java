package com.example.quorum.logging;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-run latency and success counters for agent calls, consensus rounds and whole tasks.
 * Every recorded operation is also emitted as a {@code performance_metrics} event.
 */
public class PerformanceTracker {

    /**
     * Kinds of timed work within a run. The unit counted per operation differs by kind.
     */
    public enum Operation {
        /** One agent invocation; unit is the call itself. */
        AGENT_CALL,
        /** One consensus round; unit is answers received. */
        CONSENSUS_ROUND,
        /** A task from dispatch to terminal state; unit is attempts made. */
        TASK
    }

    private final StructuredLogger logger;
    private final Map<Operation, OperationMetrics> metrics = new EnumMap<>(Operation.class);

    public PerformanceTracker(StructuredLogger logger) {
        this.logger = logger;
        for (Operation operation : Operation.values()) {
            metrics.put(operation, new OperationMetrics());
        }
    }

    public OperationTimer start(String operationId, Operation operation) {
        return new OperationTimer(operationId, operation);
    }

    /**
     * Folds a finished operation into its aggregate and logs it together with the running averages.
     *
     * @param units answers, attempts or calls depending on the operation
     */
    public void record(OperationTimer timer, boolean success, int units, Map<String, Object> details) {
        long durationMs = timer.elapsedMs();
        OperationMetrics aggregate = metrics.get(timer.getOperation());
        aggregate.add(durationMs, success, units);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("operationId", timer.getOperationId());
        fields.put("success", success);
        fields.put("count", aggregate.getCount());
        fields.put("successRate", aggregate.getSuccessRate());
        fields.put("averageDurationMs", aggregate.getAverageDurationMs());
        if (details != null) {
            fields.putAll(details);
        }
        logger.logPerformanceMetrics(timer.getOperation().name(), durationMs, units, fields);
    }

    public OperationMetrics getMetrics(Operation operation) {
        return metrics.get(operation);
    }

    /**
     * Compact view of every operation kind that was recorded at least once, for the run summary.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        metrics.forEach((operation, aggregate) -> {
            if (aggregate.getCount() > 0) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("count", aggregate.getCount());
                view.put("failures", aggregate.getCount() - aggregate.getSuccesses());
                view.put("averageDurationMs", Math.round(aggregate.getAverageDurationMs()));
                view.put("maxDurationMs", aggregate.getMaxDurationMs());
                view.put("averageUnits", aggregate.getAverageUnits());
                summary.put(operation.name(), view);
            }
        });
        return summary;
    }

    /**
     * Monotonic stopwatch for one operation.
     */
    public static final class OperationTimer {
        private final String operationId;
        private final Operation operation;
        private final long startNanos = System.nanoTime();

        OperationTimer(String operationId, Operation operation) {
            this.operationId = operationId;
            this.operation = operation;
        }

        public String getOperationId() {
            return operationId;
        }

        public Operation getOperation() {
            return operation;
        }

        public long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }

    /**
     * Aggregate for one operation kind. Safe to update from agent threads.
     */
    public static final class OperationMetrics {
        private final LongAdder count = new LongAdder();
        private final LongAdder successes = new LongAdder();
        private final LongAdder totalDurationMs = new LongAdder();
        private final LongAdder totalUnits = new LongAdder();
        private final AtomicLong maxDurationMs = new AtomicLong();

        void add(long durationMs, boolean success, int units) {
            count.increment();
            if (success) {
                successes.increment();
            }
            totalDurationMs.add(durationMs);
            totalUnits.add(units);
            maxDurationMs.accumulateAndGet(durationMs, Math::max);
        }

        public long getCount() {
            return count.sum();
        }

        public long getSuccesses() {
            return successes.sum();
        }

        public double getSuccessRate() {
            long total = count.sum();
            return total > 0 ? (double) successes.sum() / total : 0.0;
        }

        public double getAverageDurationMs() {
            long total = count.sum();
            return total > 0 ? (double) totalDurationMs.sum() / total : 0.0;
        }

        public double getAverageUnits() {
            long total = count.sum();
            return total > 0 ? (double) totalUnits.sum() / total : 0.0;
        }

        public long getMaxDurationMs() {
            return maxDurationMs.get();
        }
    }
}
