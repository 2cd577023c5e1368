package com.example.quorum.orchestrator;

import com.example.quorum.model.RunReport;
import com.example.quorum.model.TaskStatus;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Handle to a run started with {@link TaskOrchestrator#start}.
 */
public class RunHandle {

    private final String runId;
    private final CancellationToken cancellationToken;
    private final CompletableFuture<RunReport> completion;
    private final Supplier<Map<String, TaskStatus>> statusView;

    RunHandle(String runId, CancellationToken cancellationToken, CompletableFuture<RunReport> completion,
              Supplier<Map<String, TaskStatus>> statusView) {
        this.runId = runId;
        this.cancellationToken = cancellationToken;
        this.completion = completion;
        this.statusView = statusView;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Stops dispatching new attempts. In-flight calls drain, then every task that is not terminal
     * fails with {@code CANCELLED}.
     */
    public void cancel() {
        cancellationToken.cancel();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Current status of every task.
     */
    public Map<String, TaskStatus> statusSnapshot() {
        return statusView.get();
    }

    /**
     * Waits for the run to finish.
     */
    public RunReport await() {
        try {
            return completion.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Waits up to {@code timeout} for the run to finish.
     *
     * @return the report, or empty if the run is still going
     */
    public Optional<RunReport> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    public CompletableFuture<RunReport> getCompletion() {
        return completion;
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Run aborted", cause);
    }
}
