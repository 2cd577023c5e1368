package com.example.quorum.orchestrator;

import com.example.quorum.model.RunReport;
import com.example.quorum.model.TaskStatus;

/**
 * Observer of a run. Callbacks are invoked on the run's scheduling thread in the order events are
 * applied; a listener that throws is logged and otherwise ignored.
 */
public interface RunListener {

    RunListener NONE = new RunListener() { };

    default void onRunStarted(String runId) {
    }

    default void onStatusChange(String taskId, TaskStatus from, TaskStatus to) {
    }

    default void onAttemptStarted(String taskId, int attempt) {
    }

    default void onAttemptFinished(AttemptResult result) {
    }

    default void onRunFinished(RunReport report) {
    }
}
