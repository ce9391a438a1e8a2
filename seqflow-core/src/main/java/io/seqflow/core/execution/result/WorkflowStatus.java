package io.seqflow.core.execution.result;

import java.util.Objects;

/// Snapshot of a workflow's progress as reported by the status endpoint.
///
/// @param workflowId workflow identifier, not null
/// @param state lifecycle state, not null
/// @param totalSteps number of steps in the definition
/// @param executedSteps steps executed so far
/// @param successfulSteps steps that succeeded
/// @param failedSteps steps that failed
/// @param executionTimeMs elapsed execution time, `0` when unknown
/// @param error last error message, may be null
public record WorkflowStatus(
        String workflowId,
        WorkflowState state,
        int totalSteps,
        int executedSteps,
        int successfulSteps,
        int failedSteps,
        long executionTimeMs,
        String error) {

    public WorkflowStatus {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        state = state != null ? state : WorkflowState.UNKNOWN;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
