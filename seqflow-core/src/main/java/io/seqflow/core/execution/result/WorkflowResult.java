package io.seqflow.core.execution.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Canonical, transport-independent outcome of a workflow execution.
///
/// Whatever envelope the server used and whichever strategy ran, callers always get a
/// top-level `success` flag and `stepResults` keyed by step id.
///
/// ### Contracts
/// - **Invariant**: `stepResults` is never null and preserves server order
/// - **Invariant**: `finalOutput` is never null (empty when nothing meaningful exists)
///
/// @param workflowId workflow that ran, not null
/// @param success overall outcome
/// @param totalExecutionTimeMs server-reported duration, or client-measured wall-clock time
/// @param stepResults step id to step outcome, not null
/// @param finalOutput last meaningful text of the pipeline, not null
/// @param errorMessage top-level error reported by the server, may be null
/// @param transport path that produced this result, not null
public record WorkflowResult(
        String workflowId,
        boolean success,
        long totalExecutionTimeMs,
        Map<String, StepResult> stepResults,
        String finalOutput,
        String errorMessage,
        ExecutionTransport transport) {

    /// Compact constructor with validation and defensive copying.
    public WorkflowResult {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        stepResults =
                stepResults != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(stepResults))
                        : Map.of();
        finalOutput = finalOutput != null ? finalOutput : "";
        transport = transport != null ? transport : ExecutionTransport.SYNC;
    }

    /// Returns the result of a single step.
    ///
    /// @param stepId step identifier, not null
    /// @return step result, or null if the step is not present
    public StepResult step(String stepId) {
        return stepResults.get(stepId);
    }

    /// Returns a copy tagged with a different transport.
    ///
    /// @param newTransport transport to record, not null
    /// @return new result, never null
    public WorkflowResult withTransport(ExecutionTransport newTransport) {
        return new WorkflowResult(
                workflowId,
                success,
                totalExecutionTimeMs,
                stepResults,
                finalOutput,
                errorMessage,
                newTransport);
    }

    /// Returns the output of the last successful step that produced text.
    ///
    /// @param steps steps in execution order, not null
    /// @return the output, or empty string when no successful step produced text
    public static String lastSuccessfulOutput(Map<String, StepResult> steps) {
        String last = "";
        for (StepResult step : steps.values()) {
            if (step.success() && !step.output().isBlank()) {
                last = step.output();
            }
        }
        return last;
    }
}
