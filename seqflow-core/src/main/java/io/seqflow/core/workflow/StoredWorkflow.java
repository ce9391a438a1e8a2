package io.seqflow.core.workflow;

import io.seqflow.core.execution.result.WorkflowStatus;
import java.util.List;
import java.util.Objects;

/// A workflow definition as the server stores it, read back by id.
///
/// Steps carry server-side agent ids, not the names the caller registered with.
///
/// @param workflowId workflow identifier, not null
/// @param workflowName display name, never null (empty when the server sent none)
/// @param description description, never null
/// @param stopOnFailure whether the server stops at the first failed step
/// @param maxExecutionTimeSeconds execution budget, `0` when unknown
/// @param steps stored steps in execution order, never null
/// @param currentStatus status the server attached, may be null
public record StoredWorkflow(
        String workflowId,
        String workflowName,
        String description,
        boolean stopOnFailure,
        int maxExecutionTimeSeconds,
        List<Step> steps,
        WorkflowStatus currentStatus) {

    public StoredWorkflow {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        workflowName = workflowName != null ? workflowName : "";
        description = description != null ? description : "";
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /// One stored step.
    ///
    /// @param stepId step identifier, not null
    /// @param stepName display name, may be null
    /// @param agentId server-side agent id, may be null
    /// @param functionName agent function the step invokes, may be null
    public record Step(String stepId, String stepName, String agentId, String functionName) {

        public Step {
            Objects.requireNonNull(stepId, "stepId must not be null");
        }
    }
}
