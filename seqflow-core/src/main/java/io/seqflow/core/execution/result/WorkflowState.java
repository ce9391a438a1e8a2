package io.seqflow.core.execution.result;

import java.util.Locale;

/// Server-side lifecycle state of a workflow.
public enum WorkflowState {
    REGISTERED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    UNKNOWN;

    /// Parses the server's lowercase status string.
    ///
    /// @param value status text such as `"completed"`, may be null
    /// @return matching state, {@link #UNKNOWN} for null or unrecognized values
    public static WorkflowState fromServerValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "registered", "pending" -> REGISTERED;
            case "running", "in_progress", "executing" -> RUNNING;
            case "completed", "success" -> COMPLETED;
            case "failed", "error" -> FAILED;
            case "cancelled", "canceled" -> CANCELLED;
            default -> UNKNOWN;
        };
    }

    /// Returns whether the workflow will not progress any further.
    ///
    /// @return `true` for completed, failed and cancelled
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
