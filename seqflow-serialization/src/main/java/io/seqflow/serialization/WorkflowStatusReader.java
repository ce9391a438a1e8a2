package io.seqflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.seqflow.core.execution.result.ExecutorMetrics;
import io.seqflow.core.execution.result.WorkflowState;
import io.seqflow.core.execution.result.WorkflowStatus;

/// Reads the status endpoint's payload into a {@link WorkflowStatus}, and the executor
/// metrics payload into {@link ExecutorMetrics}.
///
/// The server encodes every value as a string (`{"status":"completed","total_steps":"3"}`);
/// numbers are accepted either way. Missing or unreadable counters read as `0`.
public final class WorkflowStatusReader {

    private WorkflowStatusReader() {}

    /// Reads a status payload.
    ///
    /// @param raw response tree, optionally wrapped in `data`, may be null
    /// @param workflowId id used when the payload has none, not null
    /// @return status snapshot, never null
    public static WorkflowStatus read(JsonNode raw, String workflowId) {
        JsonNode body = SeqflowSerialization.unwrapData(raw);
        if (body == null || !body.isObject()) {
            return new WorkflowStatus(workflowId, WorkflowState.UNKNOWN, 0, 0, 0, 0, 0L, null);
        }

        String id = ResultNormalizer.textOrNull(body.get("workflow_id"));
        String error = ResultNormalizer.textOrNull(body.get("error"));
        if (error == null) {
            error = ResultNormalizer.textOrNull(body.get("error_message"));
        }

        return new WorkflowStatus(
                id != null && !id.isBlank() ? id : workflowId,
                WorkflowState.fromServerValue(ResultNormalizer.textOrNull(body.get("status"))),
                intValue(body, "total_steps"),
                intValue(body, "executed_steps"),
                intValue(body, "successful_steps"),
                intValue(body, "failed_steps"),
                longValue(body, "execution_time_ms"),
                error != null && !error.isBlank() ? error : null);
    }

    /// Reads an executor metrics payload.
    ///
    /// @param raw response tree, optionally wrapped in `data`, may be null
    /// @return metrics, all zero when the payload is unreadable
    public static ExecutorMetrics readMetrics(JsonNode raw) {
        JsonNode body = SeqflowSerialization.unwrapData(raw);
        if (body == null || !body.isObject()) {
            return new ExecutorMetrics(0, 0, 0, 0);
        }
        return new ExecutorMetrics(
                intValue(body, "active_workflows"),
                intValue(body, "completed_workflows"),
                intValue(body, "failed_workflows"),
                intValue(body, "total_registered_workflows"));
    }

    private static int intValue(JsonNode body, String field) {
        return (int) longValue(body, field);
    }

    private static long longValue(JsonNode body, String field) {
        Long value = ResultNormalizer.longOrNull(body.get(field));
        return value != null ? value : 0L;
    }
}
