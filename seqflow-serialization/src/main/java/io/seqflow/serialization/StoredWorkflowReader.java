package io.seqflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.seqflow.core.workflow.StoredWorkflow;
import java.util.ArrayList;
import java.util.List;

/// Reads a stored definition returned by `GET {workflows}/{id}`.
///
/// The payload is the create format with server agent ids, plus a `current_status` object
/// in the status endpoint's format. Steps without a `step_id` are skipped.
public final class StoredWorkflowReader {

    private StoredWorkflowReader() {}

    /// Reads a stored definition.
    ///
    /// @param raw response tree, optionally wrapped in `data`, may be null
    /// @param workflowId id used when the payload has none, not null
    /// @return stored definition, never null
    public static StoredWorkflow read(JsonNode raw, String workflowId) {
        JsonNode body = SeqflowSerialization.unwrapData(raw);
        if (body == null || !body.isObject()) {
            return new StoredWorkflow(workflowId, null, null, false, 0, List.of(), null);
        }

        String id = ResultNormalizer.textOrNull(body.get("workflow_id"));
        if (id == null || id.isBlank()) {
            id = workflowId;
        }

        List<StoredWorkflow.Step> steps = new ArrayList<>();
        JsonNode stepNodes = body.get("steps");
        if (stepNodes != null && stepNodes.isArray()) {
            for (JsonNode node : stepNodes) {
                String stepId = ResultNormalizer.textOrNull(node.get("step_id"));
                if (stepId == null || stepId.isBlank()) {
                    continue;
                }
                steps.add(
                        new StoredWorkflow.Step(
                                stepId,
                                ResultNormalizer.textOrNull(node.get("step_name")),
                                ResultNormalizer.textOrNull(node.get("agent_id")),
                                ResultNormalizer.textOrNull(node.get("function_name"))));
            }
        }

        Boolean stopOnFailure = ResultNormalizer.booleanOrNull(body.get("stop_on_failure"));
        Long budget = ResultNormalizer.longOrNull(body.get("max_execution_time_seconds"));
        JsonNode status = body.get("current_status");

        return new StoredWorkflow(
                id,
                ResultNormalizer.textOrNull(body.get("workflow_name")),
                ResultNormalizer.textOrNull(body.get("description")),
                stopOnFailure == null || stopOnFailure,
                budget != null ? budget.intValue() : 0,
                steps,
                status != null && status.isObject() ? WorkflowStatusReader.read(status, id) : null);
    }
}
