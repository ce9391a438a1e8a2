package io.seqflow.client.execution;

import io.seqflow.core.execution.result.StepResult;
import io.seqflow.core.execution.result.WorkflowResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// What a streaming attempt produced: either a terminal result or the reason it ended
/// without one, plus any steps assembled before it ended.
///
/// @param result terminal result, or null when the stream was incomplete
/// @param partialStepResults steps assembled from the stream, never null (empty when the
/// stream failed mid-read)
/// @param failureReason why no terminal result was produced, null when complete
/// @param unattributedOutput text the stream sent outside any step, never null
public record StreamingOutcome(
        WorkflowResult result,
        Map<String, StepResult> partialStepResults,
        String failureReason,
        String unattributedOutput) {

    public StreamingOutcome {
        partialStepResults =
                partialStepResults != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(partialStepResults))
                        : Map.of();
        unattributedOutput = unattributedOutput != null ? unattributedOutput : "";
    }

    static StreamingOutcome complete(WorkflowResult result) {
        return complete(result, "");
    }

    static StreamingOutcome complete(WorkflowResult result, String unattributedOutput) {
        return new StreamingOutcome(result, result.stepResults(), null, unattributedOutput);
    }

    static StreamingOutcome incomplete(Map<String, StepResult> partial, String reason) {
        return incomplete(partial, reason, "");
    }

    static StreamingOutcome incomplete(
            Map<String, StepResult> partial, String reason, String unattributedOutput) {
        return new StreamingOutcome(null, partial, reason, unattributedOutput);
    }

    public boolean isComplete() {
        return result != null;
    }
}
