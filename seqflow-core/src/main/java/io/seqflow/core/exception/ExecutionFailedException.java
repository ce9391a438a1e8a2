package io.seqflow.core.exception;

import io.seqflow.core.execution.result.StepResult;
import java.io.Serial;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// No execution strategy produced a terminal result.
///
/// Carries the number of remote execute calls that were made and any step results a
/// stream managed to assemble before it ended.
public class ExecutionFailedException extends SeqflowException {

    @Serial private static final long serialVersionUID = 7510742335790431958L;

    private final String workflowId;
    private final int executeAttempts;
    private final transient Map<String, StepResult> partialStepResults;

    public ExecutionFailedException(String workflowId, String message) {
        this(workflowId, message, 1, Map.of(), null);
    }

    public ExecutionFailedException(String workflowId, String message, Throwable cause) {
        this(workflowId, message, 1, Map.of(), cause);
    }

    public ExecutionFailedException(
            String workflowId,
            String message,
            int executeAttempts,
            Map<String, StepResult> partialStepResults,
            Throwable cause) {
        super("Execution of workflow '" + workflowId + "' failed: " + message, cause);
        this.workflowId = workflowId;
        this.executeAttempts = executeAttempts;
        this.partialStepResults =
                Collections.unmodifiableMap(new LinkedHashMap<>(partialStepResults));
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /// Returns how many times the remote execute endpoint was called.
    ///
    /// @return attempt count, at most 2 for a fallback run
    public int getExecuteAttempts() {
        return executeAttempts;
    }

    /// Returns step results assembled from a stream that ended without a terminal result.
    ///
    /// @return unmodifiable map keyed by step id, never null (may be empty)
    public Map<String, StepResult> getPartialStepResults() {
        return partialStepResults;
    }
}
