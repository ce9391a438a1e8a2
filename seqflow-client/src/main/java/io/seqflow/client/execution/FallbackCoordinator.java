package io.seqflow.client.execution;

import io.seqflow.client.monitor.WorkflowMonitor;
import io.seqflow.core.exception.ExecutionFailedException;
import io.seqflow.core.exception.SeqflowException;
import io.seqflow.core.execution.ExecutionListener;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.core.execution.result.WorkflowStatus;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Bounded recovery for streaming runs that end without a terminal result.
///
/// ```
/// stream ──result──> done
///    │
///  GET status ──terminal──> GET result ──found──> done (transport POLL)
///    │
///  sync execute ──200──> done
///    │
///  ExecutionFailedException (attempts = 2, partial steps from the stream)
/// ```
///
/// The stored-result lookup is skipped when the server may still hold a result from an earlier
/// run, i.e. when registration reused an existing definition. A stored result is only taken
/// once the status endpoint reports a terminal state.
///
/// ### Contracts
/// - **Bounded**: at most one streaming and one synchronous execute request per call, so a
///   server that is not idempotent per call runs the workflow at most twice
/// - single pass; no step is ever repeated
public class FallbackCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackCoordinator.class);

    private final StreamingExecutor streamingExecutor;
    private final SynchronousExecutor synchronousExecutor;
    private final WorkflowMonitor monitor;

    public FallbackCoordinator(
            StreamingExecutor streamingExecutor,
            SynchronousExecutor synchronousExecutor,
            WorkflowMonitor monitor) {
        this.streamingExecutor =
                Objects.requireNonNull(streamingExecutor, "streamingExecutor must not be null");
        this.synchronousExecutor =
                Objects.requireNonNull(synchronousExecutor, "synchronousExecutor must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
    }

    /// Executes a registered workflow, preferring the stream.
    ///
    /// @param workflowId registered workflow id, not null
    /// @param inputContext per-run context, may be null
    /// @param listener receives streaming events, not null
    /// @param acceptStoredResult whether a result the server stored can only belong to this
    /// run; `false` skips the lookup
    /// @return terminal result, never null
    /// @throws ExecutionFailedException if every strategy failed
    public WorkflowResult execute(
            String workflowId,
            Map<String, Object> inputContext,
            ExecutionListener listener,
            boolean acceptStoredResult) {
        StreamingOutcome outcome = streamingExecutor.execute(workflowId, inputContext, listener);
        if (outcome.isComplete()) {
            return outcome.result();
        }

        LOG.warn("Workflow {} stream incomplete ({})", workflowId, outcome.failureReason());
        if (!outcome.unattributedOutput().isEmpty()) {
            LOG.debug(
                    "Workflow {} streamed output outside any step: {}",
                    workflowId,
                    outcome.unattributedOutput());
        }
        if (acceptStoredResult) {
            Optional<WorkflowResult> polled = poll(workflowId);
            if (polled.isPresent()) {
                return polled.get();
            }
        } else {
            LOG.info("Ignoring any stored result of reused workflow {}", workflowId);
        }

        LOG.warn("No stored result for workflow {}, executing synchronously", workflowId);
        try {
            return synchronousExecutor.execute(workflowId, inputContext);
        } catch (ExecutionFailedException e) {
            throw new ExecutionFailedException(
                    workflowId,
                    "stream ended without a result ("
                            + outcome.failureReason()
                            + ") and the synchronous fallback failed",
                    2,
                    outcome.partialStepResults(),
                    e);
        }
    }

    private Optional<WorkflowResult> poll(String workflowId) {
        try {
            Optional<WorkflowStatus> status = monitor.status(workflowId);
            if (status.isEmpty() || !status.get().isTerminal()) {
                LOG.debug("Workflow {} not finished on the server, no stored result", workflowId);
                return Optional.empty();
            }
            return monitor.result(workflowId)
                    .map(result -> result.withTransport(ExecutionTransport.POLL));
        } catch (SeqflowException e) {
            LOG.warn("Result lookup for workflow {} failed: {}", workflowId, e.getMessage());
            return Optional.empty();
        }
    }
}
