package io.seqflow.core.execution;

/// Incremental progress events observed while a workflow streams.
///
/// ### Event Flow
/// ```
/// StepStarted → OutputChunk* → StepCompleted → StepStarted → ... → (terminal result)
///                   ↓
///             WorkflowError (recorded, stream continues)
/// ```
///
/// `TransportDegraded` is emitted instead of the flow above when the server answers a
/// streaming request with a plain JSON body.
///
/// @see ExecutionListener for consumers
public sealed interface ExecutionEvent {

    /// Returns the workflow the event belongs to.
    ///
    /// @return workflow id, never null
    String workflowId();

    /// A step began executing.
    ///
    /// @param workflowId workflow id
    /// @param stepId step id
    /// @param stepName display name, may equal the step id
    /// @param agentName agent executing the step, may be null if the server omits it
    record StepStarted(String workflowId, String stepId, String stepName, String agentName)
            implements ExecutionEvent {}

    /// Text produced by the active step.
    ///
    /// @param workflowId workflow id
    /// @param stepId active step id, or null when output arrives outside any step
    /// @param text the new text, never null
    record OutputChunk(String workflowId, String stepId, String text) implements ExecutionEvent {}

    /// A step finished.
    ///
    /// @param workflowId workflow id
    /// @param stepId step id
    /// @param success whether the step succeeded
    /// @param error error message, may be null
    record StepCompleted(String workflowId, String stepId, boolean success, String error)
            implements ExecutionEvent {}

    /// The server reported an error; the stream may still deliver a terminal result.
    ///
    /// @param workflowId workflow id
    /// @param message error message, never null
    record WorkflowError(String workflowId, String message) implements ExecutionEvent {}

    /// The server did not stream and returned a complete document instead.
    ///
    /// @param workflowId workflow id
    /// @param contentType content type the server answered with, may be null
    record TransportDegraded(String workflowId, String contentType) implements ExecutionEvent {}
}
