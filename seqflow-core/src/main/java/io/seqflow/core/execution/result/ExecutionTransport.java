package io.seqflow.core.execution.result;

/// Which path produced a {@link WorkflowResult}.
public enum ExecutionTransport {

    /// Single blocking execute call returning JSON.
    SYNC,

    /// Server-Sent-Events stream that ended with a terminal result.
    STREAMING,

    /// Streaming was requested but the server answered with a plain JSON document.
    STREAMING_DEGRADED,

    /// Result fetched from the result endpoint after a stream ended without one.
    POLL
}
