package io.seqflow.client.execution;

/// How a workflow run is requested from the server.
public enum ExecutionMode {

    /// One blocking request returning the complete result.
    SYNC,

    /// Live progress over Server-Sent Events, falling back to polling and then to a
    /// blocking request when the stream ends without a result.
    STREAMING
}
