package io.seqflow.core.execution.result;

/// Outcome of one step as reported by the server or assembled from a stream.
///
/// @param success whether the step succeeded
/// @param output text produced by the step, never null (empty when none)
/// @param error error message if the step failed, may be null
/// @param executionTimeMs server-reported step duration, `0` when unknown
public record StepResult(boolean success, String output, String error, long executionTimeMs) {

    /// Compact constructor normalizing a null output to the empty string.
    public StepResult {
        output = output != null ? output : "";
    }
}
