package io.seqflow.client.execution;

/// States of the event-stream reader.
///
/// ```
/// AWAITING_STEP ──step_start──> IN_STEP ──step_complete──> AWAITING_STEP
///       │                          │
///       └──── workflow_complete / final result object ────> DONE
/// ```
enum StreamState {
    AWAITING_STEP,
    IN_STEP,
    DONE
}
