package io.seqflow.core.execution.result;

/// Counters the server keeps across all workflows.
///
/// @param activeWorkflows workflows currently executing
/// @param completedWorkflows runs that finished successfully since the server started
/// @param failedWorkflows runs that failed since the server started
/// @param totalRegisteredWorkflows definitions currently stored
public record ExecutorMetrics(
        int activeWorkflows,
        int completedWorkflows,
        int failedWorkflows,
        int totalRegisteredWorkflows) {}
