package io.seqflow.core.workflow;

import java.util.Map;
import java.util.Objects;

/// A workflow paired with the remote agent ids its steps resolve to.
///
/// This is the shape that gets published: every step's agent name has a matching entry in
/// `agentIds`. Instances exist only for the duration of one registration call because ids
/// may change across server restarts.
///
/// @param workflow the workflow being published, not null
/// @param agentIds agent name to remote id, covering every step's agent, not null
public record WorkflowDefinition(Workflow workflow, Map<String, String> agentIds) {

    /// Compact constructor with validation.
    ///
    /// @throws IllegalArgumentException if a step's agent has no id
    public WorkflowDefinition {
        Objects.requireNonNull(workflow, "workflow must not be null");
        agentIds = Map.copyOf(Objects.requireNonNull(agentIds, "agentIds must not be null"));
        for (WorkflowStep step : workflow.getSteps()) {
            if (!agentIds.containsKey(step.getAgentName())) {
                throw new IllegalArgumentException(
                        "No agent id for '"
                                + step.getAgentName()
                                + "' used by step '"
                                + step.getStepId()
                                + "'");
            }
        }
    }

    /// Returns the remote agent id for a step.
    ///
    /// @param step a step of this workflow, not null
    /// @return remote agent id, never null
    public String agentIdFor(WorkflowStep step) {
        return agentIds.get(step.getAgentName());
    }
}
