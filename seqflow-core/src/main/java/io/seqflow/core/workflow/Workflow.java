package io.seqflow.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// Immutable definition of a sequential pipeline of agent steps.
///
/// Steps run in insertion order on the server. The `workflowId` is chosen by the caller,
/// must be unique on the remote store and doubles as the idempotency key for
/// registration.
///
/// ### Lifecycle
/// A workflow is assembled with {@link #builder()}, which only appends steps. Once built it
/// cannot change; to alter a registered workflow, derive a new instance with
/// {@link #toBuilder()} and register it again (the registrar replaces the stored
/// definition rather than patching it).
///
/// ### Validation
/// - `workflowId` matches `[A-Za-z0-9_-]{1,100}`, the id format the server accepts
/// - step ids are unique within the workflow
///
/// @implNote Immutable and thread-safe after construction.
/// @see WorkflowStep for step defaults
/// @see WorkflowTemplates for ready-made pipelines
public final class Workflow {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,100}");

    private final String workflowId;
    private final String workflowName;
    private final String description;
    private final List<WorkflowStep> steps;
    private final Map<String, Object> globalContext;
    private final boolean stopOnFailure;
    private final int maxExecutionTimeSeconds;

    private Workflow(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID required");
        this.workflowName = builder.workflowName != null ? builder.workflowName : workflowId;
        this.description = builder.description != null ? builder.description : "";
        this.steps = List.copyOf(builder.steps);
        this.globalContext =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.globalContext));
        this.stopOnFailure = builder.stopOnFailure;
        this.maxExecutionTimeSeconds = builder.maxExecutionTimeSeconds;

        validate();
    }

    private void validate() {
        if (!ID_PATTERN.matcher(workflowId).matches()) {
            throw new IllegalStateException(
                    "Workflow ID '"
                            + workflowId
                            + "' must be 1-100 characters of letters, digits, '_' or '-'");
        }
        if (maxExecutionTimeSeconds <= 0) {
            throw new IllegalStateException(
                    "maxExecutionTimeSeconds must be positive for workflow " + workflowId);
        }

        Set<String> seen = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!seen.add(step.getStepId())) {
                throw new IllegalStateException(
                        "Duplicate step id '"
                                + step.getStepId()
                                + "' in workflow '"
                                + workflowId
                                + "'");
            }
        }
    }

    /// Returns the caller-chosen identifier.
    ///
    /// @return workflow ID, never null
    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the steps in execution order.
    ///
    /// @return unmodifiable list, never null (may be empty)
    public List<WorkflowStep> getSteps() {
        return steps;
    }

    /// Returns data shared by all steps.
    ///
    /// @return unmodifiable insertion-ordered map, never null
    public Map<String, Object> getGlobalContext() {
        return globalContext;
    }

    public boolean isStopOnFailure() {
        return stopOnFailure;
    }

    public int getMaxExecutionTimeSeconds() {
        return maxExecutionTimeSeconds;
    }

    /// Returns the distinct agent names referenced by the steps, in first-use order.
    ///
    /// @return unmodifiable set, never null
    public Set<String> getAgentNames() {
        Set<String> names = new LinkedHashSet<>();
        for (WorkflowStep step : steps) {
            names.add(step.getAgentName());
        }
        return Collections.unmodifiableSet(names);
    }

    /// Creates a builder holding a copy of this workflow's state.
    ///
    /// @return new builder instance, never null
    public Builder toBuilder() {
        Builder builder =
                new Builder()
                        .workflowId(workflowId)
                        .workflowName(workflowName)
                        .description(description)
                        .globalContext(globalContext)
                        .stopOnFailure(stopOnFailure)
                        .maxExecutionTimeSeconds(maxExecutionTimeSeconds);
        steps.forEach(builder::addStep);
        return builder;
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Workflow instances.
    ///
    /// Required field: `workflowId`. Steps can only be appended.
    ///
    /// @see #build() for validation rules
    public static final class Builder {
        private String workflowId;
        private String workflowName;
        private String description;
        private final List<WorkflowStep> steps = new ArrayList<>();
        private Map<String, Object> globalContext = new LinkedHashMap<>();
        private boolean stopOnFailure = true;
        private int maxExecutionTimeSeconds = 300;

        private Builder() {}

        /// Sets the workflow identifier (required).
        ///
        /// @param workflowId unique workflow ID, not null
        /// @return this builder for chaining
        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /// Appends a step to the end of the pipeline.
        ///
        /// @param step the step, not null
        /// @return this builder for chaining
        public Builder addStep(WorkflowStep step) {
            steps.add(Objects.requireNonNull(step, "step must not be null"));
            return this;
        }

        /// Appends a step with default settings.
        ///
        /// @param stepId unique step id, not null
        /// @param agentName agent name, not null
        /// @param prompt prompt text, may be null
        /// @return this builder for chaining
        public Builder addStep(String stepId, String agentName, String prompt) {
            return addStep(WorkflowStep.of(stepId, agentName, prompt));
        }

        /// Replaces the shared context.
        ///
        /// @param globalContext context map, not null
        /// @return this builder for chaining
        public Builder globalContext(Map<String, Object> globalContext) {
            this.globalContext = new LinkedHashMap<>(globalContext);
            return this;
        }

        public Builder contextValue(String key, Object value) {
            this.globalContext.put(key, value);
            return this;
        }

        public Builder stopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public Builder maxExecutionTimeSeconds(int maxExecutionTimeSeconds) {
            this.maxExecutionTimeSeconds = maxExecutionTimeSeconds;
            return this;
        }

        /// Builds the immutable workflow instance.
        ///
        /// @return new Workflow instance, never null
        /// @throws NullPointerException if workflowId is null
        /// @throws IllegalStateException if the id is malformed or step ids repeat
        public Workflow build() {
            return new Workflow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workflow workflow)) return false;
        return stopOnFailure == workflow.stopOnFailure
                && maxExecutionTimeSeconds == workflow.maxExecutionTimeSeconds
                && Objects.equals(workflowId, workflow.workflowId)
                && Objects.equals(workflowName, workflow.workflowName)
                && Objects.equals(description, workflow.description)
                && Objects.equals(steps, workflow.steps)
                && Objects.equals(globalContext, workflow.globalContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                workflowId,
                workflowName,
                description,
                steps,
                globalContext,
                stopOnFailure,
                maxExecutionTimeSeconds);
    }

    @Override
    public String toString() {
        return "Workflow{id='" + workflowId + "', steps=" + steps.size() + "}";
    }
}
