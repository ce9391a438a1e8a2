package io.seqflow.core.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Immutable definition of one unit of work in a sequential workflow.
///
/// A step binds a human-readable agent name to a function invocation. The agent name is
/// never a server-issued id; ids are substituted only when the workflow is published
/// (see {@link WorkflowDefinition}).
///
/// ### Defaults
/// - `functionName`: `"inference"`
/// - `timeoutSeconds`: `60`, `maxRetries`: `2` (enforced by the server)
/// - `model`: `"default"`, `temperature`: `0.7`, `maxTokens`: `1000`
/// - `stepName`: the step id with underscores replaced and words capitalized
///
/// @implNote Immutable and thread-safe after construction.
/// @see Workflow.Builder#addStep(WorkflowStep)
public final class WorkflowStep {

    public static final String DEFAULT_FUNCTION = "inference";

    private final String stepId;
    private final String stepName;
    private final String description;
    private final String agentName;
    private final String functionName;
    private final String prompt;
    private final Map<String, Object> parameters;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int timeoutSeconds;
    private final int maxRetries;
    private final boolean continueOnFailure;

    private WorkflowStep(Builder builder) {
        this.stepId = Objects.requireNonNull(builder.stepId, "Step ID required");
        this.agentName = Objects.requireNonNull(builder.agentName, "Agent name required");
        if (stepId.isBlank()) {
            throw new IllegalArgumentException("Step ID must not be blank");
        }
        if (agentName.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank for step " + stepId);
        }
        if (builder.timeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                    "timeoutSeconds must be positive for step " + stepId);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException(
                    "maxRetries must not be negative for step " + stepId);
        }
        this.functionName =
                builder.functionName != null && !builder.functionName.isBlank()
                        ? builder.functionName
                        : DEFAULT_FUNCTION;
        this.stepName = builder.stepName != null ? builder.stepName : displayName(stepId);
        this.description =
                builder.description != null
                        ? builder.description
                        : "Execute " + functionName + " using " + agentName;
        this.prompt = builder.prompt;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.maxRetries = builder.maxRetries;
        this.continueOnFailure = builder.continueOnFailure;
    }

    static String displayName(String stepId) {
        StringBuilder name = new StringBuilder();
        for (String word : stepId.replace('_', ' ').split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return name.toString();
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the human-readable agent reference.
    ///
    /// @return agent name as listed by the agent directory, never null
    public String getAgentName() {
        return agentName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /// Returns the prompt forwarded to the agent.
    ///
    /// @return prompt text, or null for functions that take only parameters
    public String getPrompt() {
        return prompt;
    }

    /// Returns caller-supplied parameters.
    ///
    /// On the wire these are merged over the generated `prompt`, `model`, `max_tokens`
    /// and `temperature` entries, so a caller parameter wins over the step default.
    ///
    /// @return unmodifiable insertion-ordered map, never null
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isContinueOnFailure() {
        return continueOnFailure;
    }

    /// Creates a builder pre-populated with this step's values.
    ///
    /// @return new builder instance, never null
    public Builder toBuilder() {
        return new Builder()
                .stepId(stepId)
                .stepName(stepName)
                .description(description)
                .agentName(agentName)
                .functionName(functionName)
                .prompt(prompt)
                .parameters(parameters)
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeoutSeconds(timeoutSeconds)
                .maxRetries(maxRetries)
                .continueOnFailure(continueOnFailure);
    }

    /// Creates a step with the minimal required fields and all defaults.
    ///
    /// @param stepId unique step id, not null
    /// @param agentName agent name, not null
    /// @param prompt prompt text, may be null
    /// @return new step, never null
    public static WorkflowStep of(String stepId, String agentName, String prompt) {
        return builder().stepId(stepId).agentName(agentName).prompt(prompt).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link WorkflowStep}.
    ///
    /// Required fields: `stepId`, `agentName`.
    public static final class Builder {
        private String stepId;
        private String stepName;
        private String description;
        private String agentName;
        private String functionName = DEFAULT_FUNCTION;
        private String prompt;
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private String model = "default";
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private int timeoutSeconds = 60;
        private int maxRetries = 2;
        private boolean continueOnFailure;

        private Builder() {}

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder stepName(String stepName) {
            this.stepName = stepName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        /// Replaces all parameters.
        ///
        /// @param parameters parameter map, not null
        /// @return this builder for chaining
        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        /// Builds the immutable step.
        ///
        /// @return new step, never null
        /// @throws NullPointerException if stepId or agentName is null
        /// @throws IllegalArgumentException if stepId or agentName is blank, or the
        /// resilience budget is invalid
        public WorkflowStep build() {
            return new WorkflowStep(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowStep step)) return false;
        return Objects.equals(stepId, step.stepId)
                && Objects.equals(agentName, step.agentName)
                && Objects.equals(functionName, step.functionName)
                && Objects.equals(prompt, step.prompt)
                && Objects.equals(parameters, step.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, agentName, functionName, prompt, parameters);
    }

    @Override
    public String toString() {
        return "WorkflowStep{id='" + stepId + "', agent='" + agentName + "'}";
    }
}
