package io.seqflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.seqflow.core.workflow.Workflow;
import io.seqflow.core.workflow.WorkflowDefinition;
import io.seqflow.core.workflow.WorkflowStep;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/// Serializes a resolved `WorkflowDefinition` into the server's create payload.
///
/// ```
/// Field                          Source
/// -------------------------------+-----------------------------------------
/// workflow_id, workflow_name     │ Workflow
/// description                    │ Workflow (omitted when empty)
/// stop_on_failure                │ Workflow
/// max_execution_time_seconds     │ Workflow
/// global_context                 │ Workflow (omitted when empty)
/// steps[].step_id ... parameters │ WorkflowStep, agent_id from the resolved map
/// ```
///
/// Step `parameters` start from the step's model settings (`prompt`, `model`,
/// `max_tokens`, `temperature`); caller-supplied parameters override them key by key.
///
/// @implNote Package-private. Registered by {@link SeqflowJacksonModule}.
class WorkflowDefinitionSerializer extends StdSerializer<WorkflowDefinition> {

    @Serial private static final long serialVersionUID = -4417381923376920841L;

    WorkflowDefinitionSerializer() {
        super(WorkflowDefinition.class);
    }

    @Override
    public void serialize(
            WorkflowDefinition definition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        Workflow workflow = definition.workflow();

        gen.writeStartObject();
        gen.writeStringField("workflow_id", workflow.getWorkflowId());
        gen.writeStringField("workflow_name", workflow.getWorkflowName());
        if (!workflow.getDescription().isEmpty()) {
            gen.writeStringField("description", workflow.getDescription());
        }
        gen.writeBooleanField("stop_on_failure", workflow.isStopOnFailure());
        gen.writeNumberField("max_execution_time_seconds", workflow.getMaxExecutionTimeSeconds());
        if (!workflow.getGlobalContext().isEmpty()) {
            provider.defaultSerializeField("global_context", workflow.getGlobalContext(), gen);
        }

        gen.writeArrayFieldStart("steps");
        for (WorkflowStep step : workflow.getSteps()) {
            writeStep(step, definition.agentIdFor(step), gen, provider);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private void writeStep(
            WorkflowStep step, String agentId, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("step_id", step.getStepId());
        gen.writeStringField("step_name", step.getStepName());
        gen.writeStringField("description", step.getDescription());
        gen.writeStringField("agent_id", agentId);
        gen.writeStringField("function_name", step.getFunctionName());
        gen.writeNumberField("timeout_seconds", step.getTimeoutSeconds());
        gen.writeNumberField("max_retries", step.getMaxRetries());
        gen.writeBooleanField("continue_on_failure", step.isContinueOnFailure());
        provider.defaultSerializeField("parameters", parameters(step), gen);
        gen.writeEndObject();
    }

    private static Map<String, Object> parameters(WorkflowStep step) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (step.getPrompt() != null) {
            parameters.put("prompt", step.getPrompt());
        }
        parameters.put("model", step.getModel());
        parameters.put("max_tokens", step.getMaxTokens());
        parameters.put("temperature", step.getTemperature());
        parameters.putAll(step.getParameters());
        return parameters;
    }
}
