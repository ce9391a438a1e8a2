package io.seqflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.seqflow.core.workflow.WorkflowDefinition;
import java.util.Map;

/// Factory and helpers for the JSON exchanged with the workflow server.
///
/// ### Usage
/// {@snippet :
/// ObjectMapper mapper = SeqflowSerialization.createMapper();
/// String createBody = SeqflowSerialization.toJson(mapper, definition);
/// String executeBody = SeqflowSerialization.executeRequest(mapper, Map.of("topic", "AI"));
/// }
///
/// @implNote Thread-safe. Callers are expected to create one mapper and reuse it.
/// @see SeqflowJacksonModule for the registered type handlers
public final class SeqflowSerialization {

    private SeqflowSerialization() {}

    /// Creates an ObjectMapper configured for the workflow API.
    ///
    /// Registers `SeqflowJacksonModule` and disables `FAIL_ON_UNKNOWN_PROPERTIES`, since
    /// servers add fields freely.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new SeqflowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /// Serializes a resolved definition into the create payload.
    ///
    /// @param mapper mapper from {@link #createMapper()}, not null
    /// @param definition resolved definition, not null
    /// @return compact JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ObjectMapper mapper, WorkflowDefinition definition) {
        try {
            return mapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow "
                            + definition.workflow().getWorkflowId()
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /// Builds the body of a create-from-template call.
    ///
    /// @param mapper mapper from {@link #createMapper()}, not null
    /// @param template resolved template definition, not null
    /// @param workflowId id overriding the template's, may be null
    /// @return `{"template":{...},"workflow_id":"..."}`, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String templateRequest(
            ObjectMapper mapper, WorkflowDefinition template, String workflowId) {
        ObjectNode body = mapper.createObjectNode();
        body.set("template", mapper.valueToTree(template));
        if (workflowId != null) {
            body.put("workflow_id", workflowId);
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize template "
                            + template.workflow().getWorkflowId()
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /// Builds the body of an execute call.
    ///
    /// @param mapper mapper from {@link #createMapper()}, not null
    /// @param inputContext per-run context, may be null or empty
    /// @return `{"input_context":{...}}`, or `{}` when there is no context
    /// @throws IllegalArgumentException if a context value cannot be serialized
    public static String executeRequest(ObjectMapper mapper, Map<String, Object> inputContext) {
        ObjectNode body = mapper.createObjectNode();
        if (inputContext != null && !inputContext.isEmpty()) {
            body.set("input_context", mapper.valueToTree(inputContext));
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize input context: " + e.getMessage(), e);
        }
    }

    /// Returns the `data` member of a response envelope, or the node itself when unwrapped.
    ///
    /// Only one level is removed.
    ///
    /// @param node response body, may be null
    /// @return the payload, or null if `node` is null
    public static JsonNode unwrapData(JsonNode node) {
        if (node != null && node.isObject()) {
            JsonNode data = node.get("data");
            if (data != null && !data.isNull()) {
                return data;
            }
        }
        return node;
    }
}
