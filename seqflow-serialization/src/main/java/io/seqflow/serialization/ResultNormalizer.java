package io.seqflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.StepResult;
import io.seqflow.core.execution.result.WorkflowResult;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Maps whatever result shape the server produced into a {@link WorkflowResult}.
///
/// Servers have reported step outcomes under several envelopes over time. The normalizer
/// removes one `data` level, then checks these keys in order and uses the first present:
///
/// ```
/// Key             Accepted forms
/// ----------------+--------------------------------------------------------------
/// step_results    │ object keyed by step id | array of step objects
/// steps           │ object keyed by step id | array of step objects
/// executed_steps  │ array of step ids | array of step objects
/// results         │ object keyed by step id | array of step objects
/// ```
///
/// Array entries are keyed by `step_id`, then `id`, then position (`step_1`, `step_2`, ...).
/// Bare step ids take the overall outcome. A present key holding `null` or a scalar still
/// wins and yields no steps.
///
/// ### Contracts
/// - **Total**: never throws; input that cannot be read yields `success = false`
/// - **Backfill**: a missing `workflow_id` or duration is taken from the caller
/// - **Final output**: explicit `final_output`, else the last successful step with
///   non-blank output, else the empty string
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class ResultNormalizer {

    private static final Logger logger = Logger.getLogger(ResultNormalizer.class.getName());

    private static final List<String> STEP_KEYS =
            List.of("step_results", "steps", "executed_steps", "results");
    private static final List<String> RESULT_DATA_TEXT_KEYS =
            List.of("text", "response", "output", "content");
    private static final List<String> STEP_TEXT_KEYS = List.of("text", "response", "content");

    private final ObjectMapper objectMapper;

    /// Creates a normalizer backed by the given Jackson mapper.
    ///
    /// @param objectMapper mapper used to parse string bodies, not null
    public ResultNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /// Parses and normalizes a raw response body.
    ///
    /// @param body response text, may be null
    /// @param workflowId id used when the payload has none, not null
    /// @param measuredMillis client-measured duration used when the payload has none
    /// @return canonical result, never null
    public WorkflowResult normalize(String body, String workflowId, long measuredMillis) {
        if (body == null || body.isBlank()) {
            return failed(workflowId, measuredMillis, "Empty result payload");
        }
        try {
            return normalize(objectMapper.readTree(body), workflowId, measuredMillis);
        } catch (JsonProcessingException e) {
            logger.fine("Unparseable result payload for " + workflowId + ": " + e.getMessage());
            return failed(workflowId, measuredMillis, "Unparseable result payload");
        }
    }

    /// Normalizes an already-parsed response.
    ///
    /// @param raw response tree, may be null
    /// @param workflowId id used when the payload has none, not null
    /// @param measuredMillis client-measured duration used when the payload has none
    /// @return canonical result, never null
    public WorkflowResult normalize(JsonNode raw, String workflowId, long measuredMillis) {
        JsonNode body = SeqflowSerialization.unwrapData(raw);
        if (body == null || !body.isObject()) {
            return failed(workflowId, measuredMillis, "Unrecognized result payload");
        }

        String id = textOrNull(body.get("workflow_id"));
        if (id == null || id.isBlank()) {
            id = workflowId;
        }

        Long reportedMillis = longOrNull(body.get("total_execution_time_ms"));
        if (reportedMillis == null) {
            reportedMillis = longOrNull(body.get("execution_time_ms"));
        }
        long totalMillis = reportedMillis != null ? reportedMillis : measuredMillis;

        String error = errorOf(body);
        Boolean explicitSuccess = explicitSuccess(body);
        boolean bareIdSuccess = explicitSuccess != null ? explicitSuccess : error == null;

        Map<String, StepResult> steps = readSteps(body, bareIdSuccess);

        boolean success;
        if (explicitSuccess != null) {
            success = explicitSuccess;
        } else {
            success = !steps.isEmpty() && steps.values().stream().allMatch(StepResult::success);
        }

        String finalOutput = renderText(body.get("final_output"));
        if (finalOutput == null || finalOutput.isBlank()) {
            finalOutput = WorkflowResult.lastSuccessfulOutput(steps);
        }

        return new WorkflowResult(
                id, success, totalMillis, steps, finalOutput, error, ExecutionTransport.SYNC);
    }

    /// Reads a single step object.
    ///
    /// @param node step object, not null
    /// @return step result, never null
    public StepResult readStep(JsonNode node) {
        String error = errorOf(node);
        Boolean success = booleanOrNull(node.get("success"));
        if (success == null) {
            success = statusSuccess(node.get("status"));
        }
        if (success == null) {
            success = error == null;
        }
        Long millis = longOrNull(node.get("execution_time_ms"));
        return new StepResult(success, outputOf(node), error, millis != null ? millis : 0L);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private Map<String, StepResult> readSteps(JsonNode body, boolean bareIdSuccess) {
        Map<String, StepResult> steps = new LinkedHashMap<>();
        for (String key : STEP_KEYS) {
            JsonNode node = body.get(key);
            if (node == null) {
                continue;
            }
            if (!node.isObject() && !node.isArray()) {
                logger.fine("Ignoring unusable '" + key + "' envelope: " + node);
                return steps;
            }
            if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    steps.put(field.getKey(), toStep(field.getValue(), bareIdSuccess));
                }
            } else {
                for (int i = 0; i < node.size(); i++) {
                    JsonNode entry = node.get(i);
                    if (entry.isObject()) {
                        steps.put(stepKey(entry, i), readStep(entry));
                    } else if (entry.isValueNode() && !entry.isNull()) {
                        steps.put(entry.asText(), new StepResult(bareIdSuccess, "", null, 0L));
                    }
                }
            }
            return steps;
        }
        return steps;
    }

    private StepResult toStep(JsonNode value, boolean bareIdSuccess) {
        if (value.isObject()) {
            return readStep(value);
        }
        // {"s1": "text"}: output only
        String text = renderText(value);
        return new StepResult(bareIdSuccess, text, null, 0L);
    }

    private static String stepKey(JsonNode entry, int index) {
        String key = textOrNull(entry.get("step_id"));
        if (key == null || key.isBlank()) {
            key = textOrNull(entry.get("id"));
        }
        return key != null && !key.isBlank() ? key : "step_" + (index + 1);
    }

    private String outputOf(JsonNode node) {
        String output = renderText(node.get("output"));
        if (output != null) {
            return output;
        }
        JsonNode resultData = node.get("result_data");
        if (resultData != null && resultData.isObject()) {
            for (String key : RESULT_DATA_TEXT_KEYS) {
                String text = renderText(resultData.get(key));
                if (text != null) {
                    return text;
                }
            }
        } else if (resultData != null && resultData.isTextual()) {
            return resultData.asText();
        }
        for (String key : STEP_TEXT_KEYS) {
            String text = renderText(node.get(key));
            if (text != null) {
                return text;
            }
        }
        return "";
    }

    private String errorOf(JsonNode node) {
        String error = renderText(node.get("error"));
        if (error == null || error.isBlank()) {
            error = renderText(node.get("error_message"));
        }
        return error == null || error.isBlank() ? null : error;
    }

    private static Boolean explicitSuccess(JsonNode body) {
        Boolean success = booleanOrNull(body.get("success"));
        return success != null ? success : statusSuccess(body.get("status"));
    }

    private static Boolean statusSuccess(JsonNode status) {
        String value = textOrNull(status);
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return "completed".equals(normalized) || "success".equals(normalized);
    }

    /// Text nodes as-is, other scalars as their text, containers as compact JSON.
    private String renderText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    static Boolean booleanOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return (long) Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static WorkflowResult failed(String workflowId, long measuredMillis, String reason) {
        return new WorkflowResult(
                workflowId, false, measuredMillis, Map.of(), "", reason, ExecutionTransport.SYNC);
    }
}
