package io.seqflow.client.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.seqflow.core.execution.ExecutionEvent;
import io.seqflow.core.execution.ExecutionListener;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.StepResult;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Line-driven state machine that turns a workflow event stream into listener events and,
/// when the server sends one, a terminal result.
///
/// ### Line classification
/// | Line                  | Effect                                                        |
/// |-----------------------|---------------------------------------------------------------|
/// | `data: {json object}` | typed event, see below                                        |
/// | `data: other`         | raw text for the active step (`[DONE]` is ignored)           |
/// | `event: name`         | event type for the frame when the JSON carries no `type`      |
/// | `id:`, `retry:`, `:`  | ignored                                                       |
/// | blank                 | ends the frame                                                |
/// | anything else         | raw text for the active step                                  |
///
/// ### Event types
/// | Type                          | Effect                                              |
/// |-------------------------------|-----------------------------------------------------|
/// | `step_start`                  | opens a step buffer, `AWAITING_STEP → IN_STEP`      |
/// | `llm_token`, `token`          | appends `token` (else `content`)                    |
/// | `llm_output`, `output`        | appends `output` (else `content`)                   |
/// | `step_complete`               | records the step, `IN_STEP → AWAITING_STEP`         |
/// | `workflow_complete`           | terminal (`result`, else the event), `→ DONE`       |
/// | `error`                       | recorded; the stream continues                      |
/// | has `final_output` or `step_results` | terminal, `→ DONE`                           |
///
/// An `error` during a step becomes that step's error when its completion carries none.
/// Recorded errors fill in the result's `error` when the terminal payload has none, and
/// are appended to the reason of an incomplete outcome.
///
/// Text arriving outside a step is kept in a separate buffer and never dropped. It is
/// carried on the outcome, and becomes the final output of a stream that ran no steps.
///
/// @implNote Not thread-safe. One instance reads one stream on one thread.
final class SseEventProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(SseEventProcessor.class);

    private static final String DONE_MARKER = "[DONE]";
    private static final List<String> STEP_ENVELOPE_KEYS =
            List.of("step_results", "steps", "executed_steps", "results");

    private final String workflowId;
    private final ObjectMapper objectMapper;
    private final ExecutionListener listener;

    private final Map<String, StepResult> steps = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final StringBuilder unattributedOutput = new StringBuilder();

    private StreamState state = StreamState.AWAITING_STEP;
    private String activeStepId;
    private StringBuilder activeOutput;
    private String activeError;
    private String frameEventName;
    private JsonNode terminalPayload;
    private int stepCounter;

    SseEventProcessor(String workflowId, ObjectMapper objectMapper, ExecutionListener listener) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Processes one line of the response body, without its line terminator.
    ///
    /// @param line the line, not null
    void accept(String line) {
        if (state == StreamState.DONE) {
            LOG.debug("Ignoring line after terminal result for {}: {}", workflowId, line);
            return;
        }
        if (line.isBlank()) {
            frameEventName = null;
        } else if (line.startsWith("data:")) {
            onData(fieldValue(line, 5));
        } else if (line.startsWith("event:")) {
            frameEventName = fieldValue(line, 6).trim();
        } else if (line.startsWith(":") || line.startsWith("id:") || line.startsWith("retry:")) {
            LOG.trace("Skipping SSE control line: {}", line);
        } else {
            appendText(line);
        }
    }

    StreamState state() {
        return state;
    }

    /// Returns the steps seen so far, including an unfinished active step marked failed.
    ///
    /// @return steps in stream order, never null
    Map<String, StepResult> partialStepResults() {
        Map<String, StepResult> partial = new LinkedHashMap<>(steps);
        if (activeStepId != null) {
            partial.put(
                    activeStepId,
                    new StepResult(
                            false,
                            activeOutput.toString(),
                            activeError != null
                                    ? activeError
                                    : "Stream ended before the step completed",
                            0L));
        }
        return partial;
    }

    /// Builds the outcome once the stream has closed cleanly.
    ///
    /// A terminal payload without step results of its own is completed with the steps
    /// assembled from the stream before it is normalized. Recorded errors and unattributed
    /// text fill in `error` and `final_output` when the payload lacks them.
    ///
    /// @param normalizer result normalizer, not null
    /// @param elapsedMs time since the request was sent
    /// @return outcome, never null
    StreamingOutcome finish(ResultNormalizer normalizer, long elapsedMs) {
        if (terminalPayload == null) {
            String reason =
                    state == StreamState.IN_STEP
                            ? "stream closed during step '" + activeStepId + "'"
                            : "stream closed without a terminal result";
            if (!errors.isEmpty()) {
                reason += "; server reported: " + String.join("; ", errors);
            }
            return StreamingOutcome.incomplete(
                    partialStepResults(), reason, unattributedOutput.toString());
        }

        WorkflowResult result =
                normalizer
                        .normalize(completedPayload(terminalPayload), workflowId, elapsedMs)
                        .withTransport(ExecutionTransport.STREAMING);
        return StreamingOutcome.complete(result, unattributedOutput.toString());
    }

    // -----------------------------------------------------------------------
    // Line handling
    // -----------------------------------------------------------------------

    private void onData(String data) {
        if (data.isEmpty() || DONE_MARKER.equals(data.trim())) {
            return;
        }
        JsonNode node = parse(data);
        if (node == null || !node.isObject()) {
            appendText(node != null && node.isTextual() ? node.asText() : data);
            return;
        }
        onEvent(node);
    }

    private void onEvent(JsonNode event) {
        String type = text(event, "type");
        if (type == null) {
            type = frameEventName;
        }
        LOG.debug("Stream event for {}: type={}", workflowId, type);

        switch (type != null ? type : "") {
            case "step_start" -> startStep(event);
            case "llm_token", "token" -> appendText(firstText(event, "token", "content"));
            case "llm_output", "output" -> appendText(firstText(event, "output", "content"));
            case "step_complete" -> completeStep(event);
            case "workflow_complete" -> {
                JsonNode result = event.get("result");
                captureTerminal(result != null && result.isObject() ? result : event);
            }
            case "error" -> recordError(event);
            default -> {
                if (event.has("final_output") || event.has("step_results")) {
                    captureTerminal(event);
                }
            }
        }
    }

    private void startStep(JsonNode event) {
        if (activeStepId != null) {
            LOG.debug("Step {} of {} never reported completion", activeStepId, workflowId);
            steps.put(
                    activeStepId,
                    new StepResult(
                            false,
                            activeOutput.toString(),
                            activeError != null ? activeError : "Step did not report completion",
                            0L));
        }
        stepCounter++;
        String stepId = firstText(event, "step_id", "id");
        if (stepId == null) {
            stepId = "step_" + stepCounter;
        }
        String stepName = text(event, "step_name");

        activeStepId = stepId;
        activeOutput = new StringBuilder();
        activeError = null;
        state = StreamState.IN_STEP;
        listener.onEvent(
                new ExecutionEvent.StepStarted(
                        workflowId,
                        stepId,
                        stepName != null ? stepName : stepId,
                        firstText(event, "agent_name", "agent_id")));
    }

    private void completeStep(JsonNode event) {
        String stepId = firstText(event, "step_id", "id");
        if (stepId == null) {
            stepId = activeStepId != null ? activeStepId : "step_" + (++stepCounter);
        }

        String output = activeOutput != null ? activeOutput.toString() : "";
        if (output.isEmpty()) {
            String reported = firstText(event, "output", "result");
            output = reported != null ? reported : "";
        }
        boolean success = event.path("success").asBoolean(false);
        String error = firstText(event, "error", "error_message");
        if (error != null && error.isBlank()) {
            error = null;
        }
        if (error == null && !success && stepId.equals(activeStepId)) {
            error = activeError;
        }

        steps.put(
                stepId,
                new StepResult(success, output, error, event.path("execution_time_ms").asLong(0L)));
        activeStepId = null;
        activeOutput = null;
        activeError = null;
        state = StreamState.AWAITING_STEP;
        listener.onEvent(new ExecutionEvent.StepCompleted(workflowId, stepId, success, error));
    }

    private void captureTerminal(JsonNode payload) {
        terminalPayload = payload;
        state = StreamState.DONE;
        LOG.debug("Terminal result received for {}", workflowId);
    }

    private void recordError(JsonNode event) {
        String message = firstText(event, "message", "error");
        if (message == null) {
            message = event.toString();
        }
        errors.add(message);
        if (activeStepId != null) {
            activeError = activeError != null ? activeError + "; " + message : message;
        }
        listener.onEvent(new ExecutionEvent.WorkflowError(workflowId, message));
    }

    private void appendText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (activeOutput != null) {
            activeOutput.append(text);
        } else {
            unattributedOutput.append(text);
        }
        listener.onEvent(new ExecutionEvent.OutputChunk(workflowId, activeStepId, text));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private JsonNode completedPayload(JsonNode payload) {
        JsonNode body = SeqflowSerialization.unwrapData(payload);
        if (body == null || !body.isObject()) {
            return payload;
        }
        boolean addSteps = !steps.isEmpty() && !hasStepEnvelope(body);
        boolean addError =
                !errors.isEmpty()
                        && !hasValue(body, "error")
                        && !hasValue(body, "error_message");
        boolean addOutput =
                steps.isEmpty()
                        && unattributedOutput.length() > 0
                        && !hasValue(body, "final_output");
        if (!addSteps && !addError && !addOutput) {
            return payload;
        }

        ObjectNode completed = ((ObjectNode) body).deepCopy();
        if (addError) {
            completed.put("error", String.join("; ", errors));
        }
        if (addOutput) {
            completed.put("final_output", unattributedOutput.toString());
        }
        if (addSteps) {
            putStepResults(completed);
        }
        return completed;
    }

    private static boolean hasStepEnvelope(JsonNode body) {
        for (String key : STEP_ENVELOPE_KEYS) {
            if (body.has(key)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasValue(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        return !value.isTextual() || !value.asText().isBlank();
    }

    private void putStepResults(ObjectNode completed) {
        ObjectNode stepResults = completed.putObject("step_results");
        steps.forEach(
                (stepId, step) -> {
                    ObjectNode node = stepResults.putObject(stepId);
                    node.put("success", step.success());
                    node.put("output", step.output());
                    if (step.error() != null) {
                        node.put("error", step.error());
                    }
                    node.put("execution_time_ms", step.executionTimeMs());
                });
    }

    private JsonNode parse(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            // not JSON: the caller treats it as raw model output
            return null;
        }
    }

    private static String fieldValue(String line, int prefixLength) {
        String value = line.substring(prefixLength);
        return value.startsWith(" ") ? value.substring(1) : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String firstText(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value != null ? value : text(node, fallback);
    }
}
