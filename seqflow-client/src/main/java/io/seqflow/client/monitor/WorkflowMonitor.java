package io.seqflow.client.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.exception.ExecutionFailedException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.ExecutorMetrics;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.core.execution.result.WorkflowState;
import io.seqflow.core.execution.result.WorkflowStatus;
import io.seqflow.core.workflow.StoredWorkflow;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import io.seqflow.serialization.StoredWorkflowReader;
import io.seqflow.serialization.WorkflowStatusReader;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Read and control operations on registered workflows.
///
/// | Operation           | Request                                   |
/// |---------------------|-------------------------------------------|
/// | `getWorkflow`       | `GET {workflows}/{id}`                    |
/// | `status`            | `GET {workflows}/{id}/status`             |
/// | `result`            | `GET {workflows}/{id}/result`             |
/// | `cancel`            | `POST {workflows}/{id}/cancel`            |
/// | `startAsync`        | `POST {workflows}/{id}/execute-async`     |
/// | `listWorkflows`     | `GET {workflows}`                         |
/// | `delete`            | `DELETE {workflows}/{id}`                 |
/// | `executorMetrics`   | `GET {workflows}/executor/metrics`        |
/// | `isServerHealthy`   | `GET {health}`                            |
///
/// A 404 means "no such workflow" (or no result yet) and is reported as an empty value or
/// `false`. Other unexpected statuses raise {@link ServerApiException}.
public class WorkflowMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowMonitor.class);

    private final ServerApi api;
    private final ObjectMapper objectMapper;
    private final ResultNormalizer normalizer;
    private final SeqflowClientConfig config;

    public WorkflowMonitor(
            ServerApi api,
            ObjectMapper objectMapper,
            ResultNormalizer normalizer,
            SeqflowClientConfig config) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Reads back the definition the server stores for a workflow.
    ///
    /// @param workflowId workflow id, not null
    /// @return stored definition with its current status, or empty if the server does not
    /// know the workflow
    /// @throws ServerApiException on transport failure or an unexpected status
    public Optional<StoredWorkflow> getWorkflow(String workflowId) {
        HttpResponse<String> response = api.get(config.workflowPath(workflowId));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        expect(response, 200, "definition of " + workflowId);
        return Optional.of(StoredWorkflowReader.read(readTree(response.body()), workflowId));
    }

    /// Returns the current status of a workflow.
    ///
    /// @param workflowId workflow id, not null
    /// @return status, or empty if the server does not know the workflow
    /// @throws ServerApiException on transport failure or an unexpected status
    public Optional<WorkflowStatus> status(String workflowId) {
        HttpResponse<String> response = api.get(config.workflowPath(workflowId) + "/status");
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        expect(response, 200, "status of " + workflowId);
        return Optional.of(WorkflowStatusReader.read(readTree(response.body()), workflowId));
    }

    /// Returns the last execution result of a workflow.
    ///
    /// @param workflowId workflow id, not null
    /// @return normalized result with transport {@link ExecutionTransport#POLL}, or empty
    /// when the workflow has not produced one
    /// @throws ServerApiException on transport failure or an unexpected status
    public Optional<WorkflowResult> result(String workflowId) {
        HttpResponse<String> response = api.get(config.workflowPath(workflowId) + "/result");
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        expect(response, 200, "result of " + workflowId);
        return Optional.of(
                normalizer
                        .normalize(response.body(), workflowId, 0L)
                        .withTransport(ExecutionTransport.POLL));
    }

    /// Asks the server to cancel a running workflow.
    ///
    /// @param workflowId workflow id, not null
    /// @return `true` if the server reports the workflow as cancelled
    /// @throws ServerApiException on transport failure or an unexpected status
    public boolean cancel(String workflowId) {
        HttpResponse<String> response =
                api.post(config.workflowPath(workflowId) + "/cancel", "{}");
        if (response.statusCode() == 404) {
            return false;
        }
        expect(response, 200, "cancel of " + workflowId);
        JsonNode body = SeqflowSerialization.unwrapData(readTree(response.body()));
        boolean cancelled = body != null && body.path("cancelled").asBoolean(false);
        LOG.info("Cancel requested for workflow {}: cancelled={}", workflowId, cancelled);
        return cancelled;
    }

    /// Starts a workflow without waiting for it.
    ///
    /// @param workflowId registered workflow id, not null
    /// @param inputContext per-run context, may be null
    /// @return the server's execution id, or the workflow id when the server returns none
    /// @throws ExecutionFailedException if the server does not accept the request
    public String startAsync(String workflowId, Map<String, Object> inputContext) {
        String body = SeqflowSerialization.executeRequest(objectMapper, inputContext);
        HttpResponse<String> response;
        try {
            response = api.post(config.workflowPath(workflowId) + "/execute-async", body);
        } catch (ServerApiException e) {
            throw new ExecutionFailedException(workflowId, e.getMessage(), e);
        }
        if (response.statusCode() != 202 && response.statusCode() != 200) {
            throw new ExecutionFailedException(
                    workflowId, "HTTP " + response.statusCode() + ": " + response.body());
        }
        JsonNode data = SeqflowSerialization.unwrapData(readTree(response.body()));
        String executionId = data != null ? data.path("execution_id").asText(null) : null;
        LOG.info("Started workflow {} asynchronously", workflowId);
        return executionId != null && !executionId.isBlank() ? executionId : workflowId;
    }

    /// Polls the status endpoint until the workflow reaches a terminal state, then fetches
    /// its result.
    ///
    /// When the result endpoint has nothing, a result is built from the final status.
    ///
    /// @param workflowId workflow id, not null
    /// @param pollInterval pause between status requests, not null
    /// @param timeout overall deadline, not null
    /// @return terminal result, never null
    /// @throws ExecutionFailedException on timeout, interruption, or an unknown workflow
    public WorkflowResult awaitCompletion(
            String workflowId, Duration pollInterval, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            WorkflowStatus status =
                    status(workflowId)
                            .orElseThrow(
                                    () ->
                                            new ExecutionFailedException(
                                                    workflowId, "workflow is not registered"));
            if (status.isTerminal()) {
                return result(workflowId).orElseGet(() -> fromStatus(status));
            }
            if (System.nanoTime() >= deadline) {
                throw new ExecutionFailedException(
                        workflowId,
                        "still " + status.state() + " after " + timeout.toMillis() + " ms");
            }
            LOG.debug("Workflow {} is {}, polling again", workflowId, status.state());
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionFailedException(workflowId, "interrupted while polling", e);
            }
        }
    }

    /// Lists the ids of all registered workflows.
    ///
    /// @return workflow ids in server order, never null
    /// @throws ServerApiException on transport failure or an unexpected status
    public List<String> listWorkflows() {
        HttpResponse<String> response = api.get(config.getWorkflowsPath());
        expect(response, 200, "workflow listing");
        JsonNode data = SeqflowSerialization.unwrapData(readTree(response.body()));
        List<String> ids = new ArrayList<>();
        if (data != null && data.isArray()) {
            for (JsonNode entry : data) {
                String id =
                        entry.isObject()
                                ? entry.path("workflow_id").asText(null)
                                : entry.asText(null);
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    /// Deletes a stored workflow definition.
    ///
    /// @param workflowId workflow id, not null
    /// @return `true` if it was deleted, `false` if it did not exist
    /// @throws ServerApiException on transport failure or an unexpected status
    public boolean delete(String workflowId) {
        HttpResponse<String> response = api.delete(config.workflowPath(workflowId));
        if (response.statusCode() == 404) {
            return false;
        }
        if (response.statusCode() != 204) {
            expect(response, 200, "delete of " + workflowId);
        }
        LOG.info("Deleted workflow {}", workflowId);
        return true;
    }

    /// Returns the server's executor counters.
    ///
    /// @return metrics, never null
    /// @throws ServerApiException on transport failure or an unexpected status
    public ExecutorMetrics executorMetrics() {
        HttpResponse<String> response = api.get(config.getWorkflowsPath() + "/executor/metrics");
        expect(response, 200, "executor metrics");
        return WorkflowStatusReader.readMetrics(readTree(response.body()));
    }

    /// Checks the server's health endpoint.
    ///
    /// @return `true` if the server answered 200, `false` on any other answer or failure
    public boolean isServerHealthy() {
        try {
            return api.get(config.getHealthPath()).statusCode() == 200;
        } catch (ServerApiException e) {
            LOG.debug("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static WorkflowResult fromStatus(WorkflowStatus status) {
        return new WorkflowResult(
                status.workflowId(),
                status.state() == WorkflowState.COMPLETED && status.failedSteps() == 0,
                status.executionTimeMs(),
                Map.of(),
                "",
                status.error(),
                ExecutionTransport.POLL);
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body != null ? body : "");
        } catch (JsonProcessingException e) {
            throw new ServerApiException("Unreadable response: " + e.getMessage(), e);
        }
    }

    private static void expect(HttpResponse<String> response, int status, String what) {
        if (response.statusCode() != status) {
            throw new ServerApiException(
                    "Unexpected answer for "
                            + what
                            + ": HTTP "
                            + response.statusCode()
                            + " "
                            + response.body(),
                    response.statusCode());
        }
    }
}
