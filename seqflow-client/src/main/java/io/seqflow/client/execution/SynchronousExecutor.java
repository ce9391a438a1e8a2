package io.seqflow.client.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.exception.ExecutionFailedException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Runs a registered workflow with one blocking execute request.
///
/// Only HTTP 200 counts as a result; any other status or transport failure fails the call
/// without retrying. Retries belong to the caller, step retries to the server.
public class SynchronousExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(SynchronousExecutor.class);

    private final ServerApi api;
    private final ObjectMapper objectMapper;
    private final ResultNormalizer normalizer;
    private final SeqflowClientConfig config;

    public SynchronousExecutor(
            ServerApi api,
            ObjectMapper objectMapper,
            ResultNormalizer normalizer,
            SeqflowClientConfig config) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Executes a registered workflow and waits for its result.
    ///
    /// @param workflowId registered workflow id, not null
    /// @param inputContext per-run context, may be null
    /// @return normalized result with transport {@link ExecutionTransport#SYNC}, never null
    /// @throws ExecutionFailedException on a non-200 status or transport failure
    public WorkflowResult execute(String workflowId, Map<String, Object> inputContext) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        String body = SeqflowSerialization.executeRequest(objectMapper, inputContext);
        long started = System.nanoTime();

        HttpResponse<String> response;
        try {
            response = api.post(config.workflowPath(workflowId) + "/execute", body);
        } catch (ServerApiException e) {
            throw new ExecutionFailedException(workflowId, e.getMessage(), e);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        if (response.statusCode() != 200) {
            throw new ExecutionFailedException(
                    workflowId, "HTTP " + response.statusCode() + ": " + response.body());
        }

        WorkflowResult result =
                normalizer
                        .normalize(response.body(), workflowId, elapsedMs)
                        .withTransport(ExecutionTransport.SYNC);
        LOG.info(
                "Workflow {} finished synchronously: success={}, steps={}, {} ms",
                workflowId,
                result.success(),
                result.stepResults().size(),
                result.totalExecutionTimeMs());
        return result;
    }
}
