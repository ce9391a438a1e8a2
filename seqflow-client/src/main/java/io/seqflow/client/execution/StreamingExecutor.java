package io.seqflow.client.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.execution.ExecutionEvent;
import io.seqflow.core.execution.ExecutionListener;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Runs a registered workflow over Server-Sent Events, reporting progress as it arrives.
///
/// The response body is read line by line with blocking reads; every decoded event is
/// handed to the listener before the next line is read. A server that answers with a
/// plain JSON document instead of an event stream is not an error: the body is normalized
/// directly and a {@link ExecutionEvent.TransportDegraded} event is emitted.
///
/// This executor never throws for a stream that ends badly. It reports an incomplete
/// {@link StreamingOutcome} and leaves recovery to {@link FallbackCoordinator}.
///
/// @see SseEventProcessor for line classification and states
public class StreamingExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingExecutor.class);

    private final ServerApi api;
    private final ObjectMapper objectMapper;
    private final ResultNormalizer normalizer;
    private final SeqflowClientConfig config;

    public StreamingExecutor(
            ServerApi api,
            ObjectMapper objectMapper,
            ResultNormalizer normalizer,
            SeqflowClientConfig config) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Executes a registered workflow and streams its progress.
    ///
    /// ### Contracts
    /// - **Postcondition**: exactly one execute request was attempted
    /// - a transport failure while reading discards the partial step buffers; a clean close
    ///   keeps them in the outcome
    ///
    /// @param workflowId registered workflow id, not null
    /// @param inputContext per-run context, may be null
    /// @param listener receives events on the calling thread, not null
    /// @return complete or incomplete outcome, never null
    public StreamingOutcome execute(
            String workflowId, Map<String, Object> inputContext, ExecutionListener listener) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        String body = SeqflowSerialization.executeRequest(objectMapper, inputContext);
        long started = System.nanoTime();

        HttpResponse<InputStream> response;
        try {
            response = api.postForStream(config.workflowPath(workflowId) + "/execute", body);
        } catch (ServerApiException e) {
            LOG.warn("Stream request for workflow {} failed: {}", workflowId, e.getMessage());
            return StreamingOutcome.incomplete(
                    Map.of(), "stream request failed: " + e.getMessage());
        }

        try (InputStream in = response.body()) {
            if (response.statusCode() != 200) {
                LOG.warn(
                        "Stream request for workflow {} answered HTTP {}",
                        workflowId,
                        response.statusCode());
                return StreamingOutcome.incomplete(Map.of(), "HTTP " + response.statusCode());
            }

            String contentType = response.headers().firstValue("Content-Type").orElse("");
            if (!isEventStream(contentType)) {
                return degraded(workflowId, in, contentType, listener, started);
            }

            SseEventProcessor processor =
                    new SseEventProcessor(workflowId, objectMapper, listener);
            BufferedReader reader =
                    new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while (processor.state() != StreamState.DONE && (line = reader.readLine()) != null) {
                processor.accept(line);
            }

            StreamingOutcome outcome = processor.finish(normalizer, elapsedMs(started));
            if (outcome.isComplete()) {
                LOG.info(
                        "Workflow {} streamed to completion: success={}, steps={}",
                        workflowId,
                        outcome.result().success(),
                        outcome.result().stepResults().size());
            } else {
                LOG.warn(
                        "Stream for workflow {} ended early: {}",
                        workflowId,
                        outcome.failureReason());
            }
            return outcome;
        } catch (IOException e) {
            LOG.warn("Stream for workflow {} failed while reading: {}", workflowId, e.getMessage());
            return StreamingOutcome.incomplete(Map.of(), "stream read failed: " + e.getMessage());
        }
    }

    private StreamingOutcome degraded(
            String workflowId,
            InputStream in,
            String contentType,
            ExecutionListener listener,
            long started)
            throws IOException {
        LOG.info(
                "Server answered workflow {} with '{}' instead of an event stream",
                workflowId,
                contentType);
        String document = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        listener.onEvent(new ExecutionEvent.TransportDegraded(workflowId, contentType));
        WorkflowResult result =
                normalizer
                        .normalize(document, workflowId, elapsedMs(started))
                        .withTransport(ExecutionTransport.STREAMING_DEGRADED);
        return StreamingOutcome.complete(result);
    }

    private static boolean isEventStream(String contentType) {
        return contentType.toLowerCase(Locale.ROOT).contains("text/event-stream");
    }

    private static long elapsedMs(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }
}
