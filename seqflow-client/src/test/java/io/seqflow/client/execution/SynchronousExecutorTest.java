package io.seqflow.client.execution;

import static io.seqflow.client.http.TestResponses.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.exception.ExecutionFailedException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.execution.result.ExecutionTransport;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SynchronousExecutorTest {

    private static final String EXECUTE = "/api/v1/sequential-workflows/w1/execute";

    @Mock private ServerApi api;

    private final ObjectMapper mapper = SeqflowSerialization.createMapper();

    private SynchronousExecutor executor;

    @BeforeEach
    void setUp() {
        executor =
                new SynchronousExecutor(
                        api, mapper, new ResultNormalizer(mapper), SeqflowClientConfig.defaults());
    }

    @Test
    void shouldNormalizeWrappedResult() throws Exception {
        // Given
        when(api.post(eq(EXECUTE), anyString()))
                .thenReturn(
                        json(
                                200,
                                """
                                {"data": {
                                  "success": true,
                                  "total_execution_time_ms": 1200,
                                  "step_results": {
                                    "s1": {"success": true, "output": "draft"},
                                    "s2": {"success": true, "output": "final"}
                                  }
                                }}
                                """));

        // When
        WorkflowResult result = executor.execute("w1", Map.of("topic", "AI"));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.transport()).isEqualTo(ExecutionTransport.SYNC);
        assertThat(result.totalExecutionTimeMs()).isEqualTo(1200L);
        assertThat(result.stepResults()).containsOnlyKeys("s1", "s2");
        assertThat(result.finalOutput()).isEqualTo("final");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(api).post(eq(EXECUTE), body.capture());
        assertThat(mapper.readTree(body.getValue()).at("/input_context/topic").asText())
                .isEqualTo("AI");
    }

    @Test
    void shouldReportFailedWorkflowAsResult() {
        when(api.post(eq(EXECUTE), anyString()))
                .thenReturn(
                        json(200, "{\"success\": false, \"error\": \"agent timed out\"}"));

        WorkflowResult result = executor.execute("w1", null);

        assertThat(result.success()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("agent timed out");
    }

    @Test
    void shouldFailOnErrorStatus() {
        when(api.post(eq(EXECUTE), anyString())).thenReturn(json(500, "internal error"));

        assertThatThrownBy(() -> executor.execute("w1", null))
                .isInstanceOfSatisfying(
                        ExecutionFailedException.class,
                        e -> {
                            assertThat(e.getMessage()).contains("HTTP 500");
                            assertThat(e.getExecuteAttempts()).isEqualTo(1);
                        });
    }

    @Test
    void shouldFailOnTransportError() {
        ServerApiException cause = new ServerApiException("Connection reset", (Throwable) null);
        when(api.post(eq(EXECUTE), anyString())).thenThrow(cause);

        assertThatThrownBy(() -> executor.execute("w1", null))
                .isInstanceOf(ExecutionFailedException.class)
                .hasCause(cause);
    }
}
