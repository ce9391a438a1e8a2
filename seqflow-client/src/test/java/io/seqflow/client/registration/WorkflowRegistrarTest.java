package io.seqflow.client.registration;

import static io.seqflow.client.http.TestResponses.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.agent.AgentNameResolver;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.agent.AgentDescriptor;
import io.seqflow.core.agent.AgentDirectory;
import io.seqflow.core.exception.RegistrationFailedException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.exception.UnresolvedAgentException;
import io.seqflow.core.workflow.Workflow;
import io.seqflow.serialization.SeqflowSerialization;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowRegistrarTest {

    private static final String WORKFLOWS = "/api/v1/sequential-workflows";
    private static final String W1 = WORKFLOWS + "/w1";

    @Mock private ServerApi api;

    @Mock private AgentDirectory directory;

    private final ObjectMapper mapper = SeqflowSerialization.createMapper();
    private final SeqflowClientConfig config = SeqflowClientConfig.defaults();

    private Workflow workflow;

    @BeforeEach
    void setUp() {
        workflow =
                Workflow.builder()
                        .workflowId("w1")
                        .addStep("s1", "writer", "Write about {topic}")
                        .build();
    }

    private WorkflowRegistrar registrar(SeqflowClientConfig cfg) {
        return new WorkflowRegistrar(api, new AgentNameResolver(directory), mapper, cfg);
    }

    private void writerKnown() {
        when(directory.listAgents()).thenReturn(List.of(new AgentDescriptor("writer", "abc-123")));
    }

    // -------------------------------------------------------------------------
    // Create
    // -------------------------------------------------------------------------

    @Nested
    class CreateTest {

        @Test
        void shouldSendResolvedAgentIds() throws Exception {
            // Given
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString())).thenReturn(json(201, "{}"));

            // When
            Registration registration = registrar(config).register(workflow);

            // Then
            ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
            verify(api).post(eq(WORKFLOWS), body.capture());
            JsonNode sent = mapper.readTree(body.getValue());
            assertThat(sent.get("workflow_id").asText()).isEqualTo("w1");
            assertThat(sent.get("steps").get(0).get("agent_id").asText()).isEqualTo("abc-123");
            assertThat(registration.definition().agentIds()).containsEntry("writer", "abc-123");
            assertThat(registration.outcome()).isEqualTo(RegistrationOutcome.CREATED);
        }

        @Test
        void shouldFailWithoutRequestWhenAgentIsUnknown() {
            when(directory.listAgents()).thenReturn(List.of(new AgentDescriptor("qa", "q-1")));

            assertThatThrownBy(() -> registrar(config).register(workflow))
                    .isInstanceOfSatisfying(
                            UnresolvedAgentException.class,
                            e -> assertThat(e.getMissingNames()).containsExactly("writer"));
            verifyNoInteractions(api);
        }

        @Test
        void shouldReportRejectedCreate() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString()))
                    .thenReturn(json(500, "{\"error\":\"boom\"}"));

            assertThatThrownBy(() -> registrar(config).register(workflow))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> {
                                assertThat(e.getStatusCode()).isEqualTo(500);
                                assertThat(e.getMessage()).contains("boom");
                            });
        }

        @Test
        void shouldReportTransportFailureWithoutStatus() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString()))
                    .thenThrow(new ServerApiException("Failed to reach server", (Throwable) null));

            assertThatThrownBy(() -> registrar(config).register(workflow))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(-1));
        }
    }

    // -------------------------------------------------------------------------
    // Conflict handling
    // -------------------------------------------------------------------------

    @Nested
    class ConflictTest {

        @Test
        void shouldDeleteAndRecreateOnConflict() {
            // Given: stored definition exists, delete finds it already gone
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString()))
                    .thenReturn(json(409, "exists"), json(201, "{}"));
            when(api.delete(W1)).thenReturn(json(404, ""));

            // When
            Registration registration = registrar(config).register(workflow);

            // Then
            assertThat(registration.outcome()).isEqualTo(RegistrationOutcome.REPLACED);
            assertThat(registration.outcome().mayHoldEarlierResult()).isFalse();
            InOrder order = inOrder(api);
            order.verify(api).post(eq(WORKFLOWS), anyString());
            order.verify(api).delete(W1);
            order.verify(api).post(eq(WORKFLOWS), anyString());
            verifyNoMoreInteractions(api);
        }

        @Test
        void shouldStopWhenDeleteIsRejected() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString())).thenReturn(json(409, "exists"));
            when(api.delete(W1)).thenReturn(json(500, "locked"));

            assertThatThrownBy(() -> registrar(config).register(workflow))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(500));
            verify(api, times(1)).post(eq(WORKFLOWS), anyString());
        }

        @Test
        void shouldNotRetryASecondConflict() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString()))
                    .thenReturn(json(409, "exists"), json(409, "still exists"));
            when(api.delete(W1)).thenReturn(json(204, ""));

            assertThatThrownBy(() -> registrar(config).register(workflow))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(409));
            verify(api, times(2)).post(eq(WORKFLOWS), anyString());
        }

        @Test
        void shouldKeepStoredDefinitionUnderReusePolicy() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString())).thenReturn(json(409, "exists"));

            Registration registration =
                    registrar(config.toBuilder().conflictPolicy(ConflictPolicy.REUSE).build())
                            .register(workflow);

            assertThat(registration.outcome()).isEqualTo(RegistrationOutcome.REUSED);
            assertThat(registration.outcome().mayHoldEarlierResult()).isTrue();
            verify(api, times(1)).post(eq(WORKFLOWS), anyString());
            verifyNoMoreInteractions(api);
        }

        @Test
        void shouldRegisterSameWorkflowTwice() {
            // Given: the first call creates, the second hits the stored copy
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString()))
                    .thenReturn(json(201, "{}"), json(409, "exists"), json(201, "{}"));
            when(api.delete(W1)).thenReturn(json(200, "{}"));
            WorkflowRegistrar registrar = registrar(config);

            // When
            registrar.register(workflow);
            registrar.register(workflow);

            // Then
            verify(api, times(3)).post(eq(WORKFLOWS), anyString());
            verify(api, times(1)).delete(W1);
        }
    }

    // -------------------------------------------------------------------------
    // Verification
    // -------------------------------------------------------------------------

    @Nested
    class VerifyTest {

        private final SeqflowClientConfig verifying =
                config.toBuilder().verifyRegistration(true).build();

        @Test
        void shouldFailWhenStoredDefinitionIsMissing() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString())).thenReturn(json(201, "{}"));
            when(api.get(W1)).thenReturn(json(404, ""));

            assertThatThrownBy(() -> registrar(verifying).register(workflow))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> assertThat(e.getStatusCode()).isEqualTo(404));
        }

        @Test
        void shouldToleratePlainServerErrorDuringVerify() {
            writerKnown();
            when(api.post(eq(WORKFLOWS), anyString())).thenReturn(json(201, "{}"));
            when(api.get(W1)).thenReturn(json(500, ""));

            Registration registration = registrar(verifying).register(workflow);

            assertThat(registration.definition().workflow()).isEqualTo(workflow);
        }
    }

    // -------------------------------------------------------------------------
    // Templates
    // -------------------------------------------------------------------------

    @Nested
    class TemplateTest {

        private static final String TEMPLATES = WORKFLOWS + "/templates";

        @Test
        void shouldSendResolvedTemplateWithOverridingId() throws Exception {
            // Given
            writerKnown();
            when(api.post(eq(TEMPLATES), anyString()))
                    .thenReturn(json(201, "{\"data\":{\"workflow_id\":\"w1_copy\"}}"));

            // When
            String created = registrar(config).createFromTemplate(workflow, "w1_copy");

            // Then
            ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
            verify(api).post(eq(TEMPLATES), body.capture());
            JsonNode sent = mapper.readTree(body.getValue());
            assertThat(sent.get("workflow_id").asText()).isEqualTo("w1_copy");
            assertThat(sent.get("template").get("workflow_id").asText()).isEqualTo("w1");
            assertThat(sent.get("template").get("steps").get(0).get("agent_id").asText())
                    .isEqualTo("abc-123");
            assertThat(created).isEqualTo("w1_copy");
        }

        @Test
        void shouldKeepTemplateIdWhenNoneIsGiven() throws Exception {
            writerKnown();
            when(api.post(eq(TEMPLATES), anyString())).thenReturn(json(201, "{}"));

            String created = registrar(config).createFromTemplate(workflow, null);

            ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
            verify(api).post(eq(TEMPLATES), body.capture());
            assertThat(mapper.readTree(body.getValue()).has("workflow_id")).isFalse();
            assertThat(created).isEqualTo("w1");
        }

        @Test
        void shouldReportTakenIdAsFailure() {
            writerKnown();
            when(api.post(eq(TEMPLATES), anyString()))
                    .thenReturn(json(409, "{\"error\":\"Workflow already exists or invalid\"}"));

            assertThatThrownBy(() -> registrar(config).createFromTemplate(workflow, "w2"))
                    .isInstanceOfSatisfying(
                            RegistrationFailedException.class,
                            e -> {
                                assertThat(e.getStatusCode()).isEqualTo(409);
                                assertThat(e.getMessage()).contains("already exists");
                            });
            verify(api, times(1)).post(eq(TEMPLATES), anyString());
            verifyNoMoreInteractions(api);
        }

        @Test
        void shouldNotSendTemplateWithUnknownAgent() {
            when(directory.listAgents()).thenReturn(List.of());

            assertThatThrownBy(() -> registrar(config).createFromTemplate(workflow, "w2"))
                    .isInstanceOf(UnresolvedAgentException.class);
            verifyNoInteractions(api);
        }
    }
}
