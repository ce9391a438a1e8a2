package io.seqflow.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkflowStepTest {

    @Test
    void shouldApplyDefaults() {
        WorkflowStep step = WorkflowStep.of("research_step", "research_assistant", "Research AI");

        assertThat(step.getFunctionName()).isEqualTo("inference");
        assertThat(step.getTimeoutSeconds()).isEqualTo(60);
        assertThat(step.getMaxRetries()).isEqualTo(2);
        assertThat(step.getModel()).isEqualTo("default");
        assertThat(step.getTemperature()).isEqualTo(0.7);
        assertThat(step.getMaxTokens()).isEqualTo(1000);
        assertThat(step.isContinueOnFailure()).isFalse();
        assertThat(step.getParameters()).isEmpty();
    }

    @Test
    void shouldDeriveStepNameAndDescription() {
        WorkflowStep step = WorkflowStep.of("write_content", "content_creator", "Write");

        assertThat(step.getStepName()).isEqualTo("Write Content");
        assertThat(step.getDescription()).isEqualTo("Execute inference using content_creator");
    }

    @Test
    void shouldFallBackToInferenceForBlankFunctionName() {
        WorkflowStep step =
                WorkflowStep.builder().stepId("s1").agentName("writer").functionName(" ").build();

        assertThat(step.getFunctionName()).isEqualTo("inference");
    }

    @Test
    void shouldKeepParametersInInsertionOrder() {
        WorkflowStep step =
                WorkflowStep.builder()
                        .stepId("review")
                        .agentName("qa_specialist")
                        .parameter("operation", "quality_review")
                        .parameter("criteria", "tone")
                        .build();

        assertThat(step.getParameters().keySet()).containsExactly("operation", "criteria");
        assertThatThrownBy(() -> step.getParameters().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectMissingAgentName() {
        assertThatThrownBy(() -> WorkflowStep.builder().stepId("s1").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Agent name required");
    }

    @Test
    void shouldRejectBlankStepId() {
        assertThatThrownBy(() -> WorkflowStep.of(" ", "writer", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvalidResilienceBudget() {
        assertThatThrownBy(
                        () ->
                                WorkflowStep.builder()
                                        .stepId("s1")
                                        .agentName("writer")
                                        .timeoutSeconds(0)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                        () ->
                                WorkflowStep.builder()
                                        .stepId("s1")
                                        .agentName("writer")
                                        .maxRetries(-1)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderShouldRoundTrip() {
        WorkflowStep step =
                WorkflowStep.builder()
                        .stepId("s1")
                        .agentName("writer")
                        .prompt("x")
                        .parameters(Map.of("k", "v"))
                        .continueOnFailure(true)
                        .build();

        WorkflowStep copy = step.toBuilder().build();

        assertThat(copy).isEqualTo(step);
        assertThat(copy.isContinueOnFailure()).isTrue();
        assertThat(copy.getStepName()).isEqualTo("S1");
    }
}
