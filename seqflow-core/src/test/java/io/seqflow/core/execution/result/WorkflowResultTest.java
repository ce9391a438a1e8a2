package io.seqflow.core.execution.result;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkflowResultTest {

    @Test
    void shouldDefaultNullCollectionsAndText() {
        WorkflowResult result = new WorkflowResult("w1", true, 10L, null, null, null, null);

        assertThat(result.stepResults()).isEmpty();
        assertThat(result.finalOutput()).isEmpty();
        assertThat(result.transport()).isEqualTo(ExecutionTransport.SYNC);
    }

    @Test
    void lastSuccessfulOutputShouldSkipFailedAndBlankSteps() {
        Map<String, StepResult> steps = new LinkedHashMap<>();
        steps.put("s1", new StepResult(true, "first", null, 0L));
        steps.put("s2", new StepResult(true, "second", null, 0L));
        steps.put("s3", new StepResult(true, "  ", null, 0L));
        steps.put("s4", new StepResult(false, "partial", "boom", 0L));

        assertThat(WorkflowResult.lastSuccessfulOutput(steps)).isEqualTo("second");
    }

    @Test
    void withTransportShouldOnlyChangeTransport() {
        WorkflowResult result =
                new WorkflowResult("w1", true, 5L, Map.of(), "out", null, ExecutionTransport.SYNC);

        WorkflowResult polled = result.withTransport(ExecutionTransport.POLL);

        assertThat(polled.transport()).isEqualTo(ExecutionTransport.POLL);
        assertThat(polled.finalOutput()).isEqualTo("out");
        assertThat(result.transport()).isEqualTo(ExecutionTransport.SYNC);
    }
}
