package io.seqflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import io.seqflow.core.execution.result.StepResult;
import io.seqflow.core.execution.result.WorkflowResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ResultNormalizerTest {

    private final ResultNormalizer normalizer =
            new ResultNormalizer(SeqflowSerialization.createMapper());

    // -------------------------------------------------------------------------
    // Envelopes: each accepted key yields the same canonical steps
    // -------------------------------------------------------------------------

    @Nested
    class EnvelopeTest {

        @Test
        void shouldReadStepResultsObjectInsideDataWrapper() {
            String body =
                    """
                    {"data": {
                      "workflow_id": "w1",
                      "success": true,
                      "total_execution_time_ms": 420,
                      "executed_steps": ["s1", "s2"],
                      "step_results": {
                        "s1": {"success": true, "execution_time_ms": 200,
                               "result_data": {"text": "facts"}},
                        "s2": {"success": true, "result_data": {"response": "article"}}
                      }
                    }}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 999L);

            assertThat(result.success()).isTrue();
            assertThat(result.totalExecutionTimeMs()).isEqualTo(420L);
            assertThat(result.stepResults().keySet()).containsExactly("s1", "s2");
            assertThat(result.step("s1").output()).isEqualTo("facts");
            assertThat(result.step("s1").executionTimeMs()).isEqualTo(200L);
            assertThat(result.finalOutput()).isEqualTo("article");
        }

        @Test
        void shouldReadStepsArrayKeyedByStepIdOrPosition() {
            String body =
                    """
                    {"success": true, "steps": [
                      {"step_id": "research", "success": true, "output": "a"},
                      {"id": "write", "success": true, "text": "b"},
                      {"success": true, "content": "c"}
                    ]}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 5L);

            assertThat(result.stepResults().keySet())
                    .containsExactly("research", "write", "step_3");
            assertThat(result.step("write").output()).isEqualTo("b");
            assertThat(result.finalOutput()).isEqualTo("c");
        }

        @Test
        void shouldGiveBareStepIdsTheOverallOutcome() {
            String body =
                    """
                    {"workflow_id": "w1", "success": false, "error_message": "step s2 failed",
                     "executed_steps": ["s1", "s2"]}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 5L);

            assertThat(result.success()).isFalse();
            assertThat(result.errorMessage()).isEqualTo("step s2 failed");
            assertThat(result.stepResults().values()).extracting(StepResult::success)
                    .containsExactly(false, false);
        }

        @Test
        void shouldReadResultsKeyWhenOthersAreAbsent() {
            String body =
                    """
                    {"results": {"s1": {"success": "true", "response": "done"}}}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 5L);

            assertThat(result.step("s1").success()).isTrue();
            assertThat(result.step("s1").output()).isEqualTo("done");
            assertThat(result.success()).isTrue();
        }

        @Test
        void shouldStopAtFirstPresentKeyEvenWhenItHoldsNoSteps() {
            String body =
                    """
                    {"success": false, "step_results": null,
                     "steps": {"s1": {"success": true, "output": "stale"}}}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 5L);

            assertThat(result.stepResults()).isEmpty();
            assertThat(result.finalOutput()).isEmpty();
        }

        @Test
        void shouldTreatScalarEnvelopeAsNoSteps() {
            String body =
                    """
                    {"executed_steps": 2, "results": {"s1": {"success": true}}}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 5L);

            assertThat(result.stepResults()).isEmpty();
            assertThat(result.success()).isFalse();
        }

        @Test
        void shouldYieldEmptyStepsWhenNoEnvelopeIsPresent() {
            WorkflowResult result = normalizer.normalize("{\"status\":\"completed\"}", "w1", 5L);

            assertThat(result.stepResults()).isEmpty();
            assertThat(result.success()).isTrue();
            assertThat(result.finalOutput()).isEmpty();
        }
    }

    // -------------------------------------------------------------------------
    // Field rules
    // -------------------------------------------------------------------------

    @Nested
    class FieldRulesTest {

        @Test
        void shouldBackfillWorkflowIdAndMeasuredDuration() {
            WorkflowResult result =
                    normalizer.normalize("{\"success\":true,\"step_results\":{}}", "w9", 1234L);

            assertThat(result.workflowId()).isEqualTo("w9");
            assertThat(result.totalExecutionTimeMs()).isEqualTo(1234L);
        }

        @Test
        void shouldAcceptExecutionTimeMsAsTotalDuration() {
            WorkflowResult result =
                    normalizer.normalize(
                            "{\"success\":true,\"execution_time_ms\":\"77\"}", "w1", 1L);

            assertThat(result.totalExecutionTimeMs()).isEqualTo(77L);
        }

        @Test
        void shouldDeriveSuccessFromStepsWhenFlagMissing() {
            WorkflowResult allOk =
                    normalizer.normalize(
                            "{\"step_results\":{\"a\":{\"success\":true},"
                                    + "\"b\":{\"success\":true}}}",
                            "w1",
                            1L);
            WorkflowResult oneFailed =
                    normalizer.normalize(
                            "{\"step_results\":{\"a\":{\"success\":true},"
                                    + "\"b\":{\"success\":false}}}",
                            "w1",
                            1L);
            WorkflowResult noSteps = normalizer.normalize("{\"step_results\":{}}", "w1", 1L);

            assertThat(allOk.success()).isTrue();
            assertThat(oneFailed.success()).isFalse();
            assertThat(noSteps.success()).isFalse();
        }

        @Test
        void shouldPreferExplicitFinalOutput() {
            String body =
                    """
                    {"success": true, "final_output": "summary",
                     "step_results": {"s1": {"success": true, "output": "draft"}}}
                    """;

            assertThat(normalizer.normalize(body, "w1", 1L).finalOutput()).isEqualTo("summary");
        }

        @Test
        void shouldRenderStructuredFinalOutputAsJson() {
            String body = "{\"success\": true, \"final_output\": {\"score\": 9}}";

            assertThat(normalizer.normalize(body, "w1", 1L).finalOutput())
                    .isEqualTo("{\"score\":9}");
        }

        @Test
        void shouldSkipFailedAndBlankStepsForFinalOutput() {
            String body =
                    """
                    {"step_results": {
                      "s1": {"success": true, "output": "kept"},
                      "s2": {"success": true, "output": "   "},
                      "s3": {"success": false, "output": "ignored", "error": "boom"}
                    }}
                    """;

            WorkflowResult result = normalizer.normalize(body, "w1", 1L);

            assertThat(result.finalOutput()).isEqualTo("kept");
            assertThat(result.step("s3").error()).isEqualTo("boom");
        }

        @Test
        void shouldTreatBlankErrorAsNoError() {
            String body =
                    "{\"step_results\": {\"s1\": {\"success\": true, \"error_message\": \"\"}}}";

            assertThat(normalizer.normalize(body, "w1", 1L).step("s1").error()).isNull();
        }
    }

    // -------------------------------------------------------------------------
    // Totality: unusable input never throws
    // -------------------------------------------------------------------------

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not json", "[1,2,3]", "\"just text\"", "{\"data\": 42}", "{"})
    void shouldNeverThrowOnUnusableInput(String body) {
        WorkflowResult result = normalizer.normalize(body, "w1", 10L);

        assertThat(result.success()).isFalse();
        assertThat(result.workflowId()).isEqualTo("w1");
        assertThat(result.totalExecutionTimeMs()).isEqualTo(10L);
        assertThat(result.stepResults()).isEmpty();
        assertThat(result.finalOutput()).isEmpty();
    }
}
