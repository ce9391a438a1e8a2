package io.seqflow.core.workflow;

/// Ready-made pipelines for common research, writing and analysis flows.
///
/// Each template returns a {@link Workflow.Builder} so callers can append steps or tweak
/// the shared context before building. Agent names refer to the agents a stock server
/// ships with (`research_assistant`, `content_creator`, `qa_specialist`,
/// `code_assistant`, `data_analyst`).
public final class WorkflowTemplates {

    private WorkflowTemplates() {}

    /// Research a topic, write about it, then review the result.
    ///
    /// @param topic subject to research, not null
    /// @param audience target readers, not null
    /// @param contentType kind of content to write (e.g. "article"), not null
    /// @return builder for workflow `content_creation`, never null
    public static Workflow.Builder contentCreation(
            String topic, String audience, String contentType) {
        return Workflow.builder()
                .workflowId("content_creation")
                .workflowName("Content Creation Pipeline")
                .description("Research, write, and review content about " + topic)
                .contextValue("topic", topic)
                .contextValue("audience", audience)
                .contextValue("content_type", contentType)
                .addStep(researchStep(topic, "research_assistant"))
                .addStep(
                        WorkflowStep.builder()
                                .stepId("write_content")
                                .agentName("content_creator")
                                .prompt(
                                        "Based on the research, write a professional "
                                                + contentType
                                                + ". Make it engaging and well-structured.")
                                .temperature(0.7)
                                .maxTokens(1500)
                                .build())
                .addStep(reviewStep("accuracy, clarity, tone", "qa_specialist"));
    }

    /// Generate code, review it, then document it.
    ///
    /// @param requirements what the code must do, not null
    /// @param language target language, not null
    /// @return builder for workflow `code_development`, never null
    public static Workflow.Builder codeDevelopment(String requirements, String language) {
        return Workflow.builder()
                .workflowId("code_development")
                .workflowName("Code Development Pipeline")
                .description("Generate, review, and document " + language + " code")
                .contextValue("requirements", requirements)
                .contextValue("language", language)
                .addStep(
                        WorkflowStep.builder()
                                .stepId("generate_code")
                                .agentName("code_assistant")
                                .prompt(
                                        "Generate "
                                                + language
                                                + " code for: "
                                                + requirements
                                                + ". Include proper error handling"
                                                + " and documentation.")
                                .temperature(0.2)
                                .maxTokens(1500)
                                .build())
                .addStep(reviewStep("code quality, security, best practices", "qa_specialist"))
                .addStep(
                        WorkflowStep.builder()
                                .stepId("document")
                                .agentName("content_creator")
                                .prompt(
                                        "Create comprehensive documentation for the "
                                                + language
                                                + " code including usage examples"
                                                + " and API reference")
                                .temperature(0.3)
                                .build());
    }

    /// Prepare data, analyze it, then derive recommendations.
    ///
    /// @param dataDescription what the data is, not null
    /// @param analysisType kind of analysis (e.g. "statistical summary"), not null
    /// @return builder for workflow `data_analysis`, never null
    public static Workflow.Builder dataAnalysis(String dataDescription, String analysisType) {
        return Workflow.builder()
                .workflowId("data_analysis")
                .workflowName("Data Analysis Pipeline")
                .description("Analyze " + dataDescription + " and generate insights")
                .stopOnFailure(false)
                .contextValue("data_description", dataDescription)
                .contextValue("analysis_type", analysisType)
                .addStep(
                        WorkflowStep.builder()
                                .stepId("prepare_data")
                                .agentName("data_analyst")
                                .functionName("data_analysis")
                                .prompt(
                                        "Prepare and validate the "
                                                + dataDescription
                                                + " for "
                                                + analysisType)
                                .parameter("operation", "data_preparation")
                                .build())
                .addStep(
                        WorkflowStep.builder()
                                .stepId("analyze")
                                .agentName("data_analyst")
                                .functionName("data_analysis")
                                .prompt("Perform " + analysisType + " on the prepared data")
                                .parameter("operation", "statistical_analysis")
                                .build())
                .addStep(
                        WorkflowStep.builder()
                                .stepId("generate_insights")
                                .agentName("research_assistant")
                                .prompt(
                                        "Based on the "
                                                + analysisType
                                                + " results, generate key insights"
                                                + " and actionable recommendations")
                                .temperature(0.4)
                                .build());
    }

    /// Research step with a low temperature for factual output.
    ///
    /// @param topic subject to research, not null
    /// @param agentName agent to use, not null
    /// @return step `research`, never null
    public static WorkflowStep researchStep(String topic, String agentName) {
        return WorkflowStep.builder()
                .stepId("research")
                .agentName(agentName)
                .prompt(
                        "Research the latest information about: "
                                + topic
                                + ". Provide comprehensive and accurate information.")
                .temperature(0.3)
                .maxTokens(1200)
                .build();
    }

    /// Quality review step using the text-processing function.
    ///
    /// @param criteria review criteria, not null
    /// @param agentName agent to use, not null
    /// @return step `review`, never null
    public static WorkflowStep reviewStep(String criteria, String agentName) {
        return WorkflowStep.builder()
                .stepId("review")
                .agentName(agentName)
                .functionName("text_processing")
                .prompt(
                        "Review the content for: "
                                + criteria
                                + ". Provide constructive feedback and suggestions.")
                .parameter("operation", "quality_review")
                .parameter("criteria", criteria)
                .build();
    }
}
