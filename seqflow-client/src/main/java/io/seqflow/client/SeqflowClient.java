package io.seqflow.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.agent.AgentNameResolver;
import io.seqflow.client.agent.HttpAgentDirectory;
import io.seqflow.client.execution.ExecutionMode;
import io.seqflow.client.execution.FallbackCoordinator;
import io.seqflow.client.execution.StreamingExecutor;
import io.seqflow.client.execution.SynchronousExecutor;
import io.seqflow.client.http.ServerApi;
import io.seqflow.client.monitor.WorkflowMonitor;
import io.seqflow.client.registration.Registration;
import io.seqflow.client.registration.WorkflowRegistrar;
import io.seqflow.core.execution.ExecutionListener;
import io.seqflow.core.execution.result.WorkflowResult;
import io.seqflow.core.workflow.Workflow;
import io.seqflow.serialization.ResultNormalizer;
import io.seqflow.serialization.SeqflowSerialization;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Entry point for running sequential workflows on a remote server.
///
/// Wires the agent resolver, registrar, executors and monitor over one shared HTTP
/// client and one agent directory cache.
///
/// ### Usage
/// {@snippet :
/// SeqflowClient client = new SeqflowClient(SeqflowClientConfig.load());
///
/// Workflow workflow = Workflow.builder()
///         .workflowId("research_pipeline")
///         .addStep("research", "research_assistant", "Research quantum computing")
///         .addStep("summarize", "content_creator", "Summarize the findings")
///         .build();
///
/// WorkflowResult result = client.execute(
///         workflow, Map.of("audience", "engineers"), ExecutionMode.STREAMING,
///         event -> System.out.println(event));
/// }
///
/// Every execute call registers the workflow first (create, or replace a stale stored
/// definition), so agent ids are resolved against the server's current directory.
///
/// @implNote Thread-safe for distinct workflow ids. Running the same workflow id from two
/// threads at once interleaves its delete and create requests.
public class SeqflowClient {

    private static final Logger LOG = LoggerFactory.getLogger(SeqflowClient.class);

    private final SeqflowClientConfig config;
    private final AgentNameResolver resolver;
    private final WorkflowRegistrar registrar;
    private final SynchronousExecutor synchronousExecutor;
    private final FallbackCoordinator fallbackCoordinator;
    private final WorkflowMonitor monitor;

    /// Creates a client with its own HTTP connection pool.
    ///
    /// @param config client configuration, not null
    public SeqflowClient(SeqflowClientConfig config) {
        this(new ServerApi(config));
    }

    /// Creates a client over an existing API binding.
    ///
    /// @param api HTTP binding, not null
    public SeqflowClient(ServerApi api) {
        Objects.requireNonNull(api, "api must not be null");
        this.config = api.getConfig();

        ObjectMapper objectMapper = SeqflowSerialization.createMapper();
        ResultNormalizer normalizer = new ResultNormalizer(objectMapper);

        this.resolver =
                new AgentNameResolver(
                        new HttpAgentDirectory(api, objectMapper, config.getAgentsPath()));
        this.registrar = new WorkflowRegistrar(api, resolver, objectMapper, config);
        this.synchronousExecutor = new SynchronousExecutor(api, objectMapper, normalizer, config);
        this.monitor = new WorkflowMonitor(api, objectMapper, normalizer, config);
        this.fallbackCoordinator =
                new FallbackCoordinator(
                        new StreamingExecutor(api, objectMapper, normalizer, config),
                        synchronousExecutor,
                        monitor);
        LOG.debug("Seqflow client created: {}", config);
    }

    /// Registers a workflow without running it.
    ///
    /// @param workflow workflow to publish, not null
    /// @return the definition that was sent and how the server stored it, never null
    /// @throws io.seqflow.core.exception.UnresolvedAgentException if an agent is unknown
    /// @throws io.seqflow.core.exception.RegistrationFailedException if publishing failed
    public Registration register(Workflow workflow) {
        return registrar.register(workflow);
    }

    /// Asks the server to instantiate a workflow from a template definition.
    ///
    /// @param template workflow used as the template, not null
    /// @param workflowId id for the new workflow, or null to keep the template's
    /// @return id of the created workflow, never null
    /// @throws io.seqflow.core.exception.UnresolvedAgentException if an agent is unknown
    /// @throws io.seqflow.core.exception.RegistrationFailedException if the server refused
    public String createFromTemplate(Workflow template, String workflowId) {
        return registrar.createFromTemplate(template, workflowId);
    }

    /// Registers and runs a workflow.
    ///
    /// @param workflow workflow to run, not null
    /// @param inputContext per-run context, may be null
    /// @param mode execution strategy, not null
    /// @param listener receives streaming events; ignored for {@link ExecutionMode#SYNC},
    /// not null
    /// @return terminal result, never null
    /// @throws io.seqflow.core.exception.UnresolvedAgentException if an agent is unknown
    /// @throws io.seqflow.core.exception.RegistrationFailedException if publishing failed
    /// @throws io.seqflow.core.exception.ExecutionFailedException if no strategy produced
    /// a result
    public WorkflowResult execute(
            Workflow workflow,
            Map<String, Object> inputContext,
            ExecutionMode mode,
            ExecutionListener listener) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Registration registration = registrar.register(workflow);

        String workflowId = workflow.getWorkflowId();
        LOG.info("Executing workflow {} ({})", workflowId, mode);
        return switch (mode) {
            case SYNC -> synchronousExecutor.execute(workflowId, inputContext);
            case STREAMING -> fallbackCoordinator.execute(
                    workflowId,
                    inputContext,
                    listener,
                    !registration.outcome().mayHoldEarlierResult());
        };
    }

    /// Registers and runs a workflow with one blocking request.
    ///
    /// @param workflow workflow to run, not null
    /// @param inputContext per-run context, may be null
    /// @return terminal result, never null
    public WorkflowResult executeSync(Workflow workflow, Map<String, Object> inputContext) {
        return execute(workflow, inputContext, ExecutionMode.SYNC, ExecutionListener.NOOP);
    }

    /// Registers and runs a workflow over the event stream, with fallback.
    ///
    /// @param workflow workflow to run, not null
    /// @param inputContext per-run context, may be null
    /// @param listener receives events as they arrive, not null
    /// @return terminal result, never null
    public WorkflowResult executeStreaming(
            Workflow workflow, Map<String, Object> inputContext, ExecutionListener listener) {
        return execute(workflow, inputContext, ExecutionMode.STREAMING, listener);
    }

    /// Returns the agent directory, fetching it when not cached yet.
    ///
    /// @return agent name to id, unmodifiable, never null
    public Map<String, String> knownAgents() {
        return resolver.knownAgents();
    }

    /// Discards the cached agent directory and fetches a fresh one.
    ///
    /// @return agent name to id, unmodifiable, never null
    public Map<String, String> refreshAgents() {
        return resolver.refresh();
    }

    public AgentNameResolver getResolver() {
        return resolver;
    }

    public WorkflowMonitor getMonitor() {
        return monitor;
    }

    public SeqflowClientConfig getConfig() {
        return config;
    }
}
