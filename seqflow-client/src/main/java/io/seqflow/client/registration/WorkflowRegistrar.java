package io.seqflow.client.registration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.SeqflowClientConfig;
import io.seqflow.client.agent.AgentNameResolver;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.exception.AgentNotFoundException;
import io.seqflow.core.exception.RegistrationFailedException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.core.exception.UnresolvedAgentException;
import io.seqflow.core.workflow.Workflow;
import io.seqflow.core.workflow.WorkflowDefinition;
import io.seqflow.serialization.SeqflowSerialization;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Publishes a workflow so that the server holds exactly the given definition.
///
/// The server has no upsert, so registration is a small state machine:
///
/// ```
/// resolve agent names ──(missing)──> UnresolvedAgentException, no request sent
///        │
///      POST ──201──> stored
///        │
///       409 ──REUSE──> stored (existing definition kept)
///        │
///     DELETE (200/204/404 = absent)
///        │
///      POST ──201──> stored
///        │
///    otherwise ──> RegistrationFailedException
/// ```
///
/// With verification enabled, a `GET` follows every success and a 404 turns it into a
/// failure.
///
/// ### Contracts
/// - **Idempotent**: registering an unchanged workflow twice never surfaces a conflict
/// - **Bounded**: at most two create requests and one delete per call
/// - names are resolved on every call; resolved ids are never cached across calls
///
/// @implNote Assumes a single writer per workflow id. Two clients registering the same id
/// concurrently can interleave between the delete and the second create.
public class WorkflowRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowRegistrar.class);

    private final ServerApi api;
    private final AgentNameResolver resolver;
    private final ObjectMapper objectMapper;
    private final SeqflowClientConfig config;

    public WorkflowRegistrar(
            ServerApi api,
            AgentNameResolver resolver,
            ObjectMapper objectMapper,
            SeqflowClientConfig config) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Resolves and publishes a workflow, replacing any stored definition with the same id.
    ///
    /// @param workflow workflow to publish, not null
    /// @return the definition that was sent and how the server stored it, never null
    /// @throws UnresolvedAgentException if a step references an unknown agent
    /// @throws RegistrationFailedException if the server did not end up storing it
    /// @throws io.seqflow.core.exception.AgentDirectoryException if the agent listing fails
    public Registration register(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        String workflowId = workflow.getWorkflowId();

        Map<String, String> agentIds;
        try {
            agentIds = resolver.resolveAll(workflow.getAgentNames());
        } catch (AgentNotFoundException e) {
            throw new UnresolvedAgentException(workflowId, e);
        }

        WorkflowDefinition definition = new WorkflowDefinition(workflow, agentIds);
        String body = SeqflowSerialization.toJson(objectMapper, definition);

        RegistrationOutcome outcome;
        try {
            HttpResponse<String> created = api.post(config.getWorkflowsPath(), body);
            if (created.statusCode() == 201) {
                LOG.info("Registered workflow {}", workflowId);
                outcome = RegistrationOutcome.CREATED;
            } else if (created.statusCode() == 409) {
                outcome = resolveConflict(workflowId, body);
            } else {
                throw failure(workflowId, created, "create rejected");
            }

            if (config.isVerifyRegistration()) {
                verify(workflowId);
            }
        } catch (ServerApiException e) {
            throw new RegistrationFailedException(workflowId, e);
        }
        return new Registration(definition, outcome);
    }

    /// Asks the server to create a workflow from a template definition.
    ///
    /// The template's agent names are resolved like {@link #register}. The server never
    /// replaces an existing workflow here, so an id that is already taken fails.
    ///
    /// @param template workflow used as the template, not null
    /// @param workflowId id for the new workflow, or null to keep the template's
    /// @return id of the created workflow, never null
    /// @throws UnresolvedAgentException if a step references an unknown agent
    /// @throws RegistrationFailedException if the server did not create it
    public String createFromTemplate(Workflow template, String workflowId) {
        Objects.requireNonNull(template, "template must not be null");
        String targetId = workflowId != null ? workflowId : template.getWorkflowId();

        Map<String, String> agentIds;
        try {
            agentIds = resolver.resolveAll(template.getAgentNames());
        } catch (AgentNotFoundException e) {
            throw new UnresolvedAgentException(targetId, e);
        }

        String body =
                SeqflowSerialization.templateRequest(
                        objectMapper, new WorkflowDefinition(template, agentIds), workflowId);
        HttpResponse<String> response;
        try {
            response = api.post(config.getWorkflowsPath() + "/templates", body);
        } catch (ServerApiException e) {
            throw new RegistrationFailedException(targetId, e);
        }
        if (response.statusCode() != 201) {
            throw failure(targetId, response, "create from template rejected");
        }

        String createdId = createdWorkflowId(response.body());
        if (createdId == null) {
            createdId = targetId;
        }
        LOG.info("Created workflow {} from template {}", createdId, template.getWorkflowId());
        return createdId;
    }

    private String createdWorkflowId(String body) {
        try {
            JsonNode tree = objectMapper.readTree(body != null ? body : "");
            JsonNode data = SeqflowSerialization.unwrapData(tree);
            String id = data != null ? data.path("workflow_id").asText(null) : null;
            return id != null && !id.isBlank() ? id : null;
        } catch (JsonProcessingException e) {
            LOG.debug("Unreadable template response: {}", e.getMessage());
            return null;
        }
    }

    private RegistrationOutcome resolveConflict(String workflowId, String body) {
        if (config.getConflictPolicy() == ConflictPolicy.REUSE) {
            LOG.info("Workflow {} already registered, reusing stored definition", workflowId);
            return RegistrationOutcome.REUSED;
        }

        LOG.info("Workflow {} already registered, replacing stored definition", workflowId);
        HttpResponse<String> deleted = api.delete(config.workflowPath(workflowId));
        int status = deleted.statusCode();
        if (status != 200 && status != 204 && status != 404) {
            throw failure(workflowId, deleted, "delete of stale definition rejected");
        }

        HttpResponse<String> recreated = api.post(config.getWorkflowsPath(), body);
        if (recreated.statusCode() != 201) {
            throw failure(workflowId, recreated, "create after delete rejected");
        }
        LOG.info("Re-registered workflow {}", workflowId);
        return RegistrationOutcome.REPLACED;
    }

    private void verify(String workflowId) {
        HttpResponse<String> stored = api.get(config.workflowPath(workflowId));
        if (stored.statusCode() == 404) {
            throw new RegistrationFailedException(
                    workflowId, 404, "definition not found after successful create");
        }
        if (stored.statusCode() != 200) {
            LOG.warn(
                    "Could not verify workflow {}: HTTP {}, assuming stored",
                    workflowId,
                    stored.statusCode());
        }
    }

    private static RegistrationFailedException failure(
            String workflowId, HttpResponse<String> response, String what) {
        return new RegistrationFailedException(
                workflowId,
                response.statusCode(),
                what + " (HTTP " + response.statusCode() + "): " + response.body());
    }
}
