package io.seqflow.client.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqflow.client.http.ServerApi;
import io.seqflow.core.agent.AgentDescriptor;
import io.seqflow.core.agent.AgentDirectory;
import io.seqflow.core.exception.AgentDirectoryException;
import io.seqflow.core.exception.ServerApiException;
import io.seqflow.serialization.SeqflowSerialization;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// {@link AgentDirectory} backed by the server's agent listing endpoint.
///
/// Accepts `{"data":[{"name":..,"id":..}]}` as well as a bare array. `agent_id` is read
/// when `id` is absent; entries lacking a name or an id are skipped.
public class HttpAgentDirectory implements AgentDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(HttpAgentDirectory.class);

    private final ServerApi api;
    private final ObjectMapper objectMapper;
    private final String agentsPath;

    public HttpAgentDirectory(ServerApi api, ObjectMapper objectMapper, String agentsPath) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.agentsPath = Objects.requireNonNull(agentsPath, "agentsPath must not be null");
    }

    @Override
    public List<AgentDescriptor> listAgents() {
        HttpResponse<String> response;
        try {
            response = api.get(agentsPath);
        } catch (ServerApiException e) {
            throw new AgentDirectoryException("Failed to list agents: " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new AgentDirectoryException(
                    "Failed to list agents: HTTP " + response.statusCode());
        }

        JsonNode agents;
        try {
            agents = SeqflowSerialization.unwrapData(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new AgentDirectoryException("Unreadable agent listing: " + e.getMessage(), e);
        }
        if (agents == null || !agents.isArray()) {
            throw new AgentDirectoryException("Agent listing is not an array");
        }

        List<AgentDescriptor> descriptors = new ArrayList<>(agents.size());
        for (JsonNode entry : agents) {
            String name = entry.path("name").asText(null);
            String id = entry.hasNonNull("id") ? entry.get("id").asText() : null;
            if (id == null) {
                id = entry.path("agent_id").asText(null);
            }
            if (name == null || name.isBlank() || id == null || id.isBlank()) {
                LOG.debug("Skipping agent entry without name or id: {}", entry);
                continue;
            }
            descriptors.add(new AgentDescriptor(name, id));
        }
        return descriptors;
    }
}
