package io.seqflow.core.agent;

import java.util.Objects;

/// One entry of the server's agent directory.
///
/// @param name human-readable agent name, not null
/// @param id server-issued identifier, not null; may change across server restarts
public record AgentDescriptor(String name, String id) {

    public AgentDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }
}
