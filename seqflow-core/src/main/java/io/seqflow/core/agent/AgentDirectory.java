package io.seqflow.core.agent;

import java.util.List;

/// Source of the current agent name to id assignments on the server.
///
/// Implementations perform one remote listing per call and hold no cache; caching is the
/// caller's concern.
///
/// @see AgentDescriptor
public interface AgentDirectory {

    /// Lists all agents currently known to the server.
    ///
    /// @return agents in server order, never null (may be empty)
    /// @throws io.seqflow.core.exception.AgentDirectoryException if the listing cannot be
    /// fetched or read
    List<AgentDescriptor> listAgents();
}
