package io.seqflow.client.agent;

import io.seqflow.core.agent.AgentDescriptor;
import io.seqflow.core.agent.AgentDirectory;
import io.seqflow.core.exception.AgentNotFoundException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Translates human-readable agent names into the server's current agent ids.
///
/// Ids are issued by the server and may change across restarts, so the resolver keeps a
/// directory cache that is filled on first use and refreshed whenever a lookup misses.
/// A refresh replaces the whole cache; entries are never merged, so a lookup can not mix
/// ids from two different listings.
///
/// ### Contracts
/// - **Postcondition**: a resolved id came from a listing taken no earlier than the last
///   miss
/// - **Atomicity**: {@link #resolveAll} returns every id or throws listing every missing
///   name; it never returns a partial map
///
/// @implNote Thread-safe. Lookups and refreshes are serialized on this instance; one
/// resolver belongs to one client.
/// @see AgentDirectory for the listing source
public class AgentNameResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AgentNameResolver.class);

    private final AgentDirectory directory;
    private volatile Map<String, String> cache;

    /// Creates a resolver over the given directory. Nothing is fetched until first use.
    ///
    /// @param directory source of agent listings, not null
    public AgentNameResolver(AgentDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /// Resolves one agent name.
    ///
    /// @param agentName agent name, not null
    /// @return current remote id, never null
    /// @throws AgentNotFoundException if the name is absent even after a fresh listing
    /// @throws io.seqflow.core.exception.AgentDirectoryException if a listing fails
    public String resolve(String agentName) throws AgentNotFoundException {
        return resolveAll(List.of(agentName)).get(agentName);
    }

    /// Resolves several agent names against one consistent listing.
    ///
    /// The directory is listed on first use, and listed again at most once per call when a
    /// name is missing from the cache.
    ///
    /// @param agentNames agent names, not null; duplicates are ignored
    /// @return name to id in the order the names were given, unmodifiable, never null
    /// @throws AgentNotFoundException naming every unresolvable name
    /// @throws io.seqflow.core.exception.AgentDirectoryException if a listing fails
    public synchronized Map<String, String> resolveAll(Collection<String> agentNames)
            throws AgentNotFoundException {
        Objects.requireNonNull(agentNames, "agentNames must not be null");
        if (agentNames.isEmpty()) {
            return Map.of();
        }

        boolean fresh = cache == null;
        Map<String, String> snapshot = fresh ? refresh() : cache;
        List<String> missing = missingNames(snapshot, agentNames);
        if (!missing.isEmpty() && !fresh) {
            LOG.debug("Agents {} not cached, refreshing directory", missing);
            snapshot = refresh();
            missing = missingNames(snapshot, agentNames);
        }
        if (!missing.isEmpty()) {
            throw new AgentNotFoundException(missing);
        }

        Map<String, String> resolved = new LinkedHashMap<>();
        for (String name : agentNames) {
            resolved.put(name, snapshot.get(name));
        }
        return Collections.unmodifiableMap(resolved);
    }

    /// Replaces the cache with a fresh listing.
    ///
    /// @return the new name to id map, unmodifiable, never null
    /// @throws io.seqflow.core.exception.AgentDirectoryException if the listing fails; the
    /// previous cache is kept in that case
    public synchronized Map<String, String> refresh() {
        Map<String, String> fresh = new LinkedHashMap<>();
        for (AgentDescriptor agent : directory.listAgents()) {
            String previous = fresh.put(agent.name(), agent.id());
            if (previous != null && !previous.equals(agent.id())) {
                LOG.warn(
                        "Agent name '{}' listed twice (ids {} and {}), using {}",
                        agent.name(),
                        previous,
                        agent.id(),
                        agent.id());
            }
        }
        cache = Collections.unmodifiableMap(fresh);
        LOG.debug("Agent directory refreshed: {} agents", fresh.size());
        return cache;
    }

    /// Returns the cached directory, fetching it when nothing is cached yet.
    ///
    /// @return name to id map, unmodifiable, never null
    /// @throws io.seqflow.core.exception.AgentDirectoryException if a listing fails
    public Map<String, String> knownAgents() {
        Map<String, String> snapshot = cache;
        return snapshot != null ? snapshot : refresh();
    }

    private static List<String> missingNames(
            Map<String, String> directory, Collection<String> agentNames) {
        List<String> missing = new ArrayList<>();
        for (String name : agentNames) {
            if (!directory.containsKey(name) && !missing.contains(name)) {
                missing.add(name);
            }
        }
        return missing;
    }
}
