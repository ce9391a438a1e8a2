package io.seqflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Raised when agent names are absent from the directory even after a fresh listing.
///
/// Not retryable: the caller referenced an agent the server does not have.
public class AgentNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 3178204665120359471L;

    private final List<String> missingNames;

    public AgentNotFoundException(List<String> missingNames) {
        super("Agent not found: " + String.join(", ", missingNames));
        this.missingNames = List.copyOf(missingNames);
    }

    /// Returns every name that could not be resolved.
    ///
    /// @return unmodifiable list, never empty
    public List<String> getMissingNames() {
        return missingNames;
    }
}
