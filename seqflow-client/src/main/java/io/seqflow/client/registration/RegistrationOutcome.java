package io.seqflow.client.registration;

/// How a registration left the server's copy of a workflow.
public enum RegistrationOutcome {
    /// No definition existed; the server stored a new one.
    CREATED,
    /// A stale definition was deleted and the new one stored in its place.
    REPLACED,
    /// A definition with the same id already existed and was kept as is.
    REUSED;

    /// Whether the server may still hold a result from an earlier run of this id.
    ///
    /// The server clears stored results only when it deletes a definition.
    ///
    /// @return `true` for {@link #REUSED}
    public boolean mayHoldEarlierResult() {
        return this == REUSED;
    }
}
