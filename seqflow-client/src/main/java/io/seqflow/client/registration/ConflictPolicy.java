package io.seqflow.client.registration;

/// What the registrar does when the server already stores a workflow with the same id.
public enum ConflictPolicy {

    /// Delete the stored definition and create the new one. The server always ends up
    /// holding exactly the definition that was sent.
    REPLACE,

    /// Keep the stored definition and treat the conflict as success. Only safe when the
    /// caller never changes a workflow without changing its id.
    REUSE
}
