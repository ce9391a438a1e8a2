package io.seqflow.client.registration;

import io.seqflow.core.workflow.WorkflowDefinition;
import java.util.Objects;

/// Result of {@link WorkflowRegistrar#register}.
///
/// @param definition the definition that was sent, not null
/// @param outcome what the server did with it, not null
public record Registration(WorkflowDefinition definition, RegistrationOutcome outcome) {

    public Registration {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }
}
