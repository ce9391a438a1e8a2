package io.seqflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.seqflow.core.workflow.WorkflowDefinition;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the sequential-workflow wire format.
///
/// - `WorkflowDefinition` → `WorkflowDefinitionSerializer` (snake_case create payload)
///
/// Results are not bound through this module. Server responses vary in shape and are read
/// as a `JsonNode` tree by {@link ResultNormalizer} and {@link WorkflowStatusReader}.
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see SeqflowSerialization for the convenience factory API
public class SeqflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3352017764981230418L;

    public SeqflowJacksonModule() {
        super("SeqflowJacksonModule");

        addSerializer(WorkflowDefinition.class, new WorkflowDefinitionSerializer());
    }
}
