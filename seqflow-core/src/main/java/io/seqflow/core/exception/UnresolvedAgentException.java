package io.seqflow.core.exception;

import java.io.Serial;
import java.util.List;

/// A workflow references agents the server does not know; registration was abandoned
/// before any registration request was sent.
public class UnresolvedAgentException extends SeqflowException {

    @Serial private static final long serialVersionUID = -1377251626402946380L;

    private final String workflowId;
    private final List<String> missingNames;

    public UnresolvedAgentException(String workflowId, AgentNotFoundException cause) {
        super(
                "Workflow '"
                        + workflowId
                        + "' references unknown agents: "
                        + String.join(", ", cause.getMissingNames()),
                cause);
        this.workflowId = workflowId;
        this.missingNames = cause.getMissingNames();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<String> getMissingNames() {
        return missingNames;
    }
}
