package io.seqflow.core.exception;

import java.io.Serial;

/// The create / conflict / delete / recreate sequence ended without a stored definition.
///
/// The status code is that of the last response seen, or `-1` when the failure was a
/// transport error.
public class RegistrationFailedException extends SeqflowException {

    @Serial private static final long serialVersionUID = 6080170512209733941L;

    private final String workflowId;
    private final int statusCode;

    public RegistrationFailedException(String workflowId, int statusCode, String message) {
        super("Registration of workflow '" + workflowId + "' failed: " + message);
        this.workflowId = workflowId;
        this.statusCode = statusCode;
    }

    public RegistrationFailedException(String workflowId, Throwable cause) {
        super("Registration of workflow '" + workflowId + "' failed: " + cause.getMessage(), cause);
        this.workflowId = workflowId;
        this.statusCode = -1;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
