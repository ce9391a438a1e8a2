package io.seqflow.core.exception;

import java.io.Serial;

/// The agent directory could not be fetched or understood.
public class AgentDirectoryException extends SeqflowException {

    @Serial private static final long serialVersionUID = 2868305133641530771L;

    public AgentDirectoryException(String message) {
        super(message);
    }

    public AgentDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
