package io.seqflow.core.exception;

import java.io.Serial;

/// Base type for failures scoped to a single workflow invocation.
///
/// Nothing in the client is fatal to the process; each subtype describes one inspectable
/// failure kind so callers can decide whether to retry the whole operation.
public class SeqflowException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4190832975126502261L;

    public SeqflowException(String message) {
        super(message);
    }

    public SeqflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
