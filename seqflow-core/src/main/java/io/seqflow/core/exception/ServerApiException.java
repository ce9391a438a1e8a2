package io.seqflow.core.exception;

import java.io.Serial;

/// The exchange with the workflow server failed: the request could not be completed
/// (connect, send or read), or the server answered with a status the operation does not
/// accept.
///
/// The status code is `-1` for transport failures.
public class ServerApiException extends SeqflowException {

    @Serial private static final long serialVersionUID = -3071944820734415166L;

    private final int statusCode;

    public ServerApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ServerApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
